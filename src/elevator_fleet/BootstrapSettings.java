package elevator_fleet;

import elevator_fleet.errors.ValidationException;
import elevator_fleet.models.BuildingConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Process settings: {@code elevator.properties} from the classpath, then {@code elevator.*}
 * system properties on top.
 */
public final class BootstrapSettings {

    public static final String RESOURCE = "elevator.properties";

    public enum StorageBackend {
        MEMORY,
        SQLITE
    }

    public final BuildingConfig building;
    public final int elevators;
    public final StorageBackend storage;
    public final Path sqliteFile;
    public final int sqlitePoolSize;
    public final int tickThreads;
    public final int simulatedCalls;

    private BootstrapSettings(BuildingConfig building, int elevators, StorageBackend storage, Path sqliteFile,
                              int sqlitePoolSize, int tickThreads, int simulatedCalls) {
        this.building = building;
        this.elevators = elevators;
        this.storage = storage;
        this.sqliteFile = sqliteFile;
        this.sqlitePoolSize = sqlitePoolSize;
        this.tickThreads = tickThreads;
        this.simulatedCalls = simulatedCalls;
    }

    public static BootstrapSettings load() {
        Properties props = new Properties();
        try (InputStream in = BootstrapSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("elevator.")) props.setProperty(key, System.getProperty(key));
        }
        return from(props);
    }

    public static BootstrapSettings from(Properties props) {
        BuildingConfig building = new BuildingConfig(
                intValue(props, "elevator.totalFloors", Config.FLOORS),
                doubleValue(props, "elevator.floorMoveTime", Config.FLOOR_MOVE_TIME),
                doubleValue(props, "elevator.doorOpenCloseTime", Config.DOOR_OPEN_CLOSE_TIME)
        );
        int elevators = intValue(props, "elevator.count", Config.ELEVATORS);
        if (elevators < 1) {
            throw ValidationException.invalidConfig("elevator.count must be at least 1, got " + elevators);
        }

        String backend = props.getProperty("elevator.storage", "memory").trim().toUpperCase(Locale.ROOT);
        StorageBackend storage;
        try {
            storage = StorageBackend.valueOf(backend);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidConfig("unknown elevator.storage '" + backend.toLowerCase(Locale.ROOT) + "'");
        }

        return new BootstrapSettings(
                building,
                elevators,
                storage,
                Path.of(props.getProperty("elevator.sqlite.file", "data/elevator.db").trim()),
                intValue(props, "elevator.sqlite.poolSize", 1),
                Math.max(1, intValue(props, "elevator.tickThreads", elevators)),
                Math.max(0, intValue(props, "elevator.simulation.calls", Config.SIMULATED_CALLS))
        );
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidConfig(key + " is not an integer: " + raw);
        }
    }

    private static double doubleValue(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidConfig(key + " is not a number: " + raw);
        }
    }
}
