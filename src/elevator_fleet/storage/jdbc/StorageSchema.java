package elevator_fleet.storage.jdbc;

import elevator_fleet.Config;
import elevator_fleet.storage.StorageException;
import elevator_fleet.utils.Logger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import javax.sql.DataSource;

/**
 * Creates the elevator tables and seeds the default fleet on an empty database.
 *
 * <p>Safe to run on every start: tables are created with {@code IF NOT EXISTS} and the fleet is
 * only inserted when no unit exists yet, so restored state is never overwritten.
 */
public final class StorageSchema {

    static final String ELEVATORS = "elevators";
    static final String ELEVATOR_LOGS = "elevator_logs";
    static final String QUERY_LOGS = "query_logs";

    private static final String CREATE_ELEVATORS =
            "CREATE TABLE IF NOT EXISTS " + ELEVATORS + " ("
                    + "id TEXT PRIMARY KEY, "
                    + "fleet_order INTEGER NOT NULL, "
                    + "current_floor INTEGER NOT NULL, "
                    + "target_floor INTEGER, "
                    + "state TEXT NOT NULL, "
                    + "direction TEXT, "
                    + "is_moving INTEGER NOT NULL, "
                    + "last_updated INTEGER NOT NULL)";

    private static final String CREATE_ELEVATOR_LOGS =
            "CREATE TABLE IF NOT EXISTS " + ELEVATOR_LOGS + " ("
                    + "id TEXT PRIMARY KEY, "
                    + "elevator_id TEXT NOT NULL, "
                    + "event TEXT NOT NULL, "
                    + "from_floor INTEGER, "
                    + "to_floor INTEGER, "
                    + "state TEXT NOT NULL, "
                    + "direction TEXT, "
                    + "timestamp INTEGER NOT NULL, "
                    + "details TEXT NOT NULL, "
                    + "FOREIGN KEY (elevator_id) REFERENCES " + ELEVATORS + " (id))";

    private static final String CREATE_QUERY_LOGS =
            "CREATE TABLE IF NOT EXISTS " + QUERY_LOGS + " ("
                    + "id TEXT PRIMARY KEY, "
                    + "query TEXT NOT NULL, "
                    + "executed_by TEXT NOT NULL, "
                    + "executed_at INTEGER NOT NULL, "
                    + "source TEXT NOT NULL, "
                    + "parameters TEXT)";

    private static final String CREATE_LOG_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_elevator_logs_elevator_ts ON "
                    + ELEVATOR_LOGS + " (elevator_id, timestamp)";

    private StorageSchema() {}

    /**
     * @param fleetSize units to create when the elevators table is empty
     * @return number of units inserted, 0 when existing state was kept
     */
    public static int initialize(DataSource dataSource, int fleetSize) {
        try (Connection connection = dataSource.getConnection()) {
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate(CREATE_ELEVATORS);
                statement.executeUpdate(CREATE_ELEVATOR_LOGS);
                statement.executeUpdate(CREATE_QUERY_LOGS);
                statement.executeUpdate(CREATE_LOG_INDEX);
            }
            if (countElevators(connection) > 0) {
                Logger.logLine("Fleet restored", "msg", "keeping persisted elevator state");
                return 0;
            }
            seedFleet(connection, fleetSize);
            Logger.logLine("Fleet created", "msg", fleetSize + " elevators at floor 1");
            return fleetSize;
        } catch (SQLException ex) {
            throw new StorageException("Failed to initialize elevator schema", ex);
        }
    }

    private static int countElevators(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + ELEVATORS)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void seedFleet(Connection connection, int fleetSize) throws SQLException {
        String sql = "INSERT INTO " + ELEVATORS
                + " (id, fleet_order, current_floor, target_floor, state, direction, is_moving, last_updated)"
                + " VALUES (?, ?, 1, NULL, 'idle', NULL, 0, ?)";
        long now = Instant.now().toEpochMilli();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 1; i <= fleetSize; i++) {
                statement.setString(1, Config.elevatorId(i));
                statement.setInt(2, i);
                statement.setLong(3, now);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }
}
