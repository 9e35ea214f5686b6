package elevator_fleet.storage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import elevator_fleet.utils.Logger;
import java.io.File;
import java.nio.file.Path;

/**
 * Builds the pooled SQLite data source used by the JDBC stores.
 *
 * <p>SQLite allows one writer at a time, so the pool is capped at a single connection unless the
 * caller asks for more explicitly.
 */
public final class HikariDataSourceFactory {

    private static final long CONNECTION_TIMEOUT_MS = 10_000L;

    private HikariDataSourceFactory() {}

    /**
     * Creates the data source, the caller owns it and must close it.
     *
     * @param databaseFile SQLite file, parent directories are created when missing
     * @param maximumPoolSize pool size, values below 1 fall back to 1
     */
    public static HikariDataSource createSqlite(Path databaseFile, int maximumPoolSize) {
        Path absolute = databaseFile.toAbsolutePath();
        Path parentPath = absolute.getParent();
        if (parentPath != null) {
            File parent = parentPath.toFile();
            if (!parent.exists()) {
                boolean created = parent.mkdirs();
                if (!created && !parent.exists()) {
                    throw new IllegalStateException("Cannot create SQLite directory: " + parent);
                }
            }
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("elevator-sqlite");
        config.setJdbcUrl("jdbc:sqlite:" + absolute);
        config.setDriverClassName("org.sqlite.JDBC");
        config.setMaximumPoolSize(Math.max(1, maximumPoolSize));
        config.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
        // PRAGMA foreign_keys only takes effect outside a transaction
        config.setAutoCommit(true);
        config.setConnectionInitSql("PRAGMA foreign_keys=ON");

        Logger.logLine("SQLite storage", "msg", absolute.toString());
        return new HikariDataSource(config);
    }
}
