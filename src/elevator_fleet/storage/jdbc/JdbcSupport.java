package elevator_fleet.storage.jdbc;

import elevator_fleet.storage.StorageException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;
import javax.sql.DataSource;

/** Shared JDBC helpers: connection access and the column conversions SQLite needs. */
abstract class JdbcSupport {

    protected final DataSource dataSource;
    // null when statements are not audited
    private final JdbcQueryLog queryLog;

    protected JdbcSupport(DataSource dataSource, JdbcQueryLog queryLog) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.queryLog = queryLog;
    }

    protected Connection openConnection() throws SQLException {
        return dataSource.getConnection();
    }

    protected void audit(Connection connection, String query, String source, Object... parameters)
            throws SQLException {
        if (queryLog != null) {
            queryLog.record(connection, query, source, parameters);
        }
    }

    protected static void setNullableInt(PreparedStatement statement, int index, Integer value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    // epoch millis, avoids driver differences in timestamp handling
    protected static void setInstant(PreparedStatement statement, int index, Instant instant)
            throws SQLException {
        statement.setLong(index, instant.toEpochMilli());
    }

    protected static Instant readInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        if (rs.wasNull()) {
            throw new StorageException("Missing timestamp column: " + column);
        }
        return Instant.ofEpochMilli(value);
    }

    /**
     * Reads a nullable integer column. SQLite is dynamically typed, so numeric strings are
     * accepted and blank strings read as null.
     */
    protected static Integer readNullableInteger(ResultSet rs, String column) throws SQLException {
        Object raw = rs.getObject(column);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        if (raw instanceof String) {
            String trimmed = ((String) raw).trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                throw new SQLException("Bad value for type Integer: " + trimmed, ex);
            }
        }
        throw new SQLException("Bad value for type Integer: " + raw);
    }
}
