package elevator_fleet.storage.jdbc;

import com.google.gson.Gson;
import elevator_fleet.models.QueryLogEntry;
import elevator_fleet.storage.QueryLog;
import elevator_fleet.storage.StorageException;
import elevator_fleet.utils.Logger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import javax.sql.DataSource;

/**
 * Writes every audited statement to the {@code query_logs} table and hands the entry to an
 * optional listener.
 *
 * <p>Entries are written on the connection of the statement being audited, so a single-connection
 * pool never waits on itself.
 */
public final class JdbcQueryLog extends JdbcSupport implements QueryLog {

    static final String EXECUTED_BY = "system";

    private static final String INSERT = "INSERT INTO " + StorageSchema.QUERY_LOGS
            + " (id, query, executed_by, executed_at, source, parameters) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String SELECT_RECENT = "SELECT id, query, executed_by, executed_at, source, parameters FROM "
            + StorageSchema.QUERY_LOGS + " ORDER BY executed_at DESC, rowid DESC LIMIT ?";

    private final Gson gson = new Gson();
    private final Consumer<QueryLogEntry> listener;

    public JdbcQueryLog(DataSource dataSource) {
        this(dataSource, null);
    }

    public JdbcQueryLog(DataSource dataSource, Consumer<QueryLogEntry> listener) {
        super(dataSource, null);
        this.listener = listener;
    }

    void record(Connection connection, String query, String source, Object... parameters) throws SQLException {
        QueryLogEntry entry = new QueryLogEntry(
                "query-" + UUID.randomUUID(),
                query,
                EXECUTED_BY,
                Instant.now(),
                source,
                parameters.length == 0 ? null : gson.toJson(Arrays.asList(parameters))
        );
        try (PreparedStatement statement = connection.prepareStatement(INSERT)) {
            statement.setString(1, entry.id);
            statement.setString(2, entry.query);
            statement.setString(3, entry.executedBy);
            setInstant(statement, 4, entry.executedAt);
            statement.setString(5, entry.source);
            statement.setString(6, entry.parameters);
            statement.executeUpdate();
        }

        if (listener != null) {
            try {
                listener.accept(entry);
            } catch (RuntimeException e) {
                Logger.logLine("Query listener failed", "msg", source, "err", String.valueOf(e));
            }
        }
    }

    @Override
    public List<QueryLogEntry> recent(int limit) {
        List<QueryLogEntry> entries = new ArrayList<>();
        if (limit <= 0) return entries;

        try (Connection connection = openConnection()) {
            // reading the audit trail is audited too
            record(connection, SELECT_RECENT, "getQueryLogs", limit);
            try (PreparedStatement statement = connection.prepareStatement(SELECT_RECENT)) {
                statement.setInt(1, limit);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new QueryLogEntry(
                                rs.getString("id"),
                                rs.getString("query"),
                                rs.getString("executed_by"),
                                readInstant(rs, "executed_at"),
                                rs.getString("source"),
                                rs.getString("parameters")
                        ));
                    }
                }
            }
            return entries;
        } catch (SQLException ex) {
            throw new StorageException("Failed to read query logs", ex);
        }
    }
}
