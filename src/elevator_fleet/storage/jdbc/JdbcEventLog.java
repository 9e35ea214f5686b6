package elevator_fleet.storage.jdbc;

import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.EventKind;
import elevator_fleet.models.MotionState;
import elevator_fleet.storage.EventLog;
import elevator_fleet.storage.StorageException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

/** Event log on the {@code elevator_logs} table. Entries are never updated or deleted. */
public final class JdbcEventLog extends JdbcSupport implements EventLog {

    public JdbcEventLog(DataSource dataSource) {
        this(dataSource, null);
    }

    /** @param queryLog audit trail for reads, or {@code null} */
    public JdbcEventLog(DataSource dataSource, JdbcQueryLog queryLog) {
        super(dataSource, queryLog);
    }

    @Override
    public void append(ElevatorEvent event) {
        String sql = "INSERT INTO " + StorageSchema.ELEVATOR_LOGS
                + " (id, elevator_id, event, from_floor, to_floor, state, direction, timestamp, details)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, event.id);
            statement.setString(2, event.elevatorId);
            statement.setString(3, event.kind.wireName());
            setNullableInt(statement, 4, event.fromFloor);
            setNullableInt(statement, 5, event.toFloor);
            statement.setString(6, event.state.wireName());
            statement.setString(7, event.direction == Direction.NONE ? null : event.direction.wireName());
            setInstant(statement, 8, event.timestamp);
            statement.setString(9, event.details);
            statement.executeUpdate();
        } catch (SQLException ex) {
            throw new StorageException("Failed to record " + event.kind + " for " + event.elevatorId, ex);
        }
    }

    @Override
    public List<ElevatorEvent> recent(String elevatorId, int limit) {
        List<ElevatorEvent> events = new ArrayList<>();
        if (limit <= 0) return events;

        StringBuilder sql = new StringBuilder(
                "SELECT id, elevator_id, event, from_floor, to_floor, state, direction, timestamp, details FROM ")
                .append(StorageSchema.ELEVATOR_LOGS);
        if (elevatorId != null) {
            sql.append(" WHERE elevator_id = ?");
        }
        // rowid breaks ties between entries written in the same millisecond
        sql.append(" ORDER BY timestamp DESC, rowid DESC LIMIT ?");

        String query = sql.toString();
        try (Connection connection = openConnection()) {
            if (elevatorId != null) {
                audit(connection, query, "getElevatorLogs", elevatorId, limit);
            } else {
                audit(connection, query, "getElevatorLogs", limit);
            }
            try (PreparedStatement statement = connection.prepareStatement(query)) {
                int index = 1;
                if (elevatorId != null) {
                    statement.setString(index++, elevatorId);
                }
                statement.setInt(index, limit);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        events.add(mapRow(rs));
                    }
                }
            }
            return events;
        } catch (SQLException ex) {
            throw new StorageException("Failed to read elevator logs", ex);
        }
    }

    private ElevatorEvent mapRow(ResultSet rs) throws SQLException {
        return new ElevatorEvent(
                rs.getString("id"),
                rs.getString("elevator_id"),
                EventKind.fromWire(rs.getString("event")),
                readNullableInteger(rs, "from_floor"),
                readNullableInteger(rs, "to_floor"),
                MotionState.fromWire(rs.getString("state")),
                Direction.fromWire(rs.getString("direction")),
                readInstant(rs, "timestamp"),
                rs.getString("details")
        );
    }
}
