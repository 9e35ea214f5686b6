package elevator_fleet.storage.jdbc;

import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.MotionState;
import elevator_fleet.storage.FleetStore;
import elevator_fleet.storage.StorageException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/**
 * Fleet store on the {@code elevators} table.
 *
 * <p>{@code is_moving} is written as a derived column for external readers and ignored on read;
 * the unit's motion state is the only source of truth. A stored target of 0 reads as "none".
 */
public final class JdbcFleetStore extends JdbcSupport implements FleetStore {

    private static final String COLUMNS =
            "id, current_floor, target_floor, state, direction, last_updated";

    public JdbcFleetStore(DataSource dataSource) {
        this(dataSource, null);
    }

    /** @param queryLog audit trail for every statement, or {@code null} */
    public JdbcFleetStore(DataSource dataSource, JdbcQueryLog queryLog) {
        super(dataSource, queryLog);
    }

    @Override
    public List<ElevatorUnit> getAll() {
        String sql = "SELECT " + COLUMNS + " FROM " + StorageSchema.ELEVATORS + " ORDER BY fleet_order, id";
        try (Connection connection = openConnection()) {
            audit(connection, sql, "getAllElevators");
            try (PreparedStatement statement = connection.prepareStatement(sql);
                 ResultSet rs = statement.executeQuery()) {
                List<ElevatorUnit> units = new ArrayList<>();
                while (rs.next()) {
                    units.add(mapRow(rs));
                }
                return units;
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to load elevators", ex);
        }
    }

    @Override
    public Optional<ElevatorUnit> get(String id) {
        if (id == null) return Optional.empty();
        String sql = "SELECT " + COLUMNS + " FROM " + StorageSchema.ELEVATORS + " WHERE id = ?";
        try (Connection connection = openConnection()) {
            audit(connection, sql, "getElevator", id);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, id);
                try (ResultSet rs = statement.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapRow(rs));
                    }
                    return Optional.empty();
                }
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to load elevator " + id, ex);
        }
    }

    @Override
    public void update(ElevatorUnit unit) {
        String sql = "UPDATE " + StorageSchema.ELEVATORS
                + " SET current_floor = ?, target_floor = ?, state = ?, direction = ?, is_moving = ?, last_updated = ?"
                + " WHERE id = ?";
        String direction = unit.direction == Direction.NONE ? null : unit.direction.wireName();
        int moving = unit.isMoving() ? 1 : 0;
        long lastUpdated = unit.lastUpdated.toEpochMilli();
        try (Connection connection = openConnection()) {
            audit(connection, sql, "updateElevator", unit.currentFloor, unit.targetFloor, unit.state.wireName(),
                    direction, moving, lastUpdated, unit.id);
            executeUpdate(connection, sql, unit, direction, moving);
        } catch (SQLException ex) {
            throw new StorageException("Failed to update elevator " + unit.id, ex);
        }
    }

    private void executeUpdate(Connection connection, String sql, ElevatorUnit unit, String direction, int moving)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, unit.currentFloor);
            setNullableInt(statement, 2, unit.targetFloor);
            statement.setString(3, unit.state.wireName());
            statement.setString(4, direction);
            statement.setInt(5, moving);
            setInstant(statement, 6, unit.lastUpdated);
            statement.setString(7, unit.id);
            int rows = statement.executeUpdate();
            if (rows == 0) {
                throw new StorageException("Cannot update unknown elevator " + unit.id);
            }
        }
    }

    private ElevatorUnit mapRow(ResultSet rs) throws SQLException {
        Integer target = readNullableInteger(rs, "target_floor");
        if (target != null && target <= 0) {
            target = null;
        }
        return new ElevatorUnit(
                rs.getString("id"),
                rs.getInt("current_floor"),
                target,
                Direction.fromWire(rs.getString("direction")),
                MotionState.fromWire(rs.getString("state")),
                readInstant(rs, "last_updated")
        );
    }
}
