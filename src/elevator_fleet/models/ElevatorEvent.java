package elevator_fleet.models;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** One immutable entry of the elevator event log. */
public final class ElevatorEvent {
    public final String id;
    public final String elevatorId;
    public final EventKind kind;
    public final Integer fromFloor;
    public final Integer toFloor;
    public final MotionState state;
    public final Direction direction;
    public final Instant timestamp;
    public final String details;

    public ElevatorEvent(String id, String elevatorId, EventKind kind, Integer fromFloor, Integer toFloor,
                         MotionState state, Direction direction, Instant timestamp, String details) {
        this.id = Objects.requireNonNull(id, "id");
        this.elevatorId = Objects.requireNonNull(elevatorId, "elevatorId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fromFloor = fromFloor;
        this.toFloor = toFloor;
        this.state = Objects.requireNonNull(state, "state");
        this.direction = direction == null ? Direction.NONE : direction;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.details = details == null ? "" : details;
    }

    // state and direction are taken from the unit after the transition
    public static ElevatorEvent of(EventKind kind, ElevatorUnit unit, Integer fromFloor, Integer toFloor,
                                   String details) {
        return new ElevatorEvent(
                "log-" + UUID.randomUUID(),
                unit.id,
                kind,
                fromFloor,
                toFloor,
                unit.state,
                unit.direction,
                Instant.now(),
                details
        );
    }

    // events that happen in place, doors and idle
    public static ElevatorEvent atFloor(EventKind kind, ElevatorUnit unit, String details) {
        return of(kind, unit, unit.currentFloor, unit.currentFloor, details);
    }

    @Override
    public String toString() {
        return kind + "[" + elevatorId + " " + fromFloor + "->" + toFloor + ", " + state + "] " + details;
    }
}
