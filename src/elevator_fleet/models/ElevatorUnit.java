package elevator_fleet.models;

import java.time.Instant;
import java.util.Objects;

// immutable snapshot, every change produces a new instance with a fresh lastUpdated
public final class ElevatorUnit {
    public final String id;
    public final int currentFloor;
    // null while idle
    public final Integer targetFloor;
    public final Direction direction;
    public final MotionState state;
    public final Instant lastUpdated;

    public ElevatorUnit(String id, int currentFloor, Integer targetFloor, Direction direction,
                        MotionState state, Instant lastUpdated) {
        this.id = Objects.requireNonNull(id, "id");
        this.currentFloor = currentFloor;
        this.targetFloor = targetFloor;
        this.direction = direction == null ? Direction.NONE : direction;
        this.state = Objects.requireNonNull(state, "state");
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public static ElevatorUnit idleAt(String id, int floor) {
        return new ElevatorUnit(id, floor, null, Direction.NONE, MotionState.IDLE, Instant.now());
    }

    public boolean isMoving() {
        return state.isMoving();
    }

    public boolean isIdle() {
        return state == MotionState.IDLE;
    }

    public boolean hasTarget() {
        return targetFloor != null;
    }

    public ElevatorUnit heading(Integer target, Direction dir, MotionState newState) {
        return new ElevatorUnit(id, currentFloor, target, dir, newState, Instant.now());
    }

    // door phases keep the target but carry no direction
    public ElevatorUnit inDoorPhase(MotionState phase) {
        return new ElevatorUnit(id, currentFloor, targetFloor, Direction.NONE, phase, Instant.now());
    }

    public ElevatorUnit settled() {
        return new ElevatorUnit(id, currentFloor, null, Direction.NONE, MotionState.IDLE, Instant.now());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElevatorUnit)) return false;
        ElevatorUnit that = (ElevatorUnit) o;
        return currentFloor == that.currentFloor
                && id.equals(that.id)
                && Objects.equals(targetFloor, that.targetFloor)
                && direction == that.direction
                && state == that.state
                && lastUpdated.equals(that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, currentFloor, targetFloor, direction, state, lastUpdated);
    }

    @Override
    public String toString() {
        return id + "{floor=" + currentFloor
                + ", target=" + (targetFloor == null ? "none" : targetFloor)
                + ", dir=" + direction
                + ", state=" + state
                + ", moving=" + isMoving() + "}";
    }
}
