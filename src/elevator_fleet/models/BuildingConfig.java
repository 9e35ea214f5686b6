package elevator_fleet.models;

import elevator_fleet.Config;
import elevator_fleet.errors.ValidationException;
import java.time.Duration;
import java.util.Objects;

/**
 * Building geometry and timings. Immutable, a running chain keeps the instance it started with.
 */
public final class BuildingConfig {
    public final int totalFloors;
    public final double floorMoveTime;
    public final double doorOpenCloseTime;

    public BuildingConfig(int totalFloors, double floorMoveTime, double doorOpenCloseTime) {
        if (totalFloors < 2) {
            throw ValidationException.invalidConfig("totalFloors must be at least 2, got " + totalFloors);
        }
        if (!(floorMoveTime > 0) || Double.isInfinite(floorMoveTime)) {
            throw ValidationException.invalidConfig("floorMoveTime must be positive, got " + floorMoveTime);
        }
        if (!(doorOpenCloseTime >= 0) || Double.isInfinite(doorOpenCloseTime)) {
            throw ValidationException.invalidConfig(
                    "doorOpenCloseTime must not be negative, got " + doorOpenCloseTime);
        }
        this.totalFloors = totalFloors;
        this.floorMoveTime = floorMoveTime;
        this.doorOpenCloseTime = doorOpenCloseTime;
    }

    public static BuildingConfig defaults() {
        return new BuildingConfig(Config.FLOORS, Config.FLOOR_MOVE_TIME, Config.DOOR_OPEN_CLOSE_TIME);
    }

    public boolean containsFloor(int floor) {
        return floor >= 1 && floor <= totalFloors;
    }

    public Duration floorMoveDuration() {
        return seconds(floorMoveTime);
    }

    public Duration doorPhaseDuration() {
        return seconds(doorOpenCloseTime);
    }

    // fields left null in the update keep their current value
    public BuildingConfig merge(ConfigUpdate update) {
        if (update == null) return this;
        return new BuildingConfig(
                update.totalFloors != null ? update.totalFloors : totalFloors,
                update.floorMoveTime != null ? update.floorMoveTime : floorMoveTime,
                update.doorOpenCloseTime != null ? update.doorOpenCloseTime : doorOpenCloseTime
        );
    }

    public static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BuildingConfig)) return false;
        BuildingConfig that = (BuildingConfig) o;
        return totalFloors == that.totalFloors
                && Double.compare(that.floorMoveTime, floorMoveTime) == 0
                && Double.compare(that.doorOpenCloseTime, doorOpenCloseTime) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalFloors, floorMoveTime, doorOpenCloseTime);
    }

    @Override
    public String toString() {
        return "BuildingConfig{totalFloors=" + totalFloors
                + ", floorMoveTime=" + floorMoveTime
                + ", doorOpenCloseTime=" + doorOpenCloseTime + "}";
    }
}
