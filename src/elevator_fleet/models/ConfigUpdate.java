package elevator_fleet.models;

// partial config change, null means "keep current"
public final class ConfigUpdate {
    public final Integer totalFloors;
    public final Double floorMoveTime;
    public final Double doorOpenCloseTime;

    public ConfigUpdate(Integer totalFloors, Double floorMoveTime, Double doorOpenCloseTime) {
        this.totalFloors = totalFloors;
        this.floorMoveTime = floorMoveTime;
        this.doorOpenCloseTime = doorOpenCloseTime;
    }

    public static ConfigUpdate totalFloors(int value) {
        return new ConfigUpdate(value, null, null);
    }

    public static ConfigUpdate timings(double floorMoveTime, double doorOpenCloseTime) {
        return new ConfigUpdate(null, floorMoveTime, doorOpenCloseTime);
    }
}
