package elevator_fleet.models;

public enum Direction {
    DOWN(-1),
    NONE(0),
    UP(1);

    private final int step;

    Direction(int step) {
        this.step = step;
    }

    public int step() {
        return step;
    }

    public static Direction towards(int fromFloor, int toFloor) {
        if (toFloor > fromFloor) return UP;
        if (toFloor < fromFloor) return DOWN;
        return NONE;
    }

    // null and unknown values read back as NONE
    public static Direction fromWire(String value) {
        if (value == null) return NONE;
        return switch (value) {
            case "up" -> UP;
            case "down" -> DOWN;
            default -> NONE;
        };
    }

    public String wireName() {
        return switch (this) {
            case UP -> "up";
            case DOWN -> "down";
            case NONE -> "none";
        };
    }

    @Override
    public String toString() {
        return wireName();
    }
}
