package elevator_fleet;

public final class Config {
    // building
    public static final int FLOORS = 10;
    public static final int ELEVATORS = 5;
    // timings in seconds
    public static final double FLOOR_MOVE_TIME = 5.0;
    public static final double DOOR_OPEN_CLOSE_TIME = 2.0;
    // dwell with doors fully open, does not follow DOOR_OPEN_CLOSE_TIME
    public static final double DOORS_OPEN_DWELL = 2.0;
    // fleet ids are elevator-1 .. elevator-N
    public static final String ELEVATOR_ID_PREFIX = "elevator-";
    public static final String ANONYMOUS = "anonymous";
    // read-back
    public static final int DEFAULT_LOG_LIMIT = 100;
    // demo simulation
    public static final int SIMULATED_CALLS = 10;

    private Config() {}

    public static String elevatorId(int number) {
        return ELEVATOR_ID_PREFIX + number;
    }
}
