package elevator_fleet.errors;

/** Rejected input, raised before any state is touched. */
public class ValidationException extends ElevatorException {

    public enum Constraint {
        FLOOR_OUT_OF_RANGE,
        SAME_FLOOR,
        INVALID_CONFIG
    }

    private final Constraint constraint;

    public ValidationException(Constraint constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public Constraint constraint() {
        return constraint;
    }

    public static ValidationException floorOutOfRange(int totalFloors) {
        return new ValidationException(Constraint.FLOOR_OUT_OF_RANGE,
                "Invalid floor. Building has " + totalFloors + " floors.");
    }

    public static ValidationException sameFloor() {
        return new ValidationException(Constraint.SAME_FLOOR,
                "From floor and to floor cannot be the same.");
    }

    public static ValidationException invalidConfig(String detail) {
        return new ValidationException(Constraint.INVALID_CONFIG, "Invalid configuration: " + detail);
    }
}
