package elevator_fleet.errors;

/**
 * Root of every failure the elevator core raises.
 *
 * <p>The message is the plain-text condition shown to callers.
 */
public class ElevatorException extends RuntimeException {
    public ElevatorException(String message) {
        super(message);
    }

    public ElevatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
