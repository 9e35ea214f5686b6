package elevator_fleet.errors;

/**
 * Internal desync between a unit and its tick chain (floor outside the building, queue head not
 * matching the floor just served, unit missing from the store).
 *
 * <p>Only raised and handled inside the movement engine; no caller ever waits on it.
 */
public class SimulationInconsistencyException extends ElevatorException {
    private final String elevatorId;

    public SimulationInconsistencyException(String elevatorId, String message) {
        super(message);
        this.elevatorId = elevatorId;
    }

    public String elevatorId() {
        return elevatorId;
    }
}
