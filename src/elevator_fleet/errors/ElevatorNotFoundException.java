package elevator_fleet.errors;

public class ElevatorNotFoundException extends ElevatorException {
    private final String elevatorId;

    public ElevatorNotFoundException(String elevatorId) {
        super("Elevator " + elevatorId + " not found");
        this.elevatorId = elevatorId;
    }

    public String elevatorId() {
        return elevatorId;
    }
}
