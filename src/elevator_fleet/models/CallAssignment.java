package elevator_fleet.models;

// answer to an accepted call, the estimate is advisory only
public final class CallAssignment {
    public final String elevatorId;
    public final double estimatedSeconds;

    public CallAssignment(String elevatorId, double estimatedSeconds) {
        this.elevatorId = elevatorId;
        this.estimatedSeconds = estimatedSeconds;
    }

    @Override
    public String toString() {
        return "CallAssignment{elevator=" + elevatorId + ", eta=" + estimatedSeconds + "s}";
    }
}
