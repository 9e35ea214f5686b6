package elevator_fleet.models;

import elevator_fleet.Config;
import java.util.UUID;

public final class CallRequest {
    // short id that ties the log lines of one call together
    public final String id;
    public final int fromFloor;
    public final int toFloor;
    public final String requestedBy;

    public CallRequest(int fromFloor, int toFloor, String requestedBy) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.fromFloor = fromFloor;
        this.toFloor = toFloor;
        this.requestedBy = (requestedBy == null || requestedBy.isBlank()) ? Config.ANONYMOUS : requestedBy;
    }

    public CallRequest(int fromFloor, int toFloor) {
        this(fromFloor, toFloor, null);
    }

    @Override
    public String toString() {
        return "call " + id + " " + fromFloor + "->" + toFloor + " by " + requestedBy;
    }
}
