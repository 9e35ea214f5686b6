package elevator_fleet.engine;

import elevator_fleet.errors.SimulationInconsistencyException;
import elevator_fleet.models.Stop;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Pending stops of one unit, served strictly first in first out.
 *
 * <p>Not thread-safe: the movement engine only touches a queue while holding its unit's lock.
 */
public final class StopQueue {

    private final String elevatorId;
    private final Deque<Stop> stops = new ArrayDeque<>();

    public StopQueue(String elevatorId) {
        this.elevatorId = elevatorId;
    }

    // pickup is skipped when the unit already stands on that floor
    public void append(int currentFloor, int pickupFloor, int dropoffFloor) {
        if (currentFloor != pickupFloor) {
            stops.addLast(Stop.pickup(pickupFloor));
        }
        stops.addLast(Stop.dropoff(dropoffFloor));
    }

    public Optional<Stop> peek() {
        return Optional.ofNullable(stops.peekFirst());
    }

    public Stop popHead(int reachedFloor) {
        Stop head = stops.peekFirst();
        if (head == null) {
            throw new SimulationInconsistencyException(elevatorId,
                    "Stop queue of " + elevatorId + " is empty at floor " + reachedFloor);
        }
        if (head.floor != reachedFloor) {
            throw new SimulationInconsistencyException(elevatorId,
                    "Stop queue of " + elevatorId + " expects floor " + head.floor + " but unit is at " + reachedFloor);
        }
        return stops.pollFirst();
    }

    // undo of a partially accepted call
    void truncateTo(int size) {
        while (stops.size() > Math.max(0, size)) {
            stops.pollLast();
        }
    }

    public void clear() {
        stops.clear();
    }

    public boolean isEmpty() {
        return stops.isEmpty();
    }

    public int size() {
        return stops.size();
    }

    public List<Stop> stops() {
        return new ArrayList<>(stops);
    }

    public List<Integer> floors() {
        List<Integer> floors = new ArrayList<>(stops.size());
        for (Stop s : stops) floors.add(s.floor);
        return floors;
    }

    @Override
    public String toString() {
        return stops.toString();
    }
}
