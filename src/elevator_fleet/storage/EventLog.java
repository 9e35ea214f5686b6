package elevator_fleet.storage;

import elevator_fleet.models.ElevatorEvent;
import java.util.List;

/** Append-only record of every unit state transition. */
public interface EventLog {

    /**
     * @throws StorageException when the entry could not be written
     */
    void append(ElevatorEvent event);

    /**
     * Newest entries first.
     *
     * @param elevatorId restrict to one unit, or {@code null} for the whole fleet
     * @param limit maximum number of entries, non-positive yields an empty list
     */
    List<ElevatorEvent> recent(String elevatorId, int limit);
}
