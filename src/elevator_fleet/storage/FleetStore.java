package elevator_fleet.storage;

import elevator_fleet.models.ElevatorUnit;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of the elevator units.
 *
 * <p>Implementations must tolerate concurrent calls from independent tick chains. The engine
 * guarantees at most one writer per unit id at a time, writes for different ids may overlap.
 */
public interface FleetStore {

    /** All units in stable fleet order. */
    List<ElevatorUnit> getAll();

    Optional<ElevatorUnit> get(String id);

    /**
     * Replaces the stored unit with the same id.
     *
     * @throws StorageException when the write fails or the id is unknown
     */
    void update(ElevatorUnit unit);
}
