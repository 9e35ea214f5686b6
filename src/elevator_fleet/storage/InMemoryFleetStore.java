package elevator_fleet.storage;

import elevator_fleet.Config;
import elevator_fleet.models.ElevatorUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryFleetStore implements FleetStore {

    // insertion order is the fleet order
    private final List<String> order = new CopyOnWriteArrayList<>();
    private final Map<String, ElevatorUnit> byId = new ConcurrentHashMap<>();

    public InMemoryFleetStore(List<ElevatorUnit> units) {
        for (ElevatorUnit u : units) {
            if (byId.putIfAbsent(u.id, u) != null) {
                throw new IllegalArgumentException("duplicate elevator id " + u.id);
            }
            order.add(u.id);
        }
    }

    // fleet of idle units on floor 1
    public static InMemoryFleetStore withDefaultFleet(int count) {
        List<ElevatorUnit> units = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            units.add(ElevatorUnit.idleAt(Config.elevatorId(i), 1));
        }
        return new InMemoryFleetStore(units);
    }

    @Override
    public List<ElevatorUnit> getAll() {
        List<ElevatorUnit> all = new ArrayList<>(order.size());
        for (String id : order) all.add(byId.get(id));
        return all;
    }

    @Override
    public Optional<ElevatorUnit> get(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public void update(ElevatorUnit unit) {
        Objects.requireNonNull(unit, "unit");
        if (byId.replace(unit.id, unit) == null) {
            throw new StorageException("Cannot update unknown elevator " + unit.id);
        }
    }
}
