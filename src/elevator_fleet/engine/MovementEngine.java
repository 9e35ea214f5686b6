package elevator_fleet.engine;

import elevator_fleet.Config;
import elevator_fleet.errors.ElevatorNotFoundException;
import elevator_fleet.errors.SimulationInconsistencyException;
import elevator_fleet.models.BuildingConfig;
import elevator_fleet.models.CallRequest;
import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.EventKind;
import elevator_fleet.models.MotionState;
import elevator_fleet.models.Stop;
import elevator_fleet.notify.Notifier;
import elevator_fleet.storage.EventLog;
import elevator_fleet.storage.FleetStore;
import elevator_fleet.utils.Logger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives every unit through its stops, one floor or one door phase per scheduled step.
 *
 * <p>Each unit owns at most one chain of scheduled steps. A step writes and publishes the unit, then
 * appends and publishes its event, and only after that schedules its successor, so the steps of one
 * unit never overlap. Steps of different units run independently.
 *
 * <p>All reads and writes of one unit, its stop queue and its chain handle happen under that
 * unit's lock, which makes the engine the single writer per unit id.
 */
public final class MovementEngine {

    private final FleetStore store;
    private final EventLog eventLog;
    private final Notifier notifier;
    private final TickScheduler scheduler;
    private final Supplier<BuildingConfig> configSource;
    private final Duration doorsOpenDwell;

    private final Map<String, UnitSlot> slots = new ConcurrentHashMap<>();

    public MovementEngine(FleetStore store, EventLog eventLog, Notifier notifier,
                          TickScheduler scheduler, Supplier<BuildingConfig> configSource) {
        this(store, eventLog, notifier, scheduler, configSource, BuildingConfig.seconds(Config.DOORS_OPEN_DWELL));
    }

    MovementEngine(FleetStore store, EventLog eventLog, Notifier notifier,
                   TickScheduler scheduler, Supplier<BuildingConfig> configSource, Duration doorsOpenDwell) {
        this.store = Objects.requireNonNull(store, "store");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        this.doorsOpenDwell = Objects.requireNonNull(doorsOpenDwell, "doorsOpenDwell");
    }

    // (|current - pickup| + |pickup - dropoff|) floors plus one opening and one closing
    public static double estimateSeconds(int currentFloor, int pickupFloor, int dropoffFloor, BuildingConfig config) {
        int floorsToMove = Math.abs(currentFloor - pickupFloor) + Math.abs(pickupFloor - dropoffFloor);
        return floorsToMove * config.floorMoveTime + 2 * config.doorOpenCloseTime;
    }

    /**
     * Queues the pickup and drop-off of an accepted call on the chosen unit and starts the unit
     * when it has no chain running.
     *
     * @return the unit as it was when the call was queued
     */
    public ElevatorUnit accept(String elevatorId, CallRequest request) {
        UnitSlot slot = slot(elevatorId);
        slot.lock.lock();
        try {
            ElevatorUnit unit = store.get(elevatorId).orElseThrow(() -> new ElevatorNotFoundException(elevatorId));
            int sizeBefore = slot.queue.size();
            slot.queue.append(unit.currentFloor, request.fromFloor, request.toFloor);

            try {
                ElevatorUnit queued = unit;
                if (slot.chain == null) {
                    // departure sets direction and motion, until then the unit waits idle
                    int head = slot.queue.peek().map(s -> s.floor).orElse(request.toFloor);
                    queued = unit.heading(head, Direction.NONE, MotionState.IDLE);
                    store.update(queued);
                    notifier.publishUnitChanged(queued);
                }
                record(ElevatorEvent.of(EventKind.ELEVATOR_CALLED, queued, request.fromFloor, request.toFloor,
                        "Elevator called from floor " + request.fromFloor + " to floor " + request.toFloor
                                + " by " + request.requestedBy));
            } catch (RuntimeException e) {
                slot.queue.truncateTo(sizeBefore);
                throw e;
            }

            Logger.logLine("Call queued", "call", request.id, "elevator", elevatorId, "from", request.fromFloor,
                    "to", request.toFloor, "queue", slot.queue);

            startLocked(slot);
            return unit;
        } finally {
            slot.lock.unlock();
        }
    }

    /** Starts the unit's chain if it has queued stops and none is running; otherwise does nothing. */
    public void start(String elevatorId) {
        UnitSlot slot = slot(elevatorId);
        slot.lock.lock();
        try {
            startLocked(slot);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Cancels every scheduled step of every unit, clears all stop queues and parks each stopped unit
     * idle where it stands. A step already running finishes its writes but schedules nothing
     * afterwards. Safe to call repeatedly.
     */
    public void stopAll() {
        int stopped = 0;
        for (UnitSlot slot : slots.values()) {
            slot.lock.lock();
            try {
                Chain chain = slot.chain;
                slot.queue.clear();
                if (chain != null) {
                    chain.cancel();
                    slot.chain = null;
                    stopped++;
                    park(slot);
                }
            } finally {
                slot.lock.unlock();
            }
        }
        Logger.logLine("Movements stopped", "msg", stopped + " active chain(s) cancelled");
    }

    public boolean hasActiveChain(String elevatorId) {
        UnitSlot slot = slots.get(elevatorId);
        if (slot == null) return false;
        slot.lock.lock();
        try {
            return slot.chain != null;
        } finally {
            slot.lock.unlock();
        }
    }

    public List<String> activeUnits() {
        List<String> active = new ArrayList<>();
        for (UnitSlot slot : slots.values()) {
            if (hasActiveChain(slot.elevatorId)) active.add(slot.elevatorId);
        }
        return active;
    }

    public List<Stop> pendingStops(String elevatorId) {
        UnitSlot slot = slots.get(elevatorId);
        if (slot == null) return List.of();
        slot.lock.lock();
        try {
            return slot.queue.stops();
        } finally {
            slot.lock.unlock();
        }
    }

    private UnitSlot slot(String elevatorId) {
        return slots.computeIfAbsent(elevatorId, UnitSlot::new);
    }

    // ---- chain steps, all called with slot.lock held ----

    private void startLocked(UnitSlot slot) {
        if (slot.chain != null) return; // one chain per unit
        if (slot.queue.isEmpty()) return;

        Chain chain = new Chain();
        slot.chain = chain;
        execute(slot, chain, (s, c) -> beginLeg(s, c, load(s)));
    }

    // a leg runs from the current floor to the queue head, it picks up the config of the moment
    private void beginLeg(UnitSlot slot, Chain chain, ElevatorUnit unit) {
        chain.config = configSource.get();
        int target = slot.queue.peek()
                .orElseThrow(() -> new SimulationInconsistencyException(slot.elevatorId, "Leg started on empty queue"))
                .floor;
        Direction dir = Direction.towards(unit.currentFloor, target);

        if (dir == Direction.NONE) {
            // already standing on the next stop
            ElevatorUnit here = unit.heading(target, Direction.NONE, MotionState.IDLE);
            persist(here);
            arrive(slot, chain, here);
            return;
        }

        ElevatorUnit moving = unit.heading(target, dir, MotionState.movingTowards(dir));
        persist(moving);
        Logger.logLine("Departing", "elevator", moving.id, "floor", moving.currentFloor, "target", target, "dir", dir);
        schedule(slot, chain, Duration.ZERO, this::tick);
    }

    private void tick(UnitSlot slot, Chain chain) {
        ElevatorUnit unit = load(slot);
        if (unit.targetFloor == null) {
            throw new SimulationInconsistencyException(slot.elevatorId, unit.id + " is moving without a target");
        }
        int target = unit.targetFloor;

        if (unit.currentFloor == target) {
            arrive(slot, chain, unit);
            return;
        }

        Direction dir = unit.direction != Direction.NONE ? unit.direction : Direction.towards(unit.currentFloor, target);
        int from = unit.currentFloor;
        int next = from + dir.step();

        if (!chain.config.containsFloor(next)) {
            stopAtBoundary(slot, unit, next);
            return;
        }

        ElevatorUnit moved = new ElevatorUnit(unit.id, next, target, dir, MotionState.movingTowards(dir),
                Instant.now());
        store.update(moved);
        notifier.publishUnitChanged(moved);
        record(ElevatorEvent.of(EventKind.FLOOR_REACHED, moved, from, next, "Elevator moved to floor " + next));
        Logger.logLine("Floor reached", "elevator", moved.id, "floor", next, "target", target);

        schedule(slot, chain, chain.config.floorMoveDuration(), this::tick);
    }

    private void arrive(UnitSlot slot, Chain chain, ElevatorUnit unit) {
        ElevatorUnit opening = unit.inDoorPhase(MotionState.DOORS_OPENING);
        store.update(opening);
        notifier.publishUnitChanged(opening);
        String kind = slot.queue.peek().map(s -> s.kind.name().toLowerCase()).orElse("stop");
        record(ElevatorEvent.atFloor(EventKind.DOORS_OPENING, opening,
                "Doors opening at floor " + opening.currentFloor + " (" + kind + ")"));
        Logger.logLine("Doors opening", "elevator", opening.id, "floor", opening.currentFloor);

        schedule(slot, chain, chain.config.doorPhaseDuration(), this::doorsOpen);
    }

    private void doorsOpen(UnitSlot slot, Chain chain) {
        ElevatorUnit open = load(slot).inDoorPhase(MotionState.DOORS_OPEN);
        store.update(open);
        notifier.publishUnitChanged(open);
        record(ElevatorEvent.atFloor(EventKind.DOORS_OPEN, open, "Doors open at floor " + open.currentFloor));

        schedule(slot, chain, doorsOpenDwell, this::doorsClosing);
    }

    private void doorsClosing(UnitSlot slot, Chain chain) {
        ElevatorUnit closing = load(slot).inDoorPhase(MotionState.DOORS_CLOSING);
        store.update(closing);
        notifier.publishUnitChanged(closing);
        record(ElevatorEvent.atFloor(EventKind.DOORS_CLOSING, closing, "Doors closing at floor " + closing.currentFloor));
        Logger.logLine("Doors closing", "elevator", closing.id, "floor", closing.currentFloor);

        schedule(slot, chain, chain.config.doorPhaseDuration(), this::finishStop);
    }

    private void finishStop(UnitSlot slot, Chain chain) {
        ElevatorUnit unit = load(slot);
        slot.queue.popHead(unit.currentFloor);

        if (!slot.queue.isEmpty()) {
            int next = slot.queue.peek().get().floor;
            // momentary idle between stops, the unit stays with this chain
            ElevatorUnit between = unit.heading(next, Direction.towards(unit.currentFloor, next), MotionState.IDLE);
            persist(between);
            beginLeg(slot, chain, between);
            return;
        }

        ElevatorUnit idle = unit.settled();
        store.update(idle);
        notifier.publishUnitChanged(idle);
        record(ElevatorEvent.atFloor(EventKind.ELEVATOR_IDLE, idle, "Elevator idle at floor " + idle.currentFloor));
        Logger.logLine("Idle", "elevator", idle.id, "floor", idle.currentFloor);
        slot.chain = null;
    }

    private void stopAtBoundary(UnitSlot slot, ElevatorUnit unit, int rejectedFloor) {
        ElevatorUnit healed = new ElevatorUnit(unit.id, unit.currentFloor, 1, Direction.NONE, MotionState.IDLE,
                Instant.now());
        slot.queue.clear();
        slot.chain = null;
        store.update(healed);
        notifier.publishUnitChanged(healed);
        record(ElevatorEvent.atFloor(EventKind.BOUNDARY_VIOLATION, healed,
                "Elevator stopped at invalid floor boundary (next floor " + rejectedFloor + ")"));
        Logger.logLine("Boundary violation", "elevator", unit.id, "floor", unit.currentFloor, "target", rejectedFloor);
    }

    // ---- plumbing ----

    private interface Step {
        void run(UnitSlot slot, Chain chain);
    }

    private void schedule(UnitSlot slot, Chain chain, Duration delay, Step step) {
        if (chain.cancelled) return;
        chain.pending = scheduler.schedule(() -> runStep(slot, chain, step), delay);
    }

    private void runStep(UnitSlot slot, Chain chain, Step step) {
        slot.lock.lock();
        try {
            if (chain.cancelled || slot.chain != chain) return;
            execute(slot, chain, step);
        } finally {
            slot.lock.unlock();
        }
    }

    // failures end the chain here, they never reach the scheduler thread or the caller
    private void execute(UnitSlot slot, Chain chain, Step step) {
        try {
            step.run(slot, chain);
        } catch (SimulationInconsistencyException e) {
            Logger.logLine("Simulation inconsistency", "elevator", slot.elevatorId, "err", e.getMessage());
            heal(slot, chain);
        } catch (Exception e) {
            // no retry: the queue is kept and the next accepted call restarts the unit
            Logger.logLine("Tick failed", "elevator", slot.elevatorId, "err", String.valueOf(e));
            dropChain(slot, chain);
        }
    }

    private void heal(UnitSlot slot, Chain chain) {
        dropChain(slot, chain);
        slot.queue.clear();
        try {
            store.get(slot.elevatorId).ifPresent(unit -> persist(unit.settled()));
        } catch (RuntimeException e) {
            Logger.logLine("Heal failed", "elevator", slot.elevatorId, "err", String.valueOf(e));
        }
    }

    // unit of a cancelled chain, settled so it no longer looks like it is travelling
    private void park(UnitSlot slot) {
        try {
            store.get(slot.elevatorId).ifPresent(unit -> {
                ElevatorUnit idle = unit.settled();
                persist(idle);
                record(ElevatorEvent.atFloor(EventKind.ELEVATOR_IDLE, idle,
                        "Elevator stopped at floor " + idle.currentFloor));
            });
        } catch (RuntimeException e) {
            Logger.logLine("Park failed", "elevator", slot.elevatorId, "err", String.valueOf(e));
        }
    }

    private void dropChain(UnitSlot slot, Chain chain) {
        chain.cancel();
        if (slot.chain == chain) slot.chain = null;
    }

    private ElevatorUnit load(UnitSlot slot) {
        return store.get(slot.elevatorId).orElseThrow(() ->
                new SimulationInconsistencyException(slot.elevatorId, "Elevator " + slot.elevatorId + " disappeared from store"));
    }

    private void persist(ElevatorUnit unit) {
        store.update(unit);
        notifier.publishUnitChanged(unit);
    }

    private void record(ElevatorEvent event) {
        eventLog.append(event);
        notifier.publishEvent(event);
    }

    private static final class UnitSlot {
        final String elevatorId;
        final ReentrantLock lock = new ReentrantLock(true);
        final StopQueue queue;
        // guarded by lock
        Chain chain;

        UnitSlot(String elevatorId) {
            this.elevatorId = elevatorId;
            this.queue = new StopQueue(elevatorId);
        }
    }

    private static final class Chain {
        volatile boolean cancelled;
        // timings of the current leg
        BuildingConfig config;
        TickScheduler.ScheduledTick pending;

        void cancel() {
            cancelled = true;
            if (pending != null) pending.cancel();
        }
    }
}
