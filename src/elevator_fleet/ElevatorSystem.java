package elevator_fleet;

import elevator_fleet.dispatcher.Dispatcher;
import elevator_fleet.engine.MovementEngine;
import elevator_fleet.engine.TickScheduler;
import elevator_fleet.errors.ElevatorNotFoundException;
import elevator_fleet.models.BuildingConfig;
import elevator_fleet.models.CallAssignment;
import elevator_fleet.models.CallRequest;
import elevator_fleet.models.ConfigUpdate;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.EventKind;
import elevator_fleet.models.QueryLogEntry;
import elevator_fleet.models.Stop;
import elevator_fleet.notify.Notifier;
import elevator_fleet.storage.EventLog;
import elevator_fleet.storage.FleetStore;
import elevator_fleet.storage.QueryLog;
import elevator_fleet.utils.Logger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for everything outside the core: accepting calls, status queries, configuration
 * and shutdown.
 */
public final class ElevatorSystem {

    private final FleetStore store;
    private final EventLog eventLog;
    private final Notifier notifier;
    private final TickScheduler scheduler;
    private final QueryLog queryLog;
    private final Dispatcher dispatcher = new Dispatcher();
    private final MovementEngine engine;
    private final AtomicReference<BuildingConfig> config;

    public ElevatorSystem(FleetStore store, EventLog eventLog, Notifier notifier,
                          TickScheduler scheduler, BuildingConfig initialConfig) {
        this(store, eventLog, notifier, scheduler, initialConfig, QueryLog.none());
    }

    public ElevatorSystem(FleetStore store, EventLog eventLog, Notifier notifier,
                          TickScheduler scheduler, BuildingConfig initialConfig, QueryLog queryLog) {
        this.queryLog = Objects.requireNonNull(queryLog, "queryLog");
        this.store = Objects.requireNonNull(store, "store");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = new AtomicReference<>(Objects.requireNonNull(initialConfig, "initialConfig"));
        this.engine = new MovementEngine(store, eventLog, notifier, scheduler, this.config::get);
    }

    /**
     * Validates the call, picks a unit and queues the trip on it.
     *
     * @throws elevator_fleet.errors.ValidationException for floors outside the building or equal floors
     */
    public CallAssignment acceptCall(int fromFloor, int toFloor, String requestedBy) {
        CallRequest request = new CallRequest(fromFloor, toFloor, requestedBy);
        BuildingConfig current = config.get();
        Logger.logLine("Call received", "call", request.id, "from", fromFloor, "to", toFloor,
                "by", request.requestedBy);

        Dispatcher.validate(request, current);

        ElevatorUnit chosen = dispatcher.choose(store.getAll(), request.fromFloor);
        ElevatorUnit unit = engine.accept(chosen.id, request);

        double eta = MovementEngine.estimateSeconds(unit.currentFloor, fromFloor, toFloor, current);
        Logger.logLine("Elevator assigned", "elevator", unit.id, "floor", unit.currentFloor, "eta", eta);
        return new CallAssignment(unit.id, eta);
    }

    public CallAssignment acceptCall(int fromFloor, int toFloor) {
        return acceptCall(fromFloor, toFloor, null);
    }

    public ElevatorUnit currentState(String elevatorId) {
        return store.get(elevatorId).orElseThrow(() -> new ElevatorNotFoundException(elevatorId));
    }

    public List<ElevatorUnit> currentState() {
        return store.getAll();
    }

    public List<ElevatorEvent> recentEvents(String elevatorId, int limit) {
        return eventLog.recent(elevatorId, limit);
    }

    public List<ElevatorEvent> recentEvents(String elevatorId) {
        return recentEvents(elevatorId, Config.DEFAULT_LOG_LIMIT);
    }

    /** Statements the store has run, newest first; always empty for the in-memory store. */
    public List<QueryLogEntry> recentQueries(int limit) {
        return queryLog.recent(limit);
    }

    public List<QueryLogEntry> recentQueries() {
        return recentQueries(Config.DEFAULT_LOG_LIMIT);
    }

    public List<Stop> pendingStops(String elevatorId) {
        return engine.pendingStops(elevatorId);
    }

    public boolean hasActiveMovement(String elevatorId) {
        return engine.hasActiveChain(elevatorId);
    }

    public List<String> activeUnits() {
        return engine.activeUnits();
    }

    public void stopAll() {
        engine.stopAll();
    }

    /** Applies a partial update; chains already under way keep the timings of their current leg. */
    public BuildingConfig setConfig(ConfigUpdate update) {
        BuildingConfig updated = config.updateAndGet(c -> c.merge(update));
        Logger.logLine("Config updated", "msg", updated);
        return updated;
    }

    public BuildingConfig getConfig() {
        return config.get();
    }

    /**
     * Settles units restored mid-journey from a previous process. Their stop queues did not
     * survive, so they are parked where they stand.
     *
     * @return number of units reset
     */
    public int recoverInterruptedUnits() {
        int recovered = 0;
        for (ElevatorUnit unit : store.getAll()) {
            if (unit.isIdle() && !unit.hasTarget()) continue;
            ElevatorUnit idle = unit.settled();
            store.update(idle);
            notifier.publishUnitChanged(idle);
            ElevatorEvent event = ElevatorEvent.atFloor(EventKind.ELEVATOR_IDLE, idle,
                    "Elevator idle at floor " + idle.currentFloor + " after restart");
            eventLog.append(event);
            notifier.publishEvent(event);
            recovered++;
        }
        if (recovered > 0) {
            Logger.logLine("Units recovered", "msg", recovered + " unit(s) parked after restart");
        }
        return recovered;
    }

    public void shutdown() {
        engine.stopAll();
        scheduler.shutdown();
    }
}
