package elevator_fleet;

import com.zaxxer.hikari.HikariDataSource;
import elevator_fleet.engine.ExecutorTickScheduler;
import elevator_fleet.models.BuildingConfig;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.notify.LoggingSubscriber;
import elevator_fleet.notify.NotificationHub;
import elevator_fleet.simulation.CallGenerator;
import elevator_fleet.storage.EventLog;
import elevator_fleet.storage.FleetStore;
import elevator_fleet.storage.InMemoryEventLog;
import elevator_fleet.storage.InMemoryFleetStore;
import elevator_fleet.storage.QueryLog;
import elevator_fleet.storage.jdbc.HikariDataSourceFactory;
import elevator_fleet.storage.jdbc.JdbcEventLog;
import elevator_fleet.storage.jdbc.JdbcFleetStore;
import elevator_fleet.storage.jdbc.JdbcQueryLog;
import elevator_fleet.storage.jdbc.StorageSchema;
import elevator_fleet.utils.Logger;

public final class Main {

    public static void main(String[] args) {
        BootstrapSettings settings = BootstrapSettings.load();
        BuildingConfig building = settings.building;
        Logger.logLine("Simulation start", "msg", building, "elevator", settings.elevators + " unit(s)",
                "state", settings.storage);

        NotificationHub hub = new NotificationHub();
        hub.subscribe(new LoggingSubscriber());

        HikariDataSource dataSource = null;
        FleetStore store;
        EventLog eventLog;
        QueryLog queryLog;
        if (settings.storage == BootstrapSettings.StorageBackend.SQLITE) {
            dataSource = HikariDataSourceFactory.createSqlite(settings.sqliteFile, settings.sqlitePoolSize);
            StorageSchema.initialize(dataSource, settings.elevators);
            JdbcQueryLog jdbcQueryLog = new JdbcQueryLog(dataSource, hub::publishQueryLogged);
            store = new JdbcFleetStore(dataSource, jdbcQueryLog);
            eventLog = new JdbcEventLog(dataSource, jdbcQueryLog);
            queryLog = jdbcQueryLog;
        } else {
            store = InMemoryFleetStore.withDefaultFleet(settings.elevators);
            eventLog = new InMemoryEventLog();
            queryLog = QueryLog.none();
        }

        ElevatorSystem system = new ElevatorSystem(store, eventLog, hub,
                new ExecutorTickScheduler(settings.tickThreads), building, queryLog);
        system.recoverInterruptedUnits();

        HikariDataSource toClose = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            system.shutdown();
            if (toClose != null) toClose.close();
        }, "Shutdown"));

        // generous bound: every call could be queued on one unit
        long perCallMs = (long) ((building.totalFloors * 2 * building.floorMoveTime
                + 2 * building.doorOpenCloseTime + Config.DOORS_OPEN_DWELL) * 1000);
        CallGenerator gen = new CallGenerator(system, building.totalFloors, settings.simulatedCalls,
                perCallMs * Math.max(1, settings.simulatedCalls));
        gen.start();

        try {
            gen.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            Logger.logLine("Calls", "msg", gen.acceptedCalls() + " accepted, " + gen.rejectedCalls() + " rejected");
            for (ElevatorUnit unit : system.currentState()) {
                Logger.logLine("Final state", "elevator", unit.id, "floor", unit.currentFloor, "state", unit.state);
            }
            Logger.logLine("Simulation end");
        }
    }
}
