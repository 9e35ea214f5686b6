package elevator_fleet.storage.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import com.zaxxer.hikari.HikariDataSource;
import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.EventKind;
import elevator_fleet.models.MotionState;
import elevator_fleet.models.QueryLogEntry;
import elevator_fleet.storage.StorageException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JDBC storage on SQLite")
class JdbcStorageTest {

    @TempDir
    Path tempDir;

    private Path dbFile;
    private HikariDataSource dataSource;
    private JdbcFleetStore store;
    private JdbcEventLog eventLog;

    @BeforeEach
    void setUp() {
        dbFile = tempDir.resolve("nested").resolve("elevator.db");
        dataSource = HikariDataSourceFactory.createSqlite(dbFile, 1);
        StorageSchema.initialize(dataSource, 3);
        store = new JdbcFleetStore(dataSource);
        eventLog = new JdbcEventLog(dataSource);
    }

    @AfterEach
    void tearDown() {
        if (dataSource != null) dataSource.close();
    }

    private static Instant millis(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }

    @Nested
    @DisplayName("schema")
    class Schema {

        @Test
        @DisplayName("empty database gets the default fleet at floor 1")
        void seedsFleet() {
            List<ElevatorUnit> fleet = store.getAll();
            assertEquals(3, fleet.size());
            assertEquals("elevator-1", fleet.get(0).id);
            assertEquals("elevator-3", fleet.get(2).id);
            for (ElevatorUnit unit : fleet) {
                assertEquals(1, unit.currentFloor);
                assertEquals(MotionState.IDLE, unit.state);
                assertNull(unit.targetFloor);
                assertEquals(Direction.NONE, unit.direction);
            }
        }

        @Test
        @DisplayName("second initialization keeps persisted state")
        void reopenKeepsState() {
            store.update(new ElevatorUnit("elevator-2", 7, 9, Direction.UP, MotionState.MOVING_UP, millis(1_000)));
            dataSource.close();

            dataSource = HikariDataSourceFactory.createSqlite(dbFile, 1);
            assertEquals(0, StorageSchema.initialize(dataSource, 5));
            JdbcFleetStore reopened = new JdbcFleetStore(dataSource);

            assertEquals(3, reopened.getAll().size());
            ElevatorUnit unit = reopened.get("elevator-2").orElseThrow();
            assertEquals(7, unit.currentFloor);
            assertEquals(MotionState.MOVING_UP, unit.state);
        }
    }

    @Nested
    @DisplayName("fleet store")
    class FleetStoreBehaviour {

        @Test
        @DisplayName("update then read returns the same unit")
        void roundTrip() {
            ElevatorUnit written = new ElevatorUnit("elevator-1", 4, 2, Direction.DOWN, MotionState.MOVING_DOWN,
                    millis(1_700_000_000_123L));
            store.update(written);
            assertEquals(written, store.get("elevator-1").orElseThrow());
        }

        @Test
        @DisplayName("idle unit without target and direction reads back as such")
        void nullsRoundTrip() {
            ElevatorUnit written = new ElevatorUnit("elevator-3", 6, null, Direction.NONE, MotionState.DOORS_OPEN,
                    millis(42));
            store.update(written);
            ElevatorUnit read = store.get("elevator-3").orElseThrow();
            assertNull(read.targetFloor);
            assertEquals(Direction.NONE, read.direction);
            assertEquals(MotionState.DOORS_OPEN, read.state);
        }

        @Test
        @DisplayName("is_moving follows the motion state")
        void derivedMovingColumn() throws Exception {
            store.update(new ElevatorUnit("elevator-1", 2, 5, Direction.UP, MotionState.MOVING_UP, millis(1)));
            store.update(new ElevatorUnit("elevator-2", 2, 2, Direction.NONE, MotionState.DOORS_OPENING, millis(1)));
            try (Connection c = dataSource.getConnection(); Statement s = c.createStatement();
                 ResultSet rs = s.executeQuery("SELECT id, is_moving FROM elevators ORDER BY fleet_order")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt("is_moving"));
                assertTrue(rs.next());
                assertEquals(0, rs.getInt("is_moving"));
            }
        }

        @Test
        @DisplayName("target of zero reads as none")
        void zeroTargetIsNone() throws Exception {
            try (Connection c = dataSource.getConnection(); Statement s = c.createStatement()) {
                s.executeUpdate("UPDATE elevators SET target_floor = 0 WHERE id = 'elevator-1'");
            }
            assertNull(store.get("elevator-1").orElseThrow().targetFloor);
        }

        @Test
        void unknownUnit() {
            assertTrue(store.get("elevator-9").isEmpty());
            assertTrue(store.get(null).isEmpty());
            assertThrows(StorageException.class, () -> store.update(ElevatorUnit.idleAt("elevator-9", 1)));
        }
    }

    @Nested
    @DisplayName("event log")
    class EventLogBehaviour {

        private ElevatorEvent event(String elevatorId, EventKind kind, long at) {
            ElevatorUnit unit = new ElevatorUnit(elevatorId, 3, 5, Direction.UP, MotionState.MOVING_UP, millis(at));
            return new ElevatorEvent("log-" + elevatorId + "-" + at + "-" + kind.wireName(), elevatorId, kind, 2, 3,
                    unit.state, unit.direction, millis(at), "moved");
        }

        @Test
        @DisplayName("newest first with limit")
        void newestFirst() {
            eventLog.append(event("elevator-1", EventKind.ELEVATOR_CALLED, 100));
            eventLog.append(event("elevator-1", EventKind.FLOOR_REACHED, 200));
            eventLog.append(event("elevator-1", EventKind.DOORS_OPENING, 300));

            List<ElevatorEvent> recent = eventLog.recent("elevator-1", 2);
            assertEquals(2, recent.size());
            assertEquals(EventKind.DOORS_OPENING, recent.get(0).kind);
            assertEquals(EventKind.FLOOR_REACHED, recent.get(1).kind);
        }

        @Test
        @DisplayName("same timestamp keeps insertion order")
        void sameMillisecond() {
            eventLog.append(event("elevator-1", EventKind.DOORS_OPEN, 500));
            eventLog.append(event("elevator-1", EventKind.DOORS_CLOSING, 500));
            assertEquals(EventKind.DOORS_CLOSING, eventLog.recent("elevator-1", 1).get(0).kind);
        }

        @Test
        @DisplayName("filter by unit or read the whole fleet")
        void filter() {
            eventLog.append(event("elevator-1", EventKind.ELEVATOR_CALLED, 100));
            eventLog.append(event("elevator-2", EventKind.ELEVATOR_CALLED, 200));

            assertEquals(1, eventLog.recent("elevator-2", 10).size());
            assertEquals(2, eventLog.recent(null, 10).size());
            assertTrue(eventLog.recent("elevator-1", 0).isEmpty());
        }

        @Test
        @DisplayName("all fields survive the round trip")
        void fields() {
            ElevatorEvent written = event("elevator-3", EventKind.FLOOR_REACHED, 1234);
            eventLog.append(written);
            ElevatorEvent read = eventLog.recent("elevator-3", 1).get(0);
            assertEquals(written.id, read.id);
            assertEquals(Integer.valueOf(2), read.fromFloor);
            assertEquals(Integer.valueOf(3), read.toFloor);
            assertEquals(MotionState.MOVING_UP, read.state);
            assertEquals(Direction.UP, read.direction);
            assertEquals(millis(1234), read.timestamp);
            assertEquals("moved", read.details);
        }

        @Test
        @DisplayName("entries must belong to a known unit")
        void foreignKey() {
            assertThrows(StorageException.class,
                    () -> eventLog.append(event("elevator-9", EventKind.ELEVATOR_IDLE, 1)));
        }
    }

    @Nested
    @DisplayName("query log")
    class QueryLogBehaviour {

        private final List<QueryLogEntry> heard = new ArrayList<>();
        private JdbcQueryLog queryLog;
        private JdbcFleetStore auditedStore;
        private JdbcEventLog auditedLog;

        @BeforeEach
        void wire() {
            queryLog = new JdbcQueryLog(dataSource, heard::add);
            auditedStore = new JdbcFleetStore(dataSource, queryLog);
            auditedLog = new JdbcEventLog(dataSource, queryLog);
        }

        private int rows() throws Exception {
            try (Connection c = dataSource.getConnection(); Statement s = c.createStatement();
                 ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM query_logs")) {
                rs.next();
                return rs.getInt(1);
            }
        }

        @Test
        @DisplayName("reads are recorded with source and JSON parameters")
        void readsAudited() {
            auditedStore.get("elevator-1");

            assertEquals(1, heard.size());
            QueryLogEntry entry = heard.get(0);
            assertEquals("getElevator", entry.source);
            assertEquals("system", entry.executedBy);
            assertEquals("[\"elevator-1\"]", entry.parameters);
            assertTrue(entry.query.startsWith("SELECT"));
            assertTrue(entry.id.startsWith("query-"));
        }

        @Test
        @DisplayName("statement without parameters stores none")
        void noParameters() {
            auditedStore.getAll();
            assertEquals("getAllElevators", heard.get(0).source);
            assertNull(heard.get(0).parameters);
        }

        @Test
        @DisplayName("update parameters keep nulls in column order")
        void updateParameters() {
            auditedStore.update(new ElevatorUnit("elevator-2", 3, null, Direction.NONE, MotionState.IDLE, millis(500)));

            QueryLogEntry entry = heard.get(0);
            assertEquals("updateElevator", entry.source);
            assertEquals("[3,null,\"idle\",null,0,500,\"elevator-2\"]", entry.parameters);
            assertEquals(3, store.get("elevator-2").orElseThrow().currentFloor);
        }

        @Test
        @DisplayName("event log reads are recorded with or without a unit filter")
        void eventLogReads() {
            auditedLog.recent("elevator-1", 5);
            auditedLog.recent(null, 7);

            assertEquals("getElevatorLogs", heard.get(0).source);
            assertEquals("[\"elevator-1\",5]", heard.get(0).parameters);
            assertEquals("[7]", heard.get(1).parameters);
        }

        @Test
        @DisplayName("recent is newest first, bounded, and records its own read")
        void recentEntries() {
            auditedStore.get("elevator-1");
            auditedStore.get("elevator-2");
            auditedStore.get("elevator-3");

            List<QueryLogEntry> recent = queryLog.recent(3);
            assertEquals(3, recent.size());
            assertEquals("getQueryLogs", recent.get(0).source);
            assertEquals("[3]", recent.get(0).parameters);
            assertEquals("[\"elevator-3\"]", recent.get(1).parameters);
            assertEquals("[\"elevator-2\"]", recent.get(2).parameters);
            assertTrue(queryLog.recent(0).isEmpty());
        }

        @Test
        @DisplayName("failing listener does not fail the statement")
        void listenerFailure() throws Exception {
            JdbcQueryLog throwing = new JdbcQueryLog(dataSource, entry -> {
                throw new IllegalStateException("listener down");
            });
            JdbcFleetStore audited = new JdbcFleetStore(dataSource, throwing);

            audited.update(new ElevatorUnit("elevator-1", 6, null, Direction.NONE, MotionState.IDLE, millis(1)));

            assertEquals(6, store.get("elevator-1").orElseThrow().currentFloor);
            assertEquals(1, rows());
        }

        @Test
        @DisplayName("stores without a query log record nothing")
        void unaudited() throws Exception {
            store.getAll();
            store.update(ElevatorUnit.idleAt("elevator-1", 2));
            eventLog.recent(null, 10);
            assertEquals(0, rows());
        }
    }
}
