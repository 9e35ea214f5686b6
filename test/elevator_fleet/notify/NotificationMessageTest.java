package elevator_fleet.notify;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.EventKind;
import elevator_fleet.models.MotionState;
import elevator_fleet.models.QueryLogEntry;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NotificationMessage")
class NotificationMessageTest {

    @Test
    @DisplayName("unit update envelope")
    void unitChanged() {
        ElevatorUnit unit = new ElevatorUnit("elevator-3", 4, 7, Direction.UP, MotionState.MOVING_UP,
                Instant.parse("2024-05-01T10:15:30Z"));

        JsonObject root = JsonParser.parseString(NotificationMessage.unitChanged(unit).toJson()).getAsJsonObject();

        assertEquals("elevator_update", root.get("type").getAsString());
        assertTrue(root.has("timestamp"));
        JsonObject data = root.getAsJsonObject("data");
        assertEquals("elevator-3", data.get("id").getAsString());
        assertEquals(4, data.get("currentFloor").getAsInt());
        assertEquals(7, data.get("targetFloor").getAsInt());
        assertEquals("moving_up", data.get("state").getAsString());
        assertEquals("up", data.get("direction").getAsString());
        assertTrue(data.get("isMoving").getAsBoolean());
        assertEquals("2024-05-01T10:15:30Z", data.get("lastUpdated").getAsString());
    }

    @Test
    @DisplayName("idle unit has null target and direction")
    void idleNulls() {
        JsonObject data = NotificationMessage.unitChanged(ElevatorUnit.idleAt("elevator-1", 1)).data();
        assertTrue(data.get("targetFloor").isJsonNull());
        assertTrue(data.get("direction").isJsonNull());
        assertFalse(data.get("isMoving").getAsBoolean());
    }

    @Test
    @DisplayName("nulls survive serialization")
    void nullsSerialized() {
        String json = NotificationMessage.unitChanged(ElevatorUnit.idleAt("elevator-1", 1)).toJson();
        JsonObject data = JsonParser.parseString(json).getAsJsonObject().getAsJsonObject("data");
        assertTrue(data.has("targetFloor"));
        assertTrue(data.get("targetFloor").isJsonNull());
        assertTrue(data.get("direction").isJsonNull());
    }

    @Test
    @DisplayName("event envelope")
    void eventRecorded() {
        ElevatorUnit unit = new ElevatorUnit("elevator-2", 5, 5, Direction.NONE, MotionState.DOORS_OPENING, Instant.now());
        ElevatorEvent event = ElevatorEvent.atFloor(EventKind.DOORS_OPENING, unit, "Doors opening at floor 5");

        NotificationMessage message = NotificationMessage.eventRecorded(event);
        assertEquals(NotificationMessage.Type.ELEVATOR_LOG, message.type());

        JsonObject data = message.data();
        assertEquals(event.id, data.get("id").getAsString());
        assertEquals("elevator-2", data.get("elevatorId").getAsString());
        assertEquals("doors_opening", data.get("event").getAsString());
        assertEquals(5, data.get("fromFloor").getAsInt());
        assertEquals(5, data.get("toFloor").getAsInt());
        assertEquals("doors_opening", data.get("state").getAsString());
        assertTrue(data.get("direction").isJsonNull());
        assertEquals("Doors opening at floor 5", data.get("details").getAsString());
    }

    @Test
    @DisplayName("query log envelope")
    void queryLogged() {
        QueryLogEntry entry = new QueryLogEntry("query-1", "SELECT 1", "system",
                Instant.parse("2024-05-01T10:15:30Z"), "getElevator", "[\"elevator-1\"]");

        JsonObject root = JsonParser.parseString(NotificationMessage.queryLogged(entry).toJson()).getAsJsonObject();

        assertEquals("query_log", root.get("type").getAsString());
        JsonObject data = root.getAsJsonObject("data");
        assertEquals("query-1", data.get("id").getAsString());
        assertEquals("SELECT 1", data.get("query").getAsString());
        assertEquals("system", data.get("executedBy").getAsString());
        assertEquals("2024-05-01T10:15:30Z", data.get("executedAt").getAsString());
        assertEquals("getElevator", data.get("source").getAsString());
        assertEquals("[\"elevator-1\"]", data.get("parameters").getAsString());
    }

    @Test
    @DisplayName("query without parameters has null parameters")
    void queryWithoutParameters() {
        QueryLogEntry entry = new QueryLogEntry("query-2", "SELECT 1", "system", Instant.now(), "getAllElevators", null);
        assertTrue(NotificationMessage.queryLogged(entry).data().get("parameters").isJsonNull());
    }

    @Test
    @DisplayName("data is handed out as a copy")
    void dataIsCopied() {
        NotificationMessage message = NotificationMessage.unitChanged(ElevatorUnit.idleAt("elevator-1", 1));
        message.data().addProperty("currentFloor", 9);
        assertEquals(1, message.data().get("currentFloor").getAsInt());
    }
}
