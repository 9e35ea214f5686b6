package elevator_fleet.notify;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.QueryLogEntry;
import java.time.Instant;
import java.util.Objects;

/**
 * Envelope pushed to observers: {@code {"type": ..., "data": {...}, "timestamp": ISO-8601}}.
 *
 * <p>Payloads are built field by field so the wire names stay stable regardless of the Java field
 * names.
 */
public final class NotificationMessage {

    public enum Type {
        ELEVATOR_UPDATE("elevator_update"),
        ELEVATOR_LOG("elevator_log"),
        QUERY_LOG("query_log");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    // observers expect idle units to carry explicit nulls
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final Type type;
    private final JsonObject data;
    private final Instant timestamp;

    public NotificationMessage(Type type, JsonObject data, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.data = Objects.requireNonNull(data, "data");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public static NotificationMessage unitChanged(ElevatorUnit unit) {
        JsonObject data = new JsonObject();
        data.addProperty("id", unit.id);
        data.addProperty("currentFloor", unit.currentFloor);
        data.add("targetFloor", nullableInt(unit.targetFloor));
        data.addProperty("state", unit.state.wireName());
        data.add("direction", direction(unit.direction));
        data.addProperty("isMoving", unit.isMoving());
        data.addProperty("lastUpdated", unit.lastUpdated.toString());
        return new NotificationMessage(Type.ELEVATOR_UPDATE, data, Instant.now());
    }

    public static NotificationMessage eventRecorded(ElevatorEvent event) {
        JsonObject data = new JsonObject();
        data.addProperty("id", event.id);
        data.addProperty("elevatorId", event.elevatorId);
        data.addProperty("event", event.kind.wireName());
        data.add("fromFloor", nullableInt(event.fromFloor));
        data.add("toFloor", nullableInt(event.toFloor));
        data.addProperty("state", event.state.wireName());
        data.add("direction", direction(event.direction));
        data.addProperty("timestamp", event.timestamp.toString());
        data.addProperty("details", event.details);
        return new NotificationMessage(Type.ELEVATOR_LOG, data, Instant.now());
    }

    public static NotificationMessage queryLogged(QueryLogEntry entry) {
        JsonObject data = new JsonObject();
        data.addProperty("id", entry.id);
        data.addProperty("query", entry.query);
        data.addProperty("executedBy", entry.executedBy);
        data.addProperty("executedAt", entry.executedAt.toString());
        data.addProperty("source", entry.source);
        data.addProperty("parameters", entry.parameters);
        return new NotificationMessage(Type.QUERY_LOG, data, Instant.now());
    }

    public Type type() {
        return type;
    }

    public JsonObject data() {
        return data.deepCopy();
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("type", type.wireName());
        root.add("data", data);
        root.addProperty("timestamp", timestamp.toString());
        return GSON.toJson(root);
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static JsonElement nullableInt(Integer value) {
        return value == null ? JsonNull.INSTANCE : GSON.toJsonTree(value);
    }

    // idle units and door phases go out as null, like the persisted form
    private static JsonElement direction(Direction direction) {
        return direction == Direction.NONE ? JsonNull.INSTANCE : GSON.toJsonTree(direction.wireName());
    }
}
