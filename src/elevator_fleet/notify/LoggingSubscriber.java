package elevator_fleet.notify;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import elevator_fleet.utils.Logger;
import java.util.function.Consumer;

// prints every hub message to the console log
public final class LoggingSubscriber implements Consumer<NotificationMessage> {

    @Override
    public void accept(NotificationMessage message) {
        JsonObject data = message.data();
        switch (message.type()) {
            case ELEVATOR_UPDATE -> Logger.logLine("Elevator update",
                    "elevator", text(data, "id"),
                    "floor", text(data, "currentFloor"),
                    "target", text(data, "targetFloor"),
                    "state", text(data, "state"),
                    "dir", text(data, "direction"));
            case ELEVATOR_LOG -> Logger.logLine(text(data, "event"),
                    "elevator", text(data, "elevatorId"),
                    "msg", text(data, "details"));
            case QUERY_LOG -> Logger.logLine("Query",
                    "source", text(data, "source"),
                    "params", text(data, "parameters"));
        }
    }

    private static String text(JsonObject data, String key) {
        JsonElement e = data.get(key);
        return (e == null || e.isJsonNull()) ? "-" : e.getAsString();
    }
}
