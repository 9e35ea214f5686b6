package elevator_fleet.notify;

import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;
import elevator_fleet.models.QueryLogEntry;
import elevator_fleet.utils.Logger;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of {@link NotificationMessage}s to every subscriber.
 *
 * <p>A failing subscriber is logged and skipped, the others still receive the message. The last
 * {@value #MAX_HISTORY_SIZE} messages are kept for late joiners and diagnostics.
 */
public final class NotificationHub implements Notifier {

    static final int MAX_HISTORY_SIZE = 100;

    private final List<Consumer<NotificationMessage>> subscribers = new CopyOnWriteArrayList<>();
    private final Deque<NotificationMessage> history = new ConcurrentLinkedDeque<>();

    public void subscribe(Consumer<NotificationMessage> subscriber) {
        if (subscriber != null) {
            subscribers.add(subscriber);
        }
    }

    public void unsubscribe(Consumer<NotificationMessage> subscriber) {
        if (subscriber != null) {
            subscribers.remove(subscriber);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public void publishUnitChanged(ElevatorUnit unit) {
        broadcast(NotificationMessage.unitChanged(unit));
    }

    @Override
    public void publishEvent(ElevatorEvent event) {
        broadcast(NotificationMessage.eventRecorded(event));
    }

    // audit trail of the SQL store, not part of the engine's notifier contract
    public void publishQueryLogged(QueryLogEntry entry) {
        broadcast(NotificationMessage.queryLogged(entry));
    }

    public void broadcast(NotificationMessage message) {
        history.addLast(message);
        while (history.size() > MAX_HISTORY_SIZE) {
            history.pollFirst();
        }

        for (Consumer<NotificationMessage> subscriber : subscribers) {
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                Logger.logLine("Subscriber failed", "msg", message.type().wireName(), "err", String.valueOf(e));
            }
        }
    }

    /** Most recent messages, oldest first. */
    public List<NotificationMessage> recentMessages(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<NotificationMessage> snapshot = new ArrayList<>(history);
        int start = Math.max(0, snapshot.size() - limit);
        return List.copyOf(snapshot.subList(start, snapshot.size()));
    }
}
