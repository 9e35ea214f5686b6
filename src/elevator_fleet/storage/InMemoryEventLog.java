package elevator_fleet.storage;

import elevator_fleet.models.ElevatorEvent;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event log kept in memory, bounded to the most recent {@code capacity} entries.
 */
public final class InMemoryEventLog implements EventLog {

    private static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final ConcurrentLinkedDeque<ElevatorEvent> entries = new ConcurrentLinkedDeque<>();
    // the deque's own size() walks every node
    private final AtomicInteger count = new AtomicInteger();

    public InMemoryEventLog() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryEventLog(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    @Override
    public void append(ElevatorEvent event) {
        entries.addLast(Objects.requireNonNull(event, "event"));
        count.incrementAndGet();
        // each decrement claims exactly one eviction
        int current;
        while ((current = count.get()) > capacity) {
            if (count.compareAndSet(current, current - 1)) {
                entries.pollFirst();
            }
        }
    }

    @Override
    public List<ElevatorEvent> recent(String elevatorId, int limit) {
        List<ElevatorEvent> out = new ArrayList<>();
        if (limit <= 0) return out;
        Iterator<ElevatorEvent> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            ElevatorEvent e = it.next();
            if (elevatorId == null || elevatorId.equals(e.elevatorId)) out.add(e);
        }
        return out;
    }

    public int size() {
        return count.get();
    }
}
