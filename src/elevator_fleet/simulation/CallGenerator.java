package elevator_fleet.simulation;

import elevator_fleet.ElevatorSystem;
import elevator_fleet.errors.ElevatorException;
import elevator_fleet.models.CallAssignment;
import elevator_fleet.utils.Logger;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Demo load: issues random calls against the system, then waits until every unit has gone idle.
 */
public final class CallGenerator extends Thread {

    private static final long IDLE_POLL_MS = 500;

    private final ElevatorSystem system;
    private final int floors;
    private final int calls;
    private final long maxWaitMs;

    private final AtomicInteger accepted = new AtomicInteger();
    private final AtomicInteger rejected = new AtomicInteger();

    public CallGenerator(ElevatorSystem system, int floors, int calls, long maxWaitMs) {
        super("Generator");
        setDaemon(true);

        this.system = system;
        this.floors = floors;
        this.calls = calls;
        this.maxWaitMs = maxWaitMs;
    }

    public int acceptedCalls() {
        return accepted.get();
    }

    public int rejectedCalls() {
        return rejected.get();
    }

    private void issueCall(int number) {
        int from = ThreadLocalRandom.current().nextInt(1, floors + 1);
        int to = ThreadLocalRandom.current().nextInt(1, floors + 1);
        while (to == from) to = ThreadLocalRandom.current().nextInt(1, floors + 1);

        try {
            CallAssignment assignment = system.acceptCall(from, to, "passenger-" + number);
            accepted.incrementAndGet();
            Logger.logLine("Passenger waiting", "elevator", assignment.elevatorId, "from", from, "to", to,
                    "eta", assignment.estimatedSeconds);
        } catch (ElevatorException e) {
            rejected.incrementAndGet();
            Logger.logLine("Call rejected", "from", from, "to", to, "err", e.getMessage());
        }
    }

    private static double rand(double a, double b) {
        return a + (b - a) * ThreadLocalRandom.current().nextDouble();
    }

    private static boolean sleepMs(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void run() {
        Logger.logLine("Generator started", "msg", calls + " call(s)");

        for (int i = 1; i <= calls; i++) {
            issueCall(i);
            if (!sleepMs((long) (rand(0.5, 2.0) * 1000))) return;
        }

        // let the fleet finish its queues
        long deadline = System.currentTimeMillis() + maxWaitMs;
        while (!system.activeUnits().isEmpty() && System.currentTimeMillis() < deadline) {
            if (!sleepMs(IDLE_POLL_MS)) return;
        }

        Logger.logLine("Generator finished", "msg", calls + " call(s) issued");
    }
}
