package elevator_fleet.engine;

import java.time.Duration;

/** Runs delayed steps of the unit tick chains. */
public interface TickScheduler {

    /**
     * Runs {@code task} once after {@code delay}; a zero delay means "as soon as possible", never
     * inline on the calling thread.
     */
    ScheduledTick schedule(Runnable task, Duration delay);

    /** Stops accepting work and releases the threads. */
    void shutdown();

    interface ScheduledTick {
        /** Prevents the task from starting, a running task is left to finish. */
        void cancel();
    }
}
