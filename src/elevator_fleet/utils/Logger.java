package elevator_fleet.utils;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.locks.ReentrantLock;

public final class Logger {

    // one start instant shared by every thread
    private static volatile Logger instance;
    private static final Object CLASS_LOCK = new Object();

    // short keys used at call sites -> printed titles
    private static final Map<String, String> LABELS = new LinkedHashMap<>();

    static {
        LABELS.put("call", "Call");
        LABELS.put("elevator", "Elevator");
        LABELS.put("floor", "Floor");
        LABELS.put("from", "From floor");
        LABELS.put("to", "To floor");
        LABELS.put("target", "Target");
        LABELS.put("state", "State");
        LABELS.put("dir", "Direction");
        LABELS.put("by", "Requested by");
        LABELS.put("eta", "ETA (s)");
        LABELS.put("queue", "Queue");
        LABELS.put("source", "Source");
        LABELS.put("params", "Parameters");
        LABELS.put("err", "Error");
        LABELS.put("msg", "Message");
    }

    private final Instant start;
    private final ReentrantLock printLock = new ReentrantLock(true); // fair, keeps lines whole
    private volatile PrintStream out = System.out;

    private Logger() {
        start = Instant.now();
    }

    public static Logger get() {
        Logger local = instance;
        if (local == null) {
            synchronized (CLASS_LOCK) {
                local = instance;
                if (local == null) {
                    local = new Logger();
                    instance = local;
                }
            }
        }
        return local;
    }

    public void redirect(PrintStream target) {
        out = target == null ? System.out : target;
    }

    public void log(String event, Object... kv) {
        // seconds since simulation start
        double dt = Duration.between(start, Instant.now()).toNanos() / 1_000_000_000.0;
        String ts = String.format("%8.3fs", dt);

        String tName = Thread.currentThread().getName();

        String detailsStr = "-";
        if (kv != null && kv.length > 0) {
            StringJoiner sj = new StringJoiner(" | ");

            for (int i = 0; i + 1 < kv.length; i += 2) {
                String k = String.valueOf(kv[i]);
                Object vObj = kv[i + 1];

                String title = LABELS.getOrDefault(k, k);
                sj.add(title + ": " + (vObj == null ? "-" : vObj));
            }

            detailsStr = (sj.length() == 0) ? "-" : sj.toString();
        }

        // fixed widths so columns line up
        String eventPadded = String.format("%-22s", event);
        String tNamePadded = String.format("%-16s", tName);

        String line = ts + " | " + tNamePadded + " | " + eventPadded + " | " + detailsStr;

        printLock.lock();
        try {
            out.println(line);
        } finally {
            printLock.unlock();
        }
    }

    public static void logLine(String event, Object... kv) {
        Logger.get().log(event, kv);
    }
}
