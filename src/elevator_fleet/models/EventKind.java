package elevator_fleet.models;

import java.util.Locale;

public enum EventKind {
    ELEVATOR_CALLED,
    FLOOR_REACHED,
    DOORS_OPENING,
    DOORS_OPEN,
    DOORS_CLOSING,
    ELEVATOR_IDLE,
    BOUNDARY_VIOLATION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventKind fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return wireName();
    }
}
