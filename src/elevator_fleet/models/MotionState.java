package elevator_fleet.models;

import java.util.Locale;

/**
 * Observable state of one elevator unit.
 *
 * <p>Whether the car is travelling is a function of the variant ({@link #isMoving()}), so the two
 * can never disagree.
 */
public enum MotionState {
    IDLE,
    MOVING_UP,
    MOVING_DOWN,
    DOORS_OPENING,
    DOORS_OPEN,
    DOORS_CLOSING;

    public boolean isMoving() {
        return this == MOVING_UP || this == MOVING_DOWN;
    }

    public boolean isDoorPhase() {
        return this == DOORS_OPENING || this == DOORS_OPEN || this == DOORS_CLOSING;
    }

    public static MotionState movingTowards(Direction direction) {
        return switch (direction) {
            case UP -> MOVING_UP;
            case DOWN -> MOVING_DOWN;
            case NONE -> IDLE;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MotionState fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("motion state is empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return wireName();
    }
}
