package elevator_fleet.models;

import java.util.Objects;

public final class Stop {

    public enum Kind {
        PICKUP,
        DROPOFF
    }

    public final Kind kind;
    public final int floor;

    public Stop(Kind kind, int floor) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.floor = floor;
    }

    public static Stop pickup(int floor) {
        return new Stop(Kind.PICKUP, floor);
    }

    public static Stop dropoff(int floor) {
        return new Stop(Kind.DROPOFF, floor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stop)) return false;
        Stop stop = (Stop) o;
        return floor == stop.floor && kind == stop.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, floor);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "@" + floor;
    }
}
