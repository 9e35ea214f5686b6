package elevator_fleet.dispatcher;

import elevator_fleet.models.ElevatorUnit;

public final class ElevatorScore {
    public final ElevatorUnit unit;
    public final int score;

    public ElevatorScore(ElevatorUnit unit, int score) {
        this.unit = unit;
        this.score = score;
    }

    @Override
    public String toString() {
        return unit.id + "=" + score;
    }
}
