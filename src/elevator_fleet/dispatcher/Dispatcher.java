package elevator_fleet.dispatcher;

import elevator_fleet.errors.ValidationException;
import elevator_fleet.models.BuildingConfig;
import elevator_fleet.models.CallRequest;
import elevator_fleet.models.Direction;
import elevator_fleet.models.ElevatorUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy selector: scores every unit against the pickup floor and returns the cheapest one.
 *
 * <p>Stateless, so one instance can be shared by any number of callers.
 */
public final class Dispatcher {

    static final int DISTANCE_WEIGHT = 10;
    static final int IDLE_BONUS = 50;
    static final int TOWARD_BONUS = 20;
    static final int AWAY_PENALTY = 30;

    // lower score is better, roughly the cost of sending this unit
    public ElevatorScore score(ElevatorUnit unit, int pickupFloor) {
        int curr = unit.currentFloor;
        int dist = Math.abs(curr - pickupFloor);

        int score = dist * DISTANCE_WEIGHT;

        if (unit.isIdle()) {
            score -= IDLE_BONUS;
        } else if (unit.isMoving()) {
            // moving away is penalised, not excluded
            if (isHeadingToward(unit.direction, curr, pickupFloor)) score -= TOWARD_BONUS;
            else score += AWAY_PENALTY;
        }
        // door phases: distance only

        return new ElevatorScore(unit, score);
    }

    public List<ElevatorScore> scoreAll(List<ElevatorUnit> fleet, int pickupFloor) {
        List<ElevatorScore> scores = new ArrayList<>(fleet.size());
        for (ElevatorUnit unit : fleet) scores.add(score(unit, pickupFloor));
        return scores;
    }

    public ElevatorUnit choose(List<ElevatorUnit> fleet, int pickupFloor) {
        if (fleet == null || fleet.isEmpty()) {
            throw ValidationException.invalidConfig("no elevators configured");
        }
        List<ElevatorScore> scores = scoreAll(fleet, pickupFloor);

        // List.sort is stable, so equal scores keep fleet order and the first one wins
        scores.sort(Comparator.comparingInt(x -> x.score));

        return scores.get(0).unit;
    }

    public static void validate(CallRequest request, BuildingConfig config) {
        if (!config.containsFloor(request.fromFloor) || !config.containsFloor(request.toFloor)) {
            throw ValidationException.floorOutOfRange(config.totalFloors);
        }
        if (request.fromFloor == request.toFloor) {
            throw ValidationException.sameFloor();
        }
    }

    private static boolean isHeadingToward(Direction direction, int currentFloor, int pickupFloor) {
        return (direction == Direction.UP && pickupFloor > currentFloor)
                || (direction == Direction.DOWN && pickupFloor < currentFloor);
    }
}
