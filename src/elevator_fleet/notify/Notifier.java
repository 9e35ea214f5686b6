package elevator_fleet.notify;

import elevator_fleet.models.ElevatorEvent;
import elevator_fleet.models.ElevatorUnit;

/**
 * Mirrors unit changes and recorded events to observers.
 *
 * <p>The engine calls this after every persisted step and does not wait for delivery. An exception
 * thrown from here is treated like any other collaborator failure and ends the unit's current chain.
 */
public interface Notifier {

    void publishUnitChanged(ElevatorUnit unit);

    void publishEvent(ElevatorEvent event);
}
