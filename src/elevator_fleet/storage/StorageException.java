package elevator_fleet.storage;

import elevator_fleet.errors.ElevatorException;

/** Storage failure, wraps the underlying SQL or IO error. */
public class StorageException extends ElevatorException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
