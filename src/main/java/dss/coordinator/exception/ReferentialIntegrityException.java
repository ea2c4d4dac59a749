package dss.coordinator.exception;

/**
 * A row could not be written or deleted because of a foreign key.
 * Raised when deleting a simulator that running or complete rows still reference,
 * and when an unregistered simulator tries to claim work.
 */
public class ReferentialIntegrityException extends JobStoreException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }

    public ReferentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
