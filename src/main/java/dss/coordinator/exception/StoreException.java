package dss.coordinator.exception;

/**
 * Underlying persistence failure (connection, I/O, unexpected SQL error).
 * Transient failures are the caller's to retry.
 */
public class StoreException extends JobStoreException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
