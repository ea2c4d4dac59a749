package dss.coordinator.exception;

/**
 * Base unchecked exception for errors reported by the simulation job store.
 *
 * <p>Subclasses name the specific rejection (duplicate id, simulation not running,
 * referential violation, invalid lifecycle request) or the underlying persistence
 * failure. HTTP controllers map them to status codes.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
