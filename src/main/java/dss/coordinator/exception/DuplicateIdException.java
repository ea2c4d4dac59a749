package dss.coordinator.exception;

/**
 * A simulation with the same id but a different descriptor is already stored.
 */
public class DuplicateIdException extends JobStoreException {

    private final String simulationId;

    public DuplicateIdException(String simulationId) {
        super("Simulation " + simulationId + " already exists with a different descriptor");
        this.simulationId = simulationId;
    }

    public String simulationId() {
        return simulationId;
    }
}
