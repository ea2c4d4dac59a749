package dss.coordinator.exception;

/**
 * Complete or requeue was requested for a simulation that is not running under the caller.
 */
public class NotRunningException extends JobStoreException {

    private final String simulatorId;
    private final String simulationId;

    public NotRunningException(String simulatorId, String simulationId) {
        super("Simulation " + simulationId + " is not running under simulator " + simulatorId);
        this.simulatorId = simulatorId;
        this.simulationId = simulationId;
    }

    public String simulatorId() {
        return simulatorId;
    }

    public String simulationId() {
        return simulationId;
    }
}
