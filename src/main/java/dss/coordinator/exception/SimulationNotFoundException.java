package dss.coordinator.exception;

public class SimulationNotFoundException extends JobStoreException {

    public SimulationNotFoundException(String simulationId) {
        super("Simulation not found: " + simulationId);
    }
}
