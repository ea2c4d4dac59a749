package dss.coordinator.exception;

import dss.coordinator.model.SimulationState;

/**
 * The requested lifecycle transition is not allowed from the simulation's current state.
 */
public class InvalidTransitionException extends JobStoreException {

    private final SimulationState currentState;

    public InvalidTransitionException(String simulationId, SimulationState currentState, String requested) {
        super("Cannot " + requested + " simulation " + simulationId + " while it is " + currentState);
        this.currentState = currentState;
    }

    public SimulationState currentState() {
        return currentState;
    }
}
