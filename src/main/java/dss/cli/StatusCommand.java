package dss.cli;

import dss.coordinator.config.Dependencies;
import dss.coordinator.service.SimulationService;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(name = "status", header = "Print queue, running and complete counts")
public class StatusCommand extends StoreCommand {

    @Override
    protected int execute() throws IOException {
        try (Dependencies deps = open()) {
            SimulationService simulations = deps.simulationService();
            out().printf("queued:     %d%n", simulations.countQueued());
            out().printf("running:    %d%n", simulations.countRunning());
            out().printf("complete:   %d%n", simulations.countCompleted());
            out().printf("simulators: %d%n", deps.simulatorService().count());
        }
        return EXIT_OK;
    }
}
