package dss.cli;

import dss.coordinator.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(name = "rerun", header = "Queue a completed simulation again")
public class RerunCommand extends StoreCommand {

    @CommandLine.Parameters(index = "0", description = "Simulation id")
    String simulationId;

    @CommandLine.Parameters(index = "1", description = "Queue priority")
    int priority;

    @Override
    protected int execute() throws IOException {
        try (Dependencies deps = open()) {
            deps.simulationService().rerun(simulationId, priority);
        }
        out().printf("Simulation %s queued with priority %d%n", simulationId, priority);
        return EXIT_OK;
    }
}
