package dss.cli;

import dss.coordinator.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(name = "delete", header = "Delete a simulation with its queue, running and complete records")
public class DeleteCommand extends StoreCommand {

    @CommandLine.Parameters(index = "0", description = "Simulation id")
    String simulationId;

    @Override
    protected int execute() throws IOException {
        try (Dependencies deps = open()) {
            if (!deps.simulationService().delete(simulationId)) {
                err().println("Simulation " + simulationId + " not found");
                return EXIT_FAILED;
            }
        }
        out().println("Deleted simulation " + simulationId);
        return EXIT_OK;
    }
}
