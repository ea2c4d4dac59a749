package dss.cli;

import dss.coordinator.config.Dependencies;
import dss.coordinator.generator.GenerationParams;
import dss.coordinator.generator.SimulationGenerator;
import dss.coordinator.generator.Topology;
import dss.coordinator.model.Simulation;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Generate one simulation per topology and destination and queue them all.
 */
@Command(name = "generate",
        header = "Generate simulations and add them to the queue",
        description = "Reads a topologies file (one 'topology|stubs' per line) and a destinations file "
                + "(one node id per line) and queues one simulation for each pair with the given priority.")
public class GenerateCommand extends StoreCommand {

    @CommandLine.Parameters(index = "0", description = "Topologies file")
    Path topologies;

    @CommandLine.Parameters(index = "1", description = "Destinations file")
    Path destinations;

    @CommandLine.Parameters(index = "2", description = "Queue priority of the generated simulations")
    int priority;

    @CommandLine.Option(names = {"--reportnodes"},
            description = "Enable report nodes data individually")
    boolean reportNodes;

    @CommandLine.Option(names = {"--c"}, paramLabel = "<repetitions>",
            description = "Number of repetitions (default: ${DEFAULT-VALUE})",
            defaultValue = "" + GenerationParams.DEFAULT_REPETITIONS)
    int repetitions;

    @CommandLine.Option(names = {"--min"}, paramLabel = "<min_delay>",
            description = "Minimum message delay (default: ${DEFAULT-VALUE})",
            defaultValue = "" + GenerationParams.DEFAULT_MIN_DELAY)
    int minDelay;

    @CommandLine.Option(names = {"--max"}, paramLabel = "<max_delay>",
            description = "Maximum message delay (default: ${DEFAULT-VALUE})",
            defaultValue = "" + GenerationParams.DEFAULT_MAX_DELAY)
    int maxDelay;

    @CommandLine.Option(names = {"--th"}, paramLabel = "<threshold>",
            description = "Threshold value (default: ${DEFAULT-VALUE})",
            defaultValue = "" + GenerationParams.DEFAULT_THRESHOLD)
    int threshold;

    @CommandLine.Option(names = {"--base-dir"},
            description = "Directory topology and stubs files are resolved against (default: current directory)",
            defaultValue = ".")
    Path baseDir;

    @Override
    protected int execute() throws IOException {
        SimulationGenerator generator = new SimulationGenerator(baseDir);

        List<Topology> topologyList = generator.readTopologies(topologies);
        List<Integer> destinationList = generator.readDestinations(destinations);
        out().printf("Found %d topologies and %d destinations%n", topologyList.size(), destinationList.size());
        out().println("Generating simulations...");

        GenerationParams params = new GenerationParams(repetitions, minDelay, maxDelay, threshold, reportNodes);
        List<Simulation> simulations = generator.generate(topologyList, destinationList, params);

        try (Dependencies deps = open()) {
            deps.simulationService().enqueueAll(simulations, priority);
        }

        out().printf("Done! %d simulations were added with priority %d%n", simulations.size(), priority);
        return EXIT_OK;
    }
}
