package dss.coordinator.generator;

import dss.coordinator.model.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds simulation descriptors from a topologies file and a destinations file:
 * one simulation per (topology, destination) pair.
 *
 * Topology and stubs references are checked against {@code baseDir}, the
 * directory simulators resolve them from.
 */
public class SimulationGenerator {

    private static final Logger log = LoggerFactory.getLogger(SimulationGenerator.class);

    private final Path baseDir;

    public SimulationGenerator(Path baseDir) {
        this.baseDir = baseDir;
    }

    /**
     * Read a topologies file, one {@code name|stubs} per non-empty line.
     */
    public List<Topology> readTopologies(Path file) throws IOException {
        List<Topology> topologies = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                topologies.add(Topology.parse(line));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(file.getFileName() + ":" + lineNo + ": " + e.getMessage(), e);
            }
        }
        return topologies;
    }

    /**
     * Read a destinations file, one node id per non-empty line.
     */
    public List<Integer> readDestinations(Path file) throws IOException {
        List<Integer> destinations = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            int destination;
            try {
                destination = Integer.parseInt(line.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        file.getFileName() + ":" + lineNo + ": destination is not a number: " + line.trim(), e);
            }
            if (destination < 0) {
                throw new IllegalArgumentException(
                        file.getFileName() + ":" + lineNo + ": destination must be non-negative: " + destination);
            }
            destinations.add(destination);
        }
        return destinations;
    }

    /**
     * Generate one simulation per topology and destination, each with a fresh
     * id and no seed.
     */
    public List<Simulation> generate(List<Topology> topologies, List<Integer> destinations, GenerationParams params) {
        params.validate();
        for (Topology topology : topologies) {
            requireFile(topology.name(), "topology");
            requireFile(topology.stubs(), "stubs");
        }

        List<Simulation> simulations = new ArrayList<>(topologies.size() * destinations.size());
        for (Topology topology : topologies) {
            for (int destination : destinations) {
                if (destination < 0) {
                    throw new IllegalArgumentException("destination must be non-negative: " + destination);
                }
                simulations.add(Simulation.builder()
                        .id(Simulation.newId())
                        .topology(topology.name())
                        .destination(destination)
                        .repetitions(params.repetitions())
                        .minDelay(params.minDelay())
                        .maxDelay(params.maxDelay())
                        .threshold(params.threshold())
                        .stubsFile(topology.stubs())
                        .seed(null)
                        .reportNodes(params.reportNodes())
                        .build());
            }
        }

        log.info("Generated {} simulations from {} topologies and {} destinations",
                simulations.size(), topologies.size(), destinations.size());
        return simulations;
    }

    private void requireFile(String reference, String kind) {
        Path path = baseDir.resolve(reference);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException(kind + " file not found: " + path);
        }
    }
}
