package dss.coordinator.generator;

import dss.coordinator.model.Simulation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimulationGeneratorTest {

    @TempDir
    Path dir;

    private SimulationGenerator generator;

    @BeforeEach
    void setUp() throws IOException {
        generator = new SimulationGenerator(dir);
        Files.writeString(dir.resolve("a.topo"), "");
        Files.writeString(dir.resolve("a.stubs"), "");
        Files.writeString(dir.resolve("b.topo"), "");
        Files.writeString(dir.resolve("b.stubs"), "");
    }

    @Test
    void readsTopologiesSkippingBlankLines() throws IOException {
        Path file = dir.resolve("topologies.txt");
        Files.writeString(file, "a.topo|a.stubs\n\n  b.topo | b.stubs  \n");

        List<Topology> topologies = generator.readTopologies(file);

        assertEquals(List.of(new Topology("a.topo", "a.stubs"), new Topology("b.topo", "b.stubs")), topologies);
    }

    @Test
    void malformedTopologyLineNamesFileAndLine() throws IOException {
        Path file = dir.resolve("topologies.txt");
        Files.writeString(file, "a.topo|a.stubs\nb.topo\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> generator.readTopologies(file));
        assertTrue(e.getMessage().startsWith("topologies.txt:2:"), e.getMessage());
    }

    @Test
    void readsDestinations() throws IOException {
        Path file = dir.resolve("destinations.txt");
        Files.writeString(file, "0\n 17 \n\n3\n");

        assertEquals(List.of(0, 17, 3), generator.readDestinations(file));
    }

    @Test
    void rejectsBadDestinations() throws IOException {
        Path notNumber = dir.resolve("d1.txt");
        Files.writeString(notNumber, "1\nx\n");
        assertThrows(IllegalArgumentException.class, () -> generator.readDestinations(notNumber));

        Path negative = dir.resolve("d2.txt");
        Files.writeString(negative, "-4\n");
        assertThrows(IllegalArgumentException.class, () -> generator.readDestinations(negative));
    }

    @Test
    void generatesOneSimulationPerPair() {
        List<Topology> topologies = List.of(new Topology("a.topo", "a.stubs"), new Topology("b.topo", "b.stubs"));
        GenerationParams params = new GenerationParams(5, 1, 20, 300, true);

        List<Simulation> simulations = generator.generate(topologies, List.of(1, 2, 3), params);

        assertEquals(6, simulations.size());
        Set<String> ids = new HashSet<>();
        for (Simulation simulation : simulations) {
            ids.add(simulation.id());
            assertEquals(5, simulation.repetitions());
            assertEquals(1, simulation.minDelay());
            assertEquals(20, simulation.maxDelay());
            assertEquals(300, simulation.threshold());
            assertTrue(simulation.reportNodes());
            assertNull(simulation.seed());
        }
        assertEquals(6, ids.size());
        assertEquals("b.stubs", simulations.get(5).stubsFile());
        assertEquals(3, simulations.get(5).destination());
    }

    @Test
    void missingStubsFileFailsBeforeGenerating() {
        List<Topology> topologies = List.of(new Topology("a.topo", "missing.stubs"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> generator.generate(topologies, List.of(1), GenerationParams.defaults()));
        assertTrue(e.getMessage().startsWith("stubs file not found"), e.getMessage());
    }

    @Test
    void invalidParamsAreRejected() {
        List<Topology> topologies = List.of(new Topology("a.topo", "a.stubs"));

        assertThrows(IllegalArgumentException.class,
                () -> generator.generate(topologies, List.of(1), new GenerationParams(0, 1, 2, 3, false)));
        assertThrows(IllegalArgumentException.class,
                () -> generator.generate(topologies, List.of(1), new GenerationParams(1, 9, 2, 3, false)));
    }
}
