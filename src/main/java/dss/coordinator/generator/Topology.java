package dss.coordinator.generator;

/**
 * A network topology file and the stubs file that goes with it.
 * Read from one {@code name|stubs} line of a topologies file.
 */
public record Topology(String name, String stubs) {

    public Topology {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("topology name is required");
        }
        if (stubs == null || stubs.isBlank()) {
            throw new IllegalArgumentException("stubs file is required for topology " + name);
        }
    }

    /**
     * Parse a {@code name|stubs} line.
     */
    public static Topology parse(String line) {
        String[] parts = line.trim().split("\\|");
        if (parts.length != 2) {
            throw new IllegalArgumentException("expected 'topology|stubs' but got: " + line.trim());
        }
        return new Topology(parts[0].trim(), parts[1].trim());
    }
}
