package dss.coordinator.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable descriptor of one unit of simulation work.
 * Created once by the generator; never changed afterwards.
 */
public final class Simulation {
    /** Width of the id columns in the store, shared by simulator ids. */
    public static final int MAX_ID_LENGTH = 64;
    /** Width of the topology and stubs file columns. */
    public static final int MAX_PATH_LENGTH = 1024;

    private final String id;
    private final String topology;
    private final int destination;
    private final int repetitions;
    private final int minDelay;
    private final int maxDelay;
    private final int threshold;
    private final String stubsFile;
    private final Integer seed; // null = simulator picks its own seed
    private final Boolean reportNodes; // null is read as false

    private Simulation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.topology = Objects.requireNonNull(builder.topology, "topology is required");
        this.stubsFile = Objects.requireNonNull(builder.stubsFile, "stubsFile is required");
        this.destination = builder.destination;
        this.repetitions = builder.repetitions;
        this.minDelay = builder.minDelay;
        this.maxDelay = builder.maxDelay;
        this.threshold = builder.threshold;
        this.seed = builder.seed;
        this.reportNodes = builder.reportNodes;

        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        requireLength("id", id, MAX_ID_LENGTH);
        requireLength("topology", topology, MAX_PATH_LENGTH);
        requireLength("stubsFile", stubsFile, MAX_PATH_LENGTH);
        if (destination < 0) {
            throw new IllegalArgumentException("destination must be non-negative: " + destination);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        if (repetitions <= 0) {
            throw new IllegalArgumentException("repetitions must be positive: " + repetitions);
        }
        if (minDelay < 0) {
            throw new IllegalArgumentException("minDelay must be non-negative: " + minDelay);
        }
        if (minDelay > maxDelay) {
            throw new IllegalArgumentException(
                    "minDelay (" + minDelay + ") must not exceed maxDelay (" + maxDelay + ")");
        }
    }

    private static void requireLength(String name, String value, int max) {
        if (value.length() > max) {
            throw new IllegalArgumentException(name + " must be at most " + max + " characters");
        }
    }

    public String id() {
        return id;
    }

    public String topology() {
        return topology;
    }

    public int destination() {
        return destination;
    }

    public int repetitions() {
        return repetitions;
    }

    public int minDelay() {
        return minDelay;
    }

    public int maxDelay() {
        return maxDelay;
    }

    public int threshold() {
        return threshold;
    }

    public String stubsFile() {
        return stubsFile;
    }

    /** Random seed, or null for a non-deterministic run. */
    public Integer seed() {
        return seed;
    }

    public boolean hasSeed() {
        return seed != null;
    }

    public boolean reportNodes() {
        return Boolean.TRUE.equals(reportNodes);
    }

    /** Raw stored flag, null when it was never set. */
    public Boolean reportNodesOrNull() {
        return reportNodes;
    }

    /**
     * Compare every descriptor field, including the id.
     * Two simulations with equal ids but different content are a duplicate-id conflict.
     */
    public boolean sameDescriptor(Simulation other) {
        if (other == null)
            return false;
        return id.equals(other.id)
                && topology.equals(other.topology)
                && destination == other.destination
                && repetitions == other.repetitions
                && minDelay == other.minDelay
                && maxDelay == other.maxDelay
                && threshold == other.threshold
                && stubsFile.equals(other.stubsFile)
                && Objects.equals(seed, other.seed)
                && reportNodes() == other.reportNodes();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .topology(topology)
                .destination(destination)
                .repetitions(repetitions)
                .minDelay(minDelay)
                .maxDelay(maxDelay)
                .threshold(threshold)
                .stubsFile(stubsFile)
                .seed(seed)
                .reportNodes(reportNodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Random token for a new simulation id. */
    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static final class Builder {
        private String id;
        private String topology;
        private int destination;
        private int repetitions = 100;
        private int minDelay = 10;
        private int maxDelay = 1000;
        private int threshold = 2_000_000;
        private String stubsFile;
        private Integer seed;
        private Boolean reportNodes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder topology(String topology) {
            this.topology = topology;
            return this;
        }

        public Builder destination(int destination) {
            this.destination = destination;
            return this;
        }

        public Builder repetitions(int repetitions) {
            this.repetitions = repetitions;
            return this;
        }

        public Builder minDelay(int minDelay) {
            this.minDelay = minDelay;
            return this;
        }

        public Builder maxDelay(int maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder stubsFile(String stubsFile) {
            this.stubsFile = stubsFile;
            return this;
        }

        public Builder seed(Integer seed) {
            this.seed = seed;
            return this;
        }

        public Builder reportNodes(Boolean reportNodes) {
            this.reportNodes = reportNodes;
            return this;
        }

        public Simulation build() {
            return new Simulation(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Simulation simulation))
            return false;
        return Objects.equals(id, simulation.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Simulation{id='" + id + "', topology='" + topology + "', destination=" + destination + "}";
    }
}
