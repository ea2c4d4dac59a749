package dss.coordinator.generator;

/**
 * Run parameters shared by every simulation of one generation batch.
 */
public record GenerationParams(
        int repetitions,
        int minDelay,
        int maxDelay,
        int threshold,
        boolean reportNodes) {

    public static final int DEFAULT_REPETITIONS = 100;
    public static final int DEFAULT_MIN_DELAY = 10;
    public static final int DEFAULT_MAX_DELAY = 1000;
    public static final int DEFAULT_THRESHOLD = 2_000_000;

    public static GenerationParams defaults() {
        return new GenerationParams(DEFAULT_REPETITIONS, DEFAULT_MIN_DELAY, DEFAULT_MAX_DELAY,
                DEFAULT_THRESHOLD, false);
    }

    public void validate() {
        if (repetitions <= 0) {
            throw new IllegalArgumentException("repetitions must be positive: " + repetitions);
        }
        if (minDelay < 0) {
            throw new IllegalArgumentException("min delay must be non-negative: " + minDelay);
        }
        if (minDelay > maxDelay) {
            throw new IllegalArgumentException(
                    "min delay (" + minDelay + ") must not exceed max delay (" + maxDelay + ")");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
    }
}
