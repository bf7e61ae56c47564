package batchflow.engine.model;

/**
 * Job priority. Higher rank is dequeued first among eligible jobs.
 */
public enum JobPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parse a priority name, case-insensitive. Null or blank yields NORMAL.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static JobPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value);
        }
    }
}
