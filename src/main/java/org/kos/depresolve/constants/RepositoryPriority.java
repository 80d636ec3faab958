package org.kos.depresolve.constants;

/**
 * Repository priority levels. Lower rank is consulted first.
 */
public enum RepositoryPriority {
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    TESTING(5);

    private final int rank;

    RepositoryPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Get RepositoryPriority from its name or rank.
     *
     * @param value "high", "HIGH" or "2"
     * @return RepositoryPriority enum or null if not found
     */
    public static RepositoryPriority fromString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (RepositoryPriority priority : values()) {
            if (priority.name().equalsIgnoreCase(trimmed) || String.valueOf(priority.rank).equals(trimmed)) {
                return priority;
            }
        }
        return null;
    }
}
