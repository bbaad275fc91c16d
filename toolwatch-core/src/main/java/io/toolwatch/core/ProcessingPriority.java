package io.toolwatch.core;

/**
 * Service classes for batch analysis. Lower values are served first.
 */
public enum ProcessingPriority {

    URGENT(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    MAINTENANCE(5);

    private final int value;

    ProcessingPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Maps a tool's configured priority level onto a tier. Levels of 5 and above are maintenance.
     */
    public static ProcessingPriority forLevel(int priorityLevel) {
        if (priorityLevel <= URGENT.value) {
            return URGENT;
        }
        for (ProcessingPriority p : values()) {
            if (p.value == priorityLevel) {
                return p;
            }
        }
        return MAINTENANCE;
    }
}
