package com.helmsman.core.model;

/**
 * Urgency assigned to a processed document, most urgent first.
 */
public enum PriorityLevel {

    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    PriorityLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Returns {@code true} if this level is as urgent as, or more urgent than, {@code other}.
     */
    public boolean isAtLeast(PriorityLevel other) {
        return ordinal() <= other.ordinal();
    }
}
