package com.helmsman.core.model;

/**
 * Maritime issue taxonomy a document is classified into.
 * <p>
 * Declaration order is significant: when two categories score the same,
 * the one declared first wins.
 */
public enum ClassificationCategory {

    CRITICAL_EQUIPMENT_FAILURE("Critical Equipment Failure Risk"),
    NAVIGATIONAL_HAZARD("Navigational Hazard Alert"),
    ENVIRONMENTAL_COMPLIANCE("Environmental Compliance Breach"),
    ROUTINE_MAINTENANCE("Routine Maintenance Required"),
    SAFETY_VIOLATION("Safety Violation Detected"),
    FUEL_EFFICIENCY("Fuel Efficiency Alert");

    private final String label;

    ClassificationCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
