package com.helmsman.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of operational document being processed.
 */
public enum DocumentType {

    MAINTENANCE_RECORD("Maintenance Record"),
    SENSOR_ALERT("Sensor Alert"),
    INCIDENT_REPORT("Incident Report"),
    INSPECTION_REPORT("Inspection Report"),
    COMPLIANCE_DOCUMENT("Compliance Document");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a caller-supplied hint leniently. Accepts the enum name or the
     * display label in any case, with spaces, hyphens or underscores as separators.
     *
     * @param hint free-form type hint, may be null
     * @return the matching type, or empty when the hint is blank or unknown
     */
    public static Optional<DocumentType> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        for (DocumentType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
