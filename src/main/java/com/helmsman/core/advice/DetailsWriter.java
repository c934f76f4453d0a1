package com.helmsman.core.advice;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the human-readable explanation attached to a processing result.
 */
@Component
public class DetailsWriter {

    private static final Map<ClassificationCategory, String> CATEGORY_DETAILS = new EnumMap<>(Map.of(
            ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE,
            "Critical equipment failure detected. Immediate attention required to prevent operational disruption or safety hazards.",
            ClassificationCategory.NAVIGATIONAL_HAZARD,
            "Navigation-related issue identified. Take appropriate measures to ensure safe navigation.",
            ClassificationCategory.ENVIRONMENTAL_COMPLIANCE,
            "Environmental compliance issue detected. Immediate action needed to prevent regulatory violations.",
            ClassificationCategory.ROUTINE_MAINTENANCE,
            "Routine maintenance requirement identified. Schedule appropriate maintenance activities.",
            ClassificationCategory.SAFETY_VIOLATION,
            "Safety violation detected. Review and reinforce safety procedures immediately.",
            ClassificationCategory.FUEL_EFFICIENCY,
            "Fuel efficiency concern identified. Consider optimization measures to improve performance."
    ));

    private static final Map<PriorityLevel, String> PRIORITY_DETAILS = new EnumMap<>(Map.of(
            PriorityLevel.CRITICAL,
            "CRITICAL priority requires immediate action to prevent serious consequences.",
            PriorityLevel.HIGH,
            "HIGH priority should be addressed within 24 hours to prevent escalation."
    ));

    public String write(ClassificationCategory category, PriorityLevel priority, String text) {
        String lowerText = text == null ? "" : text.toLowerCase(Locale.ROOT);
        var parts = new ArrayList<String>();
        parts.add(CATEGORY_DETAILS.get(category));
        if (PRIORITY_DETAILS.containsKey(priority)) {
            parts.add(PRIORITY_DETAILS.get(priority));
        }
        if (lowerText.contains("pressure")) {
            parts.add("Pressure-related issue identified - monitor system pressure closely.");
        }
        if (lowerText.contains("temperature")) {
            parts.add("Temperature anomaly detected - check cooling systems and ventilation.");
        }
        return String.join(" ", parts);
    }
}
