package com.helmsman.core.advice;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Builds the recommended action list for a classified document.
 * <p>
 * Priority actions come first, then category actions; duplicates are dropped
 * keeping the first occurrence and the list is capped at {@link #MAX_ACTIONS}.
 */
@Component
public class RecommendationGenerator {

    public static final int MAX_ACTIONS = 6;

    private static final Map<PriorityLevel, List<String>> PRIORITY_ACTIONS = new EnumMap<>(Map.of(
            PriorityLevel.CRITICAL, List.of(
                    "IMMEDIATE ACTION REQUIRED",
                    "Stop operations immediately if safe to do so",
                    "Contact technical support team",
                    "Initiate emergency response procedures",
                    "Document all findings thoroughly"),
            PriorityLevel.HIGH, List.of(
                    "Address within 24 hours",
                    "Notify relevant personnel",
                    "Schedule immediate inspection",
                    "Prepare contingency plans"),
            PriorityLevel.MEDIUM, List.of(
                    "Address within 72 hours",
                    "Monitor condition during each watch"),
            PriorityLevel.LOW, List.of(
                    "Schedule during the next maintenance window",
                    "Monitor during routine rounds")
    ));

    private static final Map<ClassificationCategory, List<String>> CATEGORY_ACTIONS = new EnumMap<>(Map.of(
            ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE, List.of(
                    "Isolate affected equipment",
                    "Order replacement parts immediately",
                    "Consider emergency port call if necessary",
                    "Implement backup systems if available"),
            ClassificationCategory.NAVIGATIONAL_HAZARD, List.of(
                    "Increase bridge watch",
                    "Use manual navigation procedures",
                    "Contact vessel traffic services",
                    "Reduce speed if conditions warrant"),
            ClassificationCategory.ENVIRONMENTAL_COMPLIANCE, List.of(
                    "Stop any discharge operations",
                    "Contact environmental compliance officer",
                    "Prepare incident report for authorities",
                    "Implement containment measures"),
            ClassificationCategory.ROUTINE_MAINTENANCE, List.of(
                    "Schedule maintenance during next port call",
                    "Order required spare parts",
                    "Assign qualified personnel",
                    "Update maintenance logs"),
            ClassificationCategory.SAFETY_VIOLATION, List.of(
                    "Immediate safety briefing for crew",
                    "Review safety procedures",
                    "Ensure proper PPE usage",
                    "Report to safety officer"),
            ClassificationCategory.FUEL_EFFICIENCY, List.of(
                    "Monitor fuel consumption patterns",
                    "Optimize engine parameters",
                    "Review voyage planning",
                    "Consider trim adjustments")
    ));

    public List<String> recommend(ClassificationCategory category, PriorityLevel priority) {
        var actions = new LinkedHashSet<String>();
        actions.addAll(PRIORITY_ACTIONS.getOrDefault(priority, List.of()));
        actions.addAll(CATEGORY_ACTIONS.getOrDefault(category, List.of()));
        return actions.stream().limit(MAX_ACTIONS).toList();
    }
}
