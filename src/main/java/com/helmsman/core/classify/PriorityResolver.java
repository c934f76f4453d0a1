package com.helmsman.core.classify;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Derives the urgency of a document from its text and classification.
 * <p>
 * Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>any urgent keyword: {@link PriorityLevel#CRITICAL}</li>
 *   <li>category override for equipment failure, environmental, navigational and safety documents</li>
 *   <li>any high keyword: {@link PriorityLevel#HIGH}</li>
 *   <li>any medium keyword: {@link PriorityLevel#MEDIUM}</li>
 *   <li>otherwise {@link PriorityLevel#LOW}</li>
 * </ol>
 */
@Component
public class PriorityResolver {

    static final List<String> URGENT_KEYWORDS = List.of(
            "critical", "emergency", "immediate", "urgent", "danger",
            "failure", "shutdown", "stop", "collision", "fire", "flood");

    static final List<String> HIGH_KEYWORDS = List.of(
            "warning", "alert", "malfunction", "leak", "damage",
            "hazard", "risk", "violation", "non-compliance");

    static final List<String> MEDIUM_KEYWORDS = List.of(
            "attention", "monitor", "check", "inspect", "service",
            "repair", "replace", "maintenance");

    private static final List<String> ENVIRONMENTAL_ESCALATORS = List.of("spill", "discharge", "violation");
    private static final List<String> SAFETY_ESCALATORS = List.of("accident", "injury");

    public PriorityLevel resolve(String cleanedText, ClassificationCategory category) {
        String lowerText = cleanedText.toLowerCase(Locale.ROOT);

        if (containsAny(lowerText, URGENT_KEYWORDS)) {
            return PriorityLevel.CRITICAL;
        }

        switch (category) {
            case CRITICAL_EQUIPMENT_FAILURE -> {
                return PriorityLevel.CRITICAL;
            }
            case ENVIRONMENTAL_COMPLIANCE -> {
                return containsAny(lowerText, ENVIRONMENTAL_ESCALATORS) ? PriorityLevel.CRITICAL : PriorityLevel.HIGH;
            }
            case NAVIGATIONAL_HAZARD -> {
                return PriorityLevel.HIGH;
            }
            case SAFETY_VIOLATION -> {
                return containsAny(lowerText, SAFETY_ESCALATORS) ? PriorityLevel.HIGH : PriorityLevel.MEDIUM;
            }
            default -> {
                // routine and fuel documents fall through to the keyword tiers
            }
        }

        if (containsAny(lowerText, HIGH_KEYWORDS)) {
            return PriorityLevel.HIGH;
        }
        if (containsAny(lowerText, MEDIUM_KEYWORDS)) {
            return PriorityLevel.MEDIUM;
        }
        return PriorityLevel.LOW;
    }

    private static boolean containsAny(String lowerText, List<String> terms) {
        for (String term : terms) {
            if (lowerText.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
