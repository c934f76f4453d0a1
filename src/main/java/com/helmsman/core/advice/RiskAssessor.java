package com.helmsman.core.advice;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Produces the risk statement of a processed document: a fixed sentence per
 * priority, followed by the risk factors the text mentions.
 */
@Component
public class RiskAssessor {

    private record RiskFactor(String label, Predicate<String> trigger) {}

    private static final Map<PriorityLevel, String> BASE_RISK = new EnumMap<>(Map.of(
            PriorityLevel.CRITICAL,
            "CRITICAL RISK: Immediate threat to vessel safety, operations, or environment.",
            PriorityLevel.HIGH,
            "HIGH RISK: Significant impact on operations or safety if not addressed promptly.",
            PriorityLevel.MEDIUM,
            "MEDIUM RISK: Moderate impact on operations, requires attention within reasonable timeframe.",
            PriorityLevel.LOW,
            "LOW RISK: Minor operational impact, routine maintenance required."
    ));

    private static final List<RiskFactor> FACTORS = List.of(
            new RiskFactor("Navigation safety impact",
                    t -> t.contains("navigation") || t.contains("gps")),
            new RiskFactor("Fire/explosion hazard",
                    t -> t.contains("fire") || t.contains("explosion")),
            new RiskFactor("Environmental impact",
                    t -> t.contains("pollution") || t.contains("spill")),
            new RiskFactor("Pressure system risk",
                    t -> t.contains("pressure")),
            new RiskFactor("Overheating risk",
                    t -> t.contains("temperature") && (t.contains("high") || t.contains("hot")))
    );

    /**
     * @param category the document classification, reserved for category-specific factors
     * @param priority resolved priority, selects the base sentence
     * @param text     cleaned document text scanned for risk factors
     */
    public String assess(ClassificationCategory category, PriorityLevel priority, String text) {
        String base = BASE_RISK.get(priority);
        List<String> factors = factors(text);
        if (factors.isEmpty()) {
            return base;
        }
        return base + " Additional factors: " + String.join(", ", factors) + ".";
    }

    List<String> factors(String text) {
        String lowerText = text == null ? "" : text.toLowerCase(Locale.ROOT);
        var triggered = new ArrayList<String>();
        for (RiskFactor factor : FACTORS) {
            if (factor.trigger().test(lowerText)) {
                triggered.add(factor.label());
            }
        }
        return triggered;
    }
}
