package com.helmsman.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of scoring a document against the pattern catalog.
 *
 * @param category   winning category, or the fallback category on weak signal
 * @param confidence share of the total score held by the winner, in [0, 1]
 * @param scores     weighted score per category, in category declaration order
 */
public record Classification(
    ClassificationCategory category,
    double confidence,
    Map<ClassificationCategory, Double> scores
) {
    public Classification {
        var ordered = new EnumMap<ClassificationCategory, Double>(ClassificationCategory.class);
        ordered.putAll(scores);
        scores = Collections.unmodifiableMap(ordered);
    }
}
