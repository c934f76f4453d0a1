package com.helmsman.core.classify;

import com.helmsman.core.catalog.PatternCatalog;
import com.helmsman.core.catalog.PatternRule;
import com.helmsman.core.config.ProcessingProperties;
import com.helmsman.core.model.Classification;
import com.helmsman.core.model.ClassificationCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores cleaned document text against every category of the
 * {@link PatternCatalog} and picks the winner.
 * <p>
 * A rule contributes {@code 0.4} per keyword hit, {@code 0.3} per equipment
 * term hit and {@code 0.3} per priority indicator hit, multiplied by the rule
 * weight. The highest category score wins; ties go to the category declared
 * first in {@link ClassificationCategory}. When the winning score is below
 * the fallback threshold the document is classified as
 * {@link ClassificationCategory#ROUTINE_MAINTENANCE} with confidence
 * {@value #FALLBACK_CONFIDENCE}.
 * <p>
 * Stateless and safe for concurrent use.
 */
@Service
public class DocumentClassifier {

    private static final Logger log = LoggerFactory.getLogger(DocumentClassifier.class);

    static final double KEYWORD_WEIGHT = 0.4;
    static final double EQUIPMENT_WEIGHT = 0.3;
    static final double INDICATOR_WEIGHT = 0.3;

    public static final ClassificationCategory FALLBACK_CATEGORY = ClassificationCategory.ROUTINE_MAINTENANCE;
    public static final double FALLBACK_CONFIDENCE = 0.1;

    private final PatternCatalog catalog;
    private final double fallbackThreshold;

    public DocumentClassifier(PatternCatalog catalog, ProcessingProperties properties) {
        this.catalog = catalog;
        this.fallbackThreshold = properties.getFallbackThreshold();
    }

    /**
     * @param cleanedText preprocessed document text
     * @return the classification, never null
     */
    public Classification classify(String cleanedText) {
        String lowerText = cleanedText.toLowerCase(Locale.ROOT);
        Map<ClassificationCategory, Double> scores = score(lowerText);

        ClassificationCategory best = null;
        double bestScore = 0.0;
        double total = 0.0;
        for (ClassificationCategory category : ClassificationCategory.values()) {
            double score = scores.get(category);
            total += score;
            // strict comparison keeps the earliest category on ties
            if (best == null || score > bestScore) {
                best = category;
                bestScore = score;
            }
        }

        if (bestScore < fallbackThreshold) {
            log.debug("Weak signal (best {} = {}), falling back to {}", best, bestScore, FALLBACK_CATEGORY);
            return new Classification(FALLBACK_CATEGORY, FALLBACK_CONFIDENCE, scores);
        }

        double confidence = total > 0 ? bestScore / total : 0.0;
        return new Classification(best, clamp(confidence), scores);
    }

    /**
     * Weighted score of each category for already lower-cased text.
     */
    Map<ClassificationCategory, Double> score(String lowerText) {
        var scores = new EnumMap<ClassificationCategory, Double>(ClassificationCategory.class);
        for (ClassificationCategory category : ClassificationCategory.values()) {
            scores.put(category, scoreCategory(catalog.rulesFor(category), lowerText));
        }
        return scores;
    }

    private static double scoreCategory(List<PatternRule> rules, String lowerText) {
        double total = 0.0;
        for (PatternRule rule : rules) {
            PatternRule.Match match = rule.match(lowerText);
            if (match.isEmpty()) {
                continue;
            }
            double raw = match.keywordHits() * KEYWORD_WEIGHT
                    + match.equipmentHits() * EQUIPMENT_WEIGHT
                    + match.indicatorHits() * INDICATOR_WEIGHT;
            total += raw * rule.weight();
        }
        return total;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
