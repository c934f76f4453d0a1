package com.helmsman.core.catalog;

import com.helmsman.core.model.ClassificationCategory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One weighted matching unit of the pattern catalog.
 * <p>
 * Terms are stored lower-cased and matched by substring containment, so
 * {@code "engine"} also matches inside {@code "engineering"}.
 *
 * @param category           category this rule votes for
 * @param keywords           general issue vocabulary
 * @param equipmentTerms     equipment and system names
 * @param priorityIndicators words that signal the category's urgency
 * @param weight             non-negative multiplier applied to the rule's raw score
 */
public record PatternRule(
    ClassificationCategory category,
    List<String> keywords,
    List<String> equipmentTerms,
    List<String> priorityIndicators,
    double weight
) {

    /**
     * Hit counts of a rule against one lower-cased text.
     */
    public record Match(int keywordHits, int equipmentHits, int indicatorHits) {
        public boolean isEmpty() {
            return keywordHits == 0 && equipmentHits == 0 && indicatorHits == 0;
        }
    }

    public PatternRule {
        Objects.requireNonNull(category, "category");
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be non-negative for " + category + ": " + weight);
        }
        keywords = lowerCased(keywords);
        equipmentTerms = lowerCased(equipmentTerms);
        priorityIndicators = lowerCased(priorityIndicators);
        if (keywords.isEmpty() && equipmentTerms.isEmpty() && priorityIndicators.isEmpty()) {
            throw new IllegalArgumentException("rule for " + category + " has no terms");
        }
    }

    /**
     * Counts the terms of each list contained in {@code lowerText}. Each term
     * counts at most once regardless of how often it occurs.
     *
     * @param lowerText text already converted to lower case
     */
    public Match match(String lowerText) {
        return new Match(
                countContained(keywords, lowerText),
                countContained(equipmentTerms, lowerText),
                countContained(priorityIndicators, lowerText));
    }

    public int termCount() {
        return keywords.size() + equipmentTerms.size() + priorityIndicators.size();
    }

    private static int countContained(List<String> terms, String lowerText) {
        int hits = 0;
        for (String term : terms) {
            if (lowerText.contains(term)) {
                hits++;
            }
        }
        return hits;
    }

    private static List<String> lowerCased(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
