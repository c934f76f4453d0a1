package com.helmsman.core.catalog;

import com.helmsman.core.model.ClassificationCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable, versioned set of classification rules grouped by category.
 * <p>
 * Built once at startup and shared read-only by every classification call.
 * Iteration follows {@link ClassificationCategory} declaration order, which is
 * also the classifier's tie-break order.
 */
public final class PatternCatalog {

    private final String version;
    private final Map<ClassificationCategory, List<PatternRule>> rulesByCategory;

    private PatternCatalog(String version, Map<ClassificationCategory, List<PatternRule>> rulesByCategory) {
        this.version = version;
        this.rulesByCategory = rulesByCategory;
    }

    /**
     * Creates a catalog from a flat rule list.
     *
     * @throws IllegalArgumentException if any category is left without a rule
     */
    public static PatternCatalog of(String version, List<PatternRule> rules) {
        var grouped = new EnumMap<ClassificationCategory, List<PatternRule>>(ClassificationCategory.class);
        for (PatternRule rule : rules) {
            grouped.computeIfAbsent(rule.category(), c -> new ArrayList<>()).add(rule);
        }

        var missing = EnumSet.allOf(ClassificationCategory.class);
        missing.removeAll(grouped.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("catalog " + version + " has no rules for " + missing);
        }

        var frozen = new EnumMap<ClassificationCategory, List<PatternRule>>(ClassificationCategory.class);
        grouped.forEach((category, list) -> frozen.put(category, List.copyOf(list)));
        return new PatternCatalog(version, Collections.unmodifiableMap(frozen));
    }

    public String version() {
        return version;
    }

    public List<PatternRule> rulesFor(ClassificationCategory category) {
        return rulesByCategory.getOrDefault(category, List.of());
    }

    public Map<ClassificationCategory, List<PatternRule>> rulesByCategory() {
        return rulesByCategory;
    }

    public int ruleCount() {
        return rulesByCategory.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "PatternCatalog[version=" + version + ", rules=" + ruleCount() + "]";
    }
}
