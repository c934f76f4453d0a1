package com.helmsman.core.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helmsman.core.model.ClassificationCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a {@link PatternCatalog} from its JSON form.
 * <p>
 * Expected layout:
 * <pre>
 * {
 *   "version": "2025.07",
 *   "rules": [
 *     { "category": "CRITICAL_EQUIPMENT_FAILURE", "weight": 1.0,
 *       "keywords": [...], "equipmentTerms": [...], "priorityIndicators": [...] }
 *   ]
 * }
 * </pre>
 */
public class PatternCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(PatternCatalogLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(String version, List<RuleDocument> rules) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
        String category,
        Double weight,
        List<String> keywords,
        List<String> equipmentTerms,
        List<String> priorityIndicators
    ) {}

    private final ObjectMapper objectMapper;

    public PatternCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and validates a catalog.
     *
     * @param in     JSON input, closed by the caller
     * @param source description of the input used in log and error messages
     * @throws CatalogLoadException if the JSON cannot be read or fails validation
     */
    public PatternCatalog load(InputStream in, String source) {
        CatalogDocument document;
        try {
            document = objectMapper.readValue(in, CatalogDocument.class);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read pattern catalog from " + source, e);
        }
        if (document == null || document.rules() == null || document.rules().isEmpty()) {
            throw new CatalogLoadException("Pattern catalog " + source + " declares no rules");
        }

        String version = document.version() == null || document.version().isBlank()
                ? "unversioned" : document.version().trim();

        var rules = new ArrayList<PatternRule>();
        for (int i = 0; i < document.rules().size(); i++) {
            rules.add(toRule(document.rules().get(i), i, source));
        }

        try {
            PatternCatalog catalog = PatternCatalog.of(version, rules);
            log.info("Loaded pattern catalog {} from {} ({} rules)", version, source, catalog.ruleCount());
            return catalog;
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Invalid pattern catalog " + source + ": " + e.getMessage(), e);
        }
    }

    private PatternRule toRule(RuleDocument doc, int index, String source) {
        if (doc == null || doc.category() == null) {
            throw new CatalogLoadException("Rule #" + index + " in " + source + " has no category");
        }
        ClassificationCategory category;
        try {
            category = ClassificationCategory.valueOf(doc.category().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Rule #" + index + " in " + source
                    + " has unknown category: " + doc.category(), e);
        }
        double weight = doc.weight() == null ? 1.0 : doc.weight();
        try {
            return new PatternRule(category, doc.keywords(), doc.equipmentTerms(),
                    doc.priorityIndicators(), weight);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Rule #" + index + " in " + source + ": " + e.getMessage(), e);
        }
    }
}
