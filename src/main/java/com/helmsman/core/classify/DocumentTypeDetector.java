package com.helmsman.core.classify;

import com.helmsman.core.model.DocumentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infers the {@link DocumentType} of a document when the caller did not supply one.
 * <p>
 * Each type has a fixed indicator list; the type with the most indicators present
 * wins, ties go to the type declared first, and a document with no indicator at
 * all is a {@link DocumentType#MAINTENANCE_RECORD}.
 */
@Component
public class DocumentTypeDetector {

    private static final Map<DocumentType, List<String>> INDICATORS = new EnumMap<>(Map.of(
            DocumentType.MAINTENANCE_RECORD,
            List.of("maintenance", "repair", "replaced", "overhaul", "serviced", "lubricat"),
            DocumentType.SENSOR_ALERT,
            List.of("alert", "alarm", "sensor", "warning", "reading", "threshold"),
            DocumentType.INCIDENT_REPORT,
            List.of("incident", "accident", "spill", "collision", "injury", "near miss"),
            DocumentType.INSPECTION_REPORT,
            List.of("inspection", "survey", "audit", "examination", "inspected"),
            DocumentType.COMPLIANCE_DOCUMENT,
            List.of("compliance", "marpol", "regulation", "certificate", "solas")
    ));

    public DocumentType detect(String cleanedText) {
        String lowerText = cleanedText.toLowerCase(Locale.ROOT);

        DocumentType best = DocumentType.MAINTENANCE_RECORD;
        int bestHits = 0;
        for (DocumentType type : DocumentType.values()) {
            int hits = 0;
            for (String indicator : INDICATORS.getOrDefault(type, List.of())) {
                if (lowerText.contains(indicator)) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best = type;
                bestHits = hits;
            }
        }
        return best;
    }

    /**
     * Resolves the type for a document: a recognised caller hint wins, otherwise
     * the type is inferred from the text.
     */
    public DocumentType resolve(String hint, String cleanedText) {
        return DocumentType.fromHint(hint).orElseGet(() -> detect(cleanedText));
    }
}
