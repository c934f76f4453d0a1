package com.helmsman.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of processing one document.
 * <p>
 * Collections are defensively copied; iteration order of keywords, entities
 * and metadata follows insertion order.
 */
public record ProcessingResult(
    String id,
    String summary,
    String details,
    ClassificationCategory classification,
    PriorityLevel priority,
    double confidence,
    Set<String> keywords,
    Map<String, Set<String>> entities,
    List<String> recommendedActions,
    String riskAssessment,
    DocumentType documentType,   // null when processing failed before inference
    String vesselId,             // passthrough, may be null
    Instant timestamp,
    Map<String, Object> metadata
) {
    public ProcessingResult {
        keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        var entityCopy = new LinkedHashMap<String, Set<String>>();
        entities.forEach((kind, values) ->
                entityCopy.put(kind, Collections.unmodifiableSet(new LinkedHashSet<>(values))));
        entities = Collections.unmodifiableMap(entityCopy);
        recommendedActions = List.copyOf(recommendedActions);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<DocumentType> documentTypeOpt() {
        return Optional.ofNullable(documentType);
    }

    public Optional<String> vesselIdOpt() {
        return Optional.ofNullable(vesselId);
    }
}
