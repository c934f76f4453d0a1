package com.helmsman.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("priority levels are ordered from most to least urgent")
    void priorityOrdering() {
        assertTrue(PriorityLevel.CRITICAL.isAtLeast(PriorityLevel.HIGH));
        assertTrue(PriorityLevel.HIGH.isAtLeast(PriorityLevel.HIGH));
        assertFalse(PriorityLevel.LOW.isAtLeast(PriorityLevel.MEDIUM));
        assertEquals(List.of(PriorityLevel.CRITICAL, PriorityLevel.HIGH, PriorityLevel.MEDIUM, PriorityLevel.LOW),
                List.of(PriorityLevel.values()));
    }

    @Test
    @DisplayName("category declaration order is the documented tie-break order")
    void categoryOrder() {
        assertEquals(List.of(
                ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE,
                ClassificationCategory.NAVIGATIONAL_HAZARD,
                ClassificationCategory.ENVIRONMENTAL_COMPLIANCE,
                ClassificationCategory.ROUTINE_MAINTENANCE,
                ClassificationCategory.SAFETY_VIOLATION,
                ClassificationCategory.FUEL_EFFICIENCY), List.of(ClassificationCategory.values()));
    }

    @Test
    @DisplayName("Classification keeps scores in category declaration order")
    void classificationScoresOrdered() {
        var scores = new HashMap<ClassificationCategory, Double>();
        scores.put(ClassificationCategory.FUEL_EFFICIENCY, 0.4);
        scores.put(ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE, 1.0);
        var classification = new Classification(ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE, 0.7, scores);

        assertEquals(List.of(ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE, ClassificationCategory.FUEL_EFFICIENCY),
                List.copyOf(classification.scores().keySet()));
        assertThrows(UnsupportedOperationException.class,
                () -> classification.scores().put(ClassificationCategory.SAFETY_VIOLATION, 1.0));
    }

    @Test
    @DisplayName("ProcessingResult copies its collections")
    void processingResultIsImmutable() {
        var keywords = new LinkedHashSet<>(List.of("engine", "failure"));
        var equipment = new LinkedHashSet<>(Set.of("engine"));
        var entities = new HashMap<String, Set<String>>();
        entities.put("equipment", equipment);
        var actions = new ArrayList<>(List.of("Isolate affected equipment"));
        var metadata = new HashMap<String, Object>(Map.of("original_length", 20));

        var result = new ProcessingResult("id-1", "summary", "details",
                ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE, PriorityLevel.CRITICAL, 0.9,
                keywords, entities, actions, "risk", null, null, Instant.EPOCH, metadata);

        keywords.add("mutated");
        equipment.add("pump");
        actions.clear();
        metadata.put("extra", true);

        assertEquals(Set.of("engine", "failure"), result.keywords());
        assertEquals(Set.of("engine"), result.entities().get("equipment"));
        assertEquals(List.of("Isolate affected equipment"), result.recommendedActions());
        assertFalse(result.metadata().containsKey("extra"));
        assertThrows(UnsupportedOperationException.class, () -> result.keywords().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> result.entities().get("equipment").add("x"));
        assertTrue(result.documentTypeOpt().isEmpty());
        assertTrue(result.vesselIdOpt().isEmpty());
    }
}
