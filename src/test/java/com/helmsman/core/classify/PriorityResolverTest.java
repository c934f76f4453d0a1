package com.helmsman.core.classify;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class PriorityResolverTest {

    private final PriorityResolver resolver = new PriorityResolver();

    @ParameterizedTest
    @EnumSource(ClassificationCategory.class)
    @DisplayName("urgent keywords make any document critical")
    void urgentKeywords(ClassificationCategory category) {
        assertEquals(PriorityLevel.CRITICAL, resolver.resolve("Fire reported in the galley", category));
    }

    @Test
    @DisplayName("equipment failures are always critical")
    void equipmentFailure() {
        assertEquals(PriorityLevel.CRITICAL,
                resolver.resolve("Pump bearing worn", ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE));
    }

    @Test
    @DisplayName("environmental documents escalate on spill, discharge or violation")
    void environmental() {
        assertEquals(PriorityLevel.CRITICAL,
                resolver.resolve("Oil spill discharge violation reported in harbor waters",
                        ClassificationCategory.ENVIRONMENTAL_COMPLIANCE));
        assertEquals(PriorityLevel.HIGH,
                resolver.resolve("Ballast water exchange logged", ClassificationCategory.ENVIRONMENTAL_COMPLIANCE));
    }

    @Test
    @DisplayName("navigational hazards are high")
    void navigational() {
        assertEquals(PriorityLevel.HIGH,
                resolver.resolve("GPS malfunction poor visibility fog", ClassificationCategory.NAVIGATIONAL_HAZARD));
    }

    @Test
    @DisplayName("safety documents are high with accident or injury, medium otherwise")
    void safety() {
        assertEquals(PriorityLevel.HIGH,
                resolver.resolve("Crew injury on deck", ClassificationCategory.SAFETY_VIOLATION));
        assertEquals(PriorityLevel.MEDIUM,
                resolver.resolve("Missing life jacket in cabin", ClassificationCategory.SAFETY_VIOLATION));
    }

    @Test
    @DisplayName("routine and fuel documents use the keyword tiers")
    void keywordTiers() {
        assertEquals(PriorityLevel.HIGH,
                resolver.resolve("Small leak at coolant hose", ClassificationCategory.ROUTINE_MAINTENANCE));
        assertEquals(PriorityLevel.MEDIUM,
                resolver.resolve("Routine filter replacement scheduled for next port call",
                        ClassificationCategory.ROUTINE_MAINTENANCE));
        assertEquals(PriorityLevel.LOW,
                resolver.resolve("Fuel consumption trending up", ClassificationCategory.FUEL_EFFICIENCY));
        assertEquals(PriorityLevel.LOW,
                resolver.resolve("Deck painted", ClassificationCategory.ROUTINE_MAINTENANCE));
    }

    @Test
    @DisplayName("keywords match by substring and ignore case")
    void substringMatching() {
        assertEquals(PriorityLevel.CRITICAL,
                resolver.resolve("Engine STOPPED unexpectedly", ClassificationCategory.FUEL_EFFICIENCY));
    }
}
