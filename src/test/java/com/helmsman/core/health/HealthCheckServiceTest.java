package com.helmsman.core.health;

import com.helmsman.core.catalog.CatalogFixtures;
import com.helmsman.core.engine.DocumentProcessor;
import com.helmsman.core.engine.PipelineFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var results = new HealthCheckService(null, null).checkAll();

        assertEquals(2, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("Catalog and working pipeline -> all UP")
    void allUp() {
        var results = new HealthCheckService(CatalogFixtures.maritime(), PipelineFixtures.processor()).checkAll();

        var catalog = component(results, "catalog");
        assertTrue(catalog.isUp());
        assertEquals("2025.07", catalog.metadata().get("version"));
        assertEquals("6", catalog.metadata().get("rules"));

        var pipeline = component(results, "pipeline");
        assertTrue(pipeline.isUp());
        assertTrue(pipeline.metadata().containsKey("confidence"));
    }

    @Test
    @DisplayName("Pipeline that throws -> pipeline DOWN")
    void pipelineThrows() {
        DocumentProcessor processor = mock(DocumentProcessor.class);
        when(processor.process(anyString())).thenThrow(new IllegalStateException("boom"));

        var pipeline = component(new HealthCheckService(CatalogFixtures.maritime(), processor).checkAll(), "pipeline");

        assertEquals(HealthStatus.Status.DOWN, pipeline.status());
        assertTrue(pipeline.detail().contains("boom"));
    }

    @Test
    @DisplayName("Self-test misclassified -> pipeline DEGRADED")
    void pipelineMisclassifies() {
        DocumentProcessor real = PipelineFixtures.processor();
        DocumentProcessor processor = mock(DocumentProcessor.class);
        when(processor.process(anyString())).thenReturn(real.process("Routine filter replacement scheduled"));

        var pipeline = component(new HealthCheckService(CatalogFixtures.maritime(), processor).checkAll(), "pipeline");

        assertEquals(HealthStatus.Status.DEGRADED, pipeline.status());
    }
}
