package com.helmsman.core.metrics;

import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.PriorityLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for document processing.
 */
@Service
public class HelmsmanMetrics {

    private final MeterRegistry registry;

    public HelmsmanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProcessed(ClassificationCategory classification, PriorityLevel priority) {
        Counter.builder("helmsman.documents.processed")
                .description("Documents processed by classification and priority")
                .tag("classification", classification.name())
                .tag("priority", priority.name())
                .register(registry)
                .increment();
    }

    public void recordProcessingDuration(Duration elapsed) {
        Timer.builder("helmsman.processing.duration")
                .description("Time spent processing one document")
                .register(registry)
                .record(elapsed);
    }

    public void recordConfidence(double confidence) {
        DistributionSummary.builder("helmsman.classification.confidence")
                .description("Classification confidence of processed documents")
                .register(registry)
                .record(confidence);
    }

    /**
     * Records a pipeline step that produced its value from a fallback.
     *
     * @param step "summary" or "keywords"
     */
    public void recordDegradedStep(String step) {
        Counter.builder("helmsman.processing.degraded")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    /**
     * Records a document rejected before processing.
     *
     * @param reason e.g. "too_short", "too_long"
     */
    public void recordRejected(String reason) {
        Counter.builder("helmsman.documents.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
