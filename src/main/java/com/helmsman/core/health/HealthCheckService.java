package com.helmsman.core.health;

import com.helmsman.core.catalog.PatternCatalog;
import com.helmsman.core.engine.DocumentProcessor;
import com.helmsman.core.model.ClassificationCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String SELF_TEST_TEXT = "Main engine critical failure, emergency shutdown required immediately";

    private final PatternCatalog catalog;
    private final DocumentProcessor processor;

    public HealthCheckService(
            @Autowired(required = false) PatternCatalog catalog,
            @Autowired(required = false) DocumentProcessor processor) {
        this.catalog = catalog;
        this.processor = processor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkPipeline());
        return results;
    }

    private HealthStatus checkCatalog() {
        if (catalog == null) {
            return new HealthStatus("catalog", HealthStatus.Status.DOWN,
                    "No pattern catalog loaded", Map.of());
        }
        return new HealthStatus("catalog", HealthStatus.Status.UP,
                "Pattern catalog " + catalog.version() + " loaded",
                Map.of("version", catalog.version(), "rules", String.valueOf(catalog.ruleCount())));
    }

    /**
     * Runs a canned equipment-failure report through the pipeline and checks
     * the classification it gets back.
     */
    private HealthStatus checkPipeline() {
        if (processor == null) {
            return new HealthStatus("pipeline", HealthStatus.Status.DOWN,
                    "No DocumentProcessor configured", Map.of());
        }
        try {
            var result = processor.process(SELF_TEST_TEXT);
            if (result.classification() == ClassificationCategory.CRITICAL_EQUIPMENT_FAILURE) {
                return new HealthStatus("pipeline", HealthStatus.Status.UP,
                        "Self-test classified correctly",
                        Map.of("confidence", String.format("%.2f", result.confidence())));
            }
            return new HealthStatus("pipeline", HealthStatus.Status.DEGRADED,
                    "Self-test classified as " + result.classification(), Map.of());
        } catch (Exception e) {
            log.warn("Pipeline health check failed: {}", e.getMessage());
            return new HealthStatus("pipeline", HealthStatus.Status.DOWN,
                    "Pipeline error: " + e.getMessage(), Map.of());
        }
    }
}
