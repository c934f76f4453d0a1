package com.helmsman.core.engine;

import com.helmsman.core.config.ProcessingProperties;
import com.helmsman.core.events.ProcessingEvent;
import com.helmsman.core.events.ProcessingEventBus;
import com.helmsman.core.logging.MdcContext;
import com.helmsman.core.metrics.HelmsmanMetrics;
import com.helmsman.core.model.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Service boundary around {@link DocumentProcessor}.
 * <p>
 * Validates input length, records metrics and publishes a
 * {@code document.processed} event for collaborators that persist or forward
 * results. Log lines carry the vessel id from the start and the document id
 * from the moment it is assigned.
 */
@Service
public class DocumentTriageService {

    private static final Logger log = LoggerFactory.getLogger(DocumentTriageService.class);

    public static final String EVENT_PROCESSED = "document.processed";
    public static final String EVENT_REJECTED = "document.rejected";

    private final DocumentProcessor processor;
    private final ProcessingProperties properties;
    private final ProcessingEventBus eventBus;
    private final HelmsmanMetrics metrics;
    private final Clock clock;

    public DocumentTriageService(DocumentProcessor processor,
                                 ProcessingProperties properties,
                                 ProcessingEventBus eventBus,
                                 @Autowired(required = false) HelmsmanMetrics metrics,
                                 Clock clock) {
        this.processor = processor;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validates and processes one document.
     *
     * @param text             raw document text
     * @param documentTypeHint optional type hint
     * @param vesselId         optional vessel identifier
     * @return the processing result
     * @throws InvalidDocumentException if the text is missing, too short or too long
     */
    public ProcessingResult triage(String text, String documentTypeHint, String vesselId) {
        MdcContext.setVessel(vesselId);
        try {
            validate(text, vesselId);

            Instant start = clock.instant();
            ProcessingResult result = processor.process(text, documentTypeHint, vesselId);
            Duration elapsed = Duration.between(start, clock.instant());

            MdcContext.setDocument(result.id(), vesselId);
            log.info("Triaged document as {} / {} in {}ms",
                    result.classification(), result.priority(), elapsed.toMillis());
            if (metrics != null) {
                metrics.recordProcessingDuration(elapsed);
                metrics.recordProcessed(result.classification(), result.priority());
                metrics.recordConfidence(result.confidence());
                degradedSteps(result).forEach(metrics::recordDegradedStep);
            }

            var payload = new HashMap<String, Object>();
            payload.put("classification", result.classification().name());
            payload.put("priority", result.priority().name());
            payload.put("confidence", result.confidence());
            payload.put("result", result);
            eventBus.publish(new ProcessingEvent(EVENT_PROCESSED, result.id(), vesselId,
                    payload, Instant.now(clock)));
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private void validate(String text, String vesselId) {
        if (text == null || text.trim().length() < properties.getMinTextLength()) {
            reject("too_short", vesselId, "Text content must be at least "
                    + properties.getMinTextLength() + " characters long");
        }
        if (text.length() > properties.getMaxTextLength()) {
            reject("too_long", vesselId, "Text content exceeds the maximum of "
                    + properties.getMaxTextLength() + " characters");
        }
    }

    private void reject(String reason, String vesselId, String message) {
        log.warn("Rejected document ({}): {}", reason, message);
        if (metrics != null) {
            metrics.recordRejected(reason);
        }
        eventBus.publish(new ProcessingEvent(EVENT_REJECTED, null, vesselId,
                Map.of("reason", reason), Instant.now(clock)));
        throw new InvalidDocumentException(reason, message);
    }

    @SuppressWarnings("unchecked")
    private static List<String> degradedSteps(ProcessingResult result) {
        Object steps = result.metadata().get(DocumentProcessor.META_DEGRADED_STEPS);
        return steps instanceof List<?> ? (List<String>) steps : List.of();
    }
}
