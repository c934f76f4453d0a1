package com.helmsman.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted around document processing, e.g. {@code document.processed}
 * or {@code document.rejected}.
 */
public record ProcessingEvent(
    String eventType,
    String documentId,
    String vesselId,
    Map<String, Object> payload,
    Instant timestamp
) {}
