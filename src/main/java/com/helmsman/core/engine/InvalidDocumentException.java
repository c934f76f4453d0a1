package com.helmsman.core.engine;

/**
 * Thrown when a document is rejected before processing, e.g. because it is
 * too short to analyze or exceeds the size limit.
 */
public class InvalidDocumentException extends RuntimeException {

    private final String reason;

    public InvalidDocumentException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Short machine-readable rejection reason, e.g. {@code too_short}.
     */
    public String getReason() {
        return reason;
    }
}
