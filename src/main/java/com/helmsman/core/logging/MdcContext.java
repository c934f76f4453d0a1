package com.helmsman.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys tagging log lines with the document being triaged. The logback
 * patterns print both keys.
 */
public final class MdcContext {

    public static final String DOCUMENT_ID = "documentId";
    public static final String VESSEL_ID = "vesselId";

    private MdcContext() {}

    /** A null or blank vessel id removes the vessel key. */
    public static void setVessel(String vesselId) {
        if (vesselId != null && !vesselId.isBlank()) {
            MDC.put(VESSEL_ID, vesselId);
        } else {
            MDC.remove(VESSEL_ID);
        }
    }

    public static void setDocument(String documentId, String vesselId) {
        MDC.put(DOCUMENT_ID, documentId);
        setVessel(vesselId);
    }

    public static void clear() {
        MDC.remove(DOCUMENT_ID);
        MDC.remove(VESSEL_ID);
    }
}
