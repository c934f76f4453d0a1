package com.helmsman.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setVessel tags the vessel before a document id exists")
    void setVessel() {
        MdcContext.setVessel("IMO-9321483");
        assertEquals("IMO-9321483", MDC.get("vesselId"));
        assertNull(MDC.get("documentId"));
    }

    @Test
    @DisplayName("setDocument with vessel puts both ids in MDC")
    void setDocumentWithVessel() {
        MdcContext.setDocument("doc-1", "IMO-9321483");
        assertEquals("doc-1", MDC.get("documentId"));
        assertEquals("IMO-9321483", MDC.get("vesselId"));
    }

    @Test
    @DisplayName("a later document without vessel drops the previous vessel id")
    void staleVesselRemoved() {
        MdcContext.setDocument("doc-1", "IMO-9321483");
        MdcContext.setDocument("doc-2", null);
        assertEquals("doc-2", MDC.get(MdcContext.DOCUMENT_ID));
        assertNull(MDC.get(MdcContext.VESSEL_ID));
    }

    @Test
    @DisplayName("blank vessel id is not recorded")
    void blankVessel() {
        MdcContext.setDocument("doc-1", " ");
        assertNull(MDC.get("vesselId"));
    }

    @Test
    @DisplayName("clear removes all helmsman MDC keys")
    void clear() {
        MdcContext.setDocument("doc-1", "IMO-9321483");
        MdcContext.clear();
        assertNull(MDC.get("documentId"));
        assertNull(MDC.get("vesselId"));
    }
}
