package com.fleetmind.core.logging;

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
    @DisplayName("setStep puts pipelineId, step and iteration in MDC")
    void setStep() {
        MdcContext.setStep("PIPE-2026-0001", "building", 2);
        assertEquals("PIPE-2026-0001", MDC.get("pipelineId"));
        assertEquals("building", MDC.get("step"));
        assertEquals("2", MDC.get("iteration"));
    }

    @Test
    @DisplayName("clearWorker leaves the pipeline keys alone")
    void clearWorker() {
        MdcContext.setPipeline("PIPE-2026-0001");
        MdcContext.setWorker("w-1");
        MdcContext.clearWorker();
        assertNull(MDC.get("workerId"));
        assertEquals("PIPE-2026-0001", MDC.get("pipelineId"));
    }

    @Test
    @DisplayName("clear removes all fleetmind MDC keys")
    void clear() {
        MdcContext.setStep("PIPE-2026-0001", "planning", 1);
        MdcContext.setWorker("w-1");
        MdcContext.clear();
        assertNull(MDC.get("pipelineId"));
        assertNull(MDC.get("step"));
        assertNull(MDC.get("iteration"));
        assertNull(MDC.get("workerId"));
    }
}
