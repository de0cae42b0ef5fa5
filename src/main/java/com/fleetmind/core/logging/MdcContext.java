package com.fleetmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Fleetmind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPipeline(String pipelineId) {
        MDC.put("pipelineId", pipelineId);
    }

    public static void setStep(String pipelineId, String step, int iteration) {
        MDC.put("pipelineId", pipelineId);
        MDC.put("step", step);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void setWorker(String workerId) {
        MDC.put("workerId", workerId);
    }

    public static void clearWorker() {
        MDC.remove("workerId");
    }

    public static void clear() {
        MDC.remove("pipelineId");
        MDC.remove("step");
        MDC.remove("iteration");
        MDC.remove("workerId");
    }
}
