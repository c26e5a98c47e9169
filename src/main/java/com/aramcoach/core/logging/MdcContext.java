package com.aramcoach.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PEV-run MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String patchId) {
        MDC.put("runId", runId);
        MDC.put("patch", patchId);
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("patch");
        MDC.remove("attempt");
    }
}
