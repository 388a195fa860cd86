package com.fiscalpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing pipeline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String ACTION_ID = "actionId";
    public static final String ACTION_TYPE = "actionType";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setAction(String actionId, String actionType) {
        MDC.put(ACTION_ID, actionId);
        if (actionType != null) {
            MDC.put(ACTION_TYPE, actionType);
        }
    }

    /** Clears the per-action keys, leaving the run id in place. */
    public static void clearAction() {
        MDC.remove(ACTION_ID);
        MDC.remove(ACTION_TYPE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        clearAction();
    }
}
