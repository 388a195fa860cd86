package com.fiscalpilot.core.model;

/**
 * Failure codes. Rollback refusals carry the code in {@link ExecutionResult#error()};
 * validation and execution failures carry the message there and the code under
 * {@link #FAILURE_KEY} in the result details.
 */
public final class ExecutionErrors {

    public static final String FAILURE_KEY = "failure";

    /** Required parameters missing or invalid; the executor was never asked to run. */
    public static final String VALIDATION_FAILED = "validation_failed";

    /** The executor raised while performing the action. */
    public static final String EXECUTION_ERROR = "execution_error";

    /** No prior result, or the prior result does not offer compensation. Executor not contacted. */
    public static final String ROLLBACK_NOT_AVAILABLE = "rollback_not_available";

    /** The executor advertised rollback but has no rollback implementation. */
    public static final String ROLLBACK_NOT_IMPLEMENTED = "rollback_not_implemented";

    /** The executor raised while compensating. */
    public static final String ROLLBACK_ERROR = "rollback_error";

    /** The prior result lacks the data needed to restore the previous state. */
    public static final String NO_ORIGINAL_DATA = "no_original_data";

    private ExecutionErrors() {}
}
