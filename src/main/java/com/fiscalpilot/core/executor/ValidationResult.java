package com.fiscalpilot.core.executor;

/**
 * Outcome of {@link ActionExecutor#validate}.
 *
 * @param valid  true when the action may be executed
 * @param reason why it may not, empty when valid
 */
public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, "");

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
