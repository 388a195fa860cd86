package com.fiscalpilot.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one execution or rollback attempt. Never mutated after creation.
 *
 * @param actionId          the action this result belongs to
 * @param status            COMPLETED, FAILED or ROLLED_BACK
 * @param summary           human-readable one-liner; dry-run summaries read differently from real ones
 * @param details           structured data produced by the executor
 * @param error             failure code or message, null on success
 * @param dryRun            true when no system of record was touched
 * @param rollbackAvailable true when the executor can compensate this result
 * @param startedAt         when the attempt began (may be null for refusals)
 * @param finishedAt        when the attempt ended
 */
public record ExecutionResult(
    String actionId,
    ActionStatus status,
    String summary,
    Map<String, Object> details,
    String error,
    boolean dryRun,
    boolean rollbackAvailable,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public ExecutionResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        summary = summary == null ? "" : summary;
    }

    public static ExecutionResult completed(String actionId, String summary, Map<String, Object> details,
                                            boolean dryRun, boolean rollbackAvailable) {
        Instant now = Instant.now();
        return new ExecutionResult(actionId, ActionStatus.COMPLETED, summary, details, null,
                dryRun, rollbackAvailable, now, now);
    }

    public static ExecutionResult failed(String actionId, String summary, String error, boolean dryRun) {
        return failed(actionId, summary, error, dryRun, Map.of());
    }

    public static ExecutionResult failed(String actionId, String summary, String error, boolean dryRun,
                                         Map<String, Object> details) {
        Instant now = Instant.now();
        return new ExecutionResult(actionId, ActionStatus.FAILED, summary, details, error,
                dryRun, false, now, now);
    }

    public static ExecutionResult rolledBack(String actionId, String summary, Map<String, Object> details) {
        Instant now = Instant.now();
        return new ExecutionResult(actionId, ActionStatus.ROLLED_BACK, summary, details, null,
                false, false, now, now);
    }

    /** Completed execution or a successful compensating rollback. */
    public boolean succeeded() {
        return status == ActionStatus.COMPLETED || status == ActionStatus.ROLLED_BACK;
    }

    public ExecutionResult withStartedAt(Instant started) {
        return new ExecutionResult(actionId, status, summary, details, error, dryRun, rollbackAvailable,
                started, finishedAt);
    }
}
