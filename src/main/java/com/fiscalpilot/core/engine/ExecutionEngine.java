package com.fiscalpilot.core.engine;

import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.events.PipelineEvent;
import com.fiscalpilot.core.events.PipelineEventBus;
import com.fiscalpilot.core.executor.ActionExecutor;
import com.fiscalpilot.core.executor.ExecutorException;
import com.fiscalpilot.core.executor.LogOnlyExecutor;
import com.fiscalpilot.core.executor.ValidationResult;
import com.fiscalpilot.core.logging.MdcContext;
import com.fiscalpilot.core.metrics.PipelineMetrics;
import com.fiscalpilot.core.model.ActionStatus;
import com.fiscalpilot.core.model.ExecutionErrors;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProcessOutcome;
import com.fiscalpilot.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes approved actions through pluggable executors.
 * <p>
 * Routes each action to the first registered executor that can handle it (falling back to
 * {@link LogOnlyExecutor}), validates before executing, caps how many actions one call
 * processes, and appends every result to an execution log that is never edited. Results are
 * indexed by action id so completed actions can later be rolled back. Mutating entry points
 * are serialized on the instance monitor.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    public static final int DEFAULT_MAX_ACTIONS_PER_RUN = 50;

    private final ApprovalGate approvalGate;
    private final List<ActionExecutor> executors = new ArrayList<>();
    private final ActionExecutor fallbackExecutor = new LogOnlyExecutor();
    private final int maxActionsPerRun;
    private final boolean dryRunByDefault;
    private final PipelineEventBus eventBus;
    private final PipelineMetrics metrics;

    private final List<ExecutionResult> executionLog = new ArrayList<>();
    /** Most recent attempt per action id, with the action and the executor that handled it. */
    private final Map<String, ExecutionRecord> latestByAction = new HashMap<>();

    private record ExecutionRecord(ProposedAction action, ActionExecutor executor, ExecutionResult result) {}

    public ExecutionEngine() {
        this(new ApprovalGate(), List.of(), DEFAULT_MAX_ACTIONS_PER_RUN, true);
    }

    public ExecutionEngine(ApprovalGate approvalGate, List<ActionExecutor> executors,
                           int maxActionsPerRun, boolean dryRunByDefault) {
        this(approvalGate, executors, maxActionsPerRun, dryRunByDefault, null, null);
    }

    public ExecutionEngine(ApprovalGate approvalGate, List<ActionExecutor> executors,
                           int maxActionsPerRun, boolean dryRunByDefault,
                           PipelineEventBus eventBus, PipelineMetrics metrics) {
        if (maxActionsPerRun < 1) {
            throw new IllegalArgumentException("maxActionsPerRun must be at least 1, got " + maxActionsPerRun);
        }
        this.approvalGate = approvalGate != null ? approvalGate : new ApprovalGate();
        if (executors != null) {
            this.executors.addAll(executors);
        }
        this.maxActionsPerRun = maxActionsPerRun;
        this.dryRunByDefault = dryRunByDefault;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // -- registry ------------------------------------------------------------

    public synchronized void registerExecutor(ActionExecutor executor) {
        executors.add(executor);
        log.info("Registered executor: {}", executor.name());
    }

    public synchronized List<ActionExecutor> executors() {
        return List.copyOf(executors);
    }

    /**
     * First registered executor that can handle the action, in registration order,
     * or the log-only fallback.
     */
    public synchronized ActionExecutor getExecutor(ProposedAction action) {
        for (ActionExecutor executor : executors) {
            if (executor.canHandle(action)) {
                return executor;
            }
        }
        return fallbackExecutor;
    }

    // -- approval delegation -------------------------------------------------

    public ApprovalGate approvalGate() {
        return approvalGate;
    }

    /** Submits actions to the approval gate. */
    public ProcessOutcome propose(List<ProposedAction> actions) {
        return approvalGate.process(actions);
    }

    public List<ProposedAction> approve(List<String> actionIds, String approvedBy, String reason) {
        return approvalGate.approve(actionIds, approvedBy, reason);
    }

    public List<ProposedAction> reject(List<String> actionIds, String rejectedBy, String reason) {
        return approvalGate.reject(actionIds, rejectedBy, reason);
    }

    // -- execution -----------------------------------------------------------

    public List<ExecutionResult> execute(List<ProposedAction> actions) {
        return execute(actions, dryRunByDefault);
    }

    /**
     * Executes the APPROVED actions in the batch, in the order given.
     * <p>
     * Anything not APPROVED is skipped. At most {@code maxActionsPerRun} actions are
     * processed; the rest are left untouched for the caller to resubmit. A dry run
     * previews each action without moving it through its lifecycle, so it stays APPROVED.
     * <p>
     * Status is checked again right before each action runs, so an instance that appears
     * twice in the batch runs once. A failure on one action never stops the rest of the batch.
     *
     * @return one result per processed action
     */
    public synchronized List<ExecutionResult> execute(List<ProposedAction> actions, boolean dryRun) {
        var results = new ArrayList<ExecutionResult>();

        List<ProposedAction> actionable = actions.stream()
                .filter(ProposedAction::isActionable)
                .toList();
        if (actionable.isEmpty()) {
            log.warn("No approved actions to execute.");
            return results;
        }

        if (actionable.size() > maxActionsPerRun) {
            log.warn("Rate limit: only executing {} of {} actions", maxActionsPerRun, actionable.size());
            if (metrics != null) {
                metrics.recordRateLimited(actionable.size() - maxActionsPerRun);
            }
            actionable = actionable.subList(0, maxActionsPerRun);
        }

        MdcContext.setRun(generateRunId());
        try {
            for (ProposedAction action : actionable) {
                if (!action.isActionable()) {
                    log.warn("Skipping action {}: status is now {}", action.getId(), action.getStatus().value());
                    continue;
                }
                MdcContext.setAction(action.getId(), action.getActionType().value());
                try {
                    results.add(executeOne(action, dryRun));
                } catch (IllegalStateException e) {
                    log.error("Action {} left its lifecycle mid-run: {}", action.getId(), e.getMessage());
                    results.add(record(action, getExecutor(action), ExecutionResult.failed(action.getId(),
                            "Execution error: " + e.getMessage(), e.getMessage(), dryRun,
                            Map.of(ExecutionErrors.FAILURE_KEY, ExecutionErrors.EXECUTION_ERROR))));
                } finally {
                    MdcContext.clearAction();
                }
            }

            log.info("Execution complete: {} actions, {} succeeded, {} failed (dry_run={})",
                    results.size(),
                    results.stream().filter(ExecutionResult::succeeded).count(),
                    results.stream().filter(r -> r.status() == ActionStatus.FAILED).count(),
                    dryRun);
        } finally {
            MdcContext.clear();
        }
        return results;
    }

    /** Executes every action the approval gate holds that a human has approved. */
    public List<ExecutionResult> executeApproved(boolean dryRun) {
        return execute(approvalGate.approvedActions(), dryRun);
    }

    public List<ExecutionResult> executeApproved() {
        return executeApproved(dryRunByDefault);
    }

    private ExecutionResult executeOne(ProposedAction action, boolean dryRun) {
        ActionExecutor executor = getExecutor(action);

        ValidationResult validation;
        try {
            validation = executor.validate(action);
        } catch (RuntimeException e) {
            log.error("Executor {} failed validating action {}: {}", executor.name(), action.getId(), e.getMessage(), e);
            validation = ValidationResult.invalid("Validation error: " + e.getMessage());
        }

        if (!validation.valid()) {
            ExecutionResult result = ExecutionResult.failed(action.getId(),
                    "Validation failed: " + validation.reason(), validation.reason(), dryRun,
                    Map.of(ExecutionErrors.FAILURE_KEY, ExecutionErrors.VALIDATION_FAILED, "executor", executor.name()));
            log.warn("Validation failed for action {}: {}", action.getId(), validation.reason());
            if (!dryRun) {
                action.transitionTo(ActionStatus.FAILED);
            }
            return record(action, executor, result);
        }

        Instant started = Instant.now();
        if (!dryRun) {
            action.transitionTo(ActionStatus.EXECUTING);
            action.setExecutedAt(started);
        }

        ExecutionResult result;
        try {
            result = executor.execute(action, dryRun);
            if (result == null) {
                throw new ExecutorException(executor.name(), "executor returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Executor {} failed on action {}: {}", executor.name(), action.getId(), e.getMessage(), e);
            result = ExecutionResult.failed(action.getId(), "Execution error: " + e.getMessage(),
                    String.valueOf(e.getMessage()), dryRun,
                    Map.of(ExecutionErrors.FAILURE_KEY, ExecutionErrors.EXECUTION_ERROR, "executor", executor.name()));
        }
        result = result.withStartedAt(started);

        if (!dryRun) {
            ActionStatus target = result.status() == ActionStatus.COMPLETED ? ActionStatus.COMPLETED : ActionStatus.FAILED;
            if (action.canTransitionTo(target)) {
                action.transitionTo(target);
                if (target == ActionStatus.COMPLETED) {
                    action.setCompletedAt(Instant.now());
                }
            } else {
                log.warn("Executor {} moved action {} to {}; keeping that status", executor.name(),
                        action.getId(), action.getStatus().value());
            }
        }
        if (metrics != null) {
            metrics.recordExecutionDuration(executor.name(), Instant.now().toEpochMilli() - started.toEpochMilli());
        }
        return record(action, executor, result);
    }

    private ExecutionResult record(ProposedAction action, ActionExecutor executor, ExecutionResult result) {
        executionLog.add(result);
        latestByAction.put(action.getId(), new ExecutionRecord(action, executor, result));
        if (metrics != null) {
            metrics.recordExecutionResult(executor.name(), result.status().value(), result.dryRun());
        }
        publish(result.succeeded() ? "action.executed" : "action.failed", result, executor.name());
        return result;
    }

    // -- rollback ------------------------------------------------------------

    /**
     * Rolls back previously completed actions. An id with no recorded result, or whose latest
     * result does not offer rollback, yields a FAILED result and the executor is not contacted.
     */
    public synchronized List<ExecutionResult> rollback(List<String> actionIds) {
        var results = new ArrayList<ExecutionResult>();
        for (String actionId : actionIds) {
            MdcContext.setAction(actionId, null);
            try {
                results.add(rollbackOne(actionId));
            } finally {
                MdcContext.clearAction();
            }
        }
        return results;
    }

    private ExecutionResult rollbackOne(String actionId) {
        ExecutionRecord prior = latestByAction.get(actionId);
        if (prior == null) {
            log.warn("No execution record for action {}", actionId);
            return refuseRollback(actionId, "No execution record for this action.");
        }
        if (!prior.result().rollbackAvailable() || prior.result().dryRun()
                || !prior.action().canTransitionTo(ActionStatus.ROLLED_BACK)) {
            log.warn("Action {} does not support rollback", actionId);
            return refuseRollback(actionId, "Rollback not available for this action.");
        }

        ActionExecutor executor = prior.executor();
        ExecutionResult result;
        try {
            result = executor.rollback(prior.action(), prior.result());
        } catch (RuntimeException e) {
            log.error("Rollback failed for action {}: {}", actionId, e.getMessage(), e);
            result = ExecutionResult.failed(actionId, "Rollback error: " + e.getMessage(),
                    ExecutionErrors.ROLLBACK_ERROR, false);
        }

        executionLog.add(result);
        if (result.status() == ActionStatus.ROLLED_BACK) {
            prior.action().transitionTo(ActionStatus.ROLLED_BACK);
            latestByAction.put(actionId, new ExecutionRecord(prior.action(), executor, result));
            publish("action.rolled_back", result, executor.name());
            log.info("Rolled back action {}: {}", actionId, result.summary());
        } else {
            publish("action.rollback_failed", result, executor.name());
        }
        if (metrics != null) {
            metrics.recordRollbackResult(result.status().value());
        }
        return result;
    }

    private ExecutionResult refuseRollback(String actionId, String summary) {
        ExecutionResult result = ExecutionResult.failed(actionId, summary,
                ExecutionErrors.ROLLBACK_NOT_AVAILABLE, false);
        if (metrics != null) {
            metrics.recordRollbackResult(result.status().value());
        }
        return result;
    }

    // -- views ---------------------------------------------------------------

    /** Every execution and rollback attempt, oldest first. */
    public synchronized List<ExecutionResult> executionLog() {
        return List.copyOf(executionLog);
    }

    /** Most recent result recorded for the action, or null. */
    public synchronized ExecutionResult latestResult(String actionId) {
        ExecutionRecord record = latestByAction.get(actionId);
        return record != null ? record.result() : null;
    }

    public synchronized EngineSummary summary() {
        return new EngineSummary(
                executors.stream().map(ActionExecutor::name).toList(),
                approvalGate.pendingActions().size(),
                executionLog.size(),
                executionLog.stream().filter(ExecutionResult::succeeded).count(),
                executionLog.stream().filter(r -> r.status() == ActionStatus.FAILED).count(),
                dryRunByDefault,
                maxActionsPerRun);
    }

    public boolean isDryRunByDefault() {
        return dryRunByDefault;
    }

    public int getMaxActionsPerRun() {
        return maxActionsPerRun;
    }

    /**
     * Generates a run ID in the format RUN-YYYY-NNNN.
     */
    private static String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }

    private void publish(String type, ExecutionResult result, String executorName) {
        if (eventBus != null) {
            var payload = new HashMap<String, Object>();
            payload.put("status", result.status().value());
            payload.put("summary", result.summary());
            payload.put("dry_run", result.dryRun());
            payload.put("rollback_available", result.rollbackAvailable());
            if (result.error() != null) {
                payload.put("error", result.error());
            }
            eventBus.publish(new PipelineEvent(type, result.actionId(), executorName, payload, Instant.now()));
        }
    }
}
