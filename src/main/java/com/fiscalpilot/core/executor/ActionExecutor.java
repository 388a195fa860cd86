package com.fiscalpilot.core.executor;

import com.fiscalpilot.core.model.ExecutionErrors;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;

import java.util.Map;
import java.util.Set;

/**
 * Pluggable handler that knows how to perform, preview and possibly undo one category of action.
 * Implementations: {@link CategorizationExecutor}, {@link NotificationExecutor}, and the
 * {@link LogOnlyExecutor} fallback.
 */
public interface ActionExecutor {

    /** Registry name; an action may ask for this executor by name. */
    String name();

    String description();

    /** Action types this executor claims. */
    Set<String> supportedActionTypes();

    /**
     * Checks that the action carries what this executor needs. Must not have side effects.
     */
    ValidationResult validate(ProposedAction action);

    /**
     * Performs the action, or under {@code dryRun} describes what it would do without
     * touching any system of record. Dry-run summaries must read differently from real ones.
     *
     * @throws ExecutorException when an external system rejects the side effect
     */
    ExecutionResult execute(ProposedAction action, boolean dryRun);

    /**
     * Compensates a previously completed result. Only executors whose side effects are
     * mechanically undoable override this; the default reports that rollback is not implemented.
     */
    default ExecutionResult rollback(ProposedAction action, ExecutionResult priorResult) {
        return ExecutionResult.failed(action.getId(),
                "Rollback not supported for this action type.",
                ExecutionErrors.ROLLBACK_NOT_IMPLEMENTED, false,
                Map.of("executor", name()));
    }

    /**
     * Whether this executor should handle the action: its type is claimed here, or the
     * action names this executor explicitly.
     */
    default boolean canHandle(ProposedAction action) {
        return supportedActionTypes().contains(action.getActionType().value())
                || name().equals(action.getExecutor());
    }
}
