package com.fiscalpilot.core.executor;

import com.fiscalpilot.core.model.ActionStep;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * No-op executor that records the action in the log without touching any external system.
 * Used as the guaranteed fallback when no registered executor claims an action, so the
 * pipeline never drops an action for lack of a handler. Never offers rollback.
 */
public class LogOnlyExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LogOnlyExecutor.class);

    public static final String NAME = "log_only";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Logs the action without performing any external operations";
    }

    @Override
    public Set<String> supportedActionTypes() {
        return Set.of();
    }

    @Override
    public ValidationResult validate(ProposedAction action) {
        return ValidationResult.ok();
    }

    @Override
    public ExecutionResult execute(ProposedAction action, boolean dryRun) {
        String mode = dryRun ? "DRY-RUN" : "LOGGED";
        String steps = action.getSteps().stream()
                .map(ActionStep::description)
                .collect(Collectors.joining("; "));

        log.info("[{}] Action '{}' ({}) saves ${} : {}",
                mode, action.getTitle(), action.getActionType().value(),
                String.format("%.2f", action.getEstimatedSavings()),
                steps.isEmpty() ? "no steps defined" : steps);

        var details = new LinkedHashMap<String, Object>();
        details.put("action_type", action.getActionType().value());
        details.put("estimated_savings", action.getEstimatedSavings());
        details.put("steps_count", action.getSteps().size());
        details.put("mode", mode);

        return ExecutionResult.completed(action.getId(), "[" + mode + "] " + action.getTitle(),
                details, dryRun, false);
    }
}
