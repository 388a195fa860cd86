package com.fiscalpilot.core.engine;

import java.util.List;

/**
 * Snapshot of engine state for operators.
 */
public record EngineSummary(
    List<String> registeredExecutors,
    int pendingActions,
    int totalExecuted,
    long succeeded,
    long failed,
    boolean dryRunByDefault,
    int maxActionsPerRun
) {}
