package com.fiscalpilot.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a proposed action.
 * <pre>
 * PROPOSED -> APPROVED | REJECTED
 * APPROVED -> EXECUTING | FAILED (validation)
 * EXECUTING -> COMPLETED | FAILED
 * COMPLETED -> ROLLED_BACK
 * </pre>
 * Status only moves forward along this graph.
 */
public enum ActionStatus {
    PROPOSED("proposed"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String value;

    ActionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }

    public boolean canTransitionTo(ActionStatus next) {
        return successors().contains(next);
    }

    private Set<ActionStatus> successors() {
        return switch (this) {
            case PROPOSED -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(EXECUTING, FAILED);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED);
            // COMPLETED is terminal for execution but still admits a compensating rollback
            case COMPLETED -> EnumSet.of(ROLLED_BACK);
            case REJECTED, FAILED, ROLLED_BACK -> EnumSet.noneOf(ActionStatus.class);
        };
    }
}
