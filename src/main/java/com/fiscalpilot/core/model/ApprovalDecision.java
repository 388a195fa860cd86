package com.fiscalpilot.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable entry in the approval ledger.
 *
 * @param actionId  the action decided on
 * @param decision  approved, rejected or partial_approval
 * @param decidedBy free-form identity of the decider ({@code system:auto} for automatic approvals)
 * @param reason    free-text reason, never null
 * @param timestamp when the decision was recorded
 */
public record ApprovalDecision(
    String actionId,
    DecisionType decision,
    String decidedBy,
    String reason,
    Instant timestamp
) implements Serializable {

    public ApprovalDecision {
        reason = reason == null ? "" : reason;
    }
}
