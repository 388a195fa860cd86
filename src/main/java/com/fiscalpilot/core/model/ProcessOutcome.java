package com.fiscalpilot.core.model;

import java.util.List;

/**
 * Partition of a batch routed through the approval gate.
 *
 * @param autoApproved  actions now APPROVED and ready to execute
 * @param needsApproval actions still PROPOSED and held for a human decision
 */
public record ProcessOutcome(
    List<ProposedAction> autoApproved,
    List<ProposedAction> needsApproval
) {

    public ProcessOutcome {
        autoApproved = List.copyOf(autoApproved);
        needsApproval = List.copyOf(needsApproval);
    }
}
