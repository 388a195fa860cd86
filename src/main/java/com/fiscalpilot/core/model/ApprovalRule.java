package com.fiscalpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Approval policy for one risk tier.
 *
 * @param level        the tier this rule governs
 * @param approvers    named approver identities
 * @param requireAll   true when every named approver must sign off, false when any one suffices
 * @param timeoutHours advisory only; nothing in the pipeline expires pending actions on its own
 */
public record ApprovalRule(
    ApprovalLevel level,
    List<String> approvers,
    boolean requireAll,
    int timeoutHours
) implements Serializable {

    public static final int DEFAULT_TIMEOUT_HOURS = 48;

    public ApprovalRule {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }

    public ApprovalRule(ApprovalLevel level, List<String> approvers, boolean requireAll) {
        this(level, approvers, requireAll, DEFAULT_TIMEOUT_HOURS);
    }

    /** True when this rule needs sign-off from more than one caller. */
    public boolean isMultiParty() {
        return requireAll && !approvers.isEmpty();
    }
}
