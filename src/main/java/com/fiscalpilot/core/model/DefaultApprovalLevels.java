package com.fiscalpilot.core.model;

import java.util.Map;

/**
 * Risk policy as data: the tier each action type starts in unless an action
 * overrides it explicitly.
 * <ul>
 *   <li>GREEN: reversible, low blast radius</li>
 *   <li>YELLOW: touches many records or sends external communication</li>
 *   <li>RED: financially consequential but individually reversible</li>
 *   <li>CRITICAL: irreversible or carries legal/compliance weight</li>
 * </ul>
 */
public final class DefaultApprovalLevels {

    /** Tier used for any type missing from the table. */
    public static final ApprovalLevel FALLBACK = ApprovalLevel.RED;

    private static final Map<ActionType, ApprovalLevel> TABLE = Map.ofEntries(
            Map.entry(ActionType.CATEGORIZE_TRANSACTION, ApprovalLevel.GREEN),
            Map.entry(ActionType.TAG_EXPENSE, ApprovalLevel.GREEN),
            Map.entry(ActionType.GENERATE_REPORT, ApprovalLevel.GREEN),
            Map.entry(ActionType.CREATE_BUDGET_ALERT, ApprovalLevel.GREEN),
            Map.entry(ActionType.FLAG_FOR_REVIEW, ApprovalLevel.GREEN),

            Map.entry(ActionType.UPDATE_CATEGORY_BULK, ApprovalLevel.YELLOW),
            Map.entry(ActionType.SEND_REMINDER, ApprovalLevel.YELLOW),

            Map.entry(ActionType.CANCEL_SUBSCRIPTION, ApprovalLevel.RED),
            Map.entry(ActionType.PAY_INVOICE, ApprovalLevel.RED),
            Map.entry(ActionType.RENEGOTIATE_VENDOR, ApprovalLevel.RED),
            Map.entry(ActionType.TRANSFER_FUNDS, ApprovalLevel.RED),
            Map.entry(ActionType.CUSTOM, ApprovalLevel.RED),

            Map.entry(ActionType.CHANGE_PAYROLL, ApprovalLevel.CRITICAL),
            Map.entry(ActionType.MODIFY_TAX_FILING, ApprovalLevel.CRITICAL),
            Map.entry(ActionType.CLOSE_ACCOUNT, ApprovalLevel.CRITICAL)
    );

    private DefaultApprovalLevels() {}

    public static ApprovalLevel forType(ActionType type) {
        if (type == null) {
            return FALLBACK;
        }
        return TABLE.getOrDefault(type, FALLBACK);
    }

    /** Read-only view of the whole table. */
    public static Map<ActionType, ApprovalLevel> table() {
        return TABLE;
    }
}
