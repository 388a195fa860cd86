package com.fiscalpilot.core.model;

/**
 * Closed set of operations the pipeline knows how to govern.
 * The default risk tier of each type lives in {@link DefaultApprovalLevels}.
 */
public enum ActionType {
    CATEGORIZE_TRANSACTION("categorize_transaction"),
    TAG_EXPENSE("tag_expense"),
    UPDATE_CATEGORY_BULK("update_category_bulk"),
    SEND_REMINDER("send_reminder"),
    FLAG_FOR_REVIEW("flag_for_review"),
    CREATE_BUDGET_ALERT("create_budget_alert"),
    GENERATE_REPORT("generate_report"),
    CANCEL_SUBSCRIPTION("cancel_subscription"),
    PAY_INVOICE("pay_invoice"),
    RENEGOTIATE_VENDOR("renegotiate_vendor"),
    TRANSFER_FUNDS("transfer_funds"),
    CHANGE_PAYROLL("change_payroll"),
    MODIFY_TAX_FILING("modify_tax_filing"),
    CLOSE_ACCOUNT("close_account"),
    CUSTOM("custom");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    /** Wire value used in parameters, events and journal lines. */
    public String value() {
        return value;
    }

    public static ActionType fromValue(String value) {
        for (ActionType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + value);
    }
}
