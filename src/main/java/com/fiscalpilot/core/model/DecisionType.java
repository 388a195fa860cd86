package com.fiscalpilot.core.model;

/**
 * Kinds of entries in the approval ledger.
 */
public enum DecisionType {
    APPROVED("approved"),
    REJECTED("rejected"),
    PARTIAL_APPROVAL("partial_approval");

    private final String value;

    DecisionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
