package com.fiscalpilot.core.model;

/**
 * Risk tiers, ordered by how much human oversight an action needs before it may run.
 * <p>
 * GREEN and YELLOW are eligible for automatic approval; RED and CRITICAL always
 * wait for an explicit (possibly multi-party) decision.
 */
public enum ApprovalLevel {
    GREEN("green"),
    YELLOW("yellow"),
    RED("red"),
    CRITICAL("critical");

    private final String value;

    ApprovalLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isAutoApprovable() {
        return this == GREEN || this == YELLOW;
    }

    public boolean isAtLeast(ApprovalLevel other) {
        return compareTo(other) >= 0;
    }

    public static ApprovalLevel fromValue(String value) {
        for (ApprovalLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown approval level: " + value);
    }
}
