package com.fiscalpilot.core.model;

import java.io.Serializable;

/**
 * After-the-fact notice that a YELLOW action was approved automatically.
 * Delivery (email, chat) belongs to the host.
 */
public record ApprovalNotification(
    String actionId,
    String title,
    ApprovalLevel level,
    String message
) implements Serializable {}
