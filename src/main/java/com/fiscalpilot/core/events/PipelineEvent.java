package com.fiscalpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the approval gate or the execution engine.
 *
 * @param eventType event type (e.g. "action.approved", "action.executed", "action.rolled_back")
 * @param actionId  the action this event relates to
 * @param actor     who caused it: an approver identity, {@code system:auto}, or an executor name
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String actionId,
    String actor,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
