package com.fiscalpilot.core.model;

import java.io.Serializable;

/**
 * One human-readable step of a proposed action. Descriptive only: the engine never
 * executes steps individually.
 *
 * @param order       1-based position within the action
 * @param description what happens in this step
 * @param reversible  whether this step on its own can be undone
 */
public record ActionStep(
    int order,
    String description,
    boolean reversible
) implements Serializable {}
