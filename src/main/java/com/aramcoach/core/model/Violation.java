package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * A single rule violation.
 *
 * @param code      machine-readable reason
 * @param message   human-readable explanation
 * @param fieldPath draft field the violation concerns, e.g. "buildPlan[0].itemIds[1]"
 */
public record Violation(
    ViolationCode code,
    String message,
    String fieldPath
) implements Serializable {}
