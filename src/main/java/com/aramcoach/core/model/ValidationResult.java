package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Guardrail outcome for one draft. {@code ok} is true iff there are no violations.
 */
public record ValidationResult(
    boolean ok,
    List<Violation> violations
) implements Serializable {

    public static ValidationResult of(List<Violation> violations) {
        var copy = List.copyOf(violations);
        return new ValidationResult(copy.isEmpty(), copy);
    }
}
