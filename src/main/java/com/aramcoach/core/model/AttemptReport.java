package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one generate-then-validate attempt.
 */
public record AttemptReport(
    int attempt,
    boolean ok,
    List<Violation> violations
) implements Serializable {}
