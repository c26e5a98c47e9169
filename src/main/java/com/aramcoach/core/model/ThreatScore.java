package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * Threat posed by one opponent, on the closed scale {@link #MIN}..{@link #MAX}.
 */
public record ThreatScore(
    String championId,
    double value,
    String rationale
) implements Serializable {

    public static final double MIN = 1.0;
    public static final double MAX = 10.0;
}
