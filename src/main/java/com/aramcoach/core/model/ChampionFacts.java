package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Static attributes of a champion for one patch.
 */
public record ChampionFacts(
    String id,
    String name,
    List<String> tags,
    Map<String, Double> stats,
    String notes
) implements Serializable {

    public ChampionFacts {
        tags = tags != null ? List.copyOf(tags) : List.of();
        stats = stats != null ? Map.copyOf(stats) : Map.of();
    }
}
