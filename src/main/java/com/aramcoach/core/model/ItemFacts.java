package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Static attributes of an item for one patch.
 */
public record ItemFacts(
    String id,
    String name,
    int cost,
    List<String> tags,
    Map<String, Double> stats,
    String description
) implements Serializable {

    public ItemFacts {
        tags = tags != null ? List.copyOf(tags) : List.of();
        stats = stats != null ? Map.copyOf(stats) : Map.of();
    }

    public boolean hasTag(String tag) {
        return tags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }
}
