package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only facts for one patch. Maps keep load order and cannot be modified,
 * so a single instance may be shared across concurrent runs.
 */
public record FactSet(
    String patchId,
    Map<String, ChampionFacts> champions,
    Map<String, ItemFacts> items,
    Map<String, RuneFacts> runes
) implements Serializable {

    public FactSet {
        champions = freeze(champions);
        items = freeze(items);
        runes = freeze(runes);
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public Optional<ChampionFacts> champion(String id) {
        return Optional.ofNullable(id).map(champions::get);
    }

    public Optional<ItemFacts> item(String id) {
        return Optional.ofNullable(id).map(items::get);
    }
}
