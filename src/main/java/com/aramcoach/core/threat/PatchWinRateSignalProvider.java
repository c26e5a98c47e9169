package com.aramcoach.core.threat;

import com.aramcoach.core.facts.PatchDataReader;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Win rates from {@code winrates.json} in the patch directory, a flat
 * {@code {"championId": 0.523}} object. Parsed once per patch; a read that
 * throws is not cached.
 */
@Service
public class PatchWinRateSignalProvider implements ExternalSignalProvider {

    private final PatchDataReader reader;
    private final ConcurrentHashMap<String, Map<String, Double>> cache = new ConcurrentHashMap<>();

    public PatchWinRateSignalProvider(PatchDataReader reader) {
        this.reader = reader;
    }

    @Override
    public OptionalDouble fetch(String patchId, String championId) {
        Map<String, Double> rates = cache.computeIfAbsent(patchId, this::load);
        Double rate = rates.get(championId);
        if (rate == null || rate < 0.0 || rate > 1.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(rate);
    }

    private Map<String, Double> load(String patchId) {
        return reader
                .readOptional(patchId, "winrates.json", new TypeReference<Map<String, Double>>() {})
                .orElse(Map.of());
    }
}
