package com.aramcoach.core.threat;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights for the static threat formula and the external-signal blend.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.threat")
public class ThreatProperties {

    /** Added to the base score for each matching champion tag (case-insensitive). */
    private Map<String, Double> tagWeights = defaultTagWeights();

    /** Share of the final score taken from the external signal, 0..1. */
    private double signalWeight = 0.3;

    /** Win rate mapped to the bottom of the scale. */
    private double signalFloor = 0.40;

    /** Win rate mapped to the top of the scale. */
    private double signalCeiling = 0.60;

    private static Map<String, Double> defaultTagWeights() {
        var weights = new LinkedHashMap<String, Double>();
        weights.put("healer", 1.5);
        weights.put("shield", 1.0);
        weights.put("tank", 1.0);
        weights.put("poke", 1.5);
        weights.put("burst", 2.0);
        weights.put("cc", 1.5);
        weights.put("mobility", 1.0);
        weights.put("sustain", 1.0);
        return weights;
    }

    public Map<String, Double> getTagWeights() {
        return tagWeights;
    }

    public void setTagWeights(Map<String, Double> tagWeights) {
        this.tagWeights = tagWeights;
    }

    public double getSignalWeight() {
        return signalWeight;
    }

    public void setSignalWeight(double signalWeight) {
        this.signalWeight = signalWeight;
    }

    public double getSignalFloor() {
        return signalFloor;
    }

    public void setSignalFloor(double signalFloor) {
        this.signalFloor = signalFloor;
    }

    public double getSignalCeiling() {
        return signalCeiling;
    }

    public void setSignalCeiling(double signalCeiling) {
        this.signalCeiling = signalCeiling;
    }
}
