package com.aramcoach.core.threat;

import com.aramcoach.core.model.ChampionFacts;
import com.aramcoach.core.model.FactSet;
import com.aramcoach.core.model.ThreatScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scores how threatening an opponent is on the {@link ThreatScore#MIN}..{@link ThreatScore#MAX} scale.
 * <p>
 * The static part is {@code 1 + sum(tag weights)} over the champion's tags.
 * A win rate, when available, is mapped linearly from
 * [{@code signalFloor}, {@code signalCeiling}] onto the scale and blended in
 * with {@code signalWeight}. Results are clamped and rounded to two decimals.
 */
@Component
public class ThreatEstimator {

    private final ThreatProperties properties;

    public ThreatEstimator(ThreatProperties properties) {
        this.properties = properties;
    }

    public ThreatScore score(String championId, FactSet facts, OptionalDouble externalSignal) {
        var champion = facts.champion(championId);
        var reasons = new ArrayList<String>();

        double base = ThreatScore.MIN;
        if (champion.isPresent()) {
            base += tagContribution(champion.get(), reasons);
        } else {
            reasons.add("no static facts");
        }
        base = clamp(base);

        double value = base;
        if (externalSignal.isPresent() && Double.isFinite(externalSignal.getAsDouble())) {
            double winRate = externalSignal.getAsDouble();
            double weight = clampUnit(properties.getSignalWeight());
            value = (1 - weight) * base + weight * signalOnScale(winRate);
            reasons.add(String.format(Locale.ROOT, "win rate %.1f%%", winRate * 100));
        }

        return new ThreatScore(championId, round(clamp(value)), String.join("; ", reasons));
    }

    private double tagContribution(ChampionFacts champion, List<String> reasons) {
        double sum = 0.0;
        for (Map.Entry<String, Double> weight : properties.getTagWeights().entrySet()) {
            boolean tagged = champion.tags().stream().anyMatch(t -> t.equalsIgnoreCase(weight.getKey()));
            if (tagged && weight.getValue() != null) {
                sum += weight.getValue();
                reasons.add(weight.getKey());
            }
        }
        return sum;
    }

    private double signalOnScale(double winRate) {
        double span = properties.getSignalCeiling() - properties.getSignalFloor();
        double position = span > 0 ? (winRate - properties.getSignalFloor()) / span : 0.5;
        return ThreatScore.MIN + clampUnit(position) * (ThreatScore.MAX - ThreatScore.MIN);
    }

    private static double clamp(double value) {
        return Math.max(ThreatScore.MIN, Math.min(ThreatScore.MAX, value));
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
