package com.aramcoach.core.threat;

import com.aramcoach.core.model.FactSet;
import com.aramcoach.core.model.ThreatScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalDouble;

import static com.aramcoach.core.CoachFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ThreatEstimatorTest {

    private final ThreatEstimator estimator = new ThreatEstimator(new ThreatProperties());
    private final FactSet facts = scenarioFacts();

    @Test
    @DisplayName("unknown champion gets the minimum score")
    void unknownChampion() {
        ThreatScore score = estimator.score("nobody", facts, OptionalDouble.empty());

        assertEquals(ThreatScore.MIN, score.value());
        assertEquals("nobody", score.championId());
        assertTrue(score.rationale().contains("no static facts"));
    }

    @Test
    @DisplayName("tag weights add up from the minimum")
    void tagWeights() {
        // healer 1.5 + sustain 1.0
        ThreatScore score = estimator.score("F", facts, OptionalDouble.empty());
        assertEquals(3.5, score.value(), 1e-9);
        assertTrue(score.rationale().contains("healer"));
    }

    @Test
    @DisplayName("win rate signal blends into the score")
    void signalBlend() {
        // base 3.5, 50% win rate maps to 5.5; 0.7 * 3.5 + 0.3 * 5.5
        ThreatScore score = estimator.score("F", facts, OptionalDouble.of(0.50));
        assertEquals(4.1, score.value(), 1e-9);
        assertTrue(score.rationale().contains("win rate 50.0%"));
    }

    @Test
    @DisplayName("scores stay within bounds for extreme inputs")
    void bounds() {
        var stacked = new FactSet(PATCH, Map.of("X", champion("X",
                "healer", "shield", "tank", "poke", "burst", "cc", "mobility", "sustain")), Map.of(), Map.of());

        double high = estimator.score("X", stacked, OptionalDouble.of(1.0)).value();
        double low = estimator.score("nobody", stacked, OptionalDouble.of(0.0)).value();

        assertEquals(ThreatScore.MAX, high);
        assertEquals(ThreatScore.MIN, low);
    }

    @Test
    @DisplayName("non-finite signal is ignored")
    void nanSignal() {
        assertEquals(estimator.score("F", facts, OptionalDouble.empty()).value(),
                estimator.score("F", facts, OptionalDouble.of(Double.NaN)).value());
    }

    @Test
    @DisplayName("same inputs give the same score")
    void deterministic() {
        assertEquals(estimator.score("I", facts, OptionalDouble.of(0.55)),
                estimator.score("I", facts, OptionalDouble.of(0.55)));
    }
}
