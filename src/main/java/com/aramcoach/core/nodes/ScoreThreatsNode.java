package com.aramcoach.core.nodes;

import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.model.ThreatScore;
import com.aramcoach.core.state.RunState;
import com.aramcoach.core.threat.ExternalSignalProvider;
import com.aramcoach.core.threat.ThreatEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.OptionalDouble;

/**
 * EVIDENCE_GATHERED → SCORED. One score per distinct opponent. The external
 * signal is advisory: when it fails the score is computed from facts alone.
 */
@Component
public class ScoreThreatsNode {

    private static final Logger log = LoggerFactory.getLogger(ScoreThreatsNode.class);

    private final ThreatEstimator estimator;
    private final ExternalSignalProvider signalProvider;

    public ScoreThreatsNode(ThreatEstimator estimator, ExternalSignalProvider signalProvider) {
        this.estimator = estimator;
        this.signalProvider = signalProvider;
    }

    public void apply(RunState state, CancellationToken token) {
        String patchId = state.request().patchId();
        var scores = new LinkedHashMap<String, ThreatScore>();
        for (String championId : state.request().opponentIds()) {
            token.throwIfCancelled(state.runId());
            OptionalDouble signal = fetchSignal(patchId, championId);
            scores.put(championId, estimator.score(championId, state.facts(), signal));
        }
        state.setThreatScores(scores);
        state.transitionTo(RunPhase.SCORED);
    }

    private OptionalDouble fetchSignal(String patchId, String championId) {
        try {
            OptionalDouble signal = signalProvider.fetch(patchId, championId);
            return signal != null ? signal : OptionalDouble.empty();
        } catch (RuntimeException e) {
            log.warn("External signal unavailable for {} on patch {}: {}", championId, patchId, e.getMessage());
            return OptionalDouble.empty();
        }
    }
}
