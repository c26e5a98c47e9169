package com.aramcoach.core.graph;

import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.model.AttemptReport;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.nodes.DraftStrategyNode;
import com.aramcoach.core.nodes.GatherEvidenceNode;
import com.aramcoach.core.nodes.LoadFactsNode;
import com.aramcoach.core.nodes.ScoreThreatsNode;
import com.aramcoach.core.nodes.ValidateDraftNode;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives a {@link RunState} from INIT to FINAL.
 *
 * <pre>
 * INIT → FACTS_LOADED → EVIDENCE_GATHERED → SCORED → DRAFTED → VALIDATED
 *                                                      ↑           │
 *                                                      └─ REFINING ┤
 *                                                                  └→ FINAL
 * </pre>
 *
 * The cancellation token is checked before every transition.
 */
@Component
public class PevStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PevStateMachine.class);

    private final LoadFactsNode loadFacts;
    private final GatherEvidenceNode gatherEvidence;
    private final ScoreThreatsNode scoreThreats;
    private final DraftStrategyNode draftStrategy;
    private final ValidateDraftNode validateDraft;

    public PevStateMachine(LoadFactsNode loadFacts,
                           GatherEvidenceNode gatherEvidence,
                           ScoreThreatsNode scoreThreats,
                           DraftStrategyNode draftStrategy,
                           ValidateDraftNode validateDraft) {
        this.loadFacts = loadFacts;
        this.gatherEvidence = gatherEvidence;
        this.scoreThreats = scoreThreats;
        this.draftStrategy = draftStrategy;
        this.validateDraft = validateDraft;
    }

    public RunState run(RunState state, CancellationToken token) {
        while (!state.isTerminal()) {
            token.throwIfCancelled(state.runId());
            switch (state.phase()) {
                case INIT -> loadFacts.apply(state);
                case FACTS_LOADED -> gatherEvidence.apply(state);
                case EVIDENCE_GATHERED -> scoreThreats.apply(state, token);
                case SCORED, REFINING -> draftStrategy.apply(state, token);
                case DRAFTED -> validateDraft.apply(state);
                case VALIDATED -> {
                    RunPhase next = routeAfterValidate(state);
                    if (next == RunPhase.REFINING) {
                        state.setFeedback(state.lastAttempt().violations());
                    }
                    state.transitionTo(next);
                }
                case FINAL -> state.finish();
            }
        }
        return state;
    }

    /**
     * FINAL when the last attempt passed or the refinement budget is spent,
     * REFINING otherwise.
     */
    RunPhase routeAfterValidate(RunState state) {
        AttemptReport last = state.lastAttempt();
        if (last.ok()) {
            return RunPhase.FINAL;
        }
        if (state.attemptCount() <= state.maxAttempts()) {
            return RunPhase.REFINING;
        }
        log.warn("Attempts exhausted after {} tries; returning degraded result", state.attemptCount());
        return RunPhase.FINAL;
    }
}
