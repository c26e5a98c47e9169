package com.aramcoach.core.nodes;

import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.facts.DataCorruptException;
import com.aramcoach.core.model.RequestContext;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.retrieval.Bm25Ranker;
import com.aramcoach.core.retrieval.RankerProperties;
import com.aramcoach.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aramcoach.core.CoachFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GatherEvidenceNodeTest {

    private static RunState loadedState(RequestContext request) {
        var state = new RunState("PEV-TEST-0001", request, 1);
        state.setFacts(scenarioFacts());
        state.transitionTo(RunPhase.FACTS_LOADED);
        return state;
    }

    @Test
    @DisplayName("query combines question, player, allies and opponents without repeats")
    void buildQuery() {
        var request = RequestContext.preGame(PATCH, PATCH, picks("A", "B"), picks("F", "F", "G"), "anti heal?");
        assertEquals("anti heal? A B F G", GatherEvidenceNode.buildQuery(request));
    }

    @Test
    @DisplayName("keeps at most topK snippets and advances the phase")
    void topK() {
        var properties = new RankerProperties();
        properties.setTopK(2);
        var node = new GatherEvidenceNode(patchId -> scenarioCorpus(), new Bm25Ranker(properties), properties);
        var state = loadedState(scenarioRequest());

        node.apply(state);

        assertEquals(2, state.evidence().size());
        assertEquals(RunPhase.EVIDENCE_GATHERED, state.phase());
    }

    @Test
    @DisplayName("empty corpus gives empty evidence")
    void emptyCorpus() {
        var properties = new RankerProperties();
        var node = new GatherEvidenceNode(patchId -> List.of(), new Bm25Ranker(properties), properties);
        var state = loadedState(scenarioRequest());

        node.apply(state);

        assertTrue(state.evidence().isEmpty());
    }

    @Test
    @DisplayName("corpus failures are fatal")
    void corpusFailure() {
        var properties = new RankerProperties();
        var node = new GatherEvidenceNode(patchId -> {
            throw new DataCorruptException("broken");
        }, new Bm25Ranker(properties), properties);

        assertThrows(FactsUnavailableException.class, () -> node.apply(loadedState(scenarioRequest())));
    }
}
