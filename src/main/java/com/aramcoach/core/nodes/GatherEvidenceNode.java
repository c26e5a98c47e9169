package com.aramcoach.core.nodes;

import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.EvidenceSource;
import com.aramcoach.core.model.RequestContext;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.retrieval.EvidenceCorpusProvider;
import com.aramcoach.core.retrieval.Ranker;
import com.aramcoach.core.retrieval.RankerProperties;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * FACTS_LOADED → EVIDENCE_GATHERED. Ranks the patch's guide corpus against a
 * query built from the question and the champions involved.
 */
@Component
public class GatherEvidenceNode {

    private static final Logger log = LoggerFactory.getLogger(GatherEvidenceNode.class);

    private final EvidenceCorpusProvider corpusProvider;
    private final Ranker ranker;
    private final RankerProperties properties;

    public GatherEvidenceNode(EvidenceCorpusProvider corpusProvider, Ranker ranker, RankerProperties properties) {
        this.corpusProvider = corpusProvider;
        this.ranker = ranker;
        this.properties = properties;
    }

    public void apply(RunState state) {
        String patchId = state.request().patchId();
        List<EvidenceSource> corpus;
        try {
            corpus = corpusProvider.corpus(patchId);
        } catch (RuntimeException e) {
            throw new FactsUnavailableException(patchId,
                    "Evidence corpus for patch " + patchId + " is unavailable: " + e.getMessage(), e);
        }
        String query = buildQuery(state.request());
        List<EvidenceSnippet> evidence = ranker.rank(query, corpus, properties.getTopK());
        log.debug("Gathered {} of {} snippets for query '{}'", evidence.size(), corpus.size(), query);
        state.setEvidence(evidence);
        state.transitionTo(RunPhase.EVIDENCE_GATHERED);
    }

    static String buildQuery(RequestContext request) {
        var parts = new ArrayList<String>();
        if (request.question() != null && !request.question().isBlank()) {
            parts.add(request.question());
        }
        if (request.myChampionId() != null) {
            parts.add(request.myChampionId());
        }
        for (String id : request.allyIds()) {
            if (!id.equals(request.myChampionId())) {
                parts.add(id);
            }
        }
        parts.addAll(request.opponentIds());
        return String.join(" ", parts);
    }
}
