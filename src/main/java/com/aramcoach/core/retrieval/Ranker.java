package com.aramcoach.core.retrieval;

import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.EvidenceSource;

import java.util.List;

/**
 * Orders evidence sources by relevance to a query.
 */
public interface Ranker {

    /**
     * Returns at most {@code k} snippets with non-increasing scores. Must be
     * deterministic, must not modify {@code corpus}, and must not fail on an
     * empty corpus or a query that matches nothing.
     */
    List<EvidenceSnippet> rank(String query, List<EvidenceSource> corpus, int k);
}
