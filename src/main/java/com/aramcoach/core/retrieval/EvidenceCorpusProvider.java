package com.aramcoach.core.retrieval;

import com.aramcoach.core.model.EvidenceSource;

import java.util.List;

/**
 * Supplies the evidence corpus a run ranks against.
 */
public interface EvidenceCorpusProvider {

    /**
     * @return the corpus for the patch, possibly empty
     * @throws com.aramcoach.core.facts.DataCorruptException if the stored corpus is unreadable
     */
    List<EvidenceSource> corpus(String patchId);
}
