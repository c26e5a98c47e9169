package com.aramcoach.core.retrieval;

import com.aramcoach.core.facts.DataCorruptException;
import com.aramcoach.core.facts.PatchDataReader;
import com.aramcoach.core.model.EvidenceSource;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads guide snippets from {@code guides.json} in the patch directory.
 * A patch without guides yields an empty corpus.
 */
@Service
public class JsonEvidenceCorpus implements EvidenceCorpusProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonEvidenceCorpus.class);

    private final PatchDataReader reader;

    public JsonEvidenceCorpus(PatchDataReader reader) {
        this.reader = reader;
    }

    @Override
    public List<EvidenceSource> corpus(String patchId) {
        List<EvidenceSource> sources = reader
                .readOptional(patchId, "guides.json", new TypeReference<List<EvidenceSource>>() {})
                .orElse(List.of());
        for (EvidenceSource source : sources) {
            if (source == null || source.id() == null || source.id().isBlank() || source.text() == null) {
                throw new DataCorruptException("guides.json for patch " + patchId + " has a snippet without id or text");
            }
        }
        if (sources.isEmpty()) {
            log.warn("No evidence corpus for patch {}", patchId);
        }
        return sources;
    }
}
