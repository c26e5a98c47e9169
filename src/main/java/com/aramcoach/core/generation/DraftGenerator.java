package com.aramcoach.core.generation;

import com.aramcoach.core.model.*;

import java.util.List;
import java.util.Map;

/**
 * Produces a strategy draft from the gathered inputs.
 * <p>
 * {@code feedback} holds the violations of the previous attempt and is empty
 * on the first attempt. Implementations should take it into account but may
 * return the same draft again.
 */
public interface DraftGenerator {

    /**
     * @throws GenerationTimeoutException if the underlying call times out
     * @throws GenerationSchemaException  if the output is malformed
     */
    StrategyDraft generate(FactSet facts,
                           List<EvidenceSnippet> evidence,
                           Map<String, ThreatScore> threatScores,
                           RequestContext request,
                           List<Violation> feedback);
}
