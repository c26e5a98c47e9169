package com.aramcoach.dispatch.api;

import com.aramcoach.core.model.AttemptReport;
import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.StrategyDraft;
import com.aramcoach.core.model.ThreatScore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outbound JSON for both advice endpoints.
 */
public record AdviceResponse(
    String patch,
    @JsonProperty("final_draft") StrategyDraft finalDraft,
    @JsonProperty("threat_scores") Map<String, ThreatScore> threatScores,
    List<EvidenceSnippet> evidence,
    @JsonProperty("violations_history") List<AttemptReport> violationsHistory,
    @JsonProperty("attempts_used") int attemptsUsed,
    boolean degraded
) {

    public static AdviceResponse from(PevResult result) {
        return new AdviceResponse(
                result.patchId(),
                result.finalDraft(),
                result.threatScores(),
                result.evidence(),
                result.violationsHistory(),
                result.attemptsUsed(),
                result.degraded());
    }
}
