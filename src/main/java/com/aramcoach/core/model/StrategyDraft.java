package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured strategy produced by a {@code DraftGenerator}. Fields may be null
 * when a generator returns malformed output; the guardrail reports those as
 * schema violations instead of failing.
 */
public record StrategyDraft(
    StrategyRole role,
    String summary,
    List<BuildStep> buildPlan,
    List<String> citedEvidenceIds,
    List<String> assumptions,
    List<StatClaim> statClaims
) implements Serializable {

    /**
     * Draft used when no generation attempt produced anything at all.
     */
    public static StrategyDraft placeholder(RequestContext request) {
        return new StrategyDraft(
                StrategyRole.FRONT_TO_BACK,
                "No strategy could be generated. Play front to back and group with your team.",
                List.of(),
                List.of(),
                List.of("patch " + request.patchId(), "generation unavailable"),
                List.of());
    }
}
