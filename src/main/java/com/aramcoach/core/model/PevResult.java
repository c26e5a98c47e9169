package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of a PEV run. Contains no run ids or timestamps so that two
 * runs over identical, deterministic inputs compare equal.
 *
 * @param finalDraft        last draft produced (placeholder if generation never succeeded)
 * @param threatScores      one score per opponent, keyed by champion id in pick order
 * @param evidence          ranked evidence the drafts were grounded on
 * @param violationsHistory one report per attempt, oldest first
 * @param attemptsUsed      number of generation calls made
 * @param degraded          true if the last attempt still had violations
 */
public record PevResult(
    String patchId,
    StrategyDraft finalDraft,
    Map<String, ThreatScore> threatScores,
    List<EvidenceSnippet> evidence,
    List<AttemptReport> violationsHistory,
    int attemptsUsed,
    boolean degraded
) implements Serializable {}
