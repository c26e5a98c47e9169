package com.aramcoach.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of a PEV run and the transitions allowed out of each.
 */
public enum RunPhase {
    INIT,
    FACTS_LOADED,
    EVIDENCE_GATHERED,
    SCORED,
    DRAFTED,
    VALIDATED,
    REFINING,
    FINAL;

    public Set<RunPhase> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(FACTS_LOADED);
            case FACTS_LOADED -> EnumSet.of(EVIDENCE_GATHERED);
            case EVIDENCE_GATHERED -> EnumSet.of(SCORED);
            case SCORED, REFINING -> EnumSet.of(DRAFTED);
            case DRAFTED -> EnumSet.of(VALIDATED);
            case VALIDATED -> EnumSet.of(REFINING, FINAL);
            case FINAL -> EnumSet.noneOf(RunPhase.class);
        };
    }

    public boolean canTransitionTo(RunPhase next) {
        return successors().contains(next);
    }
}
