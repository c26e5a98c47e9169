package com.aramcoach.core.state;

import com.aramcoach.core.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable aggregate threaded through one PEV run.
 * <p>
 * Owned by a single orchestrator invocation and never shared between runs.
 * Every phase change goes through {@link #transitionTo(RunPhase)}, which
 * rejects edges not declared in {@link RunPhase#successors()}.
 */
public class RunState {

    /** Upper bound on maxAttempts regardless of configuration. */
    public static final int MAX_ATTEMPTS_CEILING = 10;

    private final String runId;
    private final RequestContext request;
    private final int maxAttempts;

    private RunPhase phase = RunPhase.INIT;
    private FactSet facts;
    private List<EvidenceSnippet> evidence = List.of();
    private Map<String, ThreatScore> threatScores = Map.of();
    private StrategyDraft draft;
    private Violation generationFailure;
    private List<Violation> feedback = List.of();
    private final List<AttemptReport> attempts = new ArrayList<>();
    private int attemptCount;
    private boolean terminal;
    private boolean degraded;

    public RunState(String runId, RequestContext request, int maxAttempts) {
        if (maxAttempts < 0 || maxAttempts > MAX_ATTEMPTS_CEILING) {
            throw new IllegalArgumentException("maxAttempts must be between 0 and "
                    + MAX_ATTEMPTS_CEILING + ", was " + maxAttempts);
        }
        this.runId = Objects.requireNonNull(runId, "runId");
        this.request = Objects.requireNonNull(request, "request");
        this.maxAttempts = maxAttempts;
    }

    // ── Phase ────────────────────────────────────────────────────────

    public void transitionTo(RunPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + phase + " -> " + next + " in run " + runId);
        }
        phase = next;
    }

    public RunPhase phase() {
        return phase;
    }

    // ── Step outputs ─────────────────────────────────────────────────

    public void setFacts(FactSet facts) {
        this.facts = Objects.requireNonNull(facts, "facts");
    }

    public void setEvidence(List<EvidenceSnippet> evidence) {
        this.evidence = List.copyOf(evidence);
    }

    public void setThreatScores(Map<String, ThreatScore> scores) {
        this.threatScores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    /**
     * Starts a new generation attempt and returns its 1-based number.
     */
    public int beginAttempt() {
        attemptCount++;
        generationFailure = null;
        return attemptCount;
    }

    public void recordDraft(StrategyDraft draft) {
        this.draft = draft;
    }

    /**
     * Marks the current attempt as failed before validation. A previous draft,
     * if any, is kept.
     */
    public void recordGenerationFailure(Violation violation) {
        this.generationFailure = violation;
    }

    public void recordAttempt(ValidationResult result) {
        attempts.add(new AttemptReport(attemptCount, result.ok(), result.violations()));
    }

    public void setFeedback(List<Violation> feedback) {
        this.feedback = List.copyOf(feedback);
    }

    /**
     * Terminates the run. Substitutes a placeholder if no attempt produced a draft.
     */
    public void finish() {
        if (draft == null) {
            draft = StrategyDraft.placeholder(request);
        }
        degraded = lastAttempt() == null || !lastAttempt().ok();
        terminal = true;
    }

    public PevResult toResult() {
        if (!terminal) {
            throw new IllegalStateException("Run " + runId + " has not finished (phase " + phase + ")");
        }
        return new PevResult(request.patchId(), draft, threatScores, evidence,
                List.copyOf(attempts), attemptCount, degraded);
    }

    // ── Accessors ────────────────────────────────────────────────────

    public String runId() {
        return runId;
    }

    public RequestContext request() {
        return request;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public FactSet facts() {
        return facts;
    }

    public List<EvidenceSnippet> evidence() {
        return evidence;
    }

    public Map<String, ThreatScore> threatScores() {
        return threatScores;
    }

    public StrategyDraft draft() {
        return draft;
    }

    public Violation generationFailure() {
        return generationFailure;
    }

    public List<Violation> feedback() {
        return feedback;
    }

    public List<AttemptReport> attempts() {
        return Collections.unmodifiableList(attempts);
    }

    public AttemptReport lastAttempt() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    public int attemptCount() {
        return attemptCount;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
