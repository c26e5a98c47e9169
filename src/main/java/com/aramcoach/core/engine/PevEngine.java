package com.aramcoach.core.engine;

import com.aramcoach.core.events.CoachEvent;
import com.aramcoach.core.events.EventBus;
import com.aramcoach.core.graph.PevStateMachine;
import com.aramcoach.core.logging.MdcContext;
import com.aramcoach.core.metrics.CoachMetrics;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.RequestContext;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point for PEV runs.
 * <p>
 * Creates a fresh {@link RunState} per request, drives it through the
 * {@link PevStateMachine} and converts the terminal state into a
 * {@link PevResult}. Runs share nothing but read-only collaborators.
 */
@Service
public class PevEngine {

    private static final Logger log = LoggerFactory.getLogger(PevEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final PevStateMachine stateMachine;
    private final PevProperties properties;
    private final EventBus eventBus;
    private final CoachMetrics metrics;

    public PevEngine(PevStateMachine stateMachine, PevProperties properties,
                     EventBus eventBus, CoachMetrics metrics) {
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs with the configured attempt bound.
     */
    public PevResult runPev(RequestContext request) {
        return runPev(request, properties.getMaxAttempts());
    }

    public PevResult runPev(RequestContext request, int maxAttempts) {
        return runPev(request, maxAttempts, new CancellationToken());
    }

    public PevResult runPev(RequestContext request, int maxAttempts, CancellationToken token) {
        return runPev(request, maxAttempts, token, null);
    }

    /**
     * Runs the full plan → evidence → verify loop.
     *
     * @param request     immutable request inputs
     * @param maxAttempts regenerations allowed after the first draft, between 0 and the configured limit
     * @param token       checked before every transition; cancelling interrupts in-flight generation
     * @param listener    receives this run's events only, may be {@code null}
     * @return the terminal result, possibly degraded
     * @throws FactsUnavailableException if facts or evidence cannot be loaded
     * @throws RunCancelledException     if {@code token} is cancelled before the run finishes
     * @throws IllegalArgumentException  if {@code maxAttempts} is negative or above the configured limit
     */
    public PevResult runPev(RequestContext request, int maxAttempts, CancellationToken token,
                            Consumer<CoachEvent> listener) {
        if (maxAttempts < 0 || maxAttempts > properties.getMaxAttemptsLimit()) {
            throw new IllegalArgumentException("maxAttempts must be between 0 and "
                    + properties.getMaxAttemptsLimit() + ", was " + maxAttempts);
        }
        String runId = generateRunId();
        var state = new RunState(runId, request, maxAttempts);
        EventBus.Subscription subscription = listener != null ? eventBus.subscribe(runId, listener) : null;
        MdcContext.setRun(runId, request.patchId());
        long start = System.currentTimeMillis();
        try {
            log.info("Starting run {} ({}) on patch {}: allies={} opponents={} maxAttempts={}",
                    runId, request.mode(), request.patchId(), request.allyIds(), request.opponentIds(), maxAttempts);
            eventBus.publish(new CoachEvent("run.started", runId,
                    Map.of("patch", request.patchId(), "mode", request.mode().name()), Instant.now()));

            stateMachine.run(state, token);

            PevResult result = state.toResult();
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordRunDuration(elapsed);
            metrics.recordRunResult(result.degraded());
            metrics.recordAttempts(result.attemptsUsed());
            eventBus.publish(new CoachEvent("run.completed", runId,
                    Map.of("attempts", result.attemptsUsed(), "degraded", result.degraded()), Instant.now()));
            log.info("Run {} finished in {} ms after {} attempt(s){}", runId, elapsed,
                    result.attemptsUsed(), result.degraded() ? " (degraded)" : "");
            return result;
        } catch (FactsUnavailableException e) {
            log.error("Run {} failed: {}", runId, e.getMessage());
            metrics.recordRunFailure(e.isPatchMissing() ? "patch_not_found" : "data_corrupt");
            eventBus.publish(new CoachEvent("run.failed", runId,
                    Map.of("error", String.valueOf(e.getMessage())), Instant.now()));
            throw e;
        } catch (RunCancelledException e) {
            log.info("Run {} cancelled in phase {}", runId, state.phase());
            metrics.recordRunFailure("cancelled");
            eventBus.publish(new CoachEvent("run.failed", runId,
                    Map.of("error", "cancelled"), Instant.now()));
            throw e;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            MdcContext.clear();
        }
    }

    /**
     * Generates a run id in the format PEV-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PEV-%d-%04d", year, count);
    }
}
