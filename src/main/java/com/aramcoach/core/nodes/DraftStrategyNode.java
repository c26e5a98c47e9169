package com.aramcoach.core.nodes;

import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.engine.RunCancelledException;
import com.aramcoach.core.generation.DraftGenerator;
import com.aramcoach.core.generation.GenerationException;
import com.aramcoach.core.generation.GenerationProperties;
import com.aramcoach.core.generation.GenerationSchemaException;
import com.aramcoach.core.generation.GenerationTimeoutException;
import com.aramcoach.core.logging.MdcContext;
import com.aramcoach.core.metrics.CoachMetrics;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.model.StrategyDraft;
import com.aramcoach.core.model.Violation;
import com.aramcoach.core.model.ViolationCode;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SCORED or REFINING → DRAFTED.
 * <p>
 * Starts a new attempt and asks the {@link DraftGenerator} for a draft on the
 * generation executor, bounded by the configured timeout. A timeout or any
 * generator failure is recorded as a {@link ViolationCode#GENERATION_FAILED}
 * violation for this attempt instead of failing the run.
 */
@Component
public class DraftStrategyNode {

    private static final Logger log = LoggerFactory.getLogger(DraftStrategyNode.class);

    private final DraftGenerator generator;
    private final ExecutorService executor;
    private final GenerationProperties properties;
    private final CoachMetrics metrics;

    public DraftStrategyNode(DraftGenerator generator,
                             @Qualifier("generationExecutor") ExecutorService executor,
                             GenerationProperties properties,
                             CoachMetrics metrics) {
        this.generator = generator;
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
    }

    public void apply(RunState state, CancellationToken token) {
        int attempt = state.beginAttempt();
        MdcContext.setAttempt(attempt);
        log.info("Drafting attempt {} of at most {}", attempt, state.maxAttempts() + 1);
        try {
            StrategyDraft draft = generate(state, token);
            if (draft == null) {
                throw new GenerationSchemaException("Generator returned no draft", null);
            }
            state.recordDraft(draft);
        } catch (GenerationException e) {
            String reason = e instanceof GenerationTimeoutException ? "timeout"
                    : e instanceof GenerationSchemaException ? "schema" : "error";
            log.warn("Generation failed on attempt {} ({}): {}", attempt, reason, e.getMessage());
            metrics.recordGenerationFailure(reason);
            state.recordGenerationFailure(new Violation(ViolationCode.GENERATION_FAILED,
                    "Draft generation failed: " + e.getMessage(), "$"));
        }
        state.transitionTo(RunPhase.DRAFTED);
    }

    private StrategyDraft generate(RunState state, CancellationToken token) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<StrategyDraft> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return generator.generate(state.facts(), state.evidence(), state.threatScores(),
                        state.request(), state.feedback());
            } finally {
                MDC.clear();
            }
        });
        token.track(future);
        Duration timeout = properties.getTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationTimeoutException(timeout);
        } catch (CancellationException e) {
            throw new RunCancelledException(state.runId());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RunCancelledException(state.runId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationException ge) {
                throw ge;
            }
            throw new GenerationException("Generator error: " + cause.getMessage(), cause);
        } finally {
            token.untrack(future);
        }
    }
}
