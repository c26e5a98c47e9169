package com.aramcoach.core.nodes;

import com.aramcoach.core.events.CoachEvent;
import com.aramcoach.core.events.EventBus;
import com.aramcoach.core.guardrail.GuardrailValidator;
import com.aramcoach.core.metrics.CoachMetrics;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.model.ValidationResult;
import com.aramcoach.core.model.Violation;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DRAFTED → VALIDATED. Records the attempt's verdict; a failed generation is
 * recorded as-is without running the guardrail.
 */
@Component
public class ValidateDraftNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateDraftNode.class);

    private final GuardrailValidator validator;
    private final EventBus eventBus;
    private final CoachMetrics metrics;

    public ValidateDraftNode(GuardrailValidator validator, EventBus eventBus, CoachMetrics metrics) {
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public void apply(RunState state) {
        ValidationResult result = state.generationFailure() != null
                ? ValidationResult.of(List.of(state.generationFailure()))
                : validator.validate(state.draft(), state.facts(), state.evidence());
        state.recordAttempt(result);

        if (!result.ok()) {
            List<String> codes = result.violations().stream()
                    .map(v -> v.code().name())
                    .toList();
            result.violations().stream().map(Violation::code).forEach(metrics::recordViolation);
            log.info("Attempt {} rejected: {}", state.attemptCount(), codes);
            eventBus.publish(new CoachEvent("draft.rejected", state.runId(),
                    Map.of("attempt", state.attemptCount(), "codes", codes), Instant.now()));
        } else {
            log.info("Attempt {} passed validation", state.attemptCount());
        }
        state.transitionTo(RunPhase.VALIDATED);
    }
}
