package com.aramcoach.core.metrics;

import com.aramcoach.core.model.ViolationCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for PEV runs.
 */
@Service
public class CoachMetrics {

    private final MeterRegistry registry;

    public CoachMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(boolean degraded) {
        Counter.builder("aramcoach.runs.total")
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    public void recordRunFailure(String reason) {
        Counter.builder("aramcoach.runs.failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("aramcoach.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how many generation attempts a finished run used.
     */
    public void recordAttempts(int attempts) {
        DistributionSummary.builder("aramcoach.attempts")
                .description("Draft generation attempts per run")
                .register(registry)
                .record(attempts);
    }

    public void recordViolation(ViolationCode code) {
        Counter.builder("aramcoach.violations.total")
                .tag("code", code.name())
                .register(registry)
                .increment();
    }

    public void recordGenerationFailure(String reason) {
        Counter.builder("aramcoach.generation.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
