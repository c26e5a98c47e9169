package com.aramcoach.core.engine;

import com.aramcoach.core.PevHarness;
import com.aramcoach.core.events.CoachEvent;
import com.aramcoach.core.facts.DataCorruptException;
import com.aramcoach.core.facts.PatchNotFoundException;
import com.aramcoach.core.generation.DraftGenerator;
import com.aramcoach.core.generation.GenerationSchemaException;
import com.aramcoach.core.generation.RuleBasedDraftGenerator;
import com.aramcoach.core.guardrail.GuardrailProperties;
import com.aramcoach.core.guardrail.GuardrailValidator;
import com.aramcoach.core.guardrail.RuleBasedGuardrailValidator;
import com.aramcoach.core.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.aramcoach.core.CoachFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PevEngineTest {

    private static final ValidationResult REJECTED = ValidationResult.of(List.of(
            new Violation(ViolationCode.SUMMARY_TOO_LONG, "too long", "summary")));

    private PevHarness harness;

    @BeforeEach
    void setUp() {
        harness = new PevHarness();
        harness.generator = mock(DraftGenerator.class);
        harness.validator = mock(GuardrailValidator.class);
        when(harness.generator.generate(any(), any(), any(), any(), any())).thenReturn(cleanDraft("s1"));
        when(harness.validator.validate(any(), any(), any())).thenReturn(ValidationResult.of(List.of()));
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    @DisplayName("always-failing validator with maxAttempts=1 makes two generation calls and degrades")
    void alwaysFailingValidator() {
        when(harness.validator.validate(any(), any(), any())).thenReturn(REJECTED);

        PevResult result = harness.engine().runPev(scenarioRequest(), 1);

        verify(harness.generator, times(2)).generate(any(), any(), any(), any(), any());
        assertTrue(result.degraded());
        assertEquals(2, result.attemptsUsed());
        assertEquals(2, result.violationsHistory().size());
        assertEquals(List.of(1, 2), result.violationsHistory().stream().map(AttemptReport::attempt).toList());
    }

    @Test
    @DisplayName("five-versus-five scenario on 14.99 with the rule-based stack")
    void scenario() {
        harness.generator = new RuleBasedDraftGenerator();
        harness.validator = new RuleBasedGuardrailValidator(new GuardrailProperties());

        PevResult result = harness.engine().runPev(scenarioRequest(), 1);

        assertTrue(Set.of(1, 2).contains(result.attemptsUsed()));
        assertTrue(result.evidence().size() <= 5);
        assertEquals(List.of("F", "G", "H", "I", "J"), List.copyOf(result.threatScores().keySet()));
        assertEquals("14.99", result.patchId());
        assertFalse(result.degraded());
        result.threatScores().values().forEach(s ->
                assertTrue(s.value() >= ThreatScore.MIN && s.value() <= ThreatScore.MAX));
    }

    @Test
    @DisplayName("identical requests give identical results")
    void idempotent() throws Exception {
        var engine = harness.engine();
        var mapper = new ObjectMapper();

        PevResult first = engine.runPev(scenarioRequest(), 1);
        PevResult second = engine.runPev(scenarioRequest(), 1);

        assertEquals(first, second);
        assertEquals(mapper.writeValueAsString(first), mapper.writeValueAsString(second));
    }

    @Test
    @DisplayName("run ids follow PEV-YYYY-NNNN and increase")
    void runIds() {
        var engine = harness.engine();
        String a = engine.generateRunId();
        String b = engine.generateRunId();

        assertTrue(a.matches("PEV-\\d{4}-\\d{4,}"), a);
        assertNotEquals(a, b);
    }

    @Nested
    @DisplayName("fatal errors")
    class Fatal {

        @Test
        @DisplayName("unknown patch fails the run without generating")
        void unknownPatch() {
            harness.factLoader = patchId -> {
                throw new PatchNotFoundException(patchId);
            };
            var events = new CopyOnWriteArrayList<String>();
            harness.eventBus.subscribeAll(e -> events.add(e.eventType()));

            var e = assertThrows(FactsUnavailableException.class,
                    () -> harness.engine().runPev(scenarioRequest(), 1));

            assertTrue(e.isPatchMissing());
            assertEquals("14.99", e.getPatchId());
            verifyNoInteractions(harness.generator);
            assertEquals(List.of("run.started", "run.failed"), events);
            assertEquals(1.0, harness.registry.get("aramcoach.runs.failed")
                    .tag("reason", "patch_not_found").counter().count());
        }

        @Test
        @DisplayName("corrupt guides are fatal")
        void corruptCorpus() {
            harness.corpusProvider = patchId -> {
                throw new DataCorruptException("guides.json is broken");
            };

            var e = assertThrows(FactsUnavailableException.class,
                    () -> harness.engine().runPev(scenarioRequest(), 1));

            assertFalse(e.isPatchMissing());
            assertInstanceOf(PevFatalException.class, e);
        }

        @Test
        @DisplayName("MDC is cleared even when the run fails")
        void mdcCleared() {
            harness.factLoader = patchId -> {
                throw new DataCorruptException("bad");
            };

            assertThrows(FactsUnavailableException.class, () -> harness.engine().runPev(scenarioRequest(), 0));
            assertNull(MDC.get("runId"));
        }
    }

    @Nested
    @DisplayName("advisory and attempt-scoped failures")
    class AttemptFailures {

        @Test
        @DisplayName("a failing signal provider does not fail the run")
        void signalFailure() {
            harness.signalProvider = (patchId, championId) -> {
                throw new IllegalStateException("stats site down");
            };

            PevResult result = harness.engine().runPev(scenarioRequest(), 0);

            assertEquals(5, result.threatScores().size());
            assertFalse(result.degraded());
        }

        @Test
        @DisplayName("generator errors count as failed attempts and the run recovers")
        void generatorErrorThenSuccess() {
            when(harness.generator.generate(any(), any(), any(), any(), any()))
                    .thenThrow(new GenerationSchemaException("bad output", null))
                    .thenReturn(cleanDraft("s1"));

            PevResult result = harness.engine().runPev(scenarioRequest(), 1);

            assertFalse(result.degraded());
            assertEquals(2, result.attemptsUsed());
            Violation first = result.violationsHistory().get(0).violations().get(0);
            assertEquals(ViolationCode.GENERATION_FAILED, first.code());
            assertEquals(1.0, harness.registry.get("aramcoach.generation.failures")
                    .tag("reason", "schema").counter().count());
        }

        @Test
        @DisplayName("unexpected runtime errors from the generator are attempt failures too")
        void unexpectedGeneratorError() {
            when(harness.generator.generate(any(), any(), any(), any(), any()))
                    .thenThrow(new IllegalArgumentException("oops"));

            PevResult result = harness.engine().runPev(scenarioRequest(), 0);

            assertTrue(result.degraded());
            assertEquals(StrategyRole.FRONT_TO_BACK, result.finalDraft().role(), "placeholder draft");
            verifyNoInteractions(harness.validator);
        }

        @Test
        @DisplayName("generation timeouts are attempt failures")
        void generationTimeout() {
            harness.generationTimeout = Duration.ofMillis(100);
            harness.generator = (facts, evidence, threats, request, feedback) -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return cleanDraft("s1");
            };

            PevResult result = harness.engine().runPev(scenarioRequest(), 1);

            assertTrue(result.degraded());
            assertEquals(2, result.attemptsUsed());
            assertTrue(result.violationsHistory().stream()
                    .allMatch(r -> r.violations().get(0).code() == ViolationCode.GENERATION_FAILED));
            assertEquals(2.0, harness.registry.get("aramcoach.generation.failures")
                    .tag("reason", "timeout").counter().count());
        }
    }

    @Test
    @DisplayName("cancelling during generation interrupts the call and fails the run")
    void cancelDuringGeneration() throws Exception {
        var started = new CountDownLatch(1);
        harness.generator = (facts, evidence, threats, request, feedback) -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return cleanDraft("s1");
        };
        var engine = harness.engine();
        var token = new CancellationToken();

        CompletableFuture<PevResult> run = CompletableFuture.supplyAsync(
                () -> engine.runPev(scenarioRequest(), 1, token));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();

        var e = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RunCancelledException.class, e.getCause());
        verifyNoInteractions(harness.validator);
    }

    @Test
    @DisplayName("a run listener receives only that run's events and is detached afterwards")
    void runListener() {
        when(harness.validator.validate(any(), any(), any())).thenReturn(REJECTED);
        var engine = harness.engine();
        var seen = new CopyOnWriteArrayList<CoachEvent>();

        engine.runPev(scenarioRequest(), 1, new CancellationToken(), seen::add);
        engine.runPev(scenarioRequest(), 0);

        assertEquals(List.of("run.started", "draft.rejected", "draft.rejected", "run.completed"),
                seen.stream().map(CoachEvent::eventType).toList());
        assertEquals(1, seen.stream().map(CoachEvent::runId).distinct().count());
        assertEquals(1, seen.get(1).payload().get("attempt"));
    }

    @Test
    @DisplayName("maxAttempts above the configured limit is rejected before any collaborator runs")
    void attemptsAboveLimit() {
        var engine = harness.engine();

        assertThrows(IllegalArgumentException.class, () -> engine.runPev(scenarioRequest(), 4));
        assertThrows(IllegalArgumentException.class, () -> engine.runPev(scenarioRequest(), Integer.MAX_VALUE));
        verifyNoInteractions(harness.generator, harness.validator);
    }

    @Test
    @DisplayName("publishes lifecycle events and records metrics")
    void eventsAndMetrics() {
        when(harness.validator.validate(any(), any(), any())).thenReturn(REJECTED);
        var events = new CopyOnWriteArrayList<CoachEvent>();
        harness.eventBus.subscribeAll(events::add);

        harness.engine().runPev(scenarioRequest(), 1);

        assertEquals(List.of("run.started", "draft.rejected", "draft.rejected", "run.completed"),
                events.stream().map(CoachEvent::eventType).toList());
        assertEquals(1.0, harness.registry.get("aramcoach.runs.total").tag("degraded", "true").counter().count());
        assertEquals(2.0, harness.registry.get("aramcoach.violations.total")
                .tag("code", "SUMMARY_TOO_LONG").counter().count());
        assertEquals(1, harness.registry.get("aramcoach.run.duration").timer().count());
    }
}
