package com.aramcoach.core.graph;

import com.aramcoach.core.PevHarness;
import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.engine.RunCancelledException;
import com.aramcoach.core.generation.DraftGenerator;
import com.aramcoach.core.guardrail.GuardrailValidator;
import com.aramcoach.core.model.*;
import com.aramcoach.core.state.RunState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aramcoach.core.CoachFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PevStateMachineTest {

    private static final ValidationResult REJECTED = ValidationResult.of(List.of(
            new Violation(ViolationCode.MISSING_EVIDENCE, "cite something", "citedEvidenceIds")));

    private PevHarness harness;

    @BeforeEach
    void setUp() {
        harness = new PevHarness();
        harness.generator = mock(DraftGenerator.class);
        harness.validator = mock(GuardrailValidator.class);
        when(harness.generator.generate(any(), any(), any(), any(), any())).thenReturn(cleanDraft("s1"));
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private RunState run(int maxAttempts) {
        var state = new RunState("PEV-TEST-0001", scenarioRequest(), maxAttempts);
        return harness.stateMachine().run(state, new CancellationToken());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, RunState.MAX_ATTEMPTS_CEILING})
    @DisplayName("an always-failing validator stops after maxAttempts + 1 generations")
    void terminationBound(int maxAttempts) {
        when(harness.validator.validate(any(), any(), any())).thenReturn(REJECTED);

        RunState state = run(maxAttempts);

        assertEquals(RunPhase.FINAL, state.phase());
        assertEquals(maxAttempts + 1, state.attemptCount());
        assertTrue(state.isDegraded());
        verify(harness.generator, times(maxAttempts + 1)).generate(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a passing first draft ends the run without refinement")
    void passFirstTime() {
        when(harness.validator.validate(any(), any(), any())).thenReturn(ValidationResult.of(List.of()));

        RunState state = run(3);

        assertEquals(1, state.attemptCount());
        assertFalse(state.isDegraded());
    }

    @Test
    @DisplayName("refinement passes the previous violations as feedback")
    void feedbackOnRefine() {
        when(harness.validator.validate(any(), any(), any()))
                .thenReturn(REJECTED)
                .thenReturn(ValidationResult.of(List.of()));

        RunState state = run(1);

        assertFalse(state.isDegraded());
        assertEquals(2, state.attemptCount());
        verify(harness.generator).generate(any(), any(), any(), any(), eq(List.of()));
        verify(harness.generator).generate(any(), any(), any(), any(), eq(REJECTED.violations()));
    }

    @Test
    @DisplayName("routing after validation respects the attempt budget")
    void routeAfterValidate() {
        var machine = harness.stateMachine();
        var state = new RunState("PEV-TEST-0002", scenarioRequest(), 1);

        state.beginAttempt();
        state.recordAttempt(REJECTED);
        assertEquals(RunPhase.REFINING, machine.routeAfterValidate(state));

        state.beginAttempt();
        state.recordAttempt(REJECTED);
        assertEquals(RunPhase.FINAL, machine.routeAfterValidate(state));
    }

    @Test
    @DisplayName("a cancelled token stops the run before any collaborator is called")
    void cancelledBeforeStart() {
        var token = new CancellationToken();
        token.cancel();
        var state = new RunState("PEV-TEST-0003", scenarioRequest(), 1);

        assertThrows(RunCancelledException.class, () -> harness.stateMachine().run(state, token));
        assertEquals(RunPhase.INIT, state.phase());
        verifyNoInteractions(harness.generator, harness.validator);
    }
}
