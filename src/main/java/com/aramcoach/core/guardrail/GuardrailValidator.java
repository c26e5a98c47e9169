package com.aramcoach.core.guardrail;

import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.FactSet;
import com.aramcoach.core.model.StrategyDraft;
import com.aramcoach.core.model.ValidationResult;

import java.util.List;

/**
 * Judges a draft. Implementations must be side-effect free and must not throw
 * for any draft, including null or partially populated ones.
 */
public interface GuardrailValidator {

    ValidationResult validate(StrategyDraft draft, FactSet facts, List<EvidenceSnippet> evidence);
}
