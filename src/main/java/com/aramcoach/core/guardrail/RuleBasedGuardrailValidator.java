package com.aramcoach.core.guardrail;

import com.aramcoach.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates a {@link StrategyDraft} against a fixed rule set.
 * <p>
 * Rules run independently; violations are reported in rule declaration order:
 * <ol>
 *   <li>{@link ViolationCode#SCHEMA_INVALID}: required fields missing</li>
 *   <li>{@link ViolationCode#SUMMARY_TOO_LONG}: too many sentences or characters</li>
 *   <li>{@link ViolationCode#OUT_OF_SCOPE}: Summoner's Rift terms or items</li>
 *   <li>{@link ViolationCode#UNKNOWN_ITEM}: build item absent from the patch</li>
 *   <li>{@link ViolationCode#STAT_MISMATCH}: numeric claim contradicts the facts</li>
 *   <li>{@link ViolationCode#MISSING_EVIDENCE}: nothing cited although evidence existed</li>
 * </ol>
 */
@Service
public class RuleBasedGuardrailValidator implements GuardrailValidator {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedGuardrailValidator.class);

    /** Sentence terminator followed by whitespace or end of text. */
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)");

    private static final String COST_STAT = "cost";

    private final GuardrailProperties properties;
    private final List<Pattern> deniedTermPatterns;

    public RuleBasedGuardrailValidator(GuardrailProperties properties) {
        this.properties = properties;
        this.deniedTermPatterns = properties.getDeniedTerms().stream()
                .map(term -> Pattern.compile("\\b" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "\\b"))
                .toList();
    }

    @Override
    public ValidationResult validate(StrategyDraft draft, FactSet facts, List<EvidenceSnippet> evidence) {
        if (draft == null) {
            return ValidationResult.of(List.of(
                    new Violation(ViolationCode.SCHEMA_INVALID, "Draft is missing", "$")));
        }
        var violations = new ArrayList<Violation>();
        checkSchema(draft, violations);
        checkSummaryLength(draft, violations);
        checkScope(draft, facts, violations);
        checkItemsExist(draft, facts, violations);
        checkStatClaims(draft, facts, violations);
        checkEvidenceCited(draft, evidence, violations);

        var result = ValidationResult.of(violations);
        if (!result.ok()) {
            log.debug("Guardrail rejected draft with {} violation(s): {}", violations.size(),
                    violations.stream().map(v -> v.code().name()).toList());
        }
        return result;
    }

    // ── Rules ────────────────────────────────────────────────────────

    private void checkSchema(StrategyDraft draft, List<Violation> out) {
        if (draft.role() == null) {
            out.add(new Violation(ViolationCode.SCHEMA_INVALID, "role is required", "role"));
        }
        if (draft.summary() == null || draft.summary().isBlank()) {
            out.add(new Violation(ViolationCode.SCHEMA_INVALID, "summary is required", "summary"));
        }
        if (draft.buildPlan() == null) {
            out.add(new Violation(ViolationCode.SCHEMA_INVALID, "buildPlan is required", "buildPlan"));
        } else {
            for (int i = 0; i < draft.buildPlan().size(); i++) {
                BuildStep step = draft.buildPlan().get(i);
                String path = "buildPlan[" + i + "]";
                if (step == null) {
                    out.add(new Violation(ViolationCode.SCHEMA_INVALID, "build step is null", path));
                    continue;
                }
                if (step.itemIds() == null || step.itemIds().isEmpty()) {
                    out.add(new Violation(ViolationCode.SCHEMA_INVALID,
                            "build step must list at least one item", path + ".itemIds"));
                }
                if (step.window() == null) {
                    out.add(new Violation(ViolationCode.SCHEMA_INVALID,
                            "build step needs a window (EARLY, MID or LATE)", path + ".window"));
                }
            }
        }
        if (draft.citedEvidenceIds() == null) {
            out.add(new Violation(ViolationCode.SCHEMA_INVALID,
                    "citedEvidenceIds is required", "citedEvidenceIds"));
        }
    }

    private void checkSummaryLength(StrategyDraft draft, List<Violation> out) {
        String summary = draft.summary();
        if (summary == null || summary.isBlank()) {
            return;
        }
        int sentences = countSentences(summary);
        int maxSentences = properties.getMaxSummarySentences();
        int maxChars = properties.getMaxSummaryChars();
        if (sentences > maxSentences) {
            out.add(new Violation(ViolationCode.SUMMARY_TOO_LONG,
                    "Summary has " + sentences + " sentences, at most " + maxSentences + " allowed", "summary"));
        } else if (summary.length() > maxChars) {
            out.add(new Violation(ViolationCode.SUMMARY_TOO_LONG,
                    "Summary has " + summary.length() + " characters, at most " + maxChars + " allowed", "summary"));
        }
    }

    private void checkScope(StrategyDraft draft, FactSet facts, List<Violation> out) {
        scanText(draft.summary(), "summary", out);
        List<BuildStep> plan = Optional.ofNullable(draft.buildPlan()).orElse(List.of());
        for (int i = 0; i < plan.size(); i++) {
            BuildStep step = plan.get(i);
            if (step == null) {
                continue;
            }
            scanText(step.trigger(), "buildPlan[" + i + "].trigger", out);
            scanText(step.rationale(), "buildPlan[" + i + "].rationale", out);
            List<String> itemIds = Optional.ofNullable(step.itemIds()).orElse(List.of());
            for (int j = 0; j < itemIds.size(); j++) {
                var item = facts.item(itemIds.get(j));
                if (item.isEmpty()) {
                    continue;
                }
                for (String denied : properties.getDeniedItemTags()) {
                    if (item.get().hasTag(denied)) {
                        out.add(new Violation(ViolationCode.OUT_OF_SCOPE,
                                "Item " + item.get().name() + " is tagged " + denied + " and not usable in ARAM",
                                "buildPlan[" + i + "].itemIds[" + j + "]"));
                        break;
                    }
                }
            }
        }
        List<String> assumptions = Optional.ofNullable(draft.assumptions()).orElse(List.of());
        for (int i = 0; i < assumptions.size(); i++) {
            scanText(assumptions.get(i), "assumptions[" + i + "]", out);
        }
    }

    private void scanText(String text, String path, List<Violation> out) {
        if (text == null || text.isBlank()) {
            return;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> mentioned = new ArrayList<>();
        for (int i = 0; i < deniedTermPatterns.size(); i++) {
            if (deniedTermPatterns.get(i).matcher(lower).find()) {
                mentioned.add(properties.getDeniedTerms().get(i));
            }
        }
        // One violation per field, even when configured terms overlap
        if (!mentioned.isEmpty()) {
            out.add(new Violation(ViolationCode.OUT_OF_SCOPE,
                    "Mentions " + String.join(", ", mentioned) + ", not part of ARAM", path));
        }
    }

    private void checkItemsExist(StrategyDraft draft, FactSet facts, List<Violation> out) {
        List<BuildStep> plan = Optional.ofNullable(draft.buildPlan()).orElse(List.of());
        for (int i = 0; i < plan.size(); i++) {
            BuildStep step = plan.get(i);
            if (step == null || step.itemIds() == null) {
                continue;
            }
            for (int j = 0; j < step.itemIds().size(); j++) {
                String itemId = step.itemIds().get(j);
                if (facts.item(itemId).isEmpty()) {
                    out.add(new Violation(ViolationCode.UNKNOWN_ITEM,
                            "Item " + itemId + " does not exist in patch " + facts.patchId(),
                            "buildPlan[" + i + "].itemIds[" + j + "]"));
                }
            }
        }
    }

    private void checkStatClaims(StrategyDraft draft, FactSet facts, List<Violation> out) {
        List<StatClaim> claims = Optional.ofNullable(draft.statClaims()).orElse(List.of());
        for (int i = 0; i < claims.size(); i++) {
            StatClaim claim = claims.get(i);
            if (claim == null || claim.stat() == null) {
                continue;
            }
            Optional<Double> actual = factValue(claim, facts);
            if (actual.isPresent() && !withinTolerance(claim.value(), actual.get())) {
                out.add(new Violation(ViolationCode.STAT_MISMATCH,
                        String.format(Locale.ROOT, "%s of %s is %s, draft claims %s",
                                claim.stat(), claim.subjectId(), format(actual.get()), format(claim.value())),
                        "statClaims[" + i + "]"));
            }
        }
    }

    private void checkEvidenceCited(StrategyDraft draft, List<EvidenceSnippet> evidence, List<Violation> out) {
        boolean evidenceAvailable = evidence != null && !evidence.isEmpty();
        boolean citesNothing = draft.citedEvidenceIds() == null || draft.citedEvidenceIds().isEmpty();
        if (evidenceAvailable && citesNothing) {
            out.add(new Violation(ViolationCode.MISSING_EVIDENCE,
                    evidence.size() + " evidence snippet(s) available but none cited", "citedEvidenceIds"));
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────

    static int countSentences(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        var matcher = SENTENCE_END.matcher(trimmed);
        int count = 0;
        int lastEnd = 0;
        while (matcher.find()) {
            count++;
            lastEnd = matcher.end();
        }
        // Trailing text without a terminator is still a sentence
        if (!trimmed.substring(lastEnd).isBlank()) {
            count++;
        }
        return count;
    }

    private static Optional<Double> factValue(StatClaim claim, FactSet facts) {
        var item = facts.item(claim.subjectId());
        if (item.isPresent()) {
            if (COST_STAT.equalsIgnoreCase(claim.stat())) {
                return Optional.of((double) item.get().cost());
            }
            return Optional.ofNullable(item.get().stats().get(claim.stat()));
        }
        return facts.champion(claim.subjectId()).map(c -> c.stats().get(claim.stat()));
    }

    private boolean withinTolerance(double claimed, double actual) {
        double allowed = Math.abs(actual) * Math.max(0.0, properties.getStatTolerance());
        return Math.abs(claimed - actual) <= Math.max(allowed, 1e-9);
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
