package com.aramcoach.core.generation;

import com.aramcoach.core.llm.LlmEmptyResponseException;
import com.aramcoach.core.llm.LlmParseException;
import com.aramcoach.core.llm.LlmService;
import com.aramcoach.core.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates drafts with the configured chat model.
 * <p>
 * Facts, evidence, threat scores and the previous attempt's violations are
 * serialized as one JSON user message; the reply is parsed into a
 * {@link StrategyDraft} by {@link LlmService#structuredCall}.
 */
@Service
@ConditionalOnProperty(prefix = "aramcoach.generation", name = "mode", havingValue = "llm")
public class LlmDraftGenerator implements DraftGenerator {

    static final String SYSTEM_PROMPT = """
            You are a League of Legends ARAM strategy assistant. ARAM is played on a single lane
            (Howling Abyss): there is no jungle, no dragon, no baron and no rift herald. Never mention them.

            Return ONE JSON object matching the schema provided:
            - role: one of PEEL, ENGAGE, POKE, ZONE, FRONT_TO_BACK, ANTI_DIVE
            - summary: at most 3 short sentences
            - buildPlan: steps of {trigger, itemIds (ids from facts.items only), window (EARLY, MID or LATE), rationale}
            - citedEvidenceIds: ids of the evidence snippets you relied on
            - assumptions: short strings
            - statClaims: {subjectId, stat, value} for every number you state; use "cost" for item prices

            Only use item ids and numbers present in the facts. If "feedback" is not empty, your previous
            answer was rejected for those reasons; fix every one of them.
            """;

    private final LlmService llmService;
    private final ObjectMapper objectMapper;

    public LlmDraftGenerator(LlmService llmService, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.objectMapper = objectMapper;
    }

    @Override
    public StrategyDraft generate(FactSet facts,
                                  List<EvidenceSnippet> evidence,
                                  Map<String, ThreatScore> threatScores,
                                  RequestContext request,
                                  List<Violation> feedback) {
        String userPrompt = buildUserPrompt(facts, evidence, threatScores, request, feedback);
        try {
            return llmService.structuredCall(SYSTEM_PROMPT, userPrompt, StrategyDraft.class);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            throw new GenerationSchemaException("Model output is not a valid strategy draft: " + e.getMessage(), e);
        }
    }

    String buildUserPrompt(FactSet facts,
                           List<EvidenceSnippet> evidence,
                           Map<String, ThreatScore> threatScores,
                           RequestContext request,
                           List<Violation> feedback) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("patch", request.patchId());
        payload.put("mode", request.mode().name());
        payload.put("myChampion", request.myChampionId());
        payload.put("question", request.question());
        payload.put("allies", request.allies());
        payload.put("opponents", request.opponents());

        var champions = new LinkedHashMap<String, Object>();
        for (String id : request.allyIds()) {
            facts.champion(id).ifPresent(c -> champions.put(id, c.tags()));
        }
        for (String id : request.opponentIds()) {
            facts.champion(id).ifPresent(c -> champions.put(id, c.tags()));
        }
        payload.put("facts", Map.of(
                "champions", champions,
                "items", facts.items().values().stream()
                        .map(i -> Map.of("id", i.id(), "name", i.name(), "cost", i.cost(), "tags", i.tags()))
                        .toList()));
        payload.put("evidence", evidence.stream()
                .map(e -> Map.of("id", e.id(), "text", e.text()))
                .toList());
        payload.put("threats", threatScores.values());
        payload.put("feedback", feedback);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Could not serialize generation inputs: " + e.getMessage(), e);
        }
    }
}
