package com.aramcoach.dispatch.api;

import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.engine.PevEngine;
import com.aramcoach.core.engine.PevProperties;
import com.aramcoach.core.model.ChampionPick;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for coaching requests. Each call runs one synchronous PEV run.
 */
@RestController
@RequestMapping("/api/v1/advice")
public class AdviceController {

    private static final Logger log = LoggerFactory.getLogger(AdviceController.class);

    private final PevEngine pevEngine;
    private final PevProperties properties;

    public AdviceController(PevEngine pevEngine, PevProperties properties) {
        this.pevEngine = pevEngine;
        this.properties = properties;
    }

    /**
     * POST /api/v1/advice/pre-game: strategy for a full composition.
     */
    @PostMapping("/pre-game")
    public ResponseEntity<?> preGame(@RequestBody PreGameAdviceRequest request) {
        if (isEmpty(request.allies()) || isEmpty(request.enemies())) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Both allies and enemies are required"));
        }
        if (!withinLimit(request.maxAttempts())) {
            return attemptsOutOfRange();
        }
        var context = RequestContext.preGame(request.patch(), properties.getDefaultPatch(),
                toPicks(request.allies()), toPicks(request.enemies()), request.question());
        return run(context, request.maxAttempts());
    }

    /**
     * POST /api/v1/advice/ingame: answer a question for one champion.
     */
    @PostMapping("/ingame")
    public ResponseEntity<?> ingame(@RequestBody IngameQuestionRequest request) {
        if (request.champion() == null || request.champion().isBlank()
                || request.question() == null || request.question().isBlank()) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Both champion and question are required"));
        }
        if (!withinLimit(request.maxAttempts())) {
            return attemptsOutOfRange();
        }
        var context = RequestContext.ingame(request.patch(), properties.getDefaultPatch(),
                request.champion().trim(), request.question(),
                toPicks(request.allies()), toPicks(request.enemies()));
        return run(context, request.maxAttempts());
    }

    private ResponseEntity<?> run(RequestContext context, Integer maxAttempts) {
        int attempts = maxAttempts != null ? maxAttempts : properties.getMaxAttempts();
        try {
            PevResult result = pevEngine.runPev(context, attempts);
            return ResponseEntity.ok(AdviceResponse.from(result));
        } catch (FactsUnavailableException e) {
            log.warn("Advice request failed for patch {}: {}", e.getPatchId(), e.getMessage());
            HttpStatus status = e.isPatchMissing() ? HttpStatus.NOT_FOUND : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).body(
                    Map.of("error", String.valueOf(e.getMessage()), "patch", e.getPatchId()));
        }
    }

    private boolean withinLimit(Integer maxAttempts) {
        return maxAttempts == null || (maxAttempts >= 0 && maxAttempts <= properties.getMaxAttemptsLimit());
    }

    private ResponseEntity<?> attemptsOutOfRange() {
        return ResponseEntity.badRequest().body(Map.of("error",
                "max_attempts must be between 0 and " + properties.getMaxAttemptsLimit()));
    }

    private static boolean isEmpty(List<String> ids) {
        return ids == null || ids.stream().allMatch(id -> id == null || id.isBlank());
    }

    private static List<ChampionPick> toPicks(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(id -> ChampionPick.of(id.trim()))
                .toList();
    }
}
