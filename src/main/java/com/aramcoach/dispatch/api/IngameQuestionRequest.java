package com.aramcoach.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/advice/ingame.
 *
 * @param patch       patch id; nullable, defaults to the configured patch
 * @param champion    the asking player's champion id
 * @param question    the question
 * @param allies      optional ally champion ids
 * @param enemies     optional opponent champion ids
 * @param maxAttempts regenerations allowed; nullable, defaults to configuration
 */
public record IngameQuestionRequest(
    String patch,
    String champion,
    String question,
    List<String> allies,
    List<String> enemies,
    @JsonProperty("max_attempts") Integer maxAttempts
) {}
