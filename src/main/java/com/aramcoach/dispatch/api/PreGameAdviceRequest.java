package com.aramcoach.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/advice/pre-game.
 *
 * @param patch       patch id; nullable, defaults to the configured patch
 * @param allies      ally champion ids in pick order
 * @param enemies     opponent champion ids in pick order
 * @param question    optional free-text question
 * @param maxAttempts regenerations allowed; nullable, defaults to configuration
 */
public record PreGameAdviceRequest(
    String patch,
    List<String> allies,
    List<String> enemies,
    String question,
    @JsonProperty("max_attempts") Integer maxAttempts
) {}
