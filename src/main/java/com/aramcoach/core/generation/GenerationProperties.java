package com.aramcoach.core.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Which draft generator is active and how long one call may take.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.generation")
public class GenerationProperties {

    /** "rules" for the built-in heuristic strategist, "llm" for the chat model. */
    private String mode = "rules";

    private Duration timeout = Duration.ofSeconds(30);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
