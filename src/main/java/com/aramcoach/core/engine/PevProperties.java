package com.aramcoach.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Loop bound and request defaults for PEV runs.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.pev")
public class PevProperties {

    /** Number of regenerations allowed after the first draft; a run makes at most maxAttempts + 1 generation calls. */
    private int maxAttempts = 1;

    /** Largest maxAttempts a caller may request per run. */
    private int maxAttemptsLimit = 3;

    /** Patch used when a request does not name one. */
    private String defaultPatch = "14.99";

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttemptsLimit() {
        return maxAttemptsLimit;
    }

    public void setMaxAttemptsLimit(int maxAttemptsLimit) {
        this.maxAttemptsLimit = maxAttemptsLimit;
    }

    public String getDefaultPatch() {
        return defaultPatch;
    }

    public void setDefaultPatch(String defaultPatch) {
        this.defaultPatch = defaultPatch;
    }
}
