package com.aramcoach.core.generation;

import java.time.Duration;

/**
 * Generation did not finish within the configured timeout.
 */
public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(Duration timeout) {
        super("Draft generation timed out after " + timeout.toMillis() + " ms");
    }
}
