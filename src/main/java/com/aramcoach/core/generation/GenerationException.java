package com.aramcoach.core.generation;

/**
 * A draft generation attempt failed. Never fatal for a run: the orchestrator
 * records it as a failed attempt and retries while attempts remain.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
