package com.aramcoach.core.generation;

/**
 * The generator produced output that is not a structurally valid draft.
 */
public class GenerationSchemaException extends GenerationException {

    public GenerationSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
