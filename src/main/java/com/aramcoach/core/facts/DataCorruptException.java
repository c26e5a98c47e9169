package com.aramcoach.core.facts;

/**
 * Thrown when stored patch records cannot be read or fail validation.
 */
public class DataCorruptException extends RuntimeException {

    public DataCorruptException(String message) {
        super(message);
    }

    public DataCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
