package com.aramcoach.core.engine;

/**
 * A failure that ends a PEV run without a result.
 */
public abstract class PevFatalException extends RuntimeException {

    private final String patchId;

    protected PevFatalException(String patchId, String message, Throwable cause) {
        super(message, cause);
        this.patchId = patchId;
    }

    public String getPatchId() {
        return patchId;
    }
}
