package com.aramcoach.core.facts;

/**
 * Thrown when no data exists for the requested patch id.
 */
public class PatchNotFoundException extends RuntimeException {

    private final String patchId;

    public PatchNotFoundException(String patchId) {
        super("No data for patch " + patchId);
        this.patchId = patchId;
    }

    public String getPatchId() {
        return patchId;
    }
}
