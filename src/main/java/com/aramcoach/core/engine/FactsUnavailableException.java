package com.aramcoach.core.engine;

import com.aramcoach.core.facts.PatchNotFoundException;

/**
 * The facts, or the evidence corpus stored with them, could not be loaded.
 */
public class FactsUnavailableException extends PevFatalException {

    public FactsUnavailableException(String patchId, String message, Throwable cause) {
        super(patchId, message, cause);
    }

    /**
     * True when the patch id is unknown, as opposed to its data being unreadable.
     */
    public boolean isPatchMissing() {
        return getCause() instanceof PatchNotFoundException;
    }
}
