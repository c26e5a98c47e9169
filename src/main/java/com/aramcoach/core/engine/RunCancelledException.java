package com.aramcoach.core.engine;

/**
 * The caller cancelled the run before it reached a terminal state.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
