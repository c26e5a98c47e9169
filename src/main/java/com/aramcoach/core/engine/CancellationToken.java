package com.aramcoach.core.engine;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side handle for cancelling a PEV run.
 * <p>
 * The run checks the token before every phase transition. Collaborator calls
 * running on another thread are tracked here and interrupted on cancel.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(f -> f.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String runId) {
        if (cancelled.get()) {
            throw new RunCancelledException(runId);
        }
    }

    public void track(Future<?> future) {
        inFlight.add(future);
        // cancel() may have run between the caller's check and this registration
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
