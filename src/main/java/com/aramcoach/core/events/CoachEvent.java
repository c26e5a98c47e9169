package com.aramcoach.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a PEV run.
 *
 * @param eventType event type, e.g. "run.started", "draft.rejected", "run.completed", "run.failed"
 * @param runId     the run this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CoachEvent(
    String eventType,
    String runId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
