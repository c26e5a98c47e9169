package com.aramcoach.core.model;

/**
 * Game phase in which a build step applies.
 */
public enum BuildWindow {
    EARLY,
    MID,
    LATE
}
