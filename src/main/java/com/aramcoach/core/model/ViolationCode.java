package com.aramcoach.core.model;

/**
 * Closed taxonomy of reasons a draft attempt is rejected. Declaration order of
 * the guardrail rules determines reporting order.
 */
public enum ViolationCode {
    SCHEMA_INVALID,
    SUMMARY_TOO_LONG,
    OUT_OF_SCOPE,
    UNKNOWN_ITEM,
    STAT_MISMATCH,
    MISSING_EVIDENCE,
    /** Raised by the orchestrator, not the guardrail: the generator failed or timed out. */
    GENERATION_FAILED
}
