package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * Evidence source with the relevance score the ranker assigned to it.
 */
public record EvidenceSnippet(
    String id,
    String topic,
    String text,
    double score
) implements Serializable {}
