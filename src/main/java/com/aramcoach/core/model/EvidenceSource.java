package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * Unranked corpus entry.
 *
 * @param id    unique within a corpus
 * @param topic provenance: the champion or topic the text concerns; nullable
 * @param text  source text
 */
public record EvidenceSource(
    String id,
    String topic,
    String text
) implements Serializable {}
