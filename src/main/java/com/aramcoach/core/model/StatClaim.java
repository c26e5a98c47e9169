package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * A numeric statement made by a draft, e.g. "item 3123 costs 800".
 *
 * @param subjectId item or champion id the claim is about
 * @param stat      stat name as used in the facts ("cost" for item price)
 * @param value     claimed value
 */
public record StatClaim(
    String subjectId,
    String stat,
    double value
) implements Serializable {}
