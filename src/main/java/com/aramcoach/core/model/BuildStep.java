package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One step of a build plan.
 *
 * @param trigger   short condition label, e.g. "anti_heal"
 * @param itemIds   items to buy, in order; must not be empty
 * @param window    phase the step applies to
 * @param rationale why the step is recommended
 */
public record BuildStep(
    String trigger,
    List<String> itemIds,
    BuildWindow window,
    String rationale
) implements Serializable {}
