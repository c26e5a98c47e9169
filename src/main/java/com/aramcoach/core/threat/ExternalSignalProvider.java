package com.aramcoach.core.threat;

import java.util.OptionalDouble;

/**
 * Source of an empirical signal (a win rate in [0, 1]) for a champion.
 * Implementations may throw; callers treat any failure as "no signal".
 */
public interface ExternalSignalProvider {

    OptionalDouble fetch(String patchId, String championId);
}
