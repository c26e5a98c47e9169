package com.aramcoach.core.model;

/**
 * Team-fight role a strategy assigns to the player.
 */
public enum StrategyRole {
    PEEL,
    ENGAGE,
    POKE,
    ZONE,
    FRONT_TO_BACK,
    ANTI_DIVE
}
