package com.aramcoach.core.model;

/**
 * Kind of question a PEV run answers.
 */
public enum CoachMode {
    PRE_GAME,   // full team comps known, advise before the fight starts
    INGAME_QA   // single champion + free-text question
}
