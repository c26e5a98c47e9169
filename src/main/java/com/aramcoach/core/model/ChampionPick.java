package com.aramcoach.core.model;

import java.io.Serializable;

/**
 * One champion in a team composition, optionally tagged with the role the
 * player intends to take (e.g. "engage", "peel").
 */
public record ChampionPick(
    String championId,
    String role
) implements Serializable {

    public static ChampionPick of(String championId) {
        return new ChampionPick(championId, null);
    }
}
