package com.aramcoach.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Immutable inputs for a single PEV run.
 *
 * @param patchId      patch the facts are scoped to; never blank once constructed
 * @param mode         pre-game advice or in-game question
 * @param allies       ally composition in pick order
 * @param opponents    opponent composition in pick order
 * @param myChampionId the player's own champion; nullable
 * @param question     free-text question; nullable
 */
public record RequestContext(
    String patchId,
    CoachMode mode,
    List<ChampionPick> allies,
    List<ChampionPick> opponents,
    String myChampionId,
    String question
) implements Serializable {

    public RequestContext {
        if (patchId == null || patchId.isBlank()) {
            throw new IllegalArgumentException("patchId is required");
        }
        Objects.requireNonNull(mode, "mode");
        allies = allies != null ? List.copyOf(allies) : List.of();
        opponents = opponents != null ? List.copyOf(opponents) : List.of();
    }

    /**
     * Builds a pre-game request. A null or blank patch falls back to {@code defaultPatch}.
     */
    public static RequestContext preGame(String patchId, String defaultPatch,
                                         List<ChampionPick> allies, List<ChampionPick> opponents,
                                         String question) {
        String myChampion = allies != null && !allies.isEmpty() ? allies.get(0).championId() : null;
        return new RequestContext(resolvePatch(patchId, defaultPatch), CoachMode.PRE_GAME,
                allies, opponents, myChampion, question);
    }

    /**
     * Builds an in-game question request. Compositions are optional here.
     */
    public static RequestContext ingame(String patchId, String defaultPatch, String myChampionId,
                                        String question, List<ChampionPick> allies,
                                        List<ChampionPick> opponents) {
        return new RequestContext(resolvePatch(patchId, defaultPatch), CoachMode.INGAME_QA,
                allies, opponents, myChampionId, question);
    }

    private static String resolvePatch(String patchId, String defaultPatch) {
        return patchId != null && !patchId.isBlank() ? patchId.trim() : defaultPatch;
    }

    public List<String> allyIds() {
        return allies.stream().map(ChampionPick::championId).toList();
    }

    /**
     * Distinct opponent champion ids in pick order.
     */
    public List<String> opponentIds() {
        return opponents.stream().map(ChampionPick::championId).distinct().toList();
    }
}
