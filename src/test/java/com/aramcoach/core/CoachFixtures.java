package com.aramcoach.core;

import com.aramcoach.core.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared in-memory facts, evidence and drafts for unit tests.
 */
public final class CoachFixtures {

    public static final String PATCH = "14.99";

    private CoachFixtures() {}

    /** Ten champions A..J and ten items, two of them out of scope for ARAM. */
    public static FactSet scenarioFacts() {
        var champions = new LinkedHashMap<String, ChampionFacts>();
        champions.put("A", champion("A", "poke", "cc"));
        champions.put("B", champion("B", "tank", "engage"));
        champions.put("C", champion("C", "healer", "shield"));
        champions.put("D", champion("D", "burst"));
        champions.put("E", champion("E", "mobility"));
        champions.put("F", champion("F", "healer", "sustain"));
        champions.put("G", champion("G", "tank", "cc"));
        champions.put("H", champion("H", "tank", "sustain"));
        champions.put("I", champion("I", "burst", "mobility", "poke", "cc"));
        champions.put("J", champion("J", "poke"));

        var items = new LinkedHashMap<String, ItemFacts>();
        items.put("gw1", item("gw1", 800, "GrievousWounds"));
        items.put("gw2", item("gw2", 2950, "GrievousWounds"));
        items.put("pen1", item("pen1", 3000, "ArmorPenetration"));
        items.put("pen2", item("pen2", 3000, "MagicPenetration"));
        items.put("stasis", item("stasis", 3250, "Stasis"));
        items.put("veil", item("veil", 3000, "SpellShield"));
        items.put("crit", item("crit", 3400, "Crit"));
        items.put("hp", item("hp", 3100, "Health"));
        items.put("pup", item("pup", 450, "Jungle"));
        items.put("ward", item("ward", 0, "Trinket"));

        return new FactSet(PATCH, champions, items, Map.of("8010", new RuneFacts("8010", "Conqueror", "Precision")));
    }

    public static List<EvidenceSource> scenarioCorpus() {
        return List.of(
                new EvidenceSource("s1", "anti-heal", "Buy grievous wounds early against healers like F."),
                new EvidenceSource("s2", "tanks", "Penetration items beat stacked tanks such as G and H."),
                new EvidenceSource("s3", "burst", "Hold stasis for burst champions like I."),
                new EvidenceSource("s4", "poke", "Poke compositions with A and J win long sieges."),
                new EvidenceSource("s5", "engage", "B should engage once the enemy backline steps up."));
    }

    public static RequestContext scenarioRequest() {
        return RequestContext.preGame(PATCH, PATCH,
                picks("A", "B", "C", "D", "E"),
                picks("F", "G", "H", "I", "J"),
                null);
    }

    public static List<ChampionPick> picks(String... ids) {
        return java.util.Arrays.stream(ids).map(ChampionPick::of).toList();
    }

    public static ChampionFacts champion(String id, String... tags) {
        return new ChampionFacts(id, "Champion " + id, List.of(tags), Map.of("hp", 600.0), null);
    }

    public static ItemFacts item(String id, int cost, String... tags) {
        return new ItemFacts(id, "Item " + id, cost, List.of(tags), Map.of("armor", 40.0), null);
    }

    public static List<EvidenceSnippet> evidence(String... ids) {
        return java.util.Arrays.stream(ids)
                .map(id -> new EvidenceSnippet(id, "topic", "text " + id, 1.0))
                .toList();
    }

    /** A draft that passes every guardrail rule against {@link #scenarioFacts()}. */
    public static StrategyDraft cleanDraft(String... citedIds) {
        return new StrategyDraft(
                StrategyRole.POKE,
                "Poke from range. Buy anti-heal early.",
                List.of(new BuildStep("anti_heal", List.of("gw1"), BuildWindow.EARLY, "F heals")),
                List.of(citedIds),
                List.of("patch " + PATCH),
                List.of(new StatClaim("gw1", "cost", 800)));
    }
}
