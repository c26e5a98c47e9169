package com.aramcoach.core.generation;

import com.aramcoach.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deterministic strategist built from tag heuristics.
 * <p>
 * Role comes from the player's champion tags and the shape of the enemy team.
 * Build steps answer three situations: enemy healing (anti-heal, early),
 * two or more tanks (penetration, mid) and a high-threat burst champion
 * (stasis or spell shield, late). Every chosen item carries a cost claim taken
 * from the facts, and all gathered evidence is cited.
 */
@Service
@ConditionalOnProperty(prefix = "aramcoach.generation", name = "mode", havingValue = "rules", matchIfMissing = true)
public class RuleBasedDraftGenerator implements DraftGenerator {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDraftGenerator.class);

    static final double HIGH_THREAT = 7.0;
    private static final int ITEMS_PER_STEP = 2;

    @Override
    public StrategyDraft generate(FactSet facts,
                                  List<EvidenceSnippet> evidence,
                                  Map<String, ThreatScore> threatScores,
                                  RequestContext request,
                                  List<Violation> feedback) {
        String myChampion = Optional.ofNullable(request.myChampionId())
                .orElse(request.allyIds().isEmpty() ? null : request.allyIds().get(0));
        List<ChampionFacts> opponents = request.opponentIds().stream()
                .map(facts::champion)
                .flatMap(Optional::stream)
                .toList();
        Optional<ThreatScore> topThreat = threatScores.values().stream()
                .max(Comparator.comparingDouble(ThreatScore::value));

        StrategyRole role = pickRole(facts.champion(myChampion), opponents, topThreat);
        List<BuildStep> plan = makeBuildPlan(facts, opponents, topThreat);

        var sentences = new ArrayList<String>();
        sentences.add("Play " + describe(role) + (myChampion != null ? " on " + myChampion : "") + ".");
        topThreat.ifPresent(t -> sentences.add(String.format(Locale.ROOT,
                "%s is the biggest threat (%.1f/10), respect their spikes.", t.championId(), t.value())));
        if (!plan.isEmpty()) {
            sentences.add("Prioritize " + plan.get(0).trigger().replace('_', '-') + " items " + windowPhrase(plan.get(0).window()) + ".");
        } else {
            sentences.add("Group for fights and trade when summoner spells are up.");
        }
        if (hasCode(feedback, ViolationCode.SUMMARY_TOO_LONG)) {
            sentences.subList(1, sentences.size()).clear();
        }

        var claims = new ArrayList<StatClaim>();
        for (BuildStep step : plan) {
            for (String itemId : step.itemIds()) {
                facts.item(itemId).ifPresent(item -> claims.add(new StatClaim(item.id(), "cost", item.cost())));
            }
        }

        var assumptions = new ArrayList<String>();
        assumptions.add("patch " + request.patchId());
        assumptions.add("allies: " + String.join(", ", request.allyIds()));
        assumptions.add("opponents: " + String.join(", ", request.opponentIds()));
        if (request.question() != null && !request.question().isBlank()) {
            assumptions.add("question: " + request.question().trim());
        }

        if (!feedback.isEmpty()) {
            log.debug("Regenerating with {} feedback violation(s): {}", feedback.size(),
                    feedback.stream().map(v -> v.code().name()).collect(Collectors.joining(", ")));
        }

        return new StrategyDraft(
                role,
                String.join(" ", sentences),
                plan,
                evidence.stream().map(EvidenceSnippet::id).toList(),
                assumptions,
                claims);
    }

    StrategyRole pickRole(Optional<ChampionFacts> me, List<ChampionFacts> opponents, Optional<ThreatScore> topThreat) {
        List<String> myTags = me.map(ChampionFacts::tags).orElse(List.of());
        if (hasTag(myTags, "poke")) {
            return StrategyRole.POKE;
        }
        if (hasTag(myTags, "engage") || hasTag(myTags, "tank")) {
            return StrategyRole.ENGAGE;
        }
        long divers = opponents.stream().filter(c -> hasTag(c.tags(), "mobility")).count();
        if (hasTag(myTags, "healer") || hasTag(myTags, "shield")) {
            boolean burstThreat = topThreat.map(ThreatScore::value).orElse(0.0) >= HIGH_THREAT;
            return burstThreat || divers > 0 ? StrategyRole.PEEL : StrategyRole.FRONT_TO_BACK;
        }
        if (divers >= 2) {
            return StrategyRole.ANTI_DIVE;
        }
        if (hasTag(myTags, "zone")) {
            return StrategyRole.ZONE;
        }
        return StrategyRole.FRONT_TO_BACK;
    }

    List<BuildStep> makeBuildPlan(FactSet facts, List<ChampionFacts> opponents, Optional<ThreatScore> topThreat) {
        var steps = new ArrayList<BuildStep>();

        List<String> healers = opponents.stream()
                .filter(c -> hasTag(c.tags(), "healer") || hasTag(c.tags(), "sustain"))
                .map(ChampionFacts::id)
                .toList();
        if (!healers.isEmpty()) {
            pickItems(facts, "GrievousWounds").ifPresent(items -> steps.add(new BuildStep(
                    "anti_heal", items, BuildWindow.EARLY,
                    "Counter healing from " + String.join(", ", healers))));
        }

        long tanks = opponents.stream().filter(c -> hasTag(c.tags(), "tank")).count();
        if (tanks >= 2) {
            pickItems(facts, "ArmorPenetration", "MagicPenetration").ifPresent(items -> steps.add(new BuildStep(
                    "anti_tank", items, BuildWindow.MID,
                    tanks + " tanks on the enemy team")));
        }

        topThreat.filter(t -> t.value() >= HIGH_THREAT)
                .filter(t -> facts.champion(t.championId()).map(c -> hasTag(c.tags(), "burst")).orElse(false))
                .flatMap(t -> pickItems(facts, "Stasis", "SpellShield").map(items -> new BuildStep(
                        "anti_burst", items, BuildWindow.LATE,
                        "Survive " + t.championId() + "'s burst")))
                .ifPresent(steps::add);

        return steps;
    }

    private static Optional<List<String>> pickItems(FactSet facts, String... tags) {
        List<String> ids = facts.items().values().stream()
                .filter(item -> {
                    for (String tag : tags) {
                        if (item.hasTag(tag)) {
                            return true;
                        }
                    }
                    return false;
                })
                .limit(ITEMS_PER_STEP)
                .map(ItemFacts::id)
                .toList();
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids);
    }

    private static boolean hasTag(List<String> tags, String tag) {
        return tags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }

    private static boolean hasCode(List<Violation> feedback, ViolationCode code) {
        return feedback.stream().anyMatch(v -> v.code() == code);
    }

    private static String describe(StrategyRole role) {
        return role.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static String windowPhrase(BuildWindow window) {
        return switch (window) {
            case EARLY -> "early";
            case MID -> "by mid game";
            case LATE -> "late";
        };
    }
}
