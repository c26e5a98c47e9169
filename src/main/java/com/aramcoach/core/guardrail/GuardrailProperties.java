package com.aramcoach.core.guardrail;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds and scope lists for the guardrail rules.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.guardrail")
public class GuardrailProperties {

    private int maxSummarySentences = 3;
    private int maxSummaryChars = 600;

    /** Relative tolerance for numeric claims, e.g. 0.05 accepts values within 5% of the fact. */
    private double statTolerance = 0.05;

    /** Summoner's Rift mechanics that have no place in ARAM advice. Matched as whole words. */
    private List<String> deniedTerms = new ArrayList<>(List.of(
            "dragon", "baron", "jungle", "jungler", "rift herald", "smite", "ward the river"));

    /** Item tags that mark items unavailable in ARAM. */
    private List<String> deniedItemTags = new ArrayList<>(List.of("Jungle", "Trinket", "SummonersRiftOnly"));

    public int getMaxSummarySentences() {
        return maxSummarySentences;
    }

    public void setMaxSummarySentences(int maxSummarySentences) {
        this.maxSummarySentences = maxSummarySentences;
    }

    public int getMaxSummaryChars() {
        return maxSummaryChars;
    }

    public void setMaxSummaryChars(int maxSummaryChars) {
        this.maxSummaryChars = maxSummaryChars;
    }

    public double getStatTolerance() {
        return statTolerance;
    }

    public void setStatTolerance(double statTolerance) {
        this.statTolerance = statTolerance;
    }

    public List<String> getDeniedTerms() {
        return deniedTerms;
    }

    public void setDeniedTerms(List<String> deniedTerms) {
        this.deniedTerms = deniedTerms;
    }

    public List<String> getDeniedItemTags() {
        return deniedItemTags;
    }

    public void setDeniedItemTags(List<String> deniedItemTags) {
        this.deniedItemTags = deniedItemTags;
    }
}
