package com.aramcoach.dispatch.cli;

import com.aramcoach.core.events.CoachEvent;
import com.aramcoach.core.model.AttemptReport;
import com.aramcoach.core.model.BuildStep;
import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.StrategyDraft;
import com.aramcoach.core.model.ThreatScore;
import com.aramcoach.core.model.Violation;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the aram-coach CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARAM COACH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COACH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Live progress line for a run event. Events other than draft rejections are ignored.
     */
    public static void event(CoachEvent event) {
        if ("draft.rejected".equals(event.eventType())) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) [ATTEMPT " + event.payload().get("attempt") + "]|@ rejected: "
                            + event.payload().get("codes")));
        }
    }

    public static void result(PevResult result) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold THREATS|@"));
        for (ThreatScore score : result.threatScores().values()) {
            String color = score.value() >= 7.0 ? "fg(red)" : score.value() >= 4.0 ? "fg(yellow)" : "fg(green)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-12s @|%s %5.2f|@  %s", score.championId(), color, score.value(), score.rationale())));
        }

        draft(result.finalDraft());

        if (!result.evidence().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold EVIDENCE|@"));
            for (EvidenceSnippet snippet : result.evidence()) {
                System.out.printf("  [%s] %s (%.3f)%n", snippet.id(), snippet.topic(), snippet.score());
            }
        }

        System.out.println("──────────────────────────────────");
        for (AttemptReport report : result.violationsHistory()) {
            String status = report.ok() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) [ATTEMPT " + report.attempt() + "]|@ " + status));
            for (Violation v : report.violations()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + v.code() + " " + v.fieldPath() + ": " + v.message()));
            }
        }
        if (result.degraded()) {
            warn("Degraded result after " + result.attemptsUsed() + " attempt(s)");
        } else {
            success("Verified after " + result.attemptsUsed() + " attempt(s)");
        }
    }

    private static void draft(StrategyDraft draft) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold STRATEGY|@ " + (draft.role() != null ? draft.role() : "?")));
        System.out.println("  " + draft.summary());
        if (draft.buildPlan() != null) {
            for (BuildStep step : draft.buildPlan()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                        "  @|fg(blue) [%s]|@ %s: %s", step.window(), step.trigger(),
                        step.itemIds() != null ? String.join(", ", step.itemIds()) : "")));
            }
        }
    }
}
