package com.aramcoach.dispatch.cli;

import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.engine.PevEngine;
import com.aramcoach.core.engine.PevProperties;
import com.aramcoach.core.model.ChampionPick;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.RequestContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: aram-coach advise --allies a,b,c --enemies x,y,z
 * <p>
 * Runs a pre-game PEV run for the given compositions and prints the verified
 * strategy. The first ally is treated as the player's champion.
 */
@Command(name = "advise", mixinStandardHelpOptions = true,
        description = "Get a pre-game strategy for a team composition")
@Component
public class AdviseCommand implements Callable<Integer> {

    @Option(names = {"--allies", "-a"}, split = ",", required = true,
            description = "Ally champion ids, your champion first")
    private List<String> allies;

    @Option(names = {"--enemies", "-e"}, split = ",", required = true,
            description = "Opponent champion ids")
    private List<String> enemies;

    @Option(names = {"--patch", "-p"}, description = "Patch id (defaults to configured patch)")
    private String patch;

    @Option(names = {"--question", "-q"}, description = "Optional question to focus the advice")
    private String question;

    @Option(names = "--max-attempts", description = "Regenerations allowed after the first draft")
    private Integer maxAttempts;

    @Option(names = {"--verbose", "-v"}, description = "Print each rejected attempt as it happens")
    private boolean verbose;

    private final PevEngine pevEngine;
    private final PevProperties properties;

    public AdviseCommand(PevEngine pevEngine, PevProperties properties) {
        this.pevEngine = pevEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int attempts = maxAttempts != null ? maxAttempts : properties.getMaxAttempts();
        if (attempts < 0 || attempts > properties.getMaxAttemptsLimit()) {
            ConsoleOutput.error("--max-attempts must be between 0 and " + properties.getMaxAttemptsLimit());
            return 2;
        }

        var request = RequestContext.preGame(patch, properties.getDefaultPatch(),
                toPicks(allies), toPicks(enemies), question);
        ConsoleOutput.info("Patch " + request.patchId() + ": " + String.join(", ", request.allyIds())
                + " vs " + String.join(", ", request.opponentIds()));

        PevResult result;
        try {
            result = verbose
                    ? pevEngine.runPev(request, attempts, new CancellationToken(), ConsoleOutput::event)
                    : pevEngine.runPev(request, attempts);
        } catch (FactsUnavailableException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.result(result);
        return 0;
    }

    static List<ChampionPick> toPicks(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .map(ChampionPick::of)
                .toList();
    }
}
