package com.aramcoach.dispatch.cli;

import com.aramcoach.core.engine.CancellationToken;
import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.engine.PevEngine;
import com.aramcoach.core.engine.PevProperties;
import com.aramcoach.core.model.PevResult;
import com.aramcoach.core.model.RequestContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: aram-coach ask --champion ashe --question "what do I build vs healers?"
 */
@Command(name = "ask", mixinStandardHelpOptions = true,
        description = "Ask an in-game question about your champion")
@Component
public class AskCommand implements Callable<Integer> {

    @Option(names = {"--champion", "-c"}, required = true, description = "Your champion id")
    private String champion;

    @Option(names = {"--question", "-q"}, required = true, description = "The question")
    private String question;

    @Option(names = {"--enemies", "-e"}, split = ",", description = "Opponent champion ids")
    private List<String> enemies;

    @Option(names = {"--patch", "-p"}, description = "Patch id (defaults to configured patch)")
    private String patch;

    @Option(names = "--max-attempts", description = "Regenerations allowed after the first draft")
    private Integer maxAttempts;

    @Option(names = {"--verbose", "-v"}, description = "Print each rejected attempt as it happens")
    private boolean verbose;

    private final PevEngine pevEngine;
    private final PevProperties properties;

    public AskCommand(PevEngine pevEngine, PevProperties properties) {
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

        var request = RequestContext.ingame(patch, properties.getDefaultPatch(), champion.trim(), question,
                List.of(), AdviseCommand.toPicks(enemies));
        ConsoleOutput.info(request.myChampionId() + " asks: " + question);

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
}
