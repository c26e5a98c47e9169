package com.aramcoach.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: advise, ask, serve.
 */
@Command(
        name = "aram-coach",
        mixinStandardHelpOptions = true,
        version = "aram-coach 0.1.0",
        description = "Verified ARAM strategy coach",
        subcommands = {
                AdviseCommand.class,
                AskCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AramCoachCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
