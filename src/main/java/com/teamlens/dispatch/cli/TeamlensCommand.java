package com.teamlens.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Teamlens.
 * Routes to subcommands: serve, history, session.
 */
@Command(
        name = "teamlens",
        mixinStandardHelpOptions = true,
        version = "Teamlens 0.1.0",
        description = "Live observer and session history for agent teams",
        subcommands = {
                ServeCommand.class,
                HistoryCommand.class,
                SessionCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TeamlensCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
