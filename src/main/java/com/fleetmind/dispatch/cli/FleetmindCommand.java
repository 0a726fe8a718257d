package com.fleetmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for fleetmind.
 */
@Command(
        name = "fleetmind",
        mixinStandardHelpOptions = true,
        version = "fleetmind 0.1.0",
        description = "Coordinates a fleet of terminal-driven workers through per-worker mailboxes and task files",
        subcommands = {
                StatusCommand.class,
                DispatchCommand.class,
                AssignCommand.class,
                CompleteCommand.class,
                RedoCommand.class,
                InboxCommand.class,
                RouteCommand.class,
                HookCommand.class,
                ListenCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FleetmindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
