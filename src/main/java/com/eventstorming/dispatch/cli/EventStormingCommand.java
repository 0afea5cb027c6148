package com.eventstorming.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for event storming workshops.
 * Routes to workshop, element, context and query subcommands.
 */
@Command(
        name = "eventstorming",
        mixinStandardHelpOptions = true,
        version = "EventStorming 0.1.0",
        description = "Model domains as event storming workshops: events, commands, policies and bounded contexts",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                ShowCommand.class,
                AddCommand.class,
                UpdateCommand.class,
                DeleteCommand.class,
                ContextCommand.class,
                AssignCommand.class,
                SearchCommand.class,
                TimelineCommand.class,
                ContextsCommand.class,
                StatsCommand.class,
                FlowCommand.class,
                ExportCommand.class,
                ImportCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EventStormingCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
