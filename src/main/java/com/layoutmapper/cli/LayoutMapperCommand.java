package com.layoutmapper.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level command. Routes to the analyze and map subcommands.
 */
@Command(
        name = "layout-mapper",
        mixinStandardHelpOptions = true,
        version = "layout-mapper 1.0.0",
        description = "Analyzes design layouts and maps their elements to UI catalog components.",
        subcommands = {
                AnalyzeCommand.class,
                MapCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class LayoutMapperCommand implements Runnable {

    @Override
    public void run() {
        // No subcommand given
        new CommandLine(this).usage(System.out);
    }
}
