package com.example.smartcart.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "smartcart",
    mixinStandardHelpOptions = true,
    version = "smartcart 1.0.0",
    description = "Co-occurrence based menu add-on recommendations.",
    subcommands = {
        BuildCommand.class,
        RecommendCommand.class,
        EvaluateCommand.class,
        ExploreCommand.class
    }
)
public class SmartCartCli implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command: build, recommend, evaluate or explore");
    }
}
