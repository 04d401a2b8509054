package com.scaffold.generator.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; all work happens in the subcommands.
 */
@Command(
        name = "scaffold",
        mixinStandardHelpOptions = true,
        version = "scaffold-generator 1.0.0",
        description = "Generates project skeletons from declarative YAML or JSON template definitions.",
        subcommands = {GenerateCommand.class, ValidateCommand.class, ListTemplatesCommand.class}
)
public class ScaffoldCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
