package com.scaffold.generator;

import com.scaffold.generator.cli.ScaffoldCommand;

import picocli.CommandLine;

/**
 * Main entry point for the scaffold generator.
 * Generates project skeletons from declarative template definitions.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ScaffoldCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
