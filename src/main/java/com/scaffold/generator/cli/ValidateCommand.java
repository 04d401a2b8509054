package com.scaffold.generator.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import com.scaffold.generator.cli.output.GenerateResultsPrinter;
import com.scaffold.generator.engine.ScaffoldGenerator;
import com.scaffold.generator.validation.Diagnostics;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Checks template definitions without generating anything.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Loads and cross-validates template definitions."
)
public class ValidateCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "TEMPLATE", description = "Template definition file(s)")
    private List<Path> templatePaths;

    private final ScaffoldGenerator generator = new ScaffoldGenerator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        int failed = 0;
        for (Path path : templatePaths) {
            Diagnostics diagnostics = generator.validate(path);
            printer.printDiagnostics(path.toString(), diagnostics);
            if (diagnostics.hasErrors()) {
                failed++;
            }
        }
        return failed == 0 ? 0 : 1;
    }
}
