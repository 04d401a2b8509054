package com.scaffold.generator.cli;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.exception.OptionsValidationException;
import com.scaffold.generator.cli.model.GenerateOptions;
import com.scaffold.generator.cli.model.ValidatedGenerateOptions;
import com.scaffold.generator.cli.output.GenerateResultsPrinter;
import com.scaffold.generator.cli.validation.GenerateOptionsValidator;
import com.scaffold.generator.cli.values.VariableValueReader;
import com.scaffold.generator.engine.GeneratorConfig;
import com.scaffold.generator.engine.GeneratorResult;
import com.scaffold.generator.engine.ScaffoldGenerator;
import com.scaffold.generator.exception.TemplateEngineException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.parser.TemplateCache;
import com.scaffold.generator.resolve.FileLicenseTextProvider;
import com.scaffold.generator.resolve.LicenseTextProvider;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating a project from a template definition.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Renders a template definition into an output directory."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final VariableValueReader valueReader = new VariableValueReader();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        TemplateCache cache = new TemplateCache();
        try {
            Template template = cache.getOrLoad(validated.getTemplatePath());
            Map<String, Object> values = valueReader.collect(template, options.getValuesFile(), options.getInlineValues());

            LicenseTextProvider licenseTextProvider = options.getLicenseFile() != null
                    ? new FileLicenseTextProvider(options.getLicenseFile())
                    : LicenseTextProvider.NONE;

            GeneratorConfig config = GeneratorConfig.builder()
                    .templatePath(validated.getTemplatePath())
                    .values(values)
                    .outputDir(validated.getNormalizedOutputDir())
                    .overwrite(options.isOverwrite())
                    .strictValidation(!options.isLenient())
                    .platform(validated.getPlatform())
                    .licenseTextProvider(licenseTextProvider)
                    .build();

            printer.printBanner(options, validated, template);

            GeneratorResult result = new ScaffoldGenerator(cache, Clock.systemDefaultZone()).generate(config);
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;
        } catch (TemplateEngineException e) {
            log.error("Generation failed: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
