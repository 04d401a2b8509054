package com.scaffold.generator.engine;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.action.ActionPlan;
import com.scaffold.generator.action.ActionPlanner;
import com.scaffold.generator.exception.RenderingException;
import com.scaffold.generator.exception.TemplateEngineException;
import com.scaffold.generator.exception.VariableResolutionException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.parser.TemplateCache;
import com.scaffold.generator.render.RenderStats;
import com.scaffold.generator.render.RenderingEngine;
import com.scaffold.generator.resolve.SystemVariables;
import com.scaffold.generator.resolve.VariableResolver;
import com.scaffold.generator.validation.CrossValidator;
import com.scaffold.generator.validation.Diagnostics;

/**
 * End-to-end generation: load, cross-validate, resolve, render and plan actions.
 */
public class ScaffoldGenerator {
    private static final Logger log = LoggerFactory.getLogger(ScaffoldGenerator.class);

    private final TemplateCache templateCache;
    private final CrossValidator crossValidator;
    private final VariableResolver variableResolver;
    private final ActionPlanner actionPlanner;
    private final Clock clock;

    public ScaffoldGenerator() {
        this(new TemplateCache(), Clock.systemDefaultZone());
    }

    public ScaffoldGenerator(TemplateCache templateCache, Clock clock) {
        this.templateCache = templateCache;
        this.crossValidator = new CrossValidator();
        this.variableResolver = new VariableResolver();
        this.actionPlanner = new ActionPlanner();
        this.clock = clock;
    }

    /**
     * Whole-template diagnostics for a definition file. A definition that
     * cannot be loaded yields its load error as the only diagnostic.
     */
    public Diagnostics validate(Path templatePath) {
        try {
            return crossValidator.check(templateCache.getOrLoad(templatePath));
        } catch (TemplateEngineException e) {
            Diagnostics diagnostics = new Diagnostics();
            diagnostics.getErrors().add(e.getMessage());
            return diagnostics;
        }
    }

    public GeneratorResult generate(GeneratorConfig config) {
        log.info("Starting generation from template {}", config.getTemplatePath());

        Template template;
        try {
            log.info("Step 1: Loading template...");
            template = templateCache.getOrLoad(config.getTemplatePath());
        } catch (TemplateEngineException e) {
            log.error("Template could not be loaded: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        }

        log.info("Step 2: Validating template '{}'...", template.getName());
        Diagnostics diagnostics = crossValidator.check(template);
        diagnostics.getWarnings().forEach(w -> log.warn("Template warning: {}", w));
        if (diagnostics.hasErrors()) {
            if (config.isStrictValidation()) {
                diagnostics.getErrors().forEach(e -> log.error("Template error: {}", e));
                return GeneratorResult.builder()
                        .success(false)
                        .templateName(template.getName())
                        .errorMessage("Template validation failed with " + diagnostics.getErrors().size() + " error(s)")
                        .diagnostics(diagnostics.getErrors())
                        .warnings(diagnostics.getWarnings())
                        .build();
            }
            diagnostics.getErrors().forEach(e -> log.warn("Template error (ignored): {}", e));
        }

        Map<String, Object> systemValues = SystemVariables
                .forTemplate(template.getMetadata(), config.getLicenseTextProvider(), clock)
                .asMap();

        Map<String, Object> variables;
        try {
            log.info("Step 3: Resolving variables...");
            variables = variableResolver.resolve(template.getVariables(), config.getValues(), systemValues);
        } catch (VariableResolutionException e) {
            e.getErrors().forEach(msg -> log.error("  {}", msg));
            return GeneratorResult.builder()
                    .success(false)
                    .templateName(template.getName())
                    .errorMessage(e.getMessage())
                    .diagnostics(diagnostics.getErrors())
                    .warnings(diagnostics.getWarnings())
                    .variableErrors(e.getErrorsByVariable())
                    .build();
        }

        RenderStats stats;
        ActionPlan plan;
        try {
            log.info("Step 4: Rendering project...");
            RenderingEngine renderingEngine = new RenderingEngine(config.getLicenseTextProvider(), clock);
            stats = renderingEngine.render(template, variables, config.getOutputDir(), config.isOverwrite());

            log.info("Step 5: Planning actions...");
            Map<String, Object> context = new LinkedHashMap<>(variables);
            context.putAll(systemValues);
            plan = actionPlanner.plan(template, context, config.getPlatform());
        } catch (RenderingException e) {
            log.error("Rendering failed: {}", e.getMessage());
            return GeneratorResult.builder()
                    .success(false)
                    .templateName(template.getName())
                    .errorMessage(e.getMessage())
                    .diagnostics(diagnostics.getErrors())
                    .warnings(diagnostics.getWarnings())
                    .variables(variables)
                    .stats(e.getStats())
                    .outputPath(config.getOutputDir())
                    .build();
        } catch (TemplateEngineException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.builder()
                    .success(false)
                    .templateName(template.getName())
                    .errorMessage(e.getMessage())
                    .diagnostics(diagnostics.getErrors())
                    .warnings(diagnostics.getWarnings())
                    .variables(variables)
                    .outputPath(config.getOutputDir())
                    .build();
        }

        log.info("Generation complete!");
        return GeneratorResult.builder()
                .success(true)
                .templateName(template.getName())
                .outputPath(config.getOutputDir())
                .diagnostics(diagnostics.getErrors())
                .warnings(diagnostics.getWarnings())
                .variableErrors(Map.of())
                .variables(variables)
                .stats(stats)
                .actionPlan(plan)
                .build();
    }
}
