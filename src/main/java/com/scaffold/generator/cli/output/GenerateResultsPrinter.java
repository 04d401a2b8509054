package com.scaffold.generator.cli.output;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.action.ActionPlan;
import com.scaffold.generator.action.PlannedAction;
import com.scaffold.generator.cli.model.GenerateOptions;
import com.scaffold.generator.cli.model.ValidatedGenerateOptions;
import com.scaffold.generator.engine.GeneratorResult;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.action.HookStage;
import com.scaffold.generator.render.RenderStats;
import com.scaffold.generator.validation.Diagnostics;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);
    private static final String RULE = "=================================================";

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v, Template template) {
        log.info(RULE);
        log.info("Scaffold Generator");
        log.info(RULE);
        log.info("Template: {} {} ({})", template.getName(), template.getMetadata().getVersion(),
                template.getMetadata().getCategory().getValue());
        log.info("Definition: {}", v.getTemplatePath());
        log.info("Values File: {}", o.getValuesFile() != null ? o.getValuesFile().toAbsolutePath() : "None");
        log.info("Inline Values: {}", o.getInlineValues().isEmpty() ? "None" : o.getInlineValues().keySet());
        log.info("Platform: {}", v.getPlatform().getValue());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Overwrite: {}", o.isOverwrite());
        log.info(RULE);
    }

    public void printSuccess(GeneratorResult result) {
        RenderStats stats = result.getStats();

        log.info("");
        log.info(RULE);
        log.info("GENERATION SUCCESSFUL");
        log.info(RULE);
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Files Created: {}", stats.getFilesCreated());
        log.info("Files Overwritten: {}", stats.getFilesOverwritten());
        log.info("Files Skipped: {}", stats.getFilesSkipped());
        log.info("Directories Created: {}", stats.getDirectoriesCreated());

        if (stats.hasErrors()) {
            log.info("");
            log.info("Template file errors:");
            stats.getErrors().forEach(e -> log.warn("  {}", e));
        }
        printWarnings(result.getWarnings());
        printNextSteps(result.getActionPlan());
    }

    public void printFailure(GeneratorResult result) {
        log.error(RULE);
        log.error("GENERATION FAILED");
        log.error(RULE);
        log.error("{}", result.getErrorMessage());

        Map<String, List<String>> variableErrors = result.getVariableErrors();
        if (variableErrors != null && !variableErrors.isEmpty()) {
            log.error("Variable errors:");
            variableErrors.forEach((name, errors) -> errors.forEach(e -> log.error("  {}: {}", name, e)));
        }
        if (result.getDiagnostics() != null && !result.getDiagnostics().isEmpty()) {
            log.error("Template errors:");
            result.getDiagnostics().forEach(e -> log.error("  {}", e));
        }
        if (result.getStats() != null) {
            log.error("Partial output: {}", result.getStats());
        }
    }

    public void printDiagnostics(String templateLabel, Diagnostics diagnostics) {
        if (!diagnostics.hasErrors()) {
            log.info("{}: valid", templateLabel);
        } else {
            log.error("{}: {} error(s)", templateLabel, diagnostics.getErrors().size());
            diagnostics.getErrors().forEach(e -> log.error("  {}", e));
        }
        diagnostics.getWarnings().forEach(w -> log.warn("  warning: {}", w));
    }

    private void printWarnings(List<String> warnings) {
        if (warnings == null || warnings.isEmpty()) {
            return;
        }
        log.info("");
        log.info("Warnings:");
        warnings.forEach(w -> log.warn("  {}", w));
    }

    private void printNextSteps(ActionPlan plan) {
        if (plan == null || plan.isEmpty()) {
            log.info(RULE);
            return;
        }
        log.info("");
        log.info(RULE);
        log.info("NEXT STEPS");
        log.info(RULE);
        int step = 1;
        for (HookStage stage : HookStage.values()) {
            for (PlannedAction action : plan.actionsFor(stage)) {
                step = printAction(step, stage.getKey(), action);
            }
        }
        for (Map.Entry<String, List<PlannedAction>> group : plan.getGroups().entrySet()) {
            for (PlannedAction action : group.getValue()) {
                step = printAction(step, group.getKey(), action);
            }
        }
        log.info(RULE);
    }

    private int printAction(int step, String origin, PlannedAction action) {
        String description = action.getDescription() != null ? action.getDescription() : action.getName();
        log.info("{}. [{}] {}{}", step, origin, description, action.isRequired() ? "" : " (optional)");
        if (action.getWorkingDirectory() != null) {
            log.info("   cd {}", action.getWorkingDirectory());
        }
        log.info("   {}", action.getCommandLine());
        return step + 1;
    }
}
