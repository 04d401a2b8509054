package com.scaffold.generator.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.condition.ConditionEvaluator;
import com.scaffold.generator.condition.ExpressionException;
import com.scaffold.generator.condition.ExpressionParser;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.action.ActionGroup;
import com.scaffold.generator.model.action.TemplateAction;
import com.scaffold.generator.model.structure.ConditionalExpression;
import com.scaffold.generator.model.structure.DirectoryItem;
import com.scaffold.generator.model.structure.FileItem;
import com.scaffold.generator.model.structure.ProjectStructure;
import com.scaffold.generator.model.structure.TemplateFile;
import com.scaffold.generator.model.variable.TemplateVariable;
import com.scaffold.generator.render.PlaceholderRenderer;
import com.scaffold.generator.resolve.SystemVariables;

/**
 * Whole-template referential checks, run once per template and independent
 * of user input and disk state.
 *
 * <p>Problems are collected, never thrown; callers decide whether a
 * non-empty result blocks rendering.
 */
public class CrossValidator {
    private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

    public static final int LARGE_STRUCTURE_THRESHOLD = 1000;

    /**
     * Extensions of files that are themselves templates or front-end code for
     * the generated application. Their {@code {{ }}} belongs to that runtime,
     * so only their names are checked.
     */
    public static final Set<String> APPLICATION_TEMPLATE_EXTENSIONS = Set.of(
            ".html", ".htm", ".jinja", ".jinja2", ".j2", ".njk", ".liquid", ".hbs", ".handlebars",
            ".mustache", ".vue", ".svelte", ".js", ".jsx", ".ts", ".tsx");

    private final PlaceholderRenderer placeholderRenderer;

    public CrossValidator() {
        this(new PlaceholderRenderer());
    }

    public CrossValidator(PlaceholderRenderer placeholderRenderer) {
        this.placeholderRenderer = placeholderRenderer;
    }

    /**
     * Error messages for the whole template.
     */
    public List<String> validate(Template template) {
        return check(template).getErrors();
    }

    public Diagnostics check(Template template) {
        Diagnostics diagnostics = new Diagnostics();
        List<String> errors = diagnostics.getErrors();

        checkVariables(template.getVariables(), errors);
        errors.addAll(validateStructure(template.getStructure()));
        checkTemplateFiles(template, errors);
        checkActions(template, errors);
        checkVariableUsage(template, errors);

        int items = template.getStructure().countItems();
        if (items > LARGE_STRUCTURE_THRESHOLD) {
            diagnostics.getWarnings().add("Structure has " + items + " items (more than "
                    + LARGE_STRUCTURE_THRESHOLD + "), generation may be slow");
        }

        log.debug("Validated template '{}': {} errors, {} warnings", template.getName(),
                errors.size(), diagnostics.getWarnings().size());
        return diagnostics;
    }

    /**
     * Name uniqueness within every directory of the tree.
     */
    public List<String> validateStructure(ProjectStructure structure) {
        List<String> errors = new ArrayList<>();
        for (DirectoryItem directory : structure.getAllDirectories()) {
            checkDirectory(directory, errors);
        }
        return errors;
    }

    private void checkDirectory(DirectoryItem directory, List<String> errors) {
        List<String> fileNames = directory.getFiles().stream().map(FileItem::getName).toList();
        List<String> dirNames = directory.getDirectories().stream().map(DirectoryItem::getName).toList();

        Set<String> duplicateFiles = duplicates(fileNames);
        if (!duplicateFiles.isEmpty()) {
            errors.add("Duplicate file names in directory '" + directory.getName() + "': " + duplicateFiles);
        }
        Set<String> duplicateDirs = duplicates(dirNames);
        if (!duplicateDirs.isEmpty()) {
            errors.add("Duplicate directory names in directory '" + directory.getName() + "': " + duplicateDirs);
        }
        Set<String> conflicts = new LinkedHashSet<>(fileNames);
        conflicts.retainAll(new HashSet<>(dirNames));
        if (!conflicts.isEmpty()) {
            errors.add("Name conflicts between files and directories in '" + directory.getName() + "': " + conflicts);
        }
    }

    private void checkVariables(List<TemplateVariable> variables, List<String> errors) {
        Set<String> duplicateNames = duplicates(variables.stream().map(TemplateVariable::getName).toList());
        if (!duplicateNames.isEmpty()) {
            errors.add("Duplicate variable names: " + duplicateNames);
        }
        for (TemplateVariable variable : variables) {
            if (variable.hasDefault()) {
                variable.validateValue(variable.getDefaultValue())
                        .forEach(error -> errors.add("Variable '" + variable.getName() + "': " + error));
            }
        }
    }

    private void checkTemplateFiles(Template template, List<String> errors) {
        Collection<TemplateFile> files = template.getTemplateFiles().getFiles();
        Set<String> duplicateNames = duplicates(files.stream().map(TemplateFile::getName).toList());
        if (!duplicateNames.isEmpty()) {
            errors.add("Duplicate template file names: " + duplicateNames);
        }

        Set<String> available = new HashSet<>(template.getTemplateFiles().getNames());
        for (FileItem file : template.getStructure().getAllFiles()) {
            if (file.getTemplateFile() != null && !available.contains(file.getTemplateFile())) {
                errors.add("Template file '" + file.getTemplateFile() + "' not found (referenced by " + file.getName() + ")");
            }
        }
    }

    private void checkActions(Template template, List<String> errors) {
        Set<String> duplicateHookActions = duplicates(template.getHooks().getAllActions().stream()
                .map(TemplateAction::getName).toList());
        if (!duplicateHookActions.isEmpty()) {
            errors.add("Duplicate action names across hooks: " + duplicateHookActions);
        }

        Set<String> duplicateGroups = duplicates(template.getActionGroups().stream().map(ActionGroup::getName).toList());
        if (!duplicateGroups.isEmpty()) {
            errors.add("Duplicate action group names: " + duplicateGroups);
        }
        for (ActionGroup group : template.getActionGroups()) {
            Set<String> duplicateActions = duplicates(group.getActions().stream().map(TemplateAction::getName).toList());
            if (!duplicateActions.isEmpty()) {
                errors.add("Duplicate action names in group '" + group.getName() + "': " + duplicateActions);
            }
        }
    }

    private void checkVariableUsage(Template template, List<String> errors) {
        Set<String> known = new HashSet<>(template.getVariableNames());
        known.addAll(SystemVariables.NAMES);

        for (FileItem file : template.getStructure().getAllFiles()) {
            reportUnknown(placeholderRenderer.findReferences(file.getName()), known, "file name: " + file.getName(), errors);
            if (file.getContent() != null && !isApplicationTemplate(file.getName())) {
                String where = "file content: " + file.getName();
                reportUnknown(placeholderRenderer.findReferences(file.getContent()), known, where, errors);
                for (String condition : placeholderRenderer.findConditions(file.getContent())) {
                    checkExpression(condition, known, where, errors);
                }
            }
            checkCondition(file.getCondition(), known, file.getName(), errors);
        }
        for (DirectoryItem directory : template.getStructure().getAllDirectories()) {
            reportUnknown(placeholderRenderer.findReferences(directory.getName()), known,
                    "directory name: " + directory.getName(), errors);
            checkCondition(directory.getCondition(), known, directory.getName(), errors);
        }
        for (TemplateAction action : template.getHooks().getAllActions()) {
            checkCondition(action.getCondition(), known, action.getName(), errors);
        }
        for (ActionGroup group : template.getActionGroups()) {
            checkCondition(group.getCondition(), known, group.getName(), errors);
            for (TemplateAction action : group.getActions()) {
                checkCondition(action.getCondition(), known, action.getName(), errors);
            }
        }
    }

    private void checkCondition(ConditionalExpression condition, Set<String> known, String owner, List<String> errors) {
        if (condition == null || ConditionEvaluator.isLiteralToken(condition.getExpression())) {
            return;
        }
        String where = "condition: " + owner;
        if (condition.isTemplated()) {
            reportUnknown(placeholderRenderer.findReferences(condition.getExpression()), known, where, errors);
        } else {
            checkExpression(condition.getExpression(), known, where, errors);
        }
    }

    private static void checkExpression(String source, Set<String> known, String where, List<String> errors) {
        Set<String> names = new LinkedHashSet<>();
        try {
            ExpressionParser.parse(source).collectVariables(names);
        } catch (ExpressionException e) {
            errors.add("Invalid expression '" + source + "' in " + where + ": " + e.getMessage());
            return;
        }
        reportUnknown(names, known, where, errors);
    }

    private static void reportUnknown(Set<String> names, Set<String> known, String where, List<String> errors) {
        for (String name : names) {
            if (!known.contains(name)) {
                errors.add("Undefined variable '" + name + "' used in " + where);
            }
        }
    }

    static boolean isApplicationTemplate(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return APPLICATION_TEMPLATE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static Set<String> duplicates(List<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }
        return duplicates;
    }
}
