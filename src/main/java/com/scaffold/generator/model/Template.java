package com.scaffold.generator.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.action.ActionGroup;
import com.scaffold.generator.model.action.TemplateHooks;
import com.scaffold.generator.model.structure.ProjectStructure;
import com.scaffold.generator.model.structure.TemplateFiles;
import com.scaffold.generator.model.variable.TemplateVariable;

import lombok.Builder;
import lombok.Value;

/**
 * A loaded template definition. Field-level rules are checked when the parts
 * are built; whole-template rules are a separate pass
 * ({@link com.scaffold.generator.validation.CrossValidator}).
 *
 * <p>Instances are read-only and may be rendered any number of times.
 */
@Value
public class Template {

    TemplateMetadata metadata;
    List<TemplateVariable> variables;
    ProjectStructure structure;
    TemplateFiles templateFiles;
    TemplateHooks hooks;
    List<ActionGroup> actionGroups;

    /** Directory the definition was loaded from; {@code source_file} paths resolve against it. */
    Path sourceDirectory;

    @Builder
    public Template(TemplateMetadata metadata, List<TemplateVariable> variables, ProjectStructure structure,
                    TemplateFiles templateFiles, TemplateHooks hooks, List<ActionGroup> actionGroups,
                    Path sourceDirectory) {
        if (metadata == null) {
            throw new TemplateSchemaException("metadata", "is required");
        }
        if (structure == null) {
            throw new TemplateSchemaException("structure", "is required");
        }
        this.metadata = metadata;
        this.variables = SchemaRules.copyOrEmpty(variables);
        this.structure = structure;
        this.templateFiles = templateFiles != null ? templateFiles : TemplateFiles.EMPTY;
        this.hooks = hooks != null ? hooks : TemplateHooks.EMPTY;
        this.actionGroups = SchemaRules.copyOrEmpty(actionGroups);
        this.sourceDirectory = sourceDirectory;
    }

    public String getName() {
        return metadata.getName();
    }

    public Optional<TemplateVariable> findVariable(String name) {
        return variables.stream().filter(v -> v.getName().equals(name)).findFirst();
    }

    public List<String> getVariableNames() {
        return variables.stream().map(TemplateVariable::getName).toList();
    }
}
