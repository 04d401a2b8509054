package com.scaffold.generator.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.TemplateCategory;
import com.scaffold.generator.model.action.ActionType;
import com.scaffold.generator.model.action.HookStage;
import com.scaffold.generator.model.action.Platform;
import com.scaffold.generator.model.action.TemplateAction;
import com.scaffold.generator.model.structure.FileItem;
import com.scaffold.generator.model.variable.ChoiceVariable;
import com.scaffold.generator.model.variable.ConditionOperator;
import com.scaffold.generator.model.variable.RuleKind;
import com.scaffold.generator.model.variable.TemplateVariable;
import com.scaffold.generator.model.variable.VariableType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TemplateDefinitionParser using inline YAML definitions.
 */
class TemplateDefinitionParserTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final TemplateDefinitionParser parser = new TemplateDefinitionParser();

    private static final String METADATA = """
            metadata:
              name: Sample
              description: Sample template
              version: 1.0.0
              category: library
              author: Tester
            """;

    private Template parse(String yaml) throws Exception {
        Map<String, Object> definition = YAML.readValue(yaml, new TypeReference<Map<String, Object>>() {});
        return parser.parse(definition, Path.of("."));
    }

    @Test
    void testParseVariablesAndStructure() throws Exception {
        Template template = parse(METADATA + """
                variables:
                  - name: project_name
                    type: string
                    description: Project name
                    filters: [strip, kebab_case]
                    validation_rules:
                      - rule_type: max_length
                        value: 40
                  - name: db
                    type: choice
                    description: Database
                    choices:
                      - postgres
                      - value: sqlite
                        label: SQLite (file based)
                    default: sqlite
                    hide_if:
                      - variable: project_name
                        operator: startswith
                        value: tmp
                structure:
                  root_directory:
                    name: "{{ project_name }}"
                    files:
                      - name: run.sh
                        content: echo hi
                        executable: true
                        permissions: "700"
                        condition: "{{ db }}"
                    directories:
                      - name: docs
                        condition:
                          expression: db == 'postgres'
                """);

        assertThat(template.getMetadata().getCategory()).isEqualTo(TemplateCategory.LIBRARY);
        assertThat(template.getVariableNames()).containsExactly("project_name", "db");

        TemplateVariable projectName = template.findVariable("project_name").orElseThrow();
        assertThat(projectName.getFilters()).hasSize(2);
        assertThat(projectName.getValidationRules().get(0).getKind()).isEqualTo(RuleKind.MAX_LENGTH);

        ChoiceVariable db = (ChoiceVariable) template.findVariable("db").orElseThrow();
        assertThat(db.getType()).isEqualTo(VariableType.CHOICE);
        assertThat(db.getChoiceValues()).containsExactly("postgres", "sqlite");
        assertThat(db.getChoices().get(1).getDisplayLabel()).isEqualTo("SQLite (file based)");
        assertThat(db.getHideIf().get(0).getOperator()).isEqualTo(ConditionOperator.STARTS_WITH);

        FileItem run = template.getStructure().getRootDirectory().getFiles().get(0);
        assertThat(run.getFinalPermissions()).isEqualTo("700");
        assertThat(run.getCondition().getExpression()).isEqualTo("{{ db }}");
        assertThat(template.getStructure().getRootDirectory().getDirectories().get(0).getCondition().getExpression())
                .isEqualTo("db == 'postgres'");
    }

    @Test
    void testParseHooksAndGroups() throws Exception {
        Template template = parse(METADATA + """
                structure:
                  root_directory:
                    name: app
                hooks:
                  post_generate:
                    - name: init
                      type: git
                      command: git init
                      description: Initialize repository
                      platforms: [unix]
                      environment:
                        GIT_AUTHOR_NAME: bot
                      arguments: ["--quiet"]
                action_groups:
                  - name: extras
                    description: Extra setup
                    continue_on_error: true
                    actions:
                      - name: venv
                        type: python
                        command: python -m venv .venv
                        description: Create virtualenv
                        required: false
                        timeout: 120
                """);

        TemplateAction init = template.getHooks().actionsFor(HookStage.POST_GENERATE).get(0);
        assertThat(init.getType()).isEqualTo(ActionType.GIT);
        assertThat(init.getPlatforms()).containsExactly(Platform.UNIX);
        assertThat(init.getEnvironment()).containsEntry("GIT_AUTHOR_NAME", "bot");
        assertThat(init.getArguments()).containsExactly("--quiet");

        assertThat(template.getActionGroups()).hasSize(1);
        assertThat(template.getActionGroups().get(0).isContinueOnError()).isTrue();
        TemplateAction venv = template.getActionGroups().get(0).getActions().get(0);
        assertThat(venv.isRequired()).isFalse();
        assertThat(venv.getTimeout()).isEqualTo(120);
    }

    @Test
    void testErrorsCarryFieldPath() {
        assertThatThrownBy(() -> parse(METADATA + """
                variables:
                  - name: ok
                    type: string
                    description: Fine
                  - name: port
                    type: integer
                    description: Port
                    default: eighty
                structure:
                  root_directory:
                    name: app
                """))
                .isInstanceOfSatisfying(TemplateSchemaException.class,
                        e -> assertThat(e.getField()).isEqualTo("variables[1].default"));

        assertThatThrownBy(() -> parse(METADATA + """
                structure:
                  root_directory:
                    name: app
                    directories:
                      - name: src
                        files:
                          - name: a.txt
                            content: x
                            template_file: a.txt.ftl
                """))
                .isInstanceOfSatisfying(TemplateSchemaException.class,
                        e -> assertThat(e.getField()).isEqualTo("structure.root_directory.directories[0].files[0].content"));
    }

    @Test
    void testInvalidEnumValuesReported() {
        assertThatThrownBy(() -> parse("""
                metadata:
                  name: Sample
                  description: Sample template
                  version: 1.0.0
                  category: rocket
                  author: Tester
                structure:
                  root_directory:
                    name: app
                """))
                .isInstanceOfSatisfying(TemplateSchemaException.class, e -> {
                    assertThat(e.getField()).isEqualTo("metadata.category");
                    assertThat(e.getMessage()).contains("rocket");
                });

        assertThatThrownBy(() -> parse(METADATA + """
                variables:
                  - name: x
                    type: decimal
                    description: X
                structure:
                  root_directory:
                    name: app
                """))
                .isInstanceOfSatisfying(TemplateSchemaException.class,
                        e -> assertThat(e.getField()).isEqualTo("variables[0].type"));
    }

    @Test
    void testMissingSectionsRejected() {
        assertThatThrownBy(() -> parse(METADATA))
                .isInstanceOfSatisfying(TemplateSchemaException.class,
                        e -> assertThat(e.getField()).isEqualTo("structure"));
        assertThatThrownBy(() -> parse("""
                structure:
                  root_directory:
                    name: app
                """))
                .isInstanceOfSatisfying(TemplateSchemaException.class,
                        e -> assertThat(e.getField()).isEqualTo("metadata"));
    }

    @Test
    void testChoicesOnlyForChoiceTypes() {
        assertThatThrownBy(() -> parse(METADATA + """
                variables:
                  - name: x
                    type: string
                    description: X
                    choices: [a, b]
                structure:
                  root_directory:
                    name: app
                """))
                .hasMessageContaining("choices are only allowed for choice/multichoice variables");
    }

    @Test
    void testUnknownFieldsIgnored() throws Exception {
        Template template = parse(METADATA + """
                maintainers: [someone]
                structure:
                  root_directory:
                    name: app
                """);

        assertThat(template.getName()).isEqualTo("Sample");
    }
}
