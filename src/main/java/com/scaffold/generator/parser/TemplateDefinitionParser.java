package com.scaffold.generator.parser;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.OperatingSystem;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.TemplateCategory;
import com.scaffold.generator.model.TemplateLicense;
import com.scaffold.generator.model.TemplateMetadata;
import com.scaffold.generator.model.action.ActionGroup;
import com.scaffold.generator.model.action.ActionType;
import com.scaffold.generator.model.action.HookStage;
import com.scaffold.generator.model.action.Platform;
import com.scaffold.generator.model.action.TemplateAction;
import com.scaffold.generator.model.action.TemplateHooks;
import com.scaffold.generator.model.structure.ConditionalExpression;
import com.scaffold.generator.model.structure.DirectoryItem;
import com.scaffold.generator.model.structure.FileEncoding;
import com.scaffold.generator.model.structure.FileItem;
import com.scaffold.generator.model.structure.ProjectStructure;
import com.scaffold.generator.model.structure.TemplateFile;
import com.scaffold.generator.model.structure.TemplateFiles;
import com.scaffold.generator.model.variable.BooleanVariable;
import com.scaffold.generator.model.variable.ChoiceItem;
import com.scaffold.generator.model.variable.ChoiceVariable;
import com.scaffold.generator.model.variable.ConditionOperator;
import com.scaffold.generator.model.variable.ConditionalLogic;
import com.scaffold.generator.model.variable.ListVariable;
import com.scaffold.generator.model.variable.NumberVariable;
import com.scaffold.generator.model.variable.RuleKind;
import com.scaffold.generator.model.variable.StringFilter;
import com.scaffold.generator.model.variable.TemplateVariable;
import com.scaffold.generator.model.variable.TextVariable;
import com.scaffold.generator.model.variable.ValidationRule;
import com.scaffold.generator.model.variable.VariableType;

/**
 * Maps a parsed YAML/JSON definition tree onto the schema types.
 *
 * <p>Every failure is a {@link TemplateSchemaException} whose field is the
 * dotted path of the offending value, e.g. {@code variables[2].default} or
 * {@code structure.root_directory.files[0].name}. Unknown fields are logged
 * and ignored.
 */
public class TemplateDefinitionParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateDefinitionParser.class);

    private static final Set<String> ROOT_FIELDS = Set.of(
            "metadata", "configuration", "variables", "structure", "template_files", "hooks", "action_groups",
            "compatibility", "related_templates");

    public Template parse(Map<String, Object> definition, Path sourceDirectory) {
        warnUnknown(definition, ROOT_FIELDS, "");

        return Template.builder()
                .metadata(nested("metadata", () -> parseMetadata(requireMap(definition, "metadata"))))
                .variables(parseList(definition, "variables", this::parseVariable))
                .structure(nested("structure", () -> parseStructure(requireMap(definition, "structure"))))
                .templateFiles(nested("template_files", () -> parseTemplateFiles(optionalMap(definition, "template_files"))))
                .hooks(nested("hooks", () -> parseHooks(optionalMap(definition, "hooks"))))
                .actionGroups(parseList(definition, "action_groups", this::parseActionGroup))
                .sourceDirectory(sourceDirectory)
                .build();
    }

    // ---------------------------------------------------------------- metadata

    private TemplateMetadata parseMetadata(Map<String, Object> map) {
        String minRuntime = string(map, "min_runtime_version");
        if (minRuntime == null) {
            minRuntime = string(map, "min_python_version");
        }
        return TemplateMetadata.builder()
                .name(string(map, "name"))
                .description(string(map, "description"))
                .version(string(map, "version"))
                .category(enumValue(map, "category", TemplateCategory::fromValue))
                .tags(stringList(map, "tags"))
                .author(string(map, "author"))
                .authorEmail(string(map, "author_email"))
                .license(enumValue(map, "license", TemplateLicense::fromValue))
                .created(instant(map, "created"))
                .updated(instant(map, "updated"))
                .minRuntimeVersion(minRuntime)
                .compatibility(map.containsKey("compatibility")
                        ? stringList(map, "compatibility").stream().map(OperatingSystem::fromValue).toList()
                        : null)
                .documentationUrl(string(map, "documentation_url"))
                .sourceUrl(string(map, "source_url"))
                .build();
    }

    // --------------------------------------------------------------- variables

    private TemplateVariable parseVariable(Map<String, Object> map) {
        VariableType type = enumValue(map, "type", VariableType::fromValue);
        if (type == null) {
            throw new TemplateSchemaException("type", "variable type is required");
        }
        String name = string(map, "name");
        String description = string(map, "description");
        Object defaultValue = map.get("default");
        Boolean required = bool(map, "required");
        String prompt = string(map, "prompt");
        String helpText = string(map, "help_text");
        List<ValidationRule> rules = parseList(map, "validation_rules", this::parseValidationRule);
        List<ConditionalLogic> showIf = parseList(map, "show_if", this::parseConditionalLogic);
        List<ConditionalLogic> hideIf = parseList(map, "hide_if", this::parseConditionalLogic);
        List<StringFilter> filters = nested("filters",
                () -> stringList(map, "filters").stream().map(StringFilter::fromValue).toList());

        if (!type.isChoice() && map.containsKey("choices")) {
            throw new TemplateSchemaException("choices", "choices are only allowed for choice/multichoice variables");
        }

        return switch (type) {
            case STRING, EMAIL, URL, PATH -> TextVariable.builder()
                    .name(name).type(type).description(description).defaultValue(defaultValue).required(required)
                    .prompt(prompt).helpText(helpText).validationRules(rules)
                    .showIf(showIf).hideIf(hideIf).filters(filters)
                    .build();
            case BOOLEAN -> BooleanVariable.builder()
                    .name(name).description(description).defaultValue(defaultValue).required(required)
                    .prompt(prompt).helpText(helpText).validationRules(rules)
                    .showIf(showIf).hideIf(hideIf).filters(filters)
                    .build();
            case INTEGER, FLOAT -> NumberVariable.builder()
                    .name(name).type(type).description(description).defaultValue(defaultValue).required(required)
                    .prompt(prompt).helpText(helpText).validationRules(rules)
                    .showIf(showIf).hideIf(hideIf).filters(filters)
                    .build();
            case CHOICE, MULTICHOICE -> ChoiceVariable.builder()
                    .name(name).type(type).description(description).defaultValue(defaultValue).required(required)
                    .prompt(prompt).helpText(helpText).validationRules(rules)
                    .choices(parseList(map, "choices", this::parseChoice))
                    .showIf(showIf).hideIf(hideIf).filters(filters)
                    .build();
            case LIST -> ListVariable.builder()
                    .name(name).description(description).defaultValue(defaultValue).required(required)
                    .prompt(prompt).helpText(helpText).validationRules(rules)
                    .showIf(showIf).hideIf(hideIf).filters(filters)
                    .build();
        };
    }

    private ChoiceItem parseChoice(Map<String, Object> map) {
        return ChoiceItem.builder()
                .value(string(map, "value"))
                .label(string(map, "label"))
                .description(string(map, "description"))
                .build();
    }

    private ValidationRule parseValidationRule(Map<String, Object> map) {
        String kind = map.containsKey("rule_kind") ? string(map, "rule_kind") : string(map, "rule_type");
        return ValidationRule.builder()
                .kind(RuleKind.fromValue(kind))
                .operand(map.containsKey("operand") ? map.get("operand") : map.get("value"))
                .message(string(map, "message"))
                .build();
    }

    private ConditionalLogic parseConditionalLogic(Map<String, Object> map) {
        return ConditionalLogic.builder()
                .variable(string(map, "variable"))
                .operator(ConditionOperator.fromSymbol(string(map, "operator")))
                .operand(map.containsKey("operand") ? map.get("operand") : map.get("value"))
                .build();
    }

    // --------------------------------------------------------------- structure

    private ProjectStructure parseStructure(Map<String, Object> map) {
        return ProjectStructure.builder()
                .rootDirectory(nested("root_directory", () -> parseDirectory(requireMap(map, "root_directory"))))
                .build();
    }

    private DirectoryItem parseDirectory(Map<String, Object> map) {
        return DirectoryItem.builder()
                .name(string(map, "name"))
                .permissions(string(map, "permissions"))
                .condition(nested("condition", () -> condition(map.get("condition"))))
                .files(parseList(map, "files", this::parseFile))
                .directories(parseList(map, "directories", this::parseDirectory))
                .build();
    }

    private FileItem parseFile(Map<String, Object> map) {
        return FileItem.builder()
                .name(string(map, "name"))
                .content(string(map, "content"))
                .templateFile(string(map, "template_file"))
                .sourceFile(string(map, "source_file"))
                .binaryContent(string(map, "binary_content"))
                .encoding(enumValue(map, "encoding", FileEncoding::fromValue))
                .permissions(string(map, "permissions"))
                .executable(Boolean.TRUE.equals(bool(map, "executable")))
                .condition(nested("condition", () -> condition(map.get("condition"))))
                .build();
    }

    private TemplateFiles parseTemplateFiles(Map<String, Object> map) {
        if (map == null) {
            return TemplateFiles.EMPTY;
        }
        return TemplateFiles.builder()
                .files(parseList(map, "files", this::parseTemplateFile))
                .build();
    }

    private TemplateFile parseTemplateFile(Map<String, Object> map) {
        return TemplateFile.builder()
                .name(string(map, "name"))
                .content(string(map, "content"))
                .encoding(enumValue(map, "encoding", FileEncoding::fromValue))
                .description(string(map, "description"))
                .outputPath(string(map, "output_path"))
                .build();
    }

    /**
     * Accepts a bare string, a boolean, or a mapping with an {@code expression} key.
     */
    private ConditionalExpression condition(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> map) {
            Object expression = map.get("expression");
            return ConditionalExpression.of(expression == null ? null : expression.toString());
        }
        if (raw instanceof String || raw instanceof Boolean || raw instanceof Number) {
            return ConditionalExpression.of(raw.toString());
        }
        throw new TemplateSchemaException("must be a string or a mapping with an 'expression'");
    }

    // ----------------------------------------------------------------- actions

    private TemplateHooks parseHooks(Map<String, Object> map) {
        if (map == null) {
            return TemplateHooks.EMPTY;
        }
        Map<HookStage, List<TemplateAction>> stages = new EnumMap<>(HookStage.class);
        Set<String> known = new LinkedHashSet<>();
        for (HookStage stage : HookStage.values()) {
            known.add(stage.getKey());
            stages.put(stage, parseList(map, stage.getKey(), this::parseAction));
        }
        warnUnknown(map, known, "hooks.");
        return new TemplateHooks(stages);
    }

    private ActionGroup parseActionGroup(Map<String, Object> map) {
        return ActionGroup.builder()
                .name(string(map, "name"))
                .description(string(map, "description"))
                .actions(parseList(map, "actions", this::parseAction))
                .condition(nested("condition", () -> condition(map.get("condition"))))
                .parallel(Boolean.TRUE.equals(bool(map, "parallel")))
                .continueOnError(Boolean.TRUE.equals(bool(map, "continue_on_error")))
                .build();
    }

    private TemplateAction parseAction(Map<String, Object> map) {
        Set<Platform> platforms = null;
        if (map.containsKey("platforms")) {
            platforms = new LinkedHashSet<>();
            for (String value : stringList(map, "platforms")) {
                platforms.add(Platform.fromValue(value));
            }
        }
        Map<String, String> environment = new LinkedHashMap<>();
        Map<String, Object> rawEnvironment = optionalMap(map, "environment");
        if (rawEnvironment != null) {
            rawEnvironment.forEach((key, value) -> environment.put(key, value == null ? "" : value.toString()));
        }
        return TemplateAction.builder()
                .name(string(map, "name"))
                .type(enumValue(map, "type", ActionType::fromValue))
                .command(string(map, "command"))
                .description(string(map, "description"))
                .workingDirectory(string(map, "working_directory"))
                .platforms(platforms)
                .condition(nested("condition", () -> condition(map.get("condition"))))
                .required(bool(map, "required"))
                .timeout(integer(map, "timeout"))
                .environment(environment)
                .arguments(stringList(map, "arguments"))
                .build();
    }

    // ----------------------------------------------------------------- helpers

    private interface Section<T> {
        T parse();
    }

    private static <T> T nested(String path, Section<T> section) {
        try {
            return section.parse();
        } catch (TemplateSchemaException e) {
            throw e.under(path);
        }
    }

    private <T> List<T> parseList(Map<String, Object> map, String key, Function<Map<String, Object>, T> itemParser) {
        Object raw = map.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> items)) {
            throw new TemplateSchemaException(key, "must be a list");
        }
        List<T> parsed = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            String path = key + "[" + i + "]";
            Map<String, Object> item = asItemMap(items.get(i), path);
            parsed.add(nested(path, () -> itemParser.apply(item)));
        }
        return parsed;
    }

    /**
     * List items are mappings; a bare string is shorthand for {@code {value: ...}}.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asItemMap(Object item, String path) {
        if (item instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        if (item instanceof String value) {
            return Map.of("value", value);
        }
        throw new TemplateSchemaException(path, "must be a mapping");
    }

    private static Map<String, Object> requireMap(Map<String, Object> map, String key) {
        Map<String, Object> value = optionalMap(map, key);
        if (value == null) {
            throw new TemplateSchemaException("is required");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> optionalMap(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new TemplateSchemaException(key, "must be a mapping");
        }
        return (Map<String, Object>) raw;
    }

    private static String string(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) {
            throw new TemplateSchemaException(key, "must be a scalar value");
        }
        return raw.toString();
    }

    private static Boolean bool(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        throw new TemplateSchemaException(key, "must be true or false");
    }

    private static Integer integer(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Integer i) {
            return i;
        }
        throw new TemplateSchemaException(key, "must be an integer");
    }

    private static List<String> stringList(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> items)) {
            throw new TemplateSchemaException(key, "must be a list");
        }
        List<String> values = new ArrayList<>(items.size());
        for (Object item : items) {
            values.add(String.valueOf(item));
        }
        return values;
    }

    private static <E> E enumValue(Map<String, Object> map, String key, Function<String, E> parser) {
        String raw = string(map, key);
        if (raw == null) {
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (TemplateSchemaException e) {
            if (key.equals(e.getField())) {
                throw e;
            }
            String message = e.getField() == null ? e.getMessage() : e.getMessage().substring(e.getField().length() + 2);
            throw new TemplateSchemaException(key, message);
        }
    }

    private static Instant instant(Map<String, Object> map, String key) {
        String raw = string(map, key);
        if (raw == null) {
            return null;
        }
        try {
            return raw.length() == 10
                    ? LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant()
                    : Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new TemplateSchemaException(key, "'" + raw + "' is not an ISO-8601 date or timestamp");
        }
    }

    private static void warnUnknown(Map<String, Object> map, Set<String> known, String prefix) {
        for (String key : map.keySet()) {
            if (!known.contains(key)) {
                log.warn("Ignoring unknown field '{}{}'", prefix, key);
            }
        }
    }
}
