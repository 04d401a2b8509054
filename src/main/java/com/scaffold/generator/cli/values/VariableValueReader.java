package com.scaffold.generator.cli.values;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scaffold.generator.exception.TemplateLoadException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.variable.TemplateVariable;
import com.scaffold.generator.model.variable.VariableType;

/**
 * Turns command-line input into caller-supplied variable values.
 * Values files are YAML or JSON mappings; {@code --set} strings are coerced
 * using the declared type of the matching variable.
 */
public class VariableValueReader {
    private static final Logger log = LoggerFactory.getLogger(VariableValueReader.class);

    private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "y", "on", "1");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "n", "off", "0");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Map<String, Object> readValuesFile(Path valuesFile) {
        String fileName = valuesFile.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".json") ? jsonMapper : yamlMapper;
        try {
            String text = Files.readString(valuesFile);
            if (text.isBlank()) {
                return new LinkedHashMap<>();
            }
            Map<String, Object> values = mapper.readValue(text, MAP_TYPE);
            log.debug("Read {} value(s) from {}", values == null ? 0 : values.size(), valuesFile);
            return values == null ? new LinkedHashMap<>() : values;
        } catch (IOException e) {
            throw new TemplateLoadException("Failed to read values file " + valuesFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Merges the values file (if any) with inline values; inline values win.
     */
    public Map<String, Object> collect(Template template, Path valuesFile, Map<String, String> inlineValues) {
        Map<String, Object> values = valuesFile == null ? new LinkedHashMap<>() : readValuesFile(valuesFile);
        inlineValues.forEach((name, raw) -> values.put(name, coerce(template, name, raw)));
        return values;
    }

    /**
     * Converts a raw string to the declared type of {@code name}. Strings that
     * do not fit the type are passed through so the resolver reports them.
     */
    public Object coerce(Template template, String name, String raw) {
        VariableType type = template.findVariable(name).map(TemplateVariable::getType).orElse(null);
        if (type == null || raw == null) {
            return raw;
        }
        String trimmed = raw.trim();
        switch (type) {
            case BOOLEAN:
                String token = trimmed.toLowerCase(Locale.ROOT);
                if (TRUE_TOKENS.contains(token)) {
                    return Boolean.TRUE;
                }
                if (FALSE_TOKENS.contains(token)) {
                    return Boolean.FALSE;
                }
                return raw;
            case INTEGER:
                try {
                    long parsed = Long.parseLong(trimmed);
                    if (parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE) {
                        return (int) parsed;
                    }
                    return parsed;
                } catch (NumberFormatException e) {
                    return raw;
                }
            case FLOAT:
                try {
                    return Double.parseDouble(trimmed);
                } catch (NumberFormatException e) {
                    return raw;
                }
            case LIST:
            case MULTICHOICE:
                return splitList(trimmed);
            default:
                return raw;
        }
    }

    private static List<String> splitList(String raw) {
        List<String> items = new ArrayList<>();
        if (raw.isEmpty()) {
            return items;
        }
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(items::add);
        return items;
    }
}
