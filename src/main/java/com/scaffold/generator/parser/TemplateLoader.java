package com.scaffold.generator.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scaffold.generator.exception.TemplateLoadException;
import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.Template;

/**
 * Reads a template definition from a {@code .yaml}, {@code .yml} or {@code .json} file.
 */
public class TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final TemplateDefinitionParser definitionParser;

    public TemplateLoader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.definitionParser = new TemplateDefinitionParser();
    }

    public static boolean isDefinitionFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    /**
     * @throws TemplateLoadException when the file is missing, empty, unparseable or violates the schema
     */
    public Template load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new TemplateLoadException("Template file not found: " + path);
        }

        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateLoadException("Failed to read template " + path + ": " + e.getMessage(), e);
        }
        if (text.isBlank()) {
            throw new TemplateLoadException("Template file is empty: " + path);
        }

        Map<String, Object> definition;
        try {
            definition = selectMapper(path).readValue(text, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new TemplateLoadException("Failed to parse template " + path + ": " + e.getMessage(), e);
        }
        if (definition == null || definition.isEmpty()) {
            throw new TemplateLoadException("Template file is empty: " + path);
        }

        try {
            Template template = definitionParser.parse(definition, path.toAbsolutePath().getParent());
            log.debug("Loaded template '{}' from {}", template.getName(), path);
            return template;
        } catch (TemplateSchemaException e) {
            throw new TemplateLoadException("Invalid template " + path + ": " + e.getMessage(), e);
        }
    }

    private ObjectMapper selectMapper(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? jsonMapper : yamlMapper;
    }
}
