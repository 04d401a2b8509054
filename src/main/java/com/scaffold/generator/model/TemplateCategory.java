package com.scaffold.generator.model;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Closed set of template categories, keyed by their definition-file value.
 */
public enum TemplateCategory {
    SCRIPT("script"),
    CLI_SINGLE("cli_single"),
    CLI_COMPLEX("cli_complex"),
    DJANGO("django"),
    FLASK("flask"),
    LIBRARY("library"),
    CUSTOM("custom");

    private final String value;

    TemplateCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TemplateCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("category",
                        "invalid category '" + value + "', must be one of: " + allowed()));
    }

    private static String allowed() {
        return Arrays.stream(values()).map(TemplateCategory::getValue).collect(Collectors.joining(", "));
    }
}
