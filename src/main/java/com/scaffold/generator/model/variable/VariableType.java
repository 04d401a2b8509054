package com.scaffold.generator.model.variable;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Closed set of variable types. Each type maps onto exactly one
 * {@link TemplateVariable} subclass.
 */
public enum VariableType {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    FLOAT("float"),
    CHOICE("choice"),
    MULTICHOICE("multichoice"),
    LIST("list"),
    EMAIL("email"),
    URL("url"),
    PATH("path");

    private final String value;

    VariableType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isChoice() {
        return this == CHOICE || this == MULTICHOICE;
    }

    public boolean isText() {
        return this == STRING || this == EMAIL || this == URL || this == PATH;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public static VariableType fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("type",
                        "invalid variable type '" + value + "', must be one of: "
                                + Arrays.stream(values()).map(VariableType::getValue).collect(Collectors.joining(", "))));
    }
}
