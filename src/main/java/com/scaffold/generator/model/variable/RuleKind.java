package com.scaffold.generator.model.variable;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Kinds of validation rule a variable may carry.
 */
public enum RuleKind {
    PATTERN("pattern"),
    MIN_LENGTH("min_length"),
    MAX_LENGTH("max_length"),
    MIN_VALUE("min_value"),
    MAX_VALUE("max_value"),
    MIN_ITEMS("min_items"),
    MAX_ITEMS("max_items");

    private final String value;

    RuleKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isCountBound() {
        return this == MIN_LENGTH || this == MAX_LENGTH || this == MIN_ITEMS || this == MAX_ITEMS;
    }

    public static RuleKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(k -> k.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("rule_type",
                        "invalid rule type '" + value + "', must be one of: "
                                + Arrays.stream(values()).map(RuleKind::getValue).collect(Collectors.joining(", "))));
    }
}
