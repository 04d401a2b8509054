package com.scaffold.generator.model.variable;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Operators available to structured visibility conditions.
 */
public enum ConditionOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    MATCHES("matches"),
    NOT_MATCHES("not_matches");

    private final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Operators that ignore their operand.
     */
    public boolean isUnary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    public static ConditionOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("operator",
                        "invalid operator '" + symbol + "', must be one of: "
                                + Arrays.stream(values()).map(ConditionOperator::getSymbol).collect(Collectors.joining(", "))));
    }
}
