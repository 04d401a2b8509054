package com.scaffold.generator.model.variable;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A single constraint applied to a supplied value after its type has been checked.
 */
@Value
public class ValidationRule {

    RuleKind kind;
    Object operand;
    String message;

    @EqualsAndHashCode.Exclude
    Pattern compiledPattern;

    @Builder
    public ValidationRule(RuleKind kind, Object operand, String message) {
        if (kind == null) {
            throw new TemplateSchemaException("rule_type", "validation rule kind is required");
        }
        this.kind = kind;
        this.message = message;
        if (kind == RuleKind.PATTERN) {
            if (!(operand instanceof String regex)) {
                throw new TemplateSchemaException("value", "pattern rule needs a string regular expression");
            }
            try {
                this.compiledPattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new TemplateSchemaException("value", "invalid regular expression '" + regex + "': " + e.getDescription());
            }
        } else {
            this.compiledPattern = null;
            if (!(operand instanceof Number)) {
                throw new TemplateSchemaException("value", kind.getValue() + " rule needs a numeric value");
            }
            if (kind.isCountBound() && ((Number) operand).doubleValue() < 0) {
                throw new TemplateSchemaException("value", kind.getValue() + " rule needs a non-negative value");
            }
        }
        this.operand = operand;
    }

    /**
     * Applies this rule to a value of the owning variable.
     *
     * @return the failure message, empty when the rule holds or does not apply to the value's type
     */
    public Optional<String> check(String variableName, Object value) {
        boolean failed = switch (kind) {
            case PATTERN -> value instanceof String s && !compiledPattern.matcher(s).lookingAt();
            case MIN_LENGTH -> lengthOf(value) >= 0 && lengthOf(value) < bound();
            case MAX_LENGTH -> lengthOf(value) >= 0 && lengthOf(value) > bound();
            case MIN_VALUE -> isNumber(value) && ((Number) value).doubleValue() < bound();
            case MAX_VALUE -> isNumber(value) && ((Number) value).doubleValue() > bound();
            case MIN_ITEMS -> value instanceof Collection<?> c && c.size() < bound();
            case MAX_ITEMS -> value instanceof Collection<?> c && c.size() > bound();
        };
        if (!failed) {
            return Optional.empty();
        }
        return Optional.of(message != null ? message : defaultMessage(variableName));
    }

    private String defaultMessage(String variableName) {
        String prefix = "Variable '" + variableName + "' must ";
        return switch (kind) {
            case PATTERN -> prefix + "match pattern: " + operand;
            case MIN_LENGTH -> prefix + "be at least " + operand + " characters";
            case MAX_LENGTH -> prefix + "be at most " + operand + " characters";
            case MIN_VALUE -> prefix + "be at least " + operand;
            case MAX_VALUE -> prefix + "be at most " + operand;
            case MIN_ITEMS -> prefix + "have at least " + operand + " items";
            case MAX_ITEMS -> prefix + "have at most " + operand + " items";
        };
    }

    private double bound() {
        return ((Number) operand).doubleValue();
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static int lengthOf(Object value) {
        if (value instanceof CharSequence s) {
            return s.length();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        return -1;
    }
}
