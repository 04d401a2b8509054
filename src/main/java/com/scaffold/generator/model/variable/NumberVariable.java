package com.scaffold.generator.model.variable;

import java.math.BigInteger;
import java.util.List;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;

/**
 * Integer or float variable. Values keep the numeric type they were supplied with.
 */
public class NumberVariable extends TemplateVariable {

    private final Number defaultValue;

    @Builder
    public NumberVariable(String name, VariableType type, String description, Object defaultValue, Boolean required,
                          String prompt, String helpText, List<ValidationRule> validationRules,
                          List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        super(name, type != null ? type : VariableType.INTEGER, description, required, prompt, helpText,
                validationRules, showIf, hideIf, filters);
        if (!getType().isNumeric()) {
            throw new TemplateSchemaException("type", getType().getValue() + " is not a numeric type");
        }
        this.defaultValue = (Number) requireDefaultMatchesType(defaultValue);
    }

    @Override
    public Number getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected List<String> checkType(Object value) {
        if (getType() == VariableType.INTEGER) {
            return isIntegral(value) ? List.of() : List.of(typeError("integer"));
        }
        return value instanceof Number ? List.of() : List.of(typeError("number"));
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }
}
