package com.scaffold.generator.model.variable;

import java.util.List;

import lombok.Builder;

/**
 * Yes/no variable.
 */
public class BooleanVariable extends TemplateVariable {

    private final Boolean defaultValue;

    @Builder
    public BooleanVariable(String name, String description, Object defaultValue, Boolean required,
                           String prompt, String helpText, List<ValidationRule> validationRules,
                           List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        super(name, VariableType.BOOLEAN, description, required, prompt, helpText,
                validationRules, showIf, hideIf, filters);
        this.defaultValue = (Boolean) requireDefaultMatchesType(defaultValue);
    }

    @Override
    public Boolean getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected List<String> checkType(Object value) {
        return value instanceof Boolean ? List.of() : List.of(typeError("boolean"));
    }

    @Override
    protected String promptSuffix() {
        return " (y/n)";
    }
}
