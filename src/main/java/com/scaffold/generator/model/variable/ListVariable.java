package com.scaffold.generator.model.variable;

import java.util.List;

import lombok.Builder;

/**
 * Free-form list variable.
 */
public class ListVariable extends TemplateVariable {

    private final List<Object> defaultValue;

    @Builder
    public ListVariable(String name, String description, Object defaultValue, Boolean required,
                        String prompt, String helpText, List<ValidationRule> validationRules,
                        List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        super(name, VariableType.LIST, description, required, prompt, helpText,
                validationRules, showIf, hideIf, filters);
        Object checked = requireDefaultMatchesType(defaultValue);
        this.defaultValue = checked == null ? null : List.copyOf((List<?>) checked);
    }

    @Override
    public List<Object> getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected List<String> checkType(Object value) {
        return value instanceof List<?> ? List.of() : List.of(typeError("list"));
    }
}
