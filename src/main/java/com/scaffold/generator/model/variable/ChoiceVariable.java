package com.scaffold.generator.model.variable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;

/**
 * Single or multiple selection from a fixed list of at least two choices.
 */
public class ChoiceVariable extends TemplateVariable {

    private final List<ChoiceItem> choices;
    private final Object defaultValue;

    @Builder
    public ChoiceVariable(String name, VariableType type, String description, Object defaultValue, Boolean required,
                          String prompt, String helpText, List<ChoiceItem> choices, List<ValidationRule> validationRules,
                          List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        super(name, type != null ? type : VariableType.CHOICE, description, required, prompt, helpText,
                validationRules, showIf, hideIf, filters);
        if (!getType().isChoice()) {
            throw new TemplateSchemaException("type", getType().getValue() + " is not a choice type");
        }
        if (choices == null || choices.isEmpty()) {
            throw new TemplateSchemaException("choices", "choices must be provided for " + getType().getValue() + " variables");
        }
        if (choices.size() < 2) {
            throw new TemplateSchemaException("choices", "at least 2 choices required for " + getType().getValue() + " variables");
        }
        this.choices = List.copyOf(choices);
        Object checked = requireDefaultMatchesType(defaultValue);
        this.defaultValue = checked instanceof List<?> list ? List.copyOf(list) : checked;
    }

    public List<ChoiceItem> getChoices() {
        return choices;
    }

    public List<String> getChoiceValues() {
        return choices.stream().map(ChoiceItem::getValue).toList();
    }

    @Override
    public Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected List<String> checkType(Object value) {
        List<String> allowed = getChoiceValues();
        if (getType() == VariableType.CHOICE) {
            if (!(value instanceof String) || !allowed.contains(value)) {
                return List.of(typeError("one of: " + allowed));
            }
            return List.of();
        }
        if (!(value instanceof List<?> selected)) {
            return List.of(typeError("list"));
        }
        List<String> errors = new ArrayList<>();
        for (Object item : selected) {
            if (!allowed.contains(item)) {
                errors.add("Invalid choice '" + item + "' for variable '" + getName() + "'. Must be one of: " + allowed);
            }
        }
        return errors;
    }

    @Override
    protected String promptSuffix() {
        String labels = choices.stream().map(ChoiceItem::getDisplayLabel).collect(Collectors.joining(", "));
        return getType() == VariableType.MULTICHOICE
                ? " (multiple allowed: " + labels + ")"
                : " (" + labels + ")";
    }
}
