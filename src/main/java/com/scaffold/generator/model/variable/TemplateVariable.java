package com.scaffold.generator.model.variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.SchemaRules;

import lombok.Getter;

/**
 * Base of the closed variable hierarchy. Each {@link VariableType} has exactly one
 * concrete subclass carrying only the fields that type needs:
 * <ul>
 *   <li>{@link TextVariable}: string, email, url, path</li>
 *   <li>{@link BooleanVariable}: boolean</li>
 *   <li>{@link NumberVariable}: integer, float</li>
 *   <li>{@link ChoiceVariable}: choice, multichoice</li>
 *   <li>{@link ListVariable}: list</li>
 * </ul>
 * Constructors are package-private so the set of variants stays closed.
 */
@Getter
public abstract class TemplateVariable {

    private final String name;
    private final VariableType type;
    private final String description;
    private final boolean required;
    private final String prompt;
    private final String helpText;
    private final List<ValidationRule> validationRules;

    /** All must hold for the variable to be shown. */
    private final List<ConditionalLogic> showIf;

    /** Any holding hides the variable. */
    private final List<ConditionalLogic> hideIf;

    private final List<StringFilter> filters;

    TemplateVariable(String name, VariableType type, String description, Boolean required,
                     String prompt, String helpText, List<ValidationRule> validationRules,
                     List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        this.name = SchemaRules.requireIdentifier("name", name);
        if (type == null) {
            throw new TemplateSchemaException("type", "variable type is required");
        }
        this.type = type;
        this.description = SchemaRules.requireText("description", description, 200);
        this.required = required == null || required;
        this.prompt = prompt;
        this.helpText = helpText;
        this.validationRules = SchemaRules.copyOrEmpty(validationRules);
        this.showIf = SchemaRules.copyOrEmpty(showIf);
        this.hideIf = SchemaRules.copyOrEmpty(hideIf);
        this.filters = SchemaRules.copyOrEmpty(filters);
    }

    /**
     * Default value, already checked against the declared type, or {@code null}.
     */
    public abstract Object getDefaultValue();

    /**
     * Checks that a value has this variable's declared type.
     *
     * @return type errors, empty when the value is acceptable
     */
    protected abstract List<String> checkType(Object value);

    public boolean hasDefault() {
        return getDefaultValue() != null;
    }

    public boolean hasVisibilityConditions() {
        return !showIf.isEmpty() || !hideIf.isEmpty();
    }

    /**
     * Type-checks a value, then applies the validation rules in order.
     * Only the first failing rule is reported.
     */
    public List<String> validateValue(Object value) {
        List<String> typeErrors = checkType(value);
        if (!typeErrors.isEmpty()) {
            return typeErrors;
        }
        for (ValidationRule rule : validationRules) {
            Optional<String> failure = rule.check(name, value);
            if (failure.isPresent()) {
                return List.of(failure.get());
            }
        }
        return List.of();
    }

    /**
     * Applies the declared filters to a string value, or to every string of a list value.
     */
    public Object applyFilters(Object value) {
        if (filters.isEmpty()) {
            return value;
        }
        if (value instanceof String s) {
            return filterString(s);
        }
        if (value instanceof List<?> list) {
            List<Object> filtered = new ArrayList<>(list.size());
            for (Object item : list) {
                filtered.add(item instanceof String s ? filterString(s) : item);
            }
            return List.copyOf(filtered);
        }
        return value;
    }

    public String getPromptText() {
        if (prompt != null) {
            return prompt;
        }
        return "Enter " + description.toLowerCase(Locale.ROOT) + promptSuffix();
    }

    protected String promptSuffix() {
        return ":";
    }

    /**
     * Fails construction when a default does not match the declared type.
     * Subclasses call this once their own fields are assigned.
     */
    protected final Object requireDefaultMatchesType(Object defaultValue) {
        if (defaultValue == null) {
            return null;
        }
        List<String> errors = checkType(defaultValue);
        if (!errors.isEmpty()) {
            throw new TemplateSchemaException("default",
                    "default value for " + type.getValue() + " variable '" + name + "' is invalid: " + errors.get(0));
        }
        return defaultValue;
    }

    protected String typeError(String expected) {
        return "Variable '" + name + "' must be " + expected;
    }

    private String filterString(String value) {
        String result = value;
        for (StringFilter filter : filters) {
            result = filter.apply(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ": " + type.getValue() + ")";
    }
}
