package com.scaffold.generator.model.variable;

import java.util.List;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.SchemaRules;

import lombok.Builder;

/**
 * Free-text variable: string, email, url or path.
 */
public class TextVariable extends TemplateVariable {

    private final String defaultValue;

    @Builder
    public TextVariable(String name, VariableType type, String description, Object defaultValue, Boolean required,
                        String prompt, String helpText, List<ValidationRule> validationRules,
                        List<ConditionalLogic> showIf, List<ConditionalLogic> hideIf, List<StringFilter> filters) {
        super(name, type != null ? type : VariableType.STRING, description, required, prompt, helpText,
                validationRules, showIf, hideIf, filters);
        if (!getType().isText()) {
            throw new TemplateSchemaException("type", getType().getValue() + " is not a text type");
        }
        this.defaultValue = (String) requireDefaultMatchesType(defaultValue);
    }

    @Override
    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected List<String> checkType(Object value) {
        if (!(value instanceof String text)) {
            return List.of(typeError("string"));
        }
        return switch (getType()) {
            case EMAIL -> SchemaRules.EMAIL.matcher(text).matches()
                    ? List.of() : List.of(typeError("valid email address"));
            case URL -> SchemaRules.URL.matcher(text).matches()
                    ? List.of() : List.of(typeError("valid URL"));
            default -> List.of();
        };
    }
}
