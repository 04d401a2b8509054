package com.scaffold.generator.model.variable;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;
import lombok.Value;

/**
 * One selectable value of a choice or multichoice variable.
 */
@Value
public class ChoiceItem {

    String value;
    String label;
    String description;

    @Builder
    public ChoiceItem(String value, String label, String description) {
        if (value == null || value.isEmpty()) {
            throw new TemplateSchemaException("value", "choice value must not be empty");
        }
        this.value = value;
        this.label = label;
        this.description = description;
    }

    public static ChoiceItem of(String value) {
        return new ChoiceItem(value, null, null);
    }

    public String getDisplayLabel() {
        return label != null ? label : value;
    }
}
