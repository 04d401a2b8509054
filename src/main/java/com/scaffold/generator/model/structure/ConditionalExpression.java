package com.scaffold.generator.model.structure;

import com.scaffold.generator.condition.ExpressionException;
import com.scaffold.generator.condition.ExpressionParser;
import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Value;

/**
 * String condition attached to a directory or file.
 *
 * Accepted forms: a boolean literal token, a placeholder template such as
 * {@code "{{ use_tests }}"}, or a boolean expression such as
 * {@code "use_docker and not minimal"}. Bare expressions are parsed here so
 * syntax errors surface when the template is loaded.
 */
@Value
public class ConditionalExpression {

    String expression;

    public ConditionalExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new TemplateSchemaException("condition", "expression cannot be empty");
        }
        String trimmed = expression.trim();
        if (!isTemplated(trimmed)) {
            try {
                ExpressionParser.parse(trimmed);
            } catch (ExpressionException e) {
                throw new TemplateSchemaException("condition", "invalid condition '" + trimmed + "': " + e.getMessage());
            }
        }
        this.expression = trimmed;
    }

    public static ConditionalExpression of(String expression) {
        return new ConditionalExpression(expression);
    }

    public boolean isTemplated() {
        return isTemplated(expression);
    }

    private static boolean isTemplated(String text) {
        return text.contains("{{") && text.contains("}}");
    }

    @Override
    public String toString() {
        return expression;
    }
}
