package com.scaffold.generator.model.variable;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;
import lombok.Value;

/**
 * Structured comparison between a resolved variable and an operand.
 * Pure value; evaluated by {@code ConditionEvaluator}.
 */
@Value
public class ConditionalLogic {

    String variable;
    ConditionOperator operator;
    Object operand;

    @Builder
    public ConditionalLogic(String variable, ConditionOperator operator, Object operand) {
        if (variable == null || variable.isBlank()) {
            throw new TemplateSchemaException("variable", "condition must name a variable");
        }
        if (operator == null) {
            throw new TemplateSchemaException("operator", "condition operator is required");
        }
        this.variable = variable.trim();
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public String toString() {
        return operator.isUnary()
                ? variable + " " + operator.getSymbol()
                : variable + " " + operator.getSymbol() + " " + operand;
    }
}
