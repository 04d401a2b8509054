package com.scaffold.generator.condition;

import com.scaffold.generator.exception.TemplateEngineException;

/**
 * A condition expression that cannot be tokenized, parsed or evaluated.
 */
public class ExpressionException extends TemplateEngineException {

    private static final long serialVersionUID = 1L;

    public ExpressionException(String message) {
        super(message);
    }
}
