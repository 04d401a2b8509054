package com.scaffold.generator.exception;

/**
 * A template definition could not be read, parsed or constructed.
 */
public class TemplateLoadException extends TemplateEngineException {

    private static final long serialVersionUID = 1L;

    public TemplateLoadException(String message) {
        super(message);
    }

    public TemplateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
