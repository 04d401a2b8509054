package com.scaffold.generator.exception;

/**
 * Root of every failure raised by the scaffolding engine.
 */
public class TemplateEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateEngineException(String message) {
        super(message);
    }

    public TemplateEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
