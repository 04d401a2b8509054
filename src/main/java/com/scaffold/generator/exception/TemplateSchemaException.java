package com.scaffold.generator.exception;

/**
 * Structural problem found while constructing a schema object.
 * The template that produced it cannot be used at all.
 */
public class TemplateSchemaException extends TemplateEngineException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public TemplateSchemaException(String message) {
        this(null, message);
    }

    public TemplateSchemaException(String field, String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    /**
     * Dotted path of the offending field, or {@code null} when not known.
     */
    public String getField() {
        return field;
    }

    /**
     * Re-raises this error with a parent path prepended to the field.
     */
    public TemplateSchemaException under(String parentPath) {
        String path = field == null ? parentPath : parentPath + "." + field;
        String bare = field == null ? getMessage() : getMessage().substring(field.length() + 2);
        TemplateSchemaException nested = new TemplateSchemaException(path, bare);
        nested.setStackTrace(getStackTrace());
        return nested;
    }
}
