package com.scaffold.generator.exception;

import com.scaffold.generator.render.RenderStats;

/**
 * Fatal failure of a rendering run.
 */
public class RenderingException extends TemplateEngineException {

    private static final long serialVersionUID = 1L;

    private final transient RenderStats stats;

    public RenderingException(String message) {
        this(message, null, null);
    }

    public RenderingException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RenderingException(String message, RenderStats stats, Throwable cause) {
        super(message, cause);
        this.stats = stats;
    }

    /**
     * Statistics collected before the failure, or {@code null} when the run
     * never started writing.
     */
    public RenderStats getStats() {
        return stats;
    }
}
