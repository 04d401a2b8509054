package com.scaffold.generator.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.scaffold.generator.action.ActionPlan;
import com.scaffold.generator.render.RenderStats;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run. Domain failures are reported here rather than thrown.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private String templateName;

    private List<String> diagnostics;
    private List<String> warnings;

    /** Per-variable resolution errors, empty unless resolution failed. */
    private Map<String, List<String>> variableErrors;

    private Map<String, Object> variables;
    private RenderStats stats;
    private ActionPlan actionPlan;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
