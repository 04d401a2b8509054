package com.scaffold.generator.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates every missing-required and rule-violation message found in one
 * resolution pass.
 */
public class VariableResolutionException extends TemplateEngineException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;
    private final Map<String, List<String>> errorsByVariable;

    public VariableResolutionException(Map<String, List<String>> errorsByVariable) {
        super(buildMessage(errorsByVariable));
        this.errorsByVariable = copy(errorsByVariable);
        this.errors = this.errorsByVariable.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Messages keyed by variable name, in declaration order, for per-field display.
     */
    public Map<String, List<String>> getErrorsByVariable() {
        return errorsByVariable;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((name, messages) -> copy.put(name, List.copyOf(messages)));
        return Collections.unmodifiableMap(copy);
    }

    private static String buildMessage(Map<String, List<String>> errorsByVariable) {
        List<String> all = errorsByVariable.values().stream().flatMap(List::stream).toList();
        return "Variable resolution failed: " + String.join("; ", all);
    }
}
