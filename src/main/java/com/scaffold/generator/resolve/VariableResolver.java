package com.scaffold.generator.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.condition.ConditionEvaluator;
import com.scaffold.generator.exception.VariableResolutionException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.variable.TemplateVariable;

/**
 * Turns declared variables plus caller-supplied values into the resolved variable map.
 *
 * <p>Variables are processed in declaration order, so a visibility condition
 * sees only variables declared before it (and any context variables passed
 * in); a forward reference behaves as an absent variable. Hidden variables
 * are left out of the result. All problems across all variables are reported
 * together in one {@link VariableResolutionException}.
 */
public class VariableResolver {
    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    private final ConditionEvaluator conditionEvaluator;

    public VariableResolver() {
        this(new ConditionEvaluator());
    }

    public VariableResolver(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public Map<String, Object> resolve(Template template, Map<String, ?> supplied) {
        log.debug("Resolving variables for template: {}", template.getName());
        return resolve(template.getVariables(), supplied, Map.of());
    }

    public Map<String, Object> resolve(List<TemplateVariable> variables, Map<String, ?> supplied) {
        return resolve(variables, supplied, Map.of());
    }

    /**
     * @param context extra values visible to visibility conditions (e.g. system variables); not copied to the result
     */
    public Map<String, Object> resolve(List<TemplateVariable> variables, Map<String, ?> supplied,
                                       Map<String, ?> context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        Map<String, Object> scope = new LinkedHashMap<>(context);
        Map<String, List<String>> errors = new LinkedHashMap<>();

        for (TemplateVariable variable : variables) {
            String name = variable.getName();

            if (variable.hasVisibilityConditions() && !conditionEvaluator.isVisible(variable, scope)) {
                log.debug("Variable '{}' skipped due to condition", name);
                continue;
            }

            Object value;
            boolean fromUser = supplied.get(name) != null;
            if (fromUser) {
                value = supplied.get(name);
            } else if (variable.hasDefault()) {
                value = variable.getDefaultValue();
            } else if (variable.isRequired()) {
                addError(errors, name, "Required variable '" + name + "' not provided");
                continue;
            } else {
                value = null;
            }

            if (value != null) {
                List<String> problems = variable.validateValue(value);
                if (!problems.isEmpty()) {
                    problems.forEach(p -> addError(errors, name, "Variable '" + name + "': " + p));
                    continue;
                }
                value = variable.applyFilters(value);
            }

            resolved.put(name, value);
            scope.put(name, value);
            log.debug("Variable '{}' resolved to: {}{}", name, value, fromUser ? "" : " (default)");
        }

        if (!errors.isEmpty()) {
            VariableResolutionException failure = new VariableResolutionException(errors);
            log.debug("{}", failure.getMessage());
            throw failure;
        }

        supplied.keySet().stream()
                .filter(key -> variables.stream().noneMatch(v -> v.getName().equals(key)))
                .forEach(key -> log.debug("Ignoring value for undeclared variable '{}'", key));

        log.debug("Resolved {} variables", resolved.size());
        return Collections.unmodifiableMap(resolved);
    }

    private static void addError(Map<String, List<String>> errors, String name, String message) {
        errors.computeIfAbsent(name, k -> new ArrayList<>()).add(message);
    }
}
