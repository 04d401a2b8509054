package com.scaffold.generator.condition;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.exception.TemplateEngineException;
import com.scaffold.generator.model.structure.ConditionalExpression;
import com.scaffold.generator.model.variable.ConditionalLogic;
import com.scaffold.generator.model.variable.TemplateVariable;
import com.scaffold.generator.render.PlaceholderRenderer;

/**
 * Evaluates variable visibility conditions and structural item conditions
 * against a resolved variable map. Never throws: anything that cannot be
 * evaluated counts as {@code false}.
 */
public class ConditionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "off", "");

    /** A condition consisting of exactly one placeholder without filters. */
    private static final Pattern SINGLE_PLACEHOLDER = Pattern.compile("^\\{\\{([^|{}]*)}}$");

    private final PlaceholderRenderer renderer;

    public ConditionEvaluator() {
        this(new PlaceholderRenderer());
    }

    public ConditionEvaluator(PlaceholderRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * A variable is shown when every show_if condition holds and no hide_if condition holds.
     */
    public boolean isVisible(TemplateVariable variable, Map<String, ?> variables) {
        for (ConditionalLogic condition : variable.getShowIf()) {
            if (!evaluate(condition, variables)) {
                log.debug("Variable '{}' hidden: show_if [{}] does not hold", variable.getName(), condition);
                return false;
            }
        }
        for (ConditionalLogic condition : variable.getHideIf()) {
            if (evaluate(condition, variables)) {
                log.debug("Variable '{}' hidden: hide_if [{}] holds", variable.getName(), condition);
                return false;
            }
        }
        return true;
    }

    /**
     * Structured condition. An absent variable makes the condition false.
     */
    public boolean evaluate(ConditionalLogic condition, Map<String, ?> variables) {
        if (!variables.containsKey(condition.getVariable())) {
            return false;
        }
        Object value = variables.get(condition.getVariable());
        Object operand = condition.getOperand();

        try {
            return switch (condition.getOperator()) {
                case EQUALS -> ValueComparator.looselyEquals(value, operand);
                case NOT_EQUALS -> !ValueComparator.looselyEquals(value, operand);
                case LESS_THAN -> ValueComparator.compare(value, operand).map(c -> c < 0).orElse(false);
                case LESS_OR_EQUAL -> ValueComparator.compare(value, operand).map(c -> c <= 0).orElse(false);
                case GREATER_THAN -> ValueComparator.compare(value, operand).map(c -> c > 0).orElse(false);
                case GREATER_OR_EQUAL -> ValueComparator.compare(value, operand).map(c -> c >= 0).orElse(false);
                case IN -> isContainer(operand) && ValueComparator.contains(operand, value);
                case NOT_IN -> isContainer(operand) && !ValueComparator.contains(operand, value);
                case CONTAINS -> isContainer(value) && ValueComparator.contains(value, operand);
                case NOT_CONTAINS -> isContainer(value) && !ValueComparator.contains(value, operand);
                case STARTS_WITH -> String.valueOf(value).startsWith(String.valueOf(operand));
                case ENDS_WITH -> String.valueOf(value).endsWith(String.valueOf(operand));
                case IS_EMPTY -> ValueComparator.isEmpty(value);
                case IS_NOT_EMPTY -> !ValueComparator.isEmpty(value);
                case MATCHES -> matches(operand, value);
                case NOT_MATCHES -> !matches(operand, value);
            };
        } catch (PatternSyntaxException e) {
            log.warn("Invalid pattern in condition [{}]: {}", condition, e.getDescription());
            return false;
        }
    }

    public boolean evaluate(ConditionalExpression condition, Map<String, ?> variables) {
        return condition == null || evaluate(condition.getExpression(), variables);
    }

    /**
     * String condition: boolean literal token, placeholder template or boolean expression.
     */
    public boolean evaluate(String condition, Map<String, ?> variables) {
        String trimmed = condition == null ? "" : condition.trim();
        Boolean literal = literalValue(trimmed);
        if (literal != null) {
            return literal;
        }

        try {
            Matcher single = SINGLE_PLACEHOLDER.matcher(trimmed);
            if (single.matches()) {
                return toBoolean(ExpressionParser.parse(single.group(1).trim()).evaluate(variables, false));
            }
            if (renderer.containsPlaceholders(trimmed)) {
                String rendered = renderer.renderLenient(trimmed, variables).trim();
                Boolean renderedLiteral = literalValue(rendered);
                if (renderedLiteral != null) {
                    return renderedLiteral;
                }
                return toBoolean(ExpressionParser.parse(rendered).evaluate(variables, false));
            }
            return toBoolean(ExpressionParser.parse(trimmed).evaluate(variables, false));
        } catch (TemplateEngineException e) {
            log.warn("Failed to evaluate condition '{}': {}", trimmed, e.getMessage());
            return false;
        }
    }

    /**
     * Maps a value to a condition result. Strings that are boolean tokens
     * count as that boolean; anything else uses truthiness.
     */
    private static boolean toBoolean(Object value) {
        if (value instanceof String s) {
            Boolean literal = literalValue(s.trim());
            if (literal != null) {
                return literal;
            }
        }
        return ValueComparator.isTruthy(value);
    }

    /**
     * Whether the text is one of the boolean tokens accepted as a condition on its own.
     */
    public static boolean isLiteralToken(String text) {
        return text != null && literalValue(text.trim()) != null;
    }

    private static Boolean literalValue(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(lower)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static boolean isContainer(Object value) {
        return value instanceof Collection<?> || value instanceof Map<?, ?> || value instanceof String;
    }

    private static boolean matches(Object pattern, Object value) {
        if (pattern == null || value == null) {
            return false;
        }
        return Pattern.compile(String.valueOf(pattern)).matcher(String.valueOf(value)).lookingAt();
    }
}
