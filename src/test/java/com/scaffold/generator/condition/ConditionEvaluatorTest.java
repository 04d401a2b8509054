package com.scaffold.generator.condition;

import com.scaffold.generator.model.structure.ConditionalExpression;
import com.scaffold.generator.model.variable.ConditionOperator;
import com.scaffold.generator.model.variable.ConditionalLogic;
import com.scaffold.generator.model.variable.TextVariable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static final Map<String, Object> VARS = Map.of(
            "use_docker", true,
            "database", "postgres",
            "port", 8080,
            "features", List.of("auth", "cache"),
            "empty_list", List.of(),
            "mode", "yes");

    private static ConditionalLogic logic(String variable, ConditionOperator operator, Object operand) {
        return ConditionalLogic.builder().variable(variable).operator(operator).operand(operand).build();
    }

    @Test
    void testStructuredOperators() {
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.EQUALS, "postgres"), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.NOT_EQUALS, "postgres"), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("port", ConditionOperator.GREATER_THAN, 1024), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("port", ConditionOperator.LESS_OR_EQUAL, 8080.0), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.IN, List.of("mysql", "postgres")), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.NOT_IN, List.of("mysql")), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("features", ConditionOperator.CONTAINS, "auth"), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("features", ConditionOperator.NOT_CONTAINS, "queue"), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.STARTS_WITH, "post"), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.ENDS_WITH, "sql"), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("empty_list", ConditionOperator.IS_EMPTY, null), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("features", ConditionOperator.IS_NOT_EMPTY, null), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.MATCHES, "^post"), VARS)).isTrue();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.NOT_MATCHES, "mysql"), VARS)).isTrue();
    }

    @Test
    void testAbsentVariableIsFalse() {
        assertThat(evaluator.evaluate(logic("missing", ConditionOperator.EQUALS, null), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("missing", ConditionOperator.IS_EMPTY, null), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("missing", ConditionOperator.NOT_EQUALS, "x"), VARS)).isFalse();
    }

    @Test
    void testTypeMismatchYieldsFalse() {
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.LESS_THAN, 10), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("port", ConditionOperator.IN, 8080), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("port", ConditionOperator.CONTAINS, 8), VARS)).isFalse();
        assertThat(evaluator.evaluate(logic("database", ConditionOperator.MATCHES, "[broken"), VARS)).isFalse();
    }

    @Test
    void testVisibilityComposition() {
        TextVariable variable = TextVariable.builder()
                .name("docker_image")
                .description("Docker image")
                .showIf(List.of(logic("use_docker", ConditionOperator.EQUALS, true)))
                .hideIf(List.of(logic("database", ConditionOperator.EQUALS, "sqlite")))
                .build();

        Map<String, Object> vars = new HashMap<>(VARS);
        assertThat(evaluator.isVisible(variable, vars)).isTrue();

        vars.put("database", "sqlite");
        assertThat(evaluator.isVisible(variable, vars)).isFalse();

        vars.put("database", "postgres");
        vars.put("use_docker", false);
        assertThat(evaluator.isVisible(variable, vars)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({"true, true", "TRUE, true", "1, true", "yes, true", "On, true",
            "false, false", "0, false", "no, false", "OFF, false", "'', false"})
    void testLiteralTokens(String condition, boolean expected) {
        assertThat(evaluator.evaluate(condition, Map.of())).isEqualTo(expected);
    }

    @Test
    void testPlaceholderConditions() {
        assertThat(evaluator.evaluate("{{ use_docker }}", VARS)).isTrue();
        assertThat(evaluator.evaluate("{{ empty_list }}", VARS)).isFalse();
        assertThat(evaluator.evaluate("{{ mode }}", VARS)).isTrue();
        assertThat(evaluator.evaluate("{{ missing }}", VARS)).isFalse();
        assertThat(evaluator.evaluate("{{ database == 'postgres' }}", VARS)).isTrue();
        // filtered output "POSTGRES" is then read as an expression naming no variable
        assertThat(evaluator.evaluate("{{ database | upper }}", VARS)).isFalse();
    }

    @Test
    void testDefaultFilterInConditions() {
        Map<String, Object> vars = Map.of("init_git", false);

        assertThat(evaluator.evaluate("{{ init_git | default(true) }}", Map.of("init_git", true))).isTrue();
        assertThat(evaluator.evaluate("{{ init_git | default(true) }}", Map.of())).isTrue();
        assertThat(evaluator.evaluate("{{ init_git | default(true) }}", vars)).isFalse();
        assertThat(evaluator.evaluate("{{ sep == 'a|b' }}", Map.of("sep", "a|b"))).isTrue();
    }

    @Test
    void testRenderedTextReevaluated() {
        Map<String, Object> vars = Map.of("flag", "no", "db", "postgres");

        assertThat(evaluator.evaluate("{{ flag }}", vars)).isFalse();
        // renders to "'postgres' == 'postgres'"
        assertThat(evaluator.evaluate("'{{ db }}' == 'postgres'", vars)).isTrue();
    }

    @Test
    void testBareExpressions() {
        assertThat(evaluator.evaluate("use_docker and 'auth' in features", VARS)).isTrue();
        assertThat(evaluator.evaluate("port < 1024", VARS)).isFalse();
        assertThat(evaluator.evaluate("missing", VARS)).isFalse();
        assertThat(evaluator.evaluate(ConditionalExpression.of("not use_docker"), VARS)).isFalse();
        assertThat(evaluator.evaluate((ConditionalExpression) null, VARS)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"__import__('os').system('rm -rf /')", "open('/etc/passwd')", "a +", "{{ oops( }}"})
    void testUnevaluableConditionsAreFalse(String condition) {
        assertThat(evaluator.evaluate(condition, VARS)).isFalse();
    }
}
