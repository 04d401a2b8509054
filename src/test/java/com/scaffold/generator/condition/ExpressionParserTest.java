package com.scaffold.generator.condition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionTokenizer and ExpressionParser.
 */
class ExpressionParserTest {

    private static final Map<String, Object> VARS = Map.of(
            "use_docker", true,
            "minimal", false,
            "database", "postgres",
            "workers", 4,
            "features", List.of("auth", "cache"),
            "name", "");

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
            "use_docker; true",
            "not use_docker; false",
            "use_docker and not minimal; true",
            "minimal or database == 'postgres'; true",
            "database != 'postgres'; false",
            "workers >= 4 and workers < 10; true",
            "workers > 4.5; false",
            "'auth' in features; true",
            "'queue' not in features; true",
            "database in ['mysql', 'postgres']; true",
            "NOT minimal AND (workers == 4 OR minimal); true",
            "name; false",
            "missing; false",
            "missing == none; true",
            "workers < 'ten'; false"
    })
    void testEvaluate(String source, boolean expected) {
        assertThat(ExpressionParser.parse(source).test(VARS)).isEqualTo(expected);
    }

    @Test
    void testPrecedenceAndBindsTighterThanOr() {
        // true or (false and false)
        assertThat(ExpressionParser.parse("true or false and false").test(Map.of())).isTrue();
        assertThat(ExpressionParser.parse("(true or false) and false").test(Map.of())).isFalse();
    }

    @Test
    void testLiteralValues() {
        assertThat(ExpressionParser.parse("42").evaluate(Map.of(), true)).isEqualTo(42L);
        assertThat(ExpressionParser.parse("1.5").evaluate(Map.of(), true)).isEqualTo(1.5);
        assertThat(ExpressionParser.parse("\"double\"").evaluate(Map.of(), true)).isEqualTo("double");
        assertThat(ExpressionParser.parse("'it\\'s'").evaluate(Map.of(), true)).isEqualTo("it's");
        assertThat(ExpressionParser.parse("None").evaluate(Map.of(), true)).isNull();
        assertThat(ExpressionParser.parse("[1, 'a']").evaluate(Map.of(), true)).isEqualTo(List.of(1L, "a"));
    }

    @Test
    void testStrictModeRejectsUndefinedVariables() {
        Expression expression = ExpressionParser.parse("missing");

        assertThat(expression.evaluate(Map.of(), false)).isNull();
        assertThatThrownBy(() -> expression.evaluate(Map.of(), true))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("Undefined variable 'missing'");
    }

    @Test
    void testCollectVariables() {
        Set<String> names = new LinkedHashSet<>();
        ExpressionParser.parse("a and (b == 'x' or c in [d, 1])").collectVariables(names);

        assertThat(names).containsExactly("a", "b", "c", "d");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a and", "(a", "a == ", "a b", "'unterminated", "a = b", "__import__('os').system('ls')", "a; b"})
    void testSyntaxErrors(String source) {
        assertThatThrownBy(() -> ExpressionParser.parse(source)).isInstanceOf(ExpressionException.class);
    }
}
