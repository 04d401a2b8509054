package com.scaffold.generator.render;

import com.scaffold.generator.exception.RenderingException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlaceholderRendererTest {

    private final PlaceholderRenderer renderer = new PlaceholderRenderer();

    private static final Map<String, Object> VARS = Map.of(
            "project_name", "My Cool App",
            "use_docker", true,
            "port", 8080,
            "features", List.of("auth", "cache"));

    @Test
    void testSubstitutesVariables() {
        assertThat(renderer.render("name={{project_name}} port={{ port }}", VARS))
                .isEqualTo("name=My Cool App port=8080");
        assertThat(renderer.render("{{ use_docker }} / {{ features }}", VARS)).isEqualTo("true / auth, cache");
    }

    @Test
    void testFiltersChain() {
        assertThat(renderer.render("{{ project_name | snake_case }}", VARS)).isEqualTo("my_cool_app");
        assertThat(renderer.render("{{ project_name | kebab_case | upper }}", VARS)).isEqualTo("MY-COOL-APP");
        assertThat(renderer.render("{{ project_name|pascal_case }}", VARS)).isEqualTo("MyCoolApp");
        assertThat(renderer.render("{{ project_name | camel_case }}", VARS)).isEqualTo("myCoolApp");
    }

    @Test
    void testExpressionsInsidePlaceholders() {
        assertThat(renderer.render("{{ port > 1024 }}", VARS)).isEqualTo("true");
        assertThat(renderer.render("{{ 'auth' in features }}", VARS)).isEqualTo("true");
    }

    @Test
    void testStrictRenderingFailsOnUndefinedVariable() {
        assertThatThrownBy(() -> renderer.render("Hello {{ nobody }}", VARS))
                .isInstanceOf(RenderingException.class)
                .hasMessageContaining("Undefined variable 'nobody'");
    }

    @Test
    void testLenientRenderingUsesEmptyString() {
        assertThat(renderer.renderLenient("[{{ nobody }}]", VARS)).isEqualTo("[]");
    }

    @Test
    void testUnknownFilterFails() {
        assertThatThrownBy(() -> renderer.render("{{ project_name | shout }}", VARS))
                .isInstanceOf(RenderingException.class)
                .hasMessageContaining("Unknown filter 'shout'");
    }

    @Test
    void testRawBlocksCopiedVerbatim() {
        String text = "{{ port }} {% raw %}{{ not_a_variable }}{% endraw %} {{ port }}";

        assertThat(renderer.render(text, VARS)).isEqualTo("8080 {{ not_a_variable }} 8080");
        assertThat(renderer.findReferences(text)).containsExactly("port");
    }

    @Test
    void testReplacementTextIsLiteral() {
        assertThat(renderer.render("{{ price }}", Map.of("price", "$5 \\ each"))).isEqualTo("$5 \\ each");
    }

    @Test
    void testFindReferences() {
        assertThat(renderer.findReferences("{{ a }}/{{ b | upper }}/{{ a }}/{{ c == 1 }}")).containsExactly("a", "b");
        assertThat(renderer.containsPlaceholders("plain")).isFalse();
        assertThat(renderer.containsPlaceholders("{{ x }}")).isTrue();
    }

    @Test
    void testTextWithoutPlaceholdersUnchanged() {
        assertThat(renderer.render("no placeholders here", VARS)).isEqualTo("no placeholders here");
        assertThat(renderer.render("", VARS)).isEmpty();
        assertThat(PlaceholderRenderer.toText(null)).isEmpty();
    }

    @Test
    void testIfBlockSelectsSection() {
        assertThat(renderer.render("A{% if admin %}ADMIN{% endif %}B", Map.of("admin", false))).isEqualTo("AB");
        assertThat(renderer.render("A{% if admin %}ADMIN{% endif %}B", Map.of("admin", true))).isEqualTo("AADMINB");
    }

    @Test
    void testElifElseAndNestedBlocksOnTheirOwnLines() {
        String text = """
                start
                {% if kind == 'cli' %}
                cli
                {% elif kind == 'web' %}
                web
                  {% if tls %}
                  tls
                  {% endif %}
                {% else %}
                lib
                {% endif %}
                end
                """;

        assertThat(renderer.render(text, Map.of("kind", "web", "tls", true))).isEqualTo("start\nweb\n  tls\nend\n");
        assertThat(renderer.render(text, Map.of("kind", "lib", "tls", true))).isEqualTo("start\nlib\nend\n");
    }

    @Test
    void testTrimMarkersRemoveSurroundingWhitespace() {
        assertThat(renderer.render("a  {%- if x -%}  b  {%- endif -%}  c", Map.of("x", true))).isEqualTo("abc");
    }

    @Test
    void testMalformedIfBlocksFail() {
        assertThatThrownBy(() -> renderer.render("{% if port %}open", VARS))
                .isInstanceOf(RenderingException.class)
                .hasMessageContaining("Unclosed");
        assertThatThrownBy(() -> renderer.render("text{% endif %}", VARS))
                .isInstanceOf(RenderingException.class)
                .hasMessageContaining("without a matching");
        assertThatThrownBy(() -> renderer.render("{% if nobody %}x{% endif %}", VARS))
                .isInstanceOf(RenderingException.class)
                .hasMessageContaining("Undefined variable 'nobody'");
    }

    @Test
    void testDefaultFilter() {
        assertThat(renderer.render("{{ nobody | default('n/a') }}", VARS)).isEqualTo("n/a");
        assertThat(renderer.render("{{ port | default(1) }}", VARS)).isEqualTo("8080");
        assertThat(renderer.render("{{ nobody | default('x') | upper }}", VARS)).isEqualTo("X");
        assertThat(renderer.render("[{{ nobody | default }}]", VARS)).isEqualTo("[]");
        assertThat(renderer.evaluate(" init_git | default(true) ", VARS, true)).isEqualTo(true);
    }

    @Test
    void testPipeInsideQuotedStringIsNotAFilter() {
        assertThat(renderer.render("{{ sep == 'a|b' }}", Map.of("sep", "a|b"))).isEqualTo("true");
        assertThat(renderer.render("{{ \"x|y\" | upper }}", VARS)).isEqualTo("X|Y");
        assertThat(PlaceholderRenderer.splitFilters(" name | default('a|b') | upper"))
                .containsExactly(" name ", " default('a|b') ", " upper");
    }

    @Test
    void testFindConditionsAndDefaultedReferences() {
        String text = "{% if a and b %}{{ c | default('') }}{% elif d %}{% endif %}{% raw %}{% if e %}{% endraw %}";

        assertThat(renderer.findConditions(text)).containsExactly("a and b", "d");
        assertThat(renderer.findReferences(text)).isEmpty();
    }
}
