package com.scaffold.generator.model.variable;

import com.scaffold.generator.exception.TemplateSchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TemplateVariableTest {

    @Test
    void testDefaultMustMatchType() {
        assertThatThrownBy(() -> NumberVariable.builder()
                .name("port").type(VariableType.INTEGER).description("Port").defaultValue("eighty").build())
                .isInstanceOf(TemplateSchemaException.class)
                .hasMessageStartingWith("default:")
                .hasMessageContaining("must be integer");
    }

    @Test
    void testDefaultTypeCheckedBeforeRules() {
        // a bad default is a schema error even when a rule would also reject it
        assertThatThrownBy(() -> TextVariable.builder()
                .name("contact").type(VariableType.EMAIL).description("Contact").defaultValue("nobody")
                .validationRules(List.of(ValidationRule.builder().kind(RuleKind.MIN_LENGTH).operand(20).build()))
                .build())
                .isInstanceOf(TemplateSchemaException.class)
                .hasMessageContaining("valid email address");
    }

    @Test
    void testRequiredDefaultsToTrue() {
        TextVariable variable = TextVariable.builder().name("name").description("Name").build();
        assertThat(variable.isRequired()).isTrue();
        assertThat(variable.getType()).isEqualTo(VariableType.STRING);
    }

    @Test
    void testInvalidIdentifierRejected() {
        assertThatThrownBy(() -> TextVariable.builder().name("1abc").description("Bad").build())
                .hasMessageStartingWith("name:");
        assertThatThrownBy(() -> TextVariable.builder().name("has-dash").description("Bad").build())
                .hasMessageStartingWith("name:");
    }

    @Test
    void testChoiceNeedsTwoChoices() {
        assertThatThrownBy(() -> ChoiceVariable.builder()
                .name("db").description("Database").choices(List.of(ChoiceItem.of("postgres"))).build())
                .hasMessageContaining("at least 2 choices required");
        assertThatThrownBy(() -> ChoiceVariable.builder().name("db").description("Database").build())
                .hasMessageContaining("choices must be provided");
    }

    @Test
    void testChoiceDefaultMustBeAChoice() {
        assertThatThrownBy(() -> ChoiceVariable.builder()
                .name("db").description("Database")
                .choices(List.of(ChoiceItem.of("postgres"), ChoiceItem.of("sqlite")))
                .defaultValue("mysql")
                .build())
                .isInstanceOf(TemplateSchemaException.class);
    }

    @Test
    void testMultichoiceValidatesEachItem() {
        ChoiceVariable features = ChoiceVariable.builder()
                .name("features").type(VariableType.MULTICHOICE).description("Features")
                .choices(List.of(ChoiceItem.of("auth"), ChoiceItem.of("cache"), ChoiceItem.of("queue")))
                .build();

        assertThat(features.validateValue(List.of("auth", "queue"))).isEmpty();
        assertThat(features.validateValue(List.of("auth", "email")))
                .containsExactly("Invalid choice 'email' for variable 'features'. Must be one of: [auth, cache, queue]");
        assertThat(features.validateValue("auth")).containsExactly("Variable 'features' must be list");
    }

    @Test
    void testEmailAndUrlValidation() {
        TextVariable email = TextVariable.builder().name("email").type(VariableType.EMAIL).description("Email").build();
        TextVariable url = TextVariable.builder().name("homepage").type(VariableType.URL).description("Homepage").build();

        assertThat(email.validateValue("dev@example.org")).isEmpty();
        assertThat(email.validateValue("dev@example")).isNotEmpty();
        assertThat(url.validateValue("https://example.org")).isEmpty();
        assertThat(url.validateValue("ftp://example.org")).isNotEmpty();
    }

    @Test
    void testOnlyFirstFailingRuleReported() {
        TextVariable name = TextVariable.builder()
                .name("name").description("Name")
                .validationRules(List.of(
                        ValidationRule.builder().kind(RuleKind.MIN_LENGTH).operand(5).message("too short").build(),
                        ValidationRule.builder().kind(RuleKind.PATTERN).operand("^[a-z]+$").build()))
                .build();

        assertThat(name.validateValue("AB")).containsExactly("too short");
        assertThat(name.validateValue("ABCDEF")).containsExactly("Variable 'name' must match pattern: ^[a-z]+$");
        assertThat(name.validateValue("abcdef")).isEmpty();
    }

    @Test
    void testNumericBoundsAndItemCounts() {
        NumberVariable workers = NumberVariable.builder()
                .name("workers").description("Workers")
                .validationRules(List.of(
                        ValidationRule.builder().kind(RuleKind.MIN_VALUE).operand(1).build(),
                        ValidationRule.builder().kind(RuleKind.MAX_VALUE).operand(16).build()))
                .build();
        ListVariable hosts = ListVariable.builder()
                .name("hosts").description("Hosts")
                .validationRules(List.of(ValidationRule.builder().kind(RuleKind.MAX_ITEMS).operand(2).build()))
                .build();

        assertThat(workers.validateValue(0)).containsExactly("Variable 'workers' must be at least 1");
        assertThat(workers.validateValue(17)).containsExactly("Variable 'workers' must be at most 16");
        assertThat(workers.validateValue(8)).isEmpty();
        assertThat(workers.validateValue(2.5)).containsExactly("Variable 'workers' must be integer");
        assertThat(hosts.validateValue(List.of("a", "b", "c"))).containsExactly("Variable 'hosts' must have at most 2 items");
    }

    @Test
    void testInvalidRuleOperandsRejected() {
        assertThatThrownBy(() -> ValidationRule.builder().kind(RuleKind.PATTERN).operand("[unclosed").build())
                .hasMessageContaining("invalid regular expression");
        assertThatThrownBy(() -> ValidationRule.builder().kind(RuleKind.MIN_LENGTH).operand(-1).build())
                .hasMessageContaining("non-negative");
        assertThatThrownBy(() -> ValidationRule.builder().kind(RuleKind.MAX_VALUE).operand("ten").build())
                .hasMessageContaining("numeric value");
    }

    @Test
    void testFiltersAppliedInOrder() {
        TextVariable module = TextVariable.builder()
                .name("module").description("Module")
                .filters(List.of(StringFilter.STRIP, StringFilter.SNAKE_CASE))
                .build();
        ListVariable names = ListVariable.builder()
                .name("names").description("Names")
                .filters(List.of(StringFilter.UPPER))
                .build();

        assertThat(module.applyFilters("  MyProject Name ")).isEqualTo("my_project_name");
        assertThat(names.applyFilters(List.of("a", "b"))).isEqualTo(List.of("A", "B"));
        assertThat(module.applyFilters(42)).isEqualTo(42);
    }

    @Test
    void testPromptText() {
        BooleanVariable docker = BooleanVariable.builder().name("use_docker").description("Use Docker").build();
        TextVariable custom = TextVariable.builder().name("name").description("Name").prompt("Project name?").build();

        assertThat(docker.getPromptText()).isEqualTo("Enter use docker (y/n)");
        assertThat(custom.getPromptText()).isEqualTo("Project name?");
    }
}
