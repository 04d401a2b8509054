package com.scaffold.generator.cli.values;

import com.scaffold.generator.TestTemplates;
import com.scaffold.generator.exception.TemplateLoadException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.parser.TemplateLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class VariableValueReaderTest {

    private static Template template;

    @TempDir
    Path tempDir;

    private final VariableValueReader reader = new VariableValueReader();

    @BeforeAll
    static void loadTemplate() {
        template = new TemplateLoader().load(TestTemplates.fixture("python-cli/template.yaml"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "YES", "y", "on", "1"})
    void testBooleanTrueTokens(String raw) {
        assertThat(reader.coerce(template, "use_docker", raw)).isEqualTo(Boolean.TRUE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "No", "n", "off", "0"})
    void testBooleanFalseTokens(String raw) {
        assertThat(reader.coerce(template, "use_docker", raw)).isEqualTo(Boolean.FALSE);
    }

    @Test
    void testCoerceByDeclaredType() {
        assertThat(reader.coerce(template, "max_workers", " 8 ")).isEqualTo(8);
        assertThat(reader.coerce(template, "max_workers", "4294967296")).isEqualTo(4294967296L);
        assertThat(reader.coerce(template, "features", "logging, tests,")).isEqualTo(List.of("logging", "tests"));
        assertThat(reader.coerce(template, "python_version", "3.11")).isEqualTo("3.11");
        assertThat(reader.coerce(template, "unknown", "42")).isEqualTo("42");
    }

    @Test
    void testUnparseableValuesPassThrough() {
        assertThat(reader.coerce(template, "max_workers", "many")).isEqualTo("many");
        assertThat(reader.coerce(template, "use_docker", "maybe")).isEqualTo("maybe");
    }

    @Test
    void testReadValuesFiles() throws Exception {
        Path yaml = Files.writeString(tempDir.resolve("values.yaml"), """
                project_name: Data Tool
                use_docker: true
                features: [logging, tests]
                """);
        Path json = Files.writeString(tempDir.resolve("values.json"), "{\"max_workers\": 12}");
        Path blank = Files.writeString(tempDir.resolve("blank.yml"), "\n");

        assertThat(reader.readValuesFile(yaml))
                .containsEntry("project_name", "Data Tool")
                .containsEntry("use_docker", true)
                .containsEntry("features", List.of("logging", "tests"));
        assertThat(reader.readValuesFile(json)).containsExactly(entry("max_workers", 12));
        assertThat(reader.readValuesFile(blank)).isEmpty();
    }

    @Test
    void testInlineValuesWin() throws Exception {
        Path yaml = Files.writeString(tempDir.resolve("values.yaml"), """
                project_name: From File
                max_workers: 2
                """);

        Map<String, Object> values = reader.collect(template, yaml, Map.of("max_workers", "16"));

        assertThat(values).containsEntry("project_name", "From File").containsEntry("max_workers", 16);
    }

    @Test
    void testUnreadableValuesFile() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("values.json"), "[1, 2");

        assertThatThrownBy(() -> reader.readValuesFile(broken))
                .isInstanceOf(TemplateLoadException.class)
                .hasMessageStartingWith("Failed to read values file");
        assertThatThrownBy(() -> reader.readValuesFile(tempDir.resolve("absent.yaml")))
                .isInstanceOf(TemplateLoadException.class);
    }
}
