package com.scaffold.generator.resolve;

import com.scaffold.generator.TestTemplates;
import com.scaffold.generator.exception.TemplateLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SystemVariablesTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-31T23:30:00Z"), ZoneOffset.UTC);

    @Test
    void testValuesFromClock() {
        Map<String, Object> values = SystemVariables
                .forTemplate(TestTemplates.metadata(), LicenseTextProvider.NONE, CLOCK)
                .asMap();

        assertThat(values)
                .containsEntry("current_year", 2024)
                .containsEntry("current_date", "2024-12-31")
                .containsEntry("generator_name", "scaffold-generator")
                .containsEntry("license_text", "")
                .containsKey("generator_version");
        assertThat(values.keySet()).isEqualTo(SystemVariables.NAMES);
    }

    @Test
    void testSystemValuesWin() {
        SystemVariables system = SystemVariables.forTemplate(TestTemplates.metadata(), m -> "MIT text", CLOCK);

        Map<String, Object> merged = system.mergeInto(Map.of("current_year", 1999, "name", "demo"));

        assertThat(merged)
                .containsEntry("current_year", 2024)
                .containsEntry("license_text", "MIT text")
                .containsEntry("name", "demo");
        assertThat(SystemVariables.isSystemVariable("license_text")).isTrue();
        assertThat(SystemVariables.isSystemVariable("name")).isFalse();
    }

    @Test
    void testFileLicenseText(@TempDir Path tempDir) throws Exception {
        Path file = Files.writeString(tempDir.resolve("LICENSE"), "Copyright (c) Tester");

        assertThat(new FileLicenseTextProvider(file).licenseText(TestTemplates.metadata()))
                .isEqualTo("Copyright (c) Tester");
        assertThatThrownBy(() -> new FileLicenseTextProvider(tempDir.resolve("absent"))
                .licenseText(TestTemplates.metadata()))
                .isInstanceOf(TemplateLoadException.class)
                .hasMessageStartingWith("Cannot read license file");
    }
}
