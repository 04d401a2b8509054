package com.scaffold.generator.model;

import com.scaffold.generator.exception.TemplateSchemaException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TemplateMetadataTest {

    private TemplateMetadata.TemplateMetadataBuilder base() {
        return TemplateMetadata.builder()
                .name("Flask API")
                .description("REST service")
                .version("2.1.0")
                .category(TemplateCategory.FLASK)
                .author("Jane Doe");
    }

    @Test
    void testDefaultsApplied() {
        TemplateMetadata metadata = base().build();

        assertThat(metadata.getLicense()).isEqualTo(TemplateLicense.MIT);
        assertThat(metadata.getMinRuntimeVersion()).isEqualTo("3.9.6");
        assertThat(metadata.getCompatibility())
                .containsExactly(OperatingSystem.MACOS, OperatingSystem.LINUX, OperatingSystem.WINDOWS);
        assertThat(metadata.getCreated()).isNotNull();
        assertThat(metadata.getTemplateId()).isEqualTo("Jane Doe/flask-api");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.0.0", "0.1.0-beta.1", "2.0.0+build.5", "1.0.0-rc1+exp"})
    void testAcceptsSemanticVersions(String version) {
        assertThat(base().version(version).build().getVersion()).isEqualTo(version);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.0", "v1.0.0", "1.0.0.0", ""})
    void testRejectsInvalidVersions(String version) {
        assertThatThrownBy(() -> base().version(version).build())
                .isInstanceOf(TemplateSchemaException.class)
                .hasMessageStartingWith("version:");
    }

    @Test
    void testRuntimeMinimumMustBeStrict() {
        assertThatThrownBy(() -> base().minRuntimeVersion("3.10.0-beta").build())
                .isInstanceOf(TemplateSchemaException.class)
                .hasMessageContaining("min_runtime_version");
    }

    @Test
    void testUpdatedBeforeCreatedRejected() {
        Instant created = Instant.parse("2024-03-01T00:00:00Z");
        assertThatThrownBy(() -> base().created(created).updated(created.minusSeconds(60)).build())
                .isInstanceOf(TemplateSchemaException.class)
                .hasMessageContaining("updated date must be after created date");
    }

    @Test
    void testTagsMustBeLowercaseAlphanumeric() {
        assertThat(base().tags(List.of("web-api", "rest_v2")).build().getTags()).containsExactly("web-api", "rest_v2");

        assertThatThrownBy(() -> base().tags(List.of("Web")).build())
                .hasMessageContaining("must be lowercase");
        assertThatThrownBy(() -> base().tags(List.of("web api")).build())
                .hasMessageContaining("must be alphanumeric");
    }

    @Test
    void testInvalidAuthorEmailRejected() {
        assertThatThrownBy(() -> base().authorEmail("not-an-email").build())
                .hasMessageStartingWith("author_email:");
    }

    @Test
    void testRuntimeCompatibility() {
        TemplateMetadata metadata = base().minRuntimeVersion("3.10.2").build();

        assertThat(metadata.isCompatibleWithRuntime("3.10.2")).isTrue();
        assertThat(metadata.isCompatibleWithRuntime("3.11.0")).isTrue();
        assertThat(metadata.isCompatibleWithRuntime("3.9.18")).isFalse();
        assertThat(metadata.isCompatibleWithRuntime("garbage")).isFalse();
    }

    @Test
    void testOsCompatibility() {
        TemplateMetadata metadata = base().compatibility(List.of(OperatingSystem.LINUX)).build();

        assertThat(metadata.isCompatibleWithOs(OperatingSystem.LINUX)).isTrue();
        assertThat(metadata.isCompatibleWithOs(OperatingSystem.WINDOWS)).isFalse();
    }
}
