package com.scaffold.generator.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;
import lombok.Value;

/**
 * Descriptive information about a template. Immutable once loaded.
 */
@Value
public class TemplateMetadata {

    public static final String DEFAULT_MIN_RUNTIME_VERSION = "3.9.6";

    String name;
    String description;
    String version;
    TemplateCategory category;
    List<String> tags;
    String author;
    String authorEmail;
    TemplateLicense license;
    Instant created;
    Instant updated;

    /**
     * Minimum version of the target runtime the generated project needs.
     */
    String minRuntimeVersion;

    List<OperatingSystem> compatibility;
    String documentationUrl;
    String sourceUrl;

    @Builder
    public TemplateMetadata(String name, String description, String version, TemplateCategory category,
                            List<String> tags, String author, String authorEmail, TemplateLicense license,
                            Instant created, Instant updated, String minRuntimeVersion,
                            List<OperatingSystem> compatibility, String documentationUrl, String sourceUrl) {
        this.name = SchemaRules.requireText("name", name, 100);
        this.description = SchemaRules.requireText("description", description, 500);
        this.version = SchemaRules.requireMatch("version", version, SchemaRules.SEMANTIC_VERSION,
                "a semantic version (X.Y.Z)");
        if (category == null) {
            throw new TemplateSchemaException("category", "is required");
        }
        this.category = category;
        this.tags = validateTags(tags);
        this.author = SchemaRules.requireText("author", author, 100);
        this.authorEmail = authorEmail == null ? null
                : SchemaRules.requireMatch("author_email", authorEmail, SchemaRules.EMAIL, "a valid email address");
        this.license = license != null ? license : TemplateLicense.MIT;
        this.created = created != null ? created : Instant.now();
        if (updated != null && updated.isBefore(this.created)) {
            throw new TemplateSchemaException("updated", "updated date must be after created date");
        }
        this.updated = updated;
        this.minRuntimeVersion = SchemaRules.requireMatch("min_runtime_version",
                minRuntimeVersion != null ? minRuntimeVersion : DEFAULT_MIN_RUNTIME_VERSION,
                SchemaRules.STRICT_VERSION, "in format X.Y.Z");
        this.compatibility = compatibility == null || compatibility.isEmpty()
                ? List.of(OperatingSystem.MACOS, OperatingSystem.LINUX, OperatingSystem.WINDOWS)
                : List.copyOf(compatibility);
        this.documentationUrl = documentationUrl;
        this.sourceUrl = sourceUrl;
    }

    /**
     * Identifier of the form {@code author/template-name}.
     */
    public String getTemplateId() {
        return author + "/" + name.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    public boolean isCompatibleWithRuntime(String runtimeVersion) {
        if (runtimeVersion == null || !SchemaRules.STRICT_VERSION.matcher(runtimeVersion).matches()) {
            return false;
        }
        int[] min = parseVersion(minRuntimeVersion);
        int[] actual = parseVersion(runtimeVersion);
        for (int i = 0; i < 3; i++) {
            if (actual[i] != min[i]) {
                return actual[i] > min[i];
            }
        }
        return true;
    }

    public boolean isCompatibleWithOs(OperatingSystem os) {
        return compatibility.contains(os);
    }

    private static int[] parseVersion(String version) {
        String[] parts = version.split("\\.");
        return new int[] {Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2])};
    }

    private static List<String> validateTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        for (String tag : tags) {
            String stripped = tag == null ? "" : tag.replace("-", "").replace("_", "");
            if (stripped.isEmpty() || !stripped.chars().allMatch(Character::isLetterOrDigit)) {
                throw new TemplateSchemaException("tags",
                        "tag '" + tag + "' must be alphanumeric (hyphens and underscores allowed)");
            }
            if (!tag.equals(tag.toLowerCase(Locale.ROOT))) {
                throw new TemplateSchemaException("tags", "tag '" + tag + "' must be lowercase");
            }
        }
        return List.copyOf(tags);
    }
}
