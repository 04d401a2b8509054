package com.scaffold.generator.model.structure;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.SchemaRules;

import lombok.Builder;
import lombok.Value;

/**
 * A template shipped inside the template definition: FreeMarker for
 * {@code .ftl} names, placeholder syntax ({@code {{ }}} and
 * {@code {% if %}}) for {@code .j2} names.
 */
@Value
public class TemplateFile {

    public static final String FREEMARKER_SUFFIX = ".ftl";
    public static final String PLACEHOLDER_SUFFIX = ".j2";

    String name;
    String content;
    FileEncoding encoding;
    String description;

    /** Where the standalone pass writes it; defaults to the name without suffix. */
    String outputPath;

    @Builder
    public TemplateFile(String name, String content, FileEncoding encoding, String description, String outputPath) {
        if (name == null || name.isBlank()) {
            throw new TemplateSchemaException("name", "template file name cannot be empty");
        }
        String trimmed = name.trim();
        if (!trimmed.endsWith(FREEMARKER_SUFFIX) && !trimmed.endsWith(PLACEHOLDER_SUFFIX)) {
            throw new TemplateSchemaException("name", "template file name must end with '" + FREEMARKER_SUFFIX
                    + "' or '" + PLACEHOLDER_SUFFIX + "': " + trimmed);
        }
        SchemaRules.requireRelativePath("name", trimmed);
        if (content == null) {
            throw new TemplateSchemaException("content", "template file '" + trimmed + "' has no content");
        }
        this.name = trimmed;
        this.content = content;
        this.encoding = encoding != null ? encoding : FileEncoding.UTF8;
        this.description = description;
        this.outputPath = SchemaRules.requireRelativePath("output_path", outputPath);
    }

    public boolean usesPlaceholderSyntax() {
        return name.endsWith(PLACEHOLDER_SUFFIX);
    }

    public String getOutputName() {
        String suffix = usesPlaceholderSyntax() ? PLACEHOLDER_SUFFIX : FREEMARKER_SUFFIX;
        return name.substring(0, name.length() - suffix.length());
    }

    /**
     * Explicit output path, or the name without its suffix.
     */
    public String getEffectiveOutputPath() {
        return outputPath != null ? outputPath : getOutputName();
    }
}
