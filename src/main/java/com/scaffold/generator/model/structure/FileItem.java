package com.scaffold.generator.model.structure;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.SchemaRules;

import lombok.Builder;
import lombok.Value;

/**
 * A file in the template tree. Exactly one content source is set.
 */
@Value
public class FileItem {

    public static final String DEFAULT_PERMISSIONS = "644";

    /** May embed placeholders. */
    String name;

    String content;
    String templateFile;
    String sourceFile;

    /** Base64-encoded bytes. */
    String binaryContent;

    FileEncoding encoding;
    String permissions;
    boolean executable;
    ConditionalExpression condition;

    @Builder
    public FileItem(String name, String content, String templateFile, String sourceFile, String binaryContent,
                    FileEncoding encoding, String permissions, boolean executable, ConditionalExpression condition) {
        this.name = SchemaRules.requireItemName("name", name, true);
        this.content = content;
        this.templateFile = SchemaRules.requireRelativePath("template_file", templateFile);
        this.sourceFile = SchemaRules.requireRelativePath("source_file", sourceFile);
        if (binaryContent != null) {
            try {
                Base64.getMimeDecoder().decode(binaryContent);
            } catch (IllegalArgumentException e) {
                throw new TemplateSchemaException("binary_content", "is not valid base64: " + e.getMessage());
            }
        }
        this.binaryContent = binaryContent;
        this.encoding = encoding != null ? encoding : FileEncoding.UTF8;
        this.permissions = SchemaRules.requirePermissions("permissions",
                permissions != null ? permissions : DEFAULT_PERMISSIONS);
        this.executable = executable;
        this.condition = condition;
        requireSingleContentSource();
    }

    public ContentSource getContentSource() {
        if (content != null) {
            return ContentSource.INLINE;
        }
        if (templateFile != null) {
            return ContentSource.TEMPLATE_FILE;
        }
        if (sourceFile != null) {
            return ContentSource.SOURCE_FILE;
        }
        return ContentSource.BINARY;
    }

    /**
     * Whether the content is written byte-for-byte without placeholder substitution.
     */
    public boolean isBinary() {
        ContentSource source = getContentSource();
        return source == ContentSource.BINARY || source == ContentSource.SOURCE_FILE;
    }

    public byte[] decodeBinaryContent() {
        return binaryContent == null ? null : Base64.getMimeDecoder().decode(binaryContent);
    }

    /**
     * Requested permissions with the executable flag folded in:
     * 644 becomes 755 and 444 becomes 555.
     */
    public String getFinalPermissions() {
        if (executable) {
            if (DEFAULT_PERMISSIONS.equals(permissions)) {
                return "755";
            }
            if ("444".equals(permissions)) {
                return "555";
            }
        }
        return permissions;
    }

    private void requireSingleContentSource() {
        List<String> sources = new ArrayList<>();
        if (content != null) sources.add("content");
        if (templateFile != null) sources.add("template_file");
        if (sourceFile != null) sources.add("source_file");
        if (binaryContent != null) sources.add("binary_content");

        if (sources.isEmpty()) {
            throw new TemplateSchemaException("content",
                    "file '" + name + "' must have content, template_file, source_file or binary_content");
        }
        if (sources.size() > 1) {
            throw new TemplateSchemaException("content",
                    "file '" + name + "' can only have one content source, found: " + String.join(", ", sources));
        }
    }
}
