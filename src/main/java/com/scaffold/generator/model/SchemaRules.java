package com.scaffold.generator.model;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Construction-time field checks shared by the schema types.
 * Every check throws {@link TemplateSchemaException} naming the field.
 */
public final class SchemaRules {

    public static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    public static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    public static final Pattern URL = Pattern.compile("^https?://.*");

    /** X.Y.Z with optional pre-release and build metadata. */
    public static final Pattern SEMANTIC_VERSION = Pattern.compile(
            "^(\\d+)\\.(\\d+)\\.(\\d+)(-[\\w.-]+)?(\\+[\\w.-]+)?$");

    /** Strict X.Y.Z, used for compatibility minimums. */
    public static final Pattern STRICT_VERSION = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private static final Pattern OCTAL_PERMISSIONS = Pattern.compile("^[0-7]{3}$");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{.*?}}");

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[<>:\"|?*]");

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    private SchemaRules() {
        // Utility class
    }

    public static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new TemplateSchemaException(field, "must not be empty");
        }
        if (value.length() > maxLength) {
            throw new TemplateSchemaException(field, "must be at most " + maxLength + " characters");
        }
        return value;
    }

    public static String requireIdentifier(String field, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new TemplateSchemaException(field, "'" + value + "' is not a valid identifier");
        }
        return value;
    }

    public static String requireMatch(String field, String value, Pattern pattern, String expected) {
        if (value == null || !pattern.matcher(value).matches()) {
            throw new TemplateSchemaException(field, "'" + value + "' must be " + expected);
        }
        return value;
    }

    public static String requirePermissions(String field, String value) {
        if (value == null || !OCTAL_PERMISSIONS.matcher(value).matches()) {
            throw new TemplateSchemaException(field, "permissions must be a 3-digit octal string (e.g. '644'), got '" + value + "'");
        }
        return value;
    }

    /**
     * Validates a relative path and returns it with forward slashes.
     * Absolute paths, drive letters and '..' segments are rejected.
     */
    public static String requireRelativePath(String field, String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('\\', '/');
        if (normalized.isEmpty()) {
            throw new TemplateSchemaException(field, "path must not be empty");
        }
        if (normalized.startsWith("/") || normalized.contains(":")) {
            throw new TemplateSchemaException(field, "path must be relative: " + value);
        }
        if (normalized.contains("..")) {
            throw new TemplateSchemaException(field, "path cannot contain '..': " + value);
        }
        return normalized;
    }

    /**
     * Checks a file or directory name for characters and device names that
     * cannot appear on common filesystems. Placeholders are allowed.
     */
    public static String requireItemName(String field, String value, boolean stripExtension) {
        if (value == null || value.isBlank()) {
            throw new TemplateSchemaException(field, "name cannot be empty");
        }
        String trimmed = value.trim();
        String literal = PLACEHOLDER.matcher(trimmed).replaceAll("");
        if (INVALID_NAME_CHARS.matcher(literal).find()) {
            throw new TemplateSchemaException(field, "name contains invalid characters: " + trimmed);
        }
        String base = stripExtension ? trimmed.split("\\.", -1)[0] : trimmed;
        if (RESERVED_NAMES.contains(base.toUpperCase())) {
            throw new TemplateSchemaException(field, "name '" + trimmed + "' is reserved on Windows");
        }
        return trimmed;
    }

    public static <T> List<T> copyOrEmpty(Collection<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
