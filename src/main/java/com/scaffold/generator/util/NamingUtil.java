package com.scaffold.generator.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility for consistent identifier and file naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts "MyProject Name", "my-project" or "myProject" to snake_case.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.trim().replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        result = result.replaceAll("([a-z\\d])([A-Z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_");
        return result.toLowerCase(Locale.ROOT);
    }

    public static String toKebabCase(String name) {
        String snake = toSnakeCase(name);
        return snake == null ? null : snake.replace('_', '-');
    }

    /**
     * Converts snake_case, kebab-case or spaced words to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.trim().split("[-_\\s]+"))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Capitalizes every whitespace-separated word.
     */
    public static String toTitleCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split(" ", -1))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(" "));
    }

    /**
     * Lower-case, hyphen-separated form with punctuation removed.
     */
    public static String slugify(String name) {
        if (name == null) {
            return null;
        }
        String value = name.replaceAll("[^\\w\\s-]", "").trim().toLowerCase(Locale.ROOT);
        return value.replaceAll("[\\s_-]+", "-");
    }

    /**
     * Replaces every character that is unsafe in a file name with an underscore.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return null;
        }
        return name.replaceAll("[^A-Za-z0-9_.-]", "_");
    }

    public static String normalizePath(String path) {
        if (path == null) {
            return null;
        }
        String normalized = path.replace('\\', '/').replaceAll("/{2,}", "/");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static String capitalize(String str) {
        if (str == null || str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
