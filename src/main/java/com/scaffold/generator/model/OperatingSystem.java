package com.scaffold.generator.model;

import java.util.Arrays;
import java.util.Locale;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Operating systems a template declares compatibility with.
 */
public enum OperatingSystem {
    MACOS("macOS"),
    LINUX("Linux"),
    WINDOWS("Windows");

    private final String value;

    OperatingSystem(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OperatingSystem fromValue(String value) {
        return Arrays.stream(values())
                .filter(os -> os.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("compatibility",
                        "invalid OS '" + value + "', must be one of: macOS, Linux, Windows"));
    }

    /**
     * Maps a {@code os.name} system property value to a constant.
     */
    public static OperatingSystem fromOsName(String osName) {
        String lower = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (lower.contains("win")) {
            return WINDOWS;
        }
        if (lower.contains("mac") || lower.contains("darwin")) {
            return MACOS;
        }
        return LINUX;
    }

    public static OperatingSystem current() {
        return fromOsName(System.getProperty("os.name"));
    }
}
