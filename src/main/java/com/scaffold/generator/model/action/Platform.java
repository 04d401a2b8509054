package com.scaffold.generator.model.action;

import java.util.Arrays;
import java.util.Locale;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.OperatingSystem;

/**
 * Platforms an action applies to. {@link #UNIX} covers macOS and Linux.
 */
public enum Platform {
    WINDOWS("windows"),
    MACOS("macos"),
    LINUX("linux"),
    UNIX("unix");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean covers(OperatingSystem os) {
        return switch (this) {
            case WINDOWS -> os == OperatingSystem.WINDOWS;
            case MACOS -> os == OperatingSystem.MACOS;
            case LINUX -> os == OperatingSystem.LINUX;
            case UNIX -> os == OperatingSystem.MACOS || os == OperatingSystem.LINUX;
        };
    }

    public static Platform fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("platforms", "unknown platform: " + value));
    }
}
