package com.scaffold.generator.model.action;

import java.util.Arrays;
import java.util.Locale;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Kinds of post-generation work. Actions are carried through to the caller, not executed.
 */
public enum ActionType {
    COMMAND("command"),
    /** Interpreted code snippet. */
    PYTHON("python"),
    /** Version-control command. */
    GIT("git"),
    COPY("copy"),
    MOVE("move"),
    DELETE("delete"),
    MKDIR("mkdir"),
    CHMOD("chmod");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ActionType fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("type", "unknown action type: " + value));
    }
}
