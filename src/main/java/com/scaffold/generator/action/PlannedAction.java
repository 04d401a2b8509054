package com.scaffold.generator.action;

import java.util.List;
import java.util.Map;

import com.scaffold.generator.model.action.ActionType;

import lombok.Builder;
import lombok.Value;

/**
 * An action that applies to this generation, with placeholders rendered.
 */
@Value
@Builder
public class PlannedAction {
    String name;
    ActionType type;
    String description;
    String command;
    String workingDirectory;
    boolean required;
    Integer timeout;
    Map<String, String> environment;
    List<String> arguments;

    /**
     * Command followed by its arguments, space separated.
     */
    public String getCommandLine() {
        if (arguments == null || arguments.isEmpty()) {
            return command;
        }
        return command + " " + String.join(" ", arguments);
    }
}
