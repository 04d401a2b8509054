package com.scaffold.generator.model.action;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.model.OperatingSystem;
import com.scaffold.generator.model.SchemaRules;
import com.scaffold.generator.model.structure.ConditionalExpression;

import lombok.Builder;
import lombok.Value;

/**
 * A named unit of post-generation work.
 *
 * <p>Failure of a required action aborts generation; a non-required one is
 * recorded and generation continues. Execution belongs to the caller.
 */
@Value
public class TemplateAction {

    private static final List<String> DANGEROUS_COMMANDS = List.of("rm -rf", "del /f", "format", "fdisk", "mkfs");

    private static final Set<Platform> ALL_PLATFORMS = Set.of(Platform.WINDOWS, Platform.MACOS, Platform.LINUX);

    String name;
    ActionType type;
    String command;
    String description;
    String workingDirectory;
    Set<Platform> platforms;
    ConditionalExpression condition;
    boolean required;

    /** Seconds; {@code null} means no limit. */
    Integer timeout;

    Map<String, String> environment;
    List<String> arguments;

    @Builder
    public TemplateAction(String name, ActionType type, String command, String description, String workingDirectory,
                          Set<Platform> platforms, ConditionalExpression condition, Boolean required, Integer timeout,
                          Map<String, String> environment, List<String> arguments) {
        this.name = SchemaRules.requireText("name", name, 100);
        if (type == null) {
            throw new TemplateSchemaException("type", "action type is required");
        }
        this.type = type;
        if (command == null || command.isBlank()) {
            throw new TemplateSchemaException("command", "command cannot be empty");
        }
        this.command = command.strip();
        this.description = SchemaRules.requireText("description", description, 500);
        this.workingDirectory = SchemaRules.requireRelativePath("working_directory", workingDirectory);
        this.platforms = platforms == null || platforms.isEmpty() ? ALL_PLATFORMS : Set.copyOf(platforms);
        this.condition = condition;
        this.required = required == null || required;
        if (timeout != null && timeout <= 0) {
            throw new TemplateSchemaException("timeout", "timeout must be positive");
        }
        this.timeout = timeout;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.arguments = SchemaRules.copyOrEmpty(arguments);
        checkCommandMatchesType();
    }

    public boolean isSupportedOn(OperatingSystem os) {
        return platforms.stream().anyMatch(p -> p.covers(os));
    }

    private void checkCommandMatchesType() {
        if (type == ActionType.GIT && !command.startsWith("git ")) {
            throw new TemplateSchemaException("command", "git action command must start with 'git '");
        }
        if (type == ActionType.COMMAND) {
            String lower = command.toLowerCase(Locale.ROOT);
            for (String dangerous : DANGEROUS_COMMANDS) {
                if (lower.contains(dangerous)) {
                    throw new TemplateSchemaException("command",
                            "command contains potentially dangerous operation '" + dangerous + "'");
                }
            }
        }
    }
}
