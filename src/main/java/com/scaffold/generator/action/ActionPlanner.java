package com.scaffold.generator.action;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.condition.ConditionEvaluator;
import com.scaffold.generator.model.OperatingSystem;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.action.ActionGroup;
import com.scaffold.generator.model.action.HookStage;
import com.scaffold.generator.model.action.TemplateAction;
import com.scaffold.generator.render.PlaceholderRenderer;

/**
 * Selects the actions that apply to a generation. Nothing is executed:
 * running the plan is left to the caller.
 */
public class ActionPlanner {
    private static final Logger log = LoggerFactory.getLogger(ActionPlanner.class);

    private final PlaceholderRenderer placeholderRenderer;
    private final ConditionEvaluator conditionEvaluator;

    public ActionPlanner() {
        this(new PlaceholderRenderer());
    }

    public ActionPlanner(PlaceholderRenderer placeholderRenderer) {
        this.placeholderRenderer = placeholderRenderer;
        this.conditionEvaluator = new ConditionEvaluator(placeholderRenderer);
    }

    /**
     * @param variables resolved variables used for run conditions and placeholders
     * @param os platform the actions would run on
     */
    public ActionPlan plan(Template template, Map<String, Object> variables, OperatingSystem os) {
        Map<HookStage, List<PlannedAction>> stages = new EnumMap<>(HookStage.class);
        for (HookStage stage : HookStage.values()) {
            stages.put(stage, planActions(template.getHooks().actionsFor(stage), variables, os));
        }

        Map<String, List<PlannedAction>> groups = new LinkedHashMap<>();
        for (ActionGroup group : template.getActionGroups()) {
            if (!conditionEvaluator.evaluate(group.getCondition(), variables)) {
                log.debug("Action group '{}' skipped due to condition", group.getName());
                continue;
            }
            groups.put(group.getName(), planActions(group.getActions(), variables, os));
        }

        ActionPlan plan = new ActionPlan(stages, groups);
        log.debug("Planned {} actions for template '{}' on {}", plan.size(), template.getName(), os.getValue());
        return plan;
    }

    private List<PlannedAction> planActions(List<TemplateAction> actions, Map<String, Object> variables,
                                            OperatingSystem os) {
        List<PlannedAction> planned = new ArrayList<>();
        for (TemplateAction action : actions) {
            if (!action.isSupportedOn(os)) {
                log.debug("Action '{}' not supported on {}", action.getName(), os.getValue());
                continue;
            }
            if (!conditionEvaluator.evaluate(action.getCondition(), variables)) {
                log.debug("Action '{}' skipped due to condition", action.getName());
                continue;
            }
            planned.add(PlannedAction.builder()
                    .name(action.getName())
                    .type(action.getType())
                    .description(action.getDescription())
                    .command(placeholderRenderer.render(action.getCommand(), variables))
                    .workingDirectory(action.getWorkingDirectory() == null ? null
                            : placeholderRenderer.render(action.getWorkingDirectory(), variables))
                    .required(action.isRequired())
                    .timeout(action.getTimeout())
                    .environment(action.getEnvironment())
                    .arguments(action.getArguments().stream()
                            .map(arg -> placeholderRenderer.render(arg, variables))
                            .toList())
                    .build());
        }
        return planned;
    }
}
