package com.scaffold.generator.model.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Actions grouped by lifecycle stage. Stages without actions map to an empty list.
 */
public final class TemplateHooks {

    public static final TemplateHooks EMPTY = new TemplateHooks(Map.of());

    private final Map<HookStage, List<TemplateAction>> actionsByStage;

    public TemplateHooks(Map<HookStage, List<TemplateAction>> actionsByStage) {
        EnumMap<HookStage, List<TemplateAction>> copy = new EnumMap<>(HookStage.class);
        for (HookStage stage : HookStage.values()) {
            List<TemplateAction> actions = actionsByStage.get(stage);
            copy.put(stage, actions == null ? List.of() : List.copyOf(actions));
        }
        this.actionsByStage = Collections.unmodifiableMap(copy);
    }

    public List<TemplateAction> actionsFor(HookStage stage) {
        return actionsByStage.get(stage);
    }

    /**
     * Every action across all stages, in stage order.
     */
    public List<TemplateAction> getAllActions() {
        List<TemplateAction> all = new ArrayList<>();
        for (HookStage stage : HookStage.values()) {
            all.addAll(actionsByStage.get(stage));
        }
        return all;
    }

    public boolean isEmpty() {
        return actionsByStage.values().stream().allMatch(List::isEmpty);
    }

    @Override
    public String toString() {
        return "TemplateHooks" + actionsByStage;
    }
}
