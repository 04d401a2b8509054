package com.scaffold.generator.action;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.scaffold.generator.model.action.HookStage;

/**
 * Actions selected for one generation, per hook stage and per action group.
 */
public class ActionPlan {

    private final Map<HookStage, List<PlannedAction>> stages;
    private final Map<String, List<PlannedAction>> groups;

    ActionPlan(Map<HookStage, List<PlannedAction>> stages, Map<String, List<PlannedAction>> groups) {
        EnumMap<HookStage, List<PlannedAction>> stageCopy = new EnumMap<>(HookStage.class);
        for (HookStage stage : HookStage.values()) {
            stageCopy.put(stage, List.copyOf(stages.getOrDefault(stage, List.of())));
        }
        this.stages = Collections.unmodifiableMap(stageCopy);
        Map<String, List<PlannedAction>> groupCopy = new LinkedHashMap<>();
        groups.forEach((name, actions) -> groupCopy.put(name, List.copyOf(actions)));
        this.groups = Collections.unmodifiableMap(groupCopy);
    }

    public static ActionPlan empty() {
        return new ActionPlan(Map.of(), Map.of());
    }

    public List<PlannedAction> actionsFor(HookStage stage) {
        return stages.get(stage);
    }

    /**
     * Planned actions of each group whose condition held, keyed by group name.
     */
    public Map<String, List<PlannedAction>> getGroups() {
        return groups;
    }

    public int size() {
        return stages.values().stream().mapToInt(List::size).sum()
                + groups.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
