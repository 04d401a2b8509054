package com.scaffold.generator.model.action;

import java.util.List;

import com.scaffold.generator.model.SchemaRules;
import com.scaffold.generator.model.structure.ConditionalExpression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Named group of related actions with an optional condition for the whole group.
 */
@Value
public class ActionGroup {

    String name;
    String description;
    List<TemplateAction> actions;
    ConditionalExpression condition;
    boolean parallel;
    boolean continueOnError;

    @Builder
    public ActionGroup(String name, String description, @Singular List<TemplateAction> actions,
                       ConditionalExpression condition, boolean parallel, boolean continueOnError) {
        this.name = SchemaRules.requireText("name", name, 100);
        this.description = SchemaRules.requireText("description", description, 500);
        this.actions = SchemaRules.copyOrEmpty(actions);
        this.condition = condition;
        this.parallel = parallel;
        this.continueOnError = continueOnError;
    }
}
