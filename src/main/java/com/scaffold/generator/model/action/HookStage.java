package com.scaffold.generator.model.action;

/**
 * Lifecycle stages actions can be attached to, in execution order.
 */
public enum HookStage {
    PRE_GENERATE("pre_generate"),
    POST_GENERATE("post_generate"),
    PRE_FILE("pre_file"),
    POST_FILE("post_file"),
    ON_ERROR("on_error"),
    CLEANUP("cleanup");

    private final String key;

    HookStage(String key) {
        this.key = key;
    }

    /** Key used in template definitions. */
    public String getKey() {
        return key;
    }
}
