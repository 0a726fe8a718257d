package com.fleetmind.core.hook;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to the worker program's end-of-turn hook. An allow decision prints nothing; a block
 * decision is printed as {@code {"decision":"block","reason":...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HookDecision(String decision, String reason) {

    public static final String BLOCK = "block";

    private static final HookDecision ALLOW = new HookDecision(null, null);

    public static HookDecision allow() {
        return ALLOW;
    }

    public static HookDecision block(String reason) {
        return new HookDecision(BLOCK, reason);
    }

    @JsonIgnore
    public boolean blocks() {
        return BLOCK.equals(decision);
    }
}
