package com.deepansh.router.tool;

import java.util.Map;

/**
 * A function a tool-using responder may call mid-turn.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 *
 * Prefer returning an "ERROR: ..." string over throwing; both end up as an
 * error-status tool result the model can react to.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters. */
    Map<String, Object> getInputSchema();

    String execute(Map<String, Object> arguments);
}
