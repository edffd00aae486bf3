package com.deepansh.router.tool.impl;

import com.deepansh.router.tool.AgentTool;

import java.util.List;
import java.util.Map;

/**
 * Smoke-test tool: lets a responder exercise the tool loop end-to-end without external APIs.
 */
public class EchoTool implements AgentTool {

    public static final String NAME = "echo";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Echoes back the provided message. Use this to check that tool calls round-trip.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "The message to echo back"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object message = arguments.get("message");
        if (message == null) {
            return "ERROR: 'message' argument is required";
        }
        return "Echo: " + message;
    }
}
