package com.deepansh.router.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A responder's request to call a tool mid-turn. {@code id} is echoed back by the matching result. */
public record ToolUseBlock(String id, String name, Map<String, Object> input) implements ContentBlock {

    public ToolUseBlock {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("tool use id must not be blank");
        }
        input = input == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
