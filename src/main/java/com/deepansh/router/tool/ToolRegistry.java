package com.deepansh.router.tool;

import com.deepansh.router.model.ToolResultBlock;
import com.deepansh.router.model.ToolUseBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tools one responder may call, indexed by name.
 *
 * Tool execution errors are caught here and returned as error-status results
 * so the tool loop always continues; the model decides what to do next.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();

    public ToolRegistry(List<AgentTool> toolList) {
        toolList.forEach(tool -> {
            if (tools.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}] — {}", tool.getName(), tool.getDescription());
        });
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    /**
     * Runs one tool use and returns its result. Never throws.
     */
    public ToolResultBlock execute(ToolUseBlock toolUse) {
        AgentTool tool = tools.get(toolUse.name());

        if (tool == null) {
            String msg = String.format("ERROR: Unknown tool '%s'. Available tools: %s",
                    toolUse.name(), tools.keySet());
            log.warn(msg);
            return ToolResultBlock.error(toolUse.id(), msg);
        }

        log.info("Executing tool: [{}] with args: {}", toolUse.name(), toolUse.input());

        try {
            String result = tool.execute(toolUse.input());
            log.debug("Tool [{}] returned: {}", toolUse.name(), result);
            if (result != null && result.startsWith("ERROR:")) {
                return ToolResultBlock.error(toolUse.id(), result);
            }
            return ToolResultBlock.success(toolUse.id(), result == null ? "" : result);
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolUse.name(), e);
            return ToolResultBlock.error(toolUse.id(), "ERROR: Tool execution failed — " + e.getMessage());
        }
    }

    public AgentTool getTool(String name) {
        AgentTool tool = tools.get(name);
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool '" + name + "'");
        }
        return tool;
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
