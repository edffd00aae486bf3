package com.deepansh.router.tool;

import com.deepansh.router.model.Message;

import java.util.List;

/**
 * Turns an assistant message carrying ToolUse blocks into the user message
 * carrying the matching ToolResult blocks.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * @param toolUseMessage the assistant message that requested the tools
     * @param conversation   the working conversation so far, including {@code toolUseMessage}
     */
    Message handle(Message toolUseMessage, List<Message> conversation);
}
