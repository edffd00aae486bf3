package com.deepansh.router.tool;

import com.deepansh.router.model.Message;
import com.deepansh.router.model.ToolUseBlock;

import java.util.List;

/** Default {@link ToolHandler}: runs every requested tool through a {@link ToolRegistry}. */
public class RegistryToolHandler implements ToolHandler {

    private final ToolRegistry registry;

    public RegistryToolHandler(ToolRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Message handle(Message toolUseMessage, List<Message> conversation) {
        Message.MessageBuilder result = Message.builder().role(Message.Role.user);
        for (ToolUseBlock toolUse : toolUseMessage.getToolUses()) {
            result.block(registry.execute(toolUse));
        }
        return result.build();
    }

    public ToolRegistry getRegistry() {
        return registry;
    }
}
