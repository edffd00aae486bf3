package com.deepansh.router.model;

import com.deepansh.router.exception.MalformedMessageException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for messages and tool exchanges.
 *
 * A ToolResult is only valid when an earlier ASSISTANT message of the same
 * exchange carried a ToolUse with the referenced id.
 */
public final class MessageValidator {

    private MessageValidator() {
    }

    public static void validate(Message message) {
        validate(message, List.of());
    }

    /**
     * @param message the message to check
     * @param prior   earlier messages of the same logical turn, oldest first
     */
    public static void validate(Message message, List<Message> prior) {
        if (message == null) {
            throw new MalformedMessageException("message is null");
        }
        if (message.getContent().isEmpty()) {
            throw new MalformedMessageException("message content must not be empty");
        }
        if (message.getToolResults().isEmpty()) {
            return;
        }
        Set<String> known = collectToolUseIds(prior);
        checkResults(message, known);
    }

    /** Validates a whole working conversation, including result-to-use references. */
    public static void validateExchange(List<Message> exchange) {
        Set<String> known = new HashSet<>();
        for (Message message : exchange) {
            if (message == null || message.getContent().isEmpty()) {
                throw new MalformedMessageException("exchange contains an empty message");
            }
            checkResults(message, known);
            if (message.getRole() == Message.Role.assistant) {
                message.getToolUses().forEach(use -> known.add(use.id()));
            }
        }
    }

    private static void checkResults(Message message, Set<String> known) {
        for (ToolResultBlock result : message.getToolResults()) {
            if (!known.contains(result.toolUseId())) {
                throw new MalformedMessageException(
                        "tool result references unknown tool use id '" + result.toolUseId() + "'");
            }
        }
    }

    private static Set<String> collectToolUseIds(List<Message> prior) {
        Set<String> ids = new HashSet<>();
        for (Message m : prior) {
            if (m.getRole() == Message.Role.assistant) {
                m.getToolUses().forEach(use -> ids.add(use.id()));
            }
        }
        return ids;
    }
}
