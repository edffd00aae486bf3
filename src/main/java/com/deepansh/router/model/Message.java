package com.deepansh.router.model;

import com.deepansh.router.exception.MalformedMessageException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One conversation turn. Immutable once built; the content list is never empty.
 */
@Value
public class Message {

    public enum Role {
        user, assistant
    }

    Role role;
    List<ContentBlock> content;

    @Builder
    @JsonCreator
    public Message(@JsonProperty("role") Role role,
                   @JsonProperty("content") @Singular("block") List<ContentBlock> content) {
        if (role == null) {
            throw new MalformedMessageException("message role is required");
        }
        if (content == null || content.isEmpty()) {
            throw new MalformedMessageException("message content must not be empty");
        }
        if (content.stream().anyMatch(b -> b == null)) {
            throw new MalformedMessageException("message content contains a null block");
        }
        this.role = role;
        this.content = List.copyOf(content);
    }

    public static Message userText(String text) {
        return Message.builder().role(Role.user).block(new TextBlock(text)).build();
    }

    public static Message assistantText(String text) {
        return Message.builder().role(Role.assistant).block(new TextBlock(text)).build();
    }

    /** Concatenation of all text blocks, empty when there are none. */
    @JsonIgnore
    public String getText() {
        return content.stream()
                .filter(TextBlock.class::isInstance)
                .map(b -> ((TextBlock) b).text())
                .collect(Collectors.joining());
    }

    @JsonIgnore
    public List<ToolUseBlock> getToolUses() {
        return content.stream()
                .filter(ToolUseBlock.class::isInstance)
                .map(ToolUseBlock.class::cast)
                .toList();
    }

    @JsonIgnore
    public List<ToolResultBlock> getToolResults() {
        return content.stream()
                .filter(ToolResultBlock.class::isInstance)
                .map(ToolResultBlock.class::cast)
                .toList();
    }

    @JsonIgnore
    public boolean hasToolUse() {
        return content.stream().anyMatch(ToolUseBlock.class::isInstance);
    }
}
