package com.deepansh.router.model;

public record ToolResultBlock(String toolUseId, String payload, ToolResultStatus status) implements ContentBlock {

    public ToolResultBlock {
        if (toolUseId == null || toolUseId.isBlank()) {
            throw new IllegalArgumentException("toolUseId must not be blank");
        }
        if (status == null) {
            status = ToolResultStatus.success;
        }
    }

    public static ToolResultBlock success(String toolUseId, String payload) {
        return new ToolResultBlock(toolUseId, payload, ToolResultStatus.success);
    }

    public static ToolResultBlock error(String toolUseId, String payload) {
        return new ToolResultBlock(toolUseId, payload, ToolResultStatus.error);
    }
}
