package com.deepansh.router.llm;

import com.deepansh.router.model.Message;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LlmResponse {

    /** Assistant message: text blocks and/or tool-use blocks. */
    Message message;

    /** Provider finish reason, e.g. "stop" or "tool_calls". */
    String stopReason;

    @Builder.Default
    int promptTokens = 0;

    @Builder.Default
    int completionTokens = 0;

    public boolean isToolUseRequested() {
        return message != null && message.hasToolUse();
    }
}
