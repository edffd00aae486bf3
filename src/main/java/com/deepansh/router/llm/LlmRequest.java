package com.deepansh.router.llm;

import com.deepansh.router.model.Message;
import com.deepansh.router.tool.ToolDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class LlmRequest {

    String systemPrompt;

    @Builder.Default
    List<Message> messages = List.of();

    @Builder.Default
    List<ToolDefinition> tools = List.of();

    /** When set, the model must answer by calling this tool (structured output). */
    String forcedTool;

    Integer maxTokens;
    Double temperature;
    Double topP;

    @Builder.Default
    List<String> stopSequences = List.of();
}
