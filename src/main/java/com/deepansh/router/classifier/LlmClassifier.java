package com.deepansh.router.classifier;

import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.llm.LlmRequest;
import com.deepansh.router.llm.LlmResponse;
import com.deepansh.router.model.Message;
import com.deepansh.router.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Model-backed classifier. The model is forced to call {@code analyzePrompt}, so its
 * decision arrives as tool input rather than free text.
 */
@Slf4j
public class LlmClassifier extends AbstractClassifier {

    static final ToolDefinition ANALYZE_PROMPT = ToolDefinition.builder()
            .name(StructuredOutputParser.TOOL_NAME)
            .description("Analyze the user input and provide structured output")
            .inputSchema(StructuredOutputParser.inputSchema())
            .build();

    private final LlmClient llmClient;
    private final int maxTokens;
    private final double temperature;

    public LlmClassifier(LlmClient llmClient, int maxTokens, double temperature) {
        this.llmClient = llmClient;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    protected ClassifierDecision decide(String inputText, List<Message> history) {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(buildSystemPrompt(history))
                .messages(List.of(Message.userText(inputText)))
                .tools(List.of(ANALYZE_PROMPT))
                .forcedTool(StructuredOutputParser.TOOL_NAME)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();

        LlmResponse response = llmClient.chat(request);
        log.debug("Classifier reply: stopReason={} toolUses={}",
                response.getStopReason(), response.getMessage().getToolUses().size());
        return StructuredOutputParser.parse(response.getMessage());
    }
}
