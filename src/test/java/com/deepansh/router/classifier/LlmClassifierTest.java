package com.deepansh.router.classifier;

import com.deepansh.router.exception.NoStructuredOutputException;
import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.llm.LlmRequest;
import com.deepansh.router.llm.LlmResponse;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.ToolUseBlock;
import com.deepansh.router.responder.Responder;
import com.deepansh.router.responder.RuleBasedResponder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmClassifierTest {

    @Mock
    private LlmClient llmClient;

    private LlmClassifier classifier;
    private Responder math;
    private Responder tech;

    @BeforeEach
    void setUp() {
        math = new RuleBasedResponder("Math Agent", "Solves arithmetic problems", true, List.of(), "0");
        tech = new RuleBasedResponder("Tech Agent", "Answers networking questions", true, List.of(), "?");
        classifier = new LlmClassifier(llmClient, 1000, 0.0);
        classifier.setResponders(Map.of(math.getId(), math, tech.getId(), tech));
    }

    @Test
    void classify_forcesAnalyzePromptToolAndDescribesResponders() {
        when(llmClient.chat(any())).thenReturn(decision("math-agent", 0.95));

        ClassifierResult result = classifier.classify("What is 2+2?",
                List.of(Message.userText("hi"), Message.assistantText("[tech-agent] Hello")));

        assertThat(result.selectedResponder()).isSameAs(math);
        assertThat(result.confidence()).isEqualTo(0.95);

        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient).chat(sent.capture());
        LlmRequest request = sent.getValue();
        assertThat(request.getForcedTool()).isEqualTo("analyzePrompt");
        assertThat(request.getTools()).containsExactly(LlmClassifier.ANALYZE_PROMPT);
        assertThat(request.getMessages()).extracting(Message::getText).containsExactly("What is 2+2?");
        assertThat(request.getSystemPrompt())
                .contains("math-agent:Solves arithmetic problems\n\ntech-agent:Answers networking questions")
                .contains("user: hi\nassistant: [tech-agent] Hello");
    }

    @Test
    void classify_agentNameWithTrailingExplanation_resolvesByFirstToken() {
        when(llmClient.chat(any())).thenReturn(decision("Tech-Agent (networking)", 0.9));

        assertThat(classifier.classify("What is TCP?", List.of()).selectedResponder()).isSameAs(tech);
    }

    @Test
    void classify_displayName_resolvesThroughGeneratedKey() {
        when(llmClient.chat(any())).thenReturn(decision("Tech Agent", 0.9));

        assertThat(classifier.classify("What is TCP?", List.of()).selectedResponder()).isSameAs(tech);
    }

    @Test
    void classify_unknownAgent_returnsNoResponderButKeepsConfidence() {
        when(llmClient.chat(any())).thenReturn(decision("weather-agent", 0.7));

        ClassifierResult result = classifier.classify("Will it rain?", List.of());

        assertThat(result.selectedResponder()).isNull();
        assertThat(result.isSelected()).isFalse();
        assertThat(result.confidence()).isEqualTo(0.7);
    }

    @Test
    void classify_freeTextReply_propagatesNoStructuredOutput() {
        when(llmClient.chat(any())).thenReturn(LlmResponse.builder()
                .message(Message.assistantText("I think math-agent"))
                .build());

        assertThatThrownBy(() -> classifier.classify("What is 2+2?", List.of()))
                .isInstanceOf(NoStructuredOutputException.class);
    }

    @Test
    void setSystemPrompt_customTemplateAndVariables_areRendered() {
        when(llmClient.chat(any())).thenReturn(decision("math-agent", 0.8));
        classifier.setSystemPrompt("Company {{COMPANY}} agents:\n{{AGENT_DESCRIPTIONS}}", Map.of("COMPANY", "Acme"));

        classifier.classify("2+2", List.of());

        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient).chat(sent.capture());
        assertThat(sent.getValue().getSystemPrompt()).startsWith("Company Acme agents:\nmath-agent:");
    }

    private static LlmResponse decision(String agent, double confidence) {
        Message reply = Message.builder()
                .role(Message.Role.assistant)
                .block(new ToolUseBlock("call-1", StructuredOutputParser.TOOL_NAME, Map.of(
                        "userinput", "input",
                        "selected_agent", agent,
                        "confidence", confidence)))
                .build();
        return LlmResponse.builder().message(reply).stopReason("tool_calls").build();
    }
}
