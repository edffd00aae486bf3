package com.deepansh.router.llm;

import com.deepansh.router.exception.LlmException;
import com.deepansh.router.exception.LlmUnavailableException;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.ToolResultBlock;
import com.deepansh.router.model.ToolUseBlock;
import com.deepansh.router.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private static final String URL = "https://llm.test/openai/v1/chat/completions";

    private MockRestServiceServer server;
    private GenericLlmClient client;
    private LlmProviderProperties props;

    @BeforeEach
    void setUp() {
        props = new LlmProviderProperties();
        props.setApiKey("test-key");
        props.setBaseUrl("https://llm.test/openai/v1");
        props.setModel("test-model");
        props.setMaxTokens(512);
        props.setTemperature(0.2);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, new ObjectMapper(), "groq", builder, WebClient.builder());
    }

    @Test
    void chat_forcedTool_sendsToolChoiceAndParsesToolCall() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("What is 2+2?"))
                .andExpect(jsonPath("$.tool_choice.function.name").value("analyzePrompt"))
                .andRespond(withSuccess("""
                        {"choices":[{"finish_reason":"tool_calls","message":{"content":null,
                          "tool_calls":[{"id":"call_1","type":"function","function":{"name":"analyzePrompt",
                          "arguments":"{\\"userinput\\":\\"What is 2+2?\\",\\"selected_agent\\":\\"math-agent\\",\\"confidence\\":0.95}"}}]}}],
                         "usage":{"prompt_tokens":120,"completion_tokens":30}}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(LlmRequest.builder()
                .systemPrompt("Pick an agent")
                .messages(List.of(Message.userText("What is 2+2?")))
                .tools(List.of(ToolDefinition.builder()
                        .name("analyzePrompt").description("d").inputSchema(Map.of("type", "object")).build()))
                .forcedTool("analyzePrompt")
                .build());

        ToolUseBlock toolUse = response.getMessage().getToolUses().get(0);
        assertThat(toolUse.id()).isEqualTo("call_1");
        assertThat(toolUse.input()).containsEntry("selected_agent", "math-agent").containsEntry("confidence", 0.95);
        assertThat(response.getStopReason()).isEqualTo("tool_calls");
        assertThat(response.getPromptTokens()).isEqualTo(120);
        server.verify();
    }

    @Test
    void chat_toolResultMessage_isSentAsToolRole() {
        Message toolRequest = Message.builder()
                .role(Message.Role.assistant)
                .block(new ToolUseBlock("call_1", "echo", Map.of("message", "hi")))
                .build();
        Message toolAnswer = Message.builder()
                .role(Message.Role.user)
                .block(ToolResultBlock.success("call_1", "Echo: hi"))
                .build();

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].function.name").value("echo"))
                .andExpect(jsonPath("$.messages[2].role").value("tool"))
                .andExpect(jsonPath("$.messages[2].tool_call_id").value("call_1"))
                .andRespond(withSuccess("{\"choices\":[{\"finish_reason\":\"stop\",\"message\":{\"content\":\"Done\"}}]}",
                        MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("echo hi"), toolRequest, toolAnswer))
                .build());

        assertThat(response.getMessage().getText()).isEqualTo("Done");
        server.verify();
    }

    @Test
    void chat_rateLimited_throwsUnavailable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> client.chat(LlmRequest.builder().messages(List.of(Message.userText("hi"))).build()))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("429");
    }

    @Test
    void chat_invalidKey_throwsNonRetryableLlmException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid_api_key\"}"));

        assertThatThrownBy(() -> client.chat(LlmRequest.builder().messages(List.of(Message.userText("hi"))).build()))
                .isInstanceOf(LlmException.class)
                .isNotInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("GROQ_API_KEY");
    }

    @Test
    void stream_emitsContentDeltasAndAssemblesToolCalls() {
        String events = """
                data: {"choices":[{"delta":{"content":"TCP "}}]}

                data: {"choices":[{"delta":{"content":"is a protocol"}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_9","function":{"name":"echo","arguments":"{\\"mess"}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"age\\":\\"x\\"}"}}]},"finish_reason":"tool_calls"}]}

                data: [DONE]

                """;
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        GenericLlmClient streaming = streamingClient(request -> {
            sent.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                    .body(events)
                    .build());
        });

        List<LlmStreamEvent> received = streaming.stream(LlmRequest.builder()
                        .messages(List.of(Message.userText("What is TCP?")))
                        .build())
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(sent.get().url()).isEqualTo(URI.create(URL));
        assertThat(sent.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
        assertThat(received).hasSize(3);
        assertThat(received.subList(0, 2)).extracting(LlmStreamEvent::getFragment)
                .containsExactly("TCP ", "is a protocol");
        LlmResponse response = received.get(2).getResponse();
        assertThat(received.get(2).isCompleted()).isTrue();
        assertThat(response.getMessage().getText()).isEqualTo("TCP is a protocol");
        assertThat(response.getMessage().getToolUses()).singleElement()
                .satisfies(use -> {
                    assertThat(use.id()).isEqualTo("call_9");
                    assertThat(use.input()).containsEntry("message", "x");
                });
        assertThat(response.getStopReason()).isEqualTo("tool_calls");
    }

    @Test
    void stream_isColdUntilSubscribed() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        GenericLlmClient streaming = streamingClient(request -> {
            sent.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                    .body("data: [DONE]\n\n")
                    .build());
        });

        streaming.stream(LlmRequest.builder().messages(List.of(Message.userText("hi"))).build());

        assertThat(sent.get()).isNull();
    }

    @Test
    void stream_rateLimited_failsWithUnavailable() {
        GenericLlmClient streaming = streamingClient(request -> Mono.just(
                ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).body("slow down").build()));

        assertThatThrownBy(() -> streaming.stream(LlmRequest.builder()
                        .messages(List.of(Message.userText("hi"))).build()).blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("429");
    }

    @Test
    void stream_invalidKey_failsWithNonRetryableLlmException() {
        GenericLlmClient streaming = streamingClient(request -> Mono.just(
                ClientResponse.create(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid_api_key\"}").build()));

        assertThatThrownBy(() -> streaming.stream(LlmRequest.builder()
                        .messages(List.of(Message.userText("hi"))).build()).blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(LlmException.class)
                .isNotInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("GROQ_API_KEY");
    }

    @Test
    void stream_connectionRefused_failsWithUnavailable() {
        GenericLlmClient streaming = streamingClient(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection refused"), HttpMethod.POST, request.url(), HttpHeaders.EMPTY)));

        assertThatThrownBy(() -> streaming.stream(LlmRequest.builder()
                        .messages(List.of(Message.userText("hi"))).build()).blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    void stream_malformedChunk_failsWithLlmException() {
        GenericLlmClient streaming = streamingClient(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body("data: {not json\n\n")
                .build()));

        assertThatThrownBy(() -> streaming.stream(LlmRequest.builder()
                        .messages(List.of(Message.userText("hi"))).build()).blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("Malformed stream chunk");
    }

    private GenericLlmClient streamingClient(ExchangeFunction exchange) {
        return new GenericLlmClient(props, new ObjectMapper(), "groq", RestClient.builder(),
                WebClient.builder().exchangeFunction(exchange));
    }
}
