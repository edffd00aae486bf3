package com.deepansh.router.llm;

import com.deepansh.router.exception.LlmException;
import com.deepansh.router.exception.LlmUnavailableException;
import com.deepansh.router.model.ContentBlock;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.TextBlock;
import com.deepansh.router.model.ToolResultBlock;
import com.deepansh.router.model.ToolUseBlock;
import com.deepansh.router.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * OpenAI-compatible chat-completions client — works with OpenAI and Groq.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                               |
 * |------------------------|------------------------------------------------------|
 * | 401 invalid_api_key    | LlmException (not retried, not a CB failure)         |
 * | 429 rate limit         | LlmUnavailableException (counts toward the CB)       |
 * | 400 other 4xx          | LlmException                                         |
 * | 5xx server error       | LlmUnavailableException                              |
 * | network error          | LlmUnavailableException                              |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private static final String DONE_MARKER = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;
    private final WebClient webClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder,
                            WebClient.Builder webClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
        this.webClient = webClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public LlmResponse chat(LlmRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request, false);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                request.getMessages().size(), request.getTools().size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        throw toException(body, res.getStatusCode().value());
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);
        } catch (ResourceAccessException e) {
            throw new LlmUnavailableException(providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the provider's server-sent events. Text deltas are emitted as they arrive;
     * tool-call deltas are merged by index and surface only in the final completed event.
     */
    @Override
    public Flux<LlmStreamEvent> stream(LlmRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request, true);

        return Flux.defer(() -> {
            log.debug("Streaming {} messages to {} [model={}]",
                    request.getMessages().size(), providerName, props.getModel());
            StreamAssembler assembler = new StreamAssembler();

            return webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> toException(body, res.statusCode().value())))
                    .bodyToFlux(SSE_TYPE)
                    .mapNotNull(ServerSentEvent::data)
                    .takeWhile(data -> !DONE_MARKER.equals(data.trim()))
                    .<LlmStreamEvent>handle((data, sink) -> {
                        String fragment = assembler.accept(parseChunk(data));
                        if (fragment != null) {
                            sink.next(LlmStreamEvent.fragment(fragment));
                        }
                    })
                    .concatWith(Mono.fromCallable(() -> LlmStreamEvent.completed(assembler.toResponse())))
                    .doOnCancel(() -> log.debug("{} stream cancelled by consumer", providerName))
                    .onErrorMap(WebClientRequestException.class,
                            e -> new LlmUnavailableException(providerName + " unreachable: " + e.getMessage(), e));
        });
    }

    private RuntimeException toException(String body, int statusCode) {
        log.error("{} error [{}]: {}", providerName, statusCode, body);

        if (statusCode == 401) {
            return new LlmException(providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429 || statusCode >= 500) {
            return new LlmUnavailableException(providerName + " unavailable [" + statusCode + "]: " + body);
        }
        return new LlmException(providerName + " client error [" + statusCode + "]: " + body);
    }

    // ─── Request ───────────────────────────────────────────────────────────────

    private Map<String, Object> buildRequestBody(LlmRequest request, boolean stream) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        request.getMessages().forEach(m -> messages.addAll(formatMessage(m)));

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", request.getTemperature() != null ? request.getTemperature() : props.getTemperature());
        if (request.getTopP() != null) {
            body.put("top_p", request.getTopP());
        }
        if (!request.getStopSequences().isEmpty()) {
            body.put("stop", request.getStopSequences());
        }
        body.put("messages", messages);

        if (!request.getTools().isEmpty()) {
            body.put("tools", request.getTools().stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", request.getForcedTool() == null
                    ? "auto"
                    : Map.of("type", "function", "function", Map.of("name", request.getForcedTool())));
        }
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    /**
     * One conversation message may expand to several wire messages: each tool result
     * becomes its own "tool" role entry, as the chat-completions format requires.
     */
    private List<Map<String, Object>> formatMessage(Message msg) {
        List<Map<String, Object>> out = new ArrayList<>();

        if (msg.getRole() == Message.Role.assistant) {
            Map<String, Object> m = new HashMap<>();
            m.put("role", "assistant");
            m.put("content", msg.getText());
            if (msg.hasToolUse()) {
                m.put("tool_calls", msg.getToolUses().stream().map(this::formatToolCall).toList());
            }
            out.add(m);
            return out;
        }

        for (ToolResultBlock result : msg.getToolResults()) {
            out.add(Map.of(
                    "role", "tool",
                    "tool_call_id", result.toolUseId(),
                    "content", result.payload() != null ? result.payload() : ""));
        }
        String text = msg.getText();
        if (!text.isEmpty() || out.isEmpty()) {
            out.add(Map.of("role", "user", "content", text));
        }
        return out;
    }

    private Map<String, Object> formatToolCall(ToolUseBlock toolUse) {
        String arguments;
        try {
            arguments = objectMapper.writeValueAsString(toolUse.input());
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize tool arguments for " + toolUse.name(), e);
        }
        return Map.of(
                "id", toolUse.id(),
                "type", "function",
                "function", Map.of("name", toolUse.name(), "arguments", arguments));
    }

    // ─── Response ──────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new LlmException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage — prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        String finishReason = (String) choice.get("finish_reason");

        List<ContentBlock> blocks = new ArrayList<>();
        String content = message != null ? (String) message.get("content") : null;
        if (content != null && !content.isEmpty()) {
            blocks.add(new TextBlock(content));
        }
        List<Map<String, Object>> toolCalls = message != null
                ? (List<Map<String, Object>>) message.get("tool_calls")
                : null;
        if (toolCalls != null) {
            for (Map<String, Object> call : toolCalls) {
                Map<String, Object> function = (Map<String, Object>) call.get("function");
                blocks.add(new ToolUseBlock(
                        (String) call.get("id"),
                        (String) function.get("name"),
                        parseArguments((String) function.get("arguments"))));
            }
        }

        return LlmResponse.builder()
                .message(assistantMessage(blocks))
                .stopReason(finishReason)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private Map<String, Object> parseChunk(String data) {
        try {
            return objectMapper.readValue(data, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed stream chunk from " + providerName, e);
        }
    }

    private Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to parse tool arguments from " + providerName + " response", e);
        }
    }

    // A completion with neither text nor tool calls still yields a message; callers judge emptiness
    private Message assistantMessage(List<ContentBlock> blocks) {
        if (blocks.isEmpty()) {
            return Message.assistantText("");
        }
        return Message.builder().role(Message.Role.assistant).content(blocks).build();
    }

    /** Folds the chunks of one streamed completion. Confined to one subscription. */
    private final class StreamAssembler {

        private final StringBuilder text = new StringBuilder();
        private final Map<Integer, PartialToolCall> toolCalls = new TreeMap<>();
        private String finishReason;

        /** @return the text fragment carried by this chunk, or null */
        @SuppressWarnings("unchecked")
        String accept(Map<String, Object> chunk) {
            List<Map<String, Object>> choices = (List<Map<String, Object>>) chunk.get("choices");
            if (choices == null || choices.isEmpty()) {
                return null;
            }
            Map<String, Object> choice = choices.get(0);
            if (choice.get("finish_reason") != null) {
                finishReason = (String) choice.get("finish_reason");
            }
            Map<String, Object> delta = (Map<String, Object>) choice.get("delta");
            if (delta == null) {
                return null;
            }

            List<Map<String, Object>> deltaCalls = (List<Map<String, Object>>) delta.get("tool_calls");
            if (deltaCalls != null) {
                for (Map<String, Object> call : deltaCalls) {
                    int index = ((Number) call.getOrDefault("index", 0)).intValue();
                    toolCalls.computeIfAbsent(index, i -> new PartialToolCall()).merge(call);
                }
            }

            String fragment = (String) delta.get("content");
            if (fragment == null || fragment.isEmpty()) {
                return null;
            }
            text.append(fragment);
            return fragment;
        }

        LlmResponse toResponse() {
            List<ContentBlock> blocks = new ArrayList<>();
            if (text.length() > 0) {
                blocks.add(new TextBlock(text.toString()));
            }
            for (PartialToolCall call : toolCalls.values()) {
                blocks.add(new ToolUseBlock(call.id, call.name, parseArguments(call.arguments.toString())));
            }
            return LlmResponse.builder()
                    .message(assistantMessage(blocks))
                    .stopReason(finishReason)
                    .build();
        }
    }

    private static final class PartialToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        @SuppressWarnings("unchecked")
        void merge(Map<String, Object> delta) {
            if (delta.get("id") != null) {
                id = (String) delta.get("id");
            }
            Map<String, Object> function = (Map<String, Object>) delta.get("function");
            if (function != null) {
                if (function.get("name") != null) {
                    name = (String) function.get("name");
                }
                if (function.get("arguments") != null) {
                    arguments.append((String) function.get("arguments"));
                }
            }
        }
    }
}
