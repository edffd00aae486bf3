package com.deepansh.router.responder;

import com.deepansh.router.exception.ResponderException;
import com.deepansh.router.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Responder backed by a remote HTTP function (serverless handler, internal microservice).
 *
 * Request body:
 * <pre>
 * {"query": "...", "chatHistory": [...], "additionalParams": {...}, "userId": "...", "sessionId": "..."}
 * </pre>
 * The reply is read from a top-level {@code response} field, or from {@code body.response}
 * when the function answers in the proxy style where {@code body} is a JSON string.
 */
@Slf4j
public class RemoteFunctionResponder extends AbstractResponder {

    private final RestClient restClient;
    private final String functionUrl;
    private final ObjectMapper objectMapper;

    public RemoteFunctionResponder(String name, String description, boolean saveChat,
                                   RestClient restClient, String functionUrl, ObjectMapper objectMapper) {
        super(name, description, ResponderCapabilities.PLAIN, saveChat);
        if (functionUrl == null || functionUrl.isBlank()) {
            throw new IllegalArgumentException("functionUrl is required for responder " + name);
        }
        this.restClient = restClient;
        this.functionUrl = functionUrl;
        this.objectMapper = objectMapper;
    }

    @Override
    protected ResponderOutput respond(ResponderRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", request.getInputText());
        payload.put("chatHistory", request.getHistory());
        payload.put("additionalParams", request.getAdditionalParams());
        payload.put("userId", request.getUserId());
        payload.put("sessionId", request.getSessionId());

        log.info("Remote function call [responder={}, url={}]", getId(), functionUrl);

        String body;
        try {
            body = restClient.post()
                    .uri(functionUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String error = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        throw new ResponderException("Remote function for '" + getId() + "' returned "
                                + res.getStatusCode().value() + ": " + error);
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new ResponderException("Remote function for '" + getId() + "' unreachable: " + e.getMessage(), e);
        }

        return ResponderOutput.of(Message.assistantText(decode(body)));
    }

    String decode(String body) {
        if (body == null || body.isBlank()) {
            throw new ResponderException("Remote function for '" + getId() + "' returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode response = root.get("response");
            if (response == null && root.path("body").isTextual()) {
                response = objectMapper.readTree(root.get("body").asText()).get("response");
            }
            if (response == null || response.isNull()) {
                throw new ResponderException("Remote function for '" + getId()
                        + "' returned no 'response' field; fields were " + fieldNames(root));
            }
            return response.isTextual() ? response.asText() : response.toString();
        } catch (JsonProcessingException e) {
            throw new ResponderException("Remote function for '" + getId() + "' returned invalid JSON", e);
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
