package com.deepansh.router.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestMetadata {

    public static final String NO_AGENT_ID = "no_agent_selected";
    public static final String NO_AGENT_NAME = "No Agent";

    String userInput;
    String agentId;
    String agentName;
    String userId;
    String sessionId;

    @Builder.Default
    Map<String, String> additionalParams = Map.of();

    Double confidence;
    RouteErrorType errorType;
}
