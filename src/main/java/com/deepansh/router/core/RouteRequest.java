package com.deepansh.router.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RouteRequest {

    String input;
    String userId;
    String sessionId;

    @Builder.Default
    Map<String, String> additionalParams = Map.of();

    /** Optional; when present the classifier is skipped. */
    ForcedSelection forcedSelection;
}
