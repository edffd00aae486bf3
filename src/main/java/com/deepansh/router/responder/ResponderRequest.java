package com.deepansh.router.responder;

import com.deepansh.router.model.Message;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ResponderRequest {

    String inputText;
    String userId;
    String sessionId;

    /** Bounded history of this responder for the (user, session) pair, oldest first. */
    @Builder.Default
    List<Message> history = List.of();

    @Builder.Default
    Map<String, String> additionalParams = Map.of();
}
