package com.deepansh.router.llm;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One element of a streamed model turn: a text fragment as it arrives, or, last,
 * the assembled turn including any tool uses.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LlmStreamEvent {

    String fragment;
    LlmResponse response;

    public static LlmStreamEvent fragment(String text) {
        return new LlmStreamEvent(text, null);
    }

    public static LlmStreamEvent completed(LlmResponse response) {
        return new LlmStreamEvent(null, response);
    }

    public boolean isCompleted() {
        return response != null;
    }
}
