package com.deepansh.router.responder;

import com.deepansh.router.model.Message;
import lombok.Getter;

/**
 * Working state of one tool-use exchange. Owned by a single {@code process} call and
 * discarded when it returns.
 */
@Getter
public class ToolExchangeState {

    private Message pendingToolUse;
    private final StringBuilder accumulatedText = new StringBuilder();
    private int recursionsRemaining;
    private int invocations;

    public ToolExchangeState(int maxRecursions) {
        if (maxRecursions < 1) {
            throw new IllegalArgumentException("toolMaxRecursions must be >= 1, got " + maxRecursions);
        }
        this.recursionsRemaining = maxRecursions;
    }

    /** Records one model invocation and its reply. */
    void recordInvocation(Message reply) {
        invocations++;
        recursionsRemaining--;
        String text = reply.getText();
        if (!text.isEmpty()) {
            if (accumulatedText.length() > 0) {
                accumulatedText.append('\n');
            }
            accumulatedText.append(text);
        }
        pendingToolUse = reply.hasToolUse() ? reply : null;
    }

    public boolean canRecurse() {
        return pendingToolUse != null && recursionsRemaining > 0;
    }

    public String getAccumulatedText() {
        return accumulatedText.toString();
    }
}
