package com.deepansh.router.memory;

import com.deepansh.router.exception.MalformedMessageException;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.TextBlock;

import java.util.List;

/**
 * Bounded conversation history, scoped by (userId, sessionId, responderId).
 *
 * Implementations must make {@link #appendExchange} atomic per triple and must not
 * serialize appends of different triples against each other. Every backend failure
 * surfaces as {@link com.deepansh.router.exception.StorageUnavailableException}.
 */
public interface ChatHistoryStore {

    /**
     * @return at most {@code 2 * maxPairs} messages, oldest first. Empty for an unknown triple.
     */
    List<Message> loadRecent(String userId, String sessionId, String responderId, int maxPairs);

    /**
     * Appends one user/assistant pair and trims the history to the newest {@code maxPairs} pairs.
     */
    void appendExchange(String userId, String sessionId, String responderId,
                        Message userMessage, Message responderMessage, int maxPairs);

    /**
     * Every stored message of the session across all responders, in append order.
     * Assistant text is prefixed with {@code [responderId]} so a classifier can see who answered.
     */
    List<Message> loadSessionTimeline(String userId, String sessionId);

    static void checkExchange(Message userMessage, Message responderMessage, int maxPairs) {
        if (maxPairs < 1) {
            throw new IllegalArgumentException("maxPairs must be >= 1, got " + maxPairs);
        }
        if (userMessage == null || userMessage.getRole() != Message.Role.user) {
            throw new MalformedMessageException("exchange must start with a user message");
        }
        if (responderMessage == null || responderMessage.getRole() != Message.Role.assistant) {
            throw new MalformedMessageException("exchange must end with an assistant message");
        }
    }

    static <T> List<T> keepNewestPairs(List<T> messages, int maxPairs) {
        int max = maxPairs * 2;
        if (messages.size() <= max) {
            return messages;
        }
        return messages.subList(messages.size() - max, messages.size());
    }

    static Message tagWithResponder(Message message, String responderId) {
        if (message.getRole() != Message.Role.assistant) {
            return message;
        }
        return Message.builder()
                .role(Message.Role.assistant)
                .block(new TextBlock("[" + responderId + "] " + message.getText()))
                .build();
    }
}
