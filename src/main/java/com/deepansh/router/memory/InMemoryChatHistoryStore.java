package com.deepansh.router.memory;

import com.deepansh.router.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local history store.
 *
 * Each triple maps to an immutable snapshot list that is replaced through
 * {@link ConcurrentHashMap#compute}, so appends for one triple are serialized
 * while other triples proceed independently. Nothing expires; use the Redis
 * store when retention matters.
 */
@Slf4j
public class InMemoryChatHistoryStore implements ChatHistoryStore {

    private final Map<ConversationKey, List<StoredMessage>> conversations = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicLong lastStamp = new AtomicLong();

    public InMemoryChatHistoryStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatHistoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<Message> loadRecent(String userId, String sessionId, String responderId, int maxPairs) {
        List<StoredMessage> stored = conversations.getOrDefault(
                new ConversationKey(userId, sessionId, responderId), List.of());
        List<Message> result = ChatHistoryStore.keepNewestPairs(stored, maxPairs).stream()
                .map(StoredMessage::message)
                .toList();
        log.debug("Loaded {} messages [user={}, session={}, responder={}]",
                result.size(), userId, sessionId, responderId);
        return result;
    }

    @Override
    public void appendExchange(String userId, String sessionId, String responderId,
                               Message userMessage, Message responderMessage, int maxPairs) {
        ChatHistoryStore.checkExchange(userMessage, responderMessage, maxPairs);

        List<StoredMessage> updated = conversations.compute(
                new ConversationKey(userId, sessionId, responderId), (k, existing) -> {
            List<StoredMessage> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(new StoredMessage(userMessage, nextStamp()));
            next.add(new StoredMessage(responderMessage, nextStamp()));
            return List.copyOf(ChatHistoryStore.keepNewestPairs(next, maxPairs));
        });

        log.debug("Appended exchange [user={}, session={}, responder={}, size={}]",
                userId, sessionId, responderId, updated.size());
    }

    @Override
    public List<Message> loadSessionTimeline(String userId, String sessionId) {
        List<StoredMessage> all = new ArrayList<>();

        conversations.forEach((key, messages) -> {
            if (!key.inSession(userId, sessionId)) {
                return;
            }
            String responderId = key.responderId();
            messages.forEach(m -> all.add(new StoredMessage(
                    ChatHistoryStore.tagWithResponder(m.message(), responderId), m.storedAt())));
        });

        all.sort(Comparator.comparingLong(StoredMessage::storedAt));
        return all.stream().map(StoredMessage::message).toList();
    }

    // Strictly increasing so the session timeline keeps append order even within one millisecond
    private long nextStamp() {
        long now = clock.millis();
        return lastStamp.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
