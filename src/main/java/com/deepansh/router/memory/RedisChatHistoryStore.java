package com.deepansh.router.memory;

import com.deepansh.router.exception.StorageUnavailableException;
import com.deepansh.router.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Redis-backed history store.
 *
 * Layout (each id length-prefixed, see {@link ConversationKey#encode}):
 * - router:history:{userId}:{sessionId}:{responderId}  LIST of JSON {@link StoredMessage}, oldest first
 * - router:session-responders:{userId}:{sessionId}     SET of responder ids seen in the session
 *
 * An exchange is written with RPUSH + LTRIM + EXPIRE inside one MULTI/EXEC, so
 * concurrent appends for the same triple are serialized by Redis and the list never
 * exceeds 2 * maxPairs entries. TTL is refreshed on every write; expiry is the only deletion.
 */
@Slf4j
public class RedisChatHistoryStore implements ChatHistoryStore {

    private static final String KEY_PREFIX = "router:history:";
    private static final String INDEX_PREFIX = "router:session-responders:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public RedisChatHistoryStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this(redisTemplate, objectMapper, ttl, Clock.systemUTC());
    }

    public RedisChatHistoryStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                 Duration ttl, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public List<Message> loadRecent(String userId, String sessionId, String responderId, int maxPairs) {
        String key = historyKey(userId, sessionId, responderId);
        List<Message> messages = readList(key, -2L * maxPairs).stream()
                .map(StoredMessage::message)
                .toList();
        log.debug("Loaded {} messages from {}", messages.size(), key);
        return messages;
    }

    @Override
    public void appendExchange(String userId, String sessionId, String responderId,
                               Message userMessage, Message responderMessage, int maxPairs) {
        ChatHistoryStore.checkExchange(userMessage, responderMessage, maxPairs);

        String key = historyKey(userId, sessionId, responderId);
        String indexKey = indexKey(userId, sessionId);
        long now = clock.millis();
        String userJson = serialize(new StoredMessage(userMessage, now));
        String replyJson = serialize(new StoredMessage(responderMessage, now + 1));

        try {
            redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.multi();
                    ops.opsForList().rightPushAll(key, userJson, replyJson);
                    ops.opsForList().trim(key, -2L * maxPairs, -1);
                    ops.expire(key, ttl);
                    ops.opsForSet().add(indexKey, responderId);
                    ops.expire(indexKey, ttl);
                    return ops.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to append exchange to " + key, e);
        }

        log.debug("Appended exchange to {} (maxPairs={}, TTL={})", key, maxPairs, ttl);
    }

    @Override
    public List<Message> loadSessionTimeline(String userId, String sessionId) {
        Set<String> responderIds;
        try {
            responderIds = redisTemplate.opsForSet().members(indexKey(userId, sessionId));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read session index for " + sessionId, e);
        }
        if (responderIds == null || responderIds.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> all = new ArrayList<>();
        for (String responderId : responderIds) {
            readList(historyKey(userId, sessionId, responderId), 0).forEach(m -> all.add(new StoredMessage(
                    ChatHistoryStore.tagWithResponder(m.message(), responderId), m.storedAt())));
        }
        all.sort(Comparator.comparingLong(StoredMessage::storedAt));
        return all.stream().map(StoredMessage::message).toList();
    }

    private List<StoredMessage> readList(String key, long start) {
        List<String> raw;
        try {
            raw = redisTemplate.opsForList().range(key, start, -1);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read history " + key, e);
        }
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> result = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                result.add(objectMapper.readValue(json, StoredMessage.class));
            } catch (JsonProcessingException e) {
                throw new StorageUnavailableException("Corrupt history entry in " + key, e);
            }
        }
        return result;
    }

    private String serialize(StoredMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Failed to serialize history entry", e);
        }
    }

    private String historyKey(String userId, String sessionId, String responderId) {
        return KEY_PREFIX + ConversationKey.encode(userId, sessionId, responderId);
    }

    private String indexKey(String userId, String sessionId) {
        return INDEX_PREFIX + ConversationKey.encode(userId, sessionId);
    }
}
