package com.deepansh.router.config;

import com.deepansh.router.memory.ChatHistoryStore;
import com.deepansh.router.memory.InMemoryChatHistoryStore;
import com.deepansh.router.memory.RedisChatHistoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Picks the history backend from {@code router.history.store}. */
@Configuration
@Slf4j
public class HistoryStoreConfig {

    @Bean
    public ChatHistoryStore chatHistoryStore(RouterProperties props,
                                             ObjectProvider<StringRedisTemplate> redisTemplate,
                                             ObjectMapper objectMapper) {
        String store = props.getHistory().getStore();
        if ("redis".equalsIgnoreCase(store)) {
            log.info("History store: redis [ttl={}]", props.getHistory().getTtl());
            return new RedisChatHistoryStore(redisTemplate.getObject(), objectMapper, props.getHistory().getTtl());
        }
        if (!"memory".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown router.history.store '" + store + "', expected memory or redis");
        }
        log.info("History store: in-memory (history is lost on restart)");
        return new InMemoryChatHistoryStore();
    }
}
