package com.deepansh.router.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * Both providers speak the OpenAI chat-completions dialect, so one client class serves both.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o-mini}") private String openAiModel;
    @Value("${openai.max-tokens:1024}") private int openAiMaxTokens;
    @Value("${openai.temperature:0.0}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.3-70b-versatile}") private String groqModel;
    @Value("${groq.max-tokens:1024}") private int groqMaxTokens;
    @Value("${groq.temperature:0.0}") private double groqTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", "openai".equalsIgnoreCase(provider) ? openAiModel : groqModel);
        log.info("================================================================");
    }

    /**
     * The raw provider client. Callers get it through {@code ResilientLlmClient}.
     */
    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper,
                                     @Qualifier("llmRestClientBuilder") RestClient.Builder builder,
                                     @Qualifier("llmWebClientBuilder") WebClient.Builder streamingBuilder) {
        if ("openai".equalsIgnoreCase(provider)) {
            logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
            return new GenericLlmClient(
                    props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                    objectMapper, "openai", builder.clone(), streamingBuilder.clone());
        }
        logKey("GROQ", groqKey, "GROQ_API_KEY");
        return new GenericLlmClient(
                props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                objectMapper, "groq", builder.clone(), streamingBuilder.clone());
    }

    private LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens, double temp) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temp);
        return p;
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.warn("  {} API key not set; LLM responders and the LLM classifier will fail. Set {}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
