package com.deepansh.router.llm;

import lombok.Data;

/**
 * Holds config for a single OpenAI-compatible provider.
 * Populated from application.yml for openai / groq.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;
}
