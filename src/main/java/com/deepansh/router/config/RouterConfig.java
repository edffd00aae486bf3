package com.deepansh.router.config;

import com.deepansh.router.classifier.AbstractClassifier;
import com.deepansh.router.classifier.Classifier;
import com.deepansh.router.classifier.KeywordClassifier;
import com.deepansh.router.classifier.LlmClassifier;
import com.deepansh.router.core.Orchestrator;
import com.deepansh.router.core.ResponderRegistry;
import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.memory.ChatHistoryStore;
import com.deepansh.router.observability.TraceService;
import com.deepansh.router.responder.Responder;
import com.deepansh.router.tool.AgentTool;
import com.deepansh.router.tool.ToolRegistry;
import com.deepansh.router.tool.impl.EchoTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the routing core: tools, classifier, declared responders and the orchestrator.
 */
@Configuration
@EnableConfigurationProperties(RouterProperties.class)
@Slf4j
public class RouterConfig {

    @Bean
    public AgentTool echoTool() {
        return new EchoTool();
    }

    @Bean
    public ToolRegistry toolRegistry(List<AgentTool> tools) {
        return new ToolRegistry(tools);
    }

    @Bean
    public Classifier classifier(RouterProperties props, LlmClient llmClient) {
        RouterProperties.ClassifierSettings settings = props.getClassifier();
        AbstractClassifier classifier = switch (settings.getType().toLowerCase()) {
            case "llm" -> new LlmClassifier(llmClient, settings.getMaxTokens(), settings.getTemperature());
            case "keyword" -> new KeywordClassifier(settings.getKeywords());
            default -> throw new IllegalStateException("Unknown router.classifier.type '" + settings.getType()
                    + "', expected llm or keyword");
        };
        if (settings.getPromptTemplate() != null) {
            classifier.setSystemPrompt(settings.getPromptTemplate(), null);
        }
        log.info("Classifier: {}", classifier.getClass().getSimpleName());
        return classifier;
    }

    @Bean
    public ResponderFactory responderFactory(LlmClient llmClient,
                                             ToolRegistry toolRegistry,
                                             @Qualifier("llmRestClientBuilder") RestClient.Builder restClientBuilder,
                                             ObjectMapper objectMapper,
                                             @Qualifier("routerTaskExecutor") Executor executor) {
        return new ResponderFactory(llmClient, toolRegistry, restClientBuilder, objectMapper, executor);
    }

    @Bean
    public ResponderRegistry responderRegistry(RouterProperties props, ResponderFactory factory) {
        ResponderRegistry registry = new ResponderRegistry();
        List<Responder> responders = factory.createAll(props.getResponders());
        responders.forEach(registry::register);

        String defaultId = props.getDefaultResponder();
        if (defaultId != null && !defaultId.isBlank() && !registry.contains(defaultId)) {
            throw new IllegalStateException("router.default-responder '" + defaultId + "' is not a declared responder");
        }
        log.info("{} responder(s) registered, default={}", registry.size(),
                defaultId == null || defaultId.isBlank() ? "none" : defaultId);
        return registry;
    }

    @Bean
    public Orchestrator orchestrator(RouterProperties props,
                                     Classifier classifier,
                                     ChatHistoryStore historyStore,
                                     ResponderRegistry registry,
                                     @Qualifier("routerTaskExecutor") Executor executor,
                                     TraceService traceService) {
        return new Orchestrator(props, classifier, historyStore, registry, executor, traceService);
    }
}
