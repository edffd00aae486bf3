package com.deepansh.router.config;

import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.responder.AbstractResponder;
import com.deepansh.router.responder.ChainResponder;
import com.deepansh.router.responder.LlmResponder;
import com.deepansh.router.responder.RemoteFunctionResponder;
import com.deepansh.router.responder.Responder;
import com.deepansh.router.responder.RuleBasedResponder;
import com.deepansh.router.responder.SupervisorResponder;
import com.deepansh.router.tool.RegistryToolHandler;
import com.deepansh.router.tool.ToolDefinition;
import com.deepansh.router.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Builds responders from {@code router.responders} entries.
 *
 * Entries are built in declaration order; a chain or a supervisor team may only reference
 * responders declared before it (by name or id). Configuration mistakes fail startup with IllegalStateException.
 */
@Slf4j
public class ResponderFactory {

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public ResponderFactory(LlmClient llmClient, ToolRegistry toolRegistry, RestClient.Builder restClientBuilder,
                            ObjectMapper objectMapper, Executor executor) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public List<Responder> createAll(List<ResponderProperties> declarations) {
        Map<String, Responder> built = new LinkedHashMap<>();
        for (ResponderProperties p : declarations) {
            Responder responder = create(p, built);
            built.put(responder.getId(), responder);
        }
        return new ArrayList<>(built.values());
    }

    Responder create(ResponderProperties p, Map<String, Responder> declaredBefore) {
        log.info("Building {} responder '{}'", p.getType(), p.getName());
        return switch (p.getType()) {
            case LLM -> llm(p);
            case REMOTE -> new RemoteFunctionResponder(p.getName(), p.getDescription(), p.isSaveChat(),
                    restClientBuilder.clone().build(), p.getUrl(), objectMapper);
            case RULE -> new RuleBasedResponder(p.getName(), p.getDescription(), p.isSaveChat(),
                    p.getRules().stream()
                            .map(r -> RuleBasedResponder.Rule.of(r.getPattern(), r.getReply()))
                            .toList(),
                    p.getFallbackReply());
            case CHAIN -> new ChainResponder(p.getName(), p.getDescription(), p.isSaveChat(),
                    p.getChain().stream().map(ref -> lookup(ref, declaredBefore, p.getName())).toList());
            case SUPERVISOR -> supervisor(p, declaredBefore);
        };
    }

    private Responder supervisor(ResponderProperties p, Map<String, Responder> declaredBefore) {
        if (p.isStreaming()) {
            throw new IllegalStateException("Supervisor '" + p.getName() + "' cannot stream");
        }
        return SupervisorResponder.builder()
                .name(p.getName())
                .description(p.getDescription())
                .llmClient(llmClient)
                .team(p.getTeam().stream().map(ref -> lookup(ref, declaredBefore, p.getName())).toList())
                .extraTools(checkedTools(p).stream().map(toolRegistry::getTool).toList())
                .executor(executor)
                .toolMaxRecursions(p.getToolMaxRecursions())
                .trace(p.isTrace())
                .saveChat(p.isSaveChat())
                .build();
    }

    private List<String> checkedTools(ResponderProperties p) {
        List<String> unknown = p.getTools().stream().filter(t -> !toolRegistry.hasTool(t)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("Responder '" + p.getName() + "' references unknown tools " + unknown);
        }
        return p.getTools();
    }

    private Responder llm(ResponderProperties p) {
        LlmResponder.LlmResponderBuilder builder = LlmResponder.builder()
                .name(p.getName())
                .description(p.getDescription())
                .llmClient(llmClient)
                .streaming(p.isStreaming())
                .saveChat(p.isSaveChat())
                .promptTemplate(p.getPromptTemplate())
                .promptVariables(p.getPromptVariables())
                .maxTokens(p.getMaxTokens())
                .temperature(p.getTemperature())
                .topP(p.getTopP())
                .stopSequences(p.getStopSequences())
                .executor(executor);

        if (!p.getTools().isEmpty()) {
            List<String> names = checkedTools(p);
            List<ToolDefinition> definitions = toolRegistry.getAllDefinitions().stream()
                    .filter(d -> names.contains(d.getName()))
                    .toList();
            builder.tools(definitions)
                    .toolHandler(new RegistryToolHandler(toolRegistry))
                    .toolMaxRecursions(p.getToolMaxRecursions());
        }
        return builder.build();
    }

    private static Responder lookup(String ref, Map<String, Responder> declaredBefore, String ownerName) {
        Responder byId = declaredBefore.get(ref);
        if (byId != null) {
            return byId;
        }
        Responder byName = declaredBefore.get(AbstractResponder.generateKeyFromName(ref));
        if (byName == null) {
            throw new IllegalStateException("'" + ownerName + "' references '" + ref
                    + "', which is not declared before it");
        }
        return byName;
    }
}
