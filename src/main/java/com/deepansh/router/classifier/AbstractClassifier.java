package com.deepansh.router.classifier;

import com.deepansh.router.llm.PromptTemplate;
import com.deepansh.router.model.Message;
import com.deepansh.router.responder.AbstractResponder;
import com.deepansh.router.responder.Responder;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared classifier plumbing: the responder table, the routing prompt and name resolution.
 *
 * The prompt template receives two built-in variables, {@code {{AGENT_DESCRIPTIONS}}}
 * ("id:description" blocks) and {@code {{HISTORY}}} ("role: text" lines); custom variables
 * set through {@link #setSystemPrompt} are substituted alongside them.
 */
@Slf4j
public abstract class AbstractClassifier implements Classifier {

    static final String DEFAULT_PROMPT_TEMPLATE = """
            You are AgentMatcher, an assistant that matches a user's request to the most suitable agent.
            Identify the key entities and intent of the request and pick the agent best equipped to handle it.

            The user's input may continue a previous interaction. The conversation history below shows which
            agent answered before, as [agent-id] in front of each assistant reply. When the input is a
            follow-up ("yes", "ok", "tell me more", "1"), select the same agent as before.

            Available agents:
            <agents>
            {{AGENT_DESCRIPTIONS}}
            </agents>
            If no agent fits, put "unknown" as the selected agent.

            Confidence is a number between 0 and 1: high for clear requests or clear follow-ups,
            lower for vague requests that could fit several agents.

            Conversation history:
            <history>
            {{HISTORY}}
            </history>

            Answer only by calling the analyzePrompt tool with the user input, the selected agent id
            and your confidence.""";

    private volatile Map<String, Responder> responders = Map.of();
    private String promptTemplate = DEFAULT_PROMPT_TEMPLATE;
    private Map<String, String> customVariables = Map.of();

    @Override
    public final ClassifierResult classify(String inputText, List<Message> history) {
        ClassifierDecision decision = decide(inputText, history);
        Responder selected = resolveResponder(decision.selectedAgent());
        if (selected == null) {
            log.warn("Classifier selected unregistered responder '{}' (confidence={})",
                    decision.selectedAgent(), decision.confidence());
        }
        return new ClassifierResult(selected, decision.confidence());
    }

    /** Produces the raw decision; structured-output errors propagate to the caller. */
    protected abstract ClassifierDecision decide(String inputText, List<Message> history);

    @Override
    public void setResponders(Map<String, Responder> responders) {
        this.responders = Map.copyOf(responders);
    }

    protected Map<String, Responder> getResponders() {
        return responders;
    }

    public synchronized void setSystemPrompt(String template, Map<String, String> variables) {
        if (template != null && !template.isBlank()) {
            this.promptTemplate = template;
        }
        if (variables != null) {
            this.customVariables = Map.copyOf(variables);
        }
    }

    /**
     * First whitespace-separated token, lowercased, looked up by id. Models often answer
     * "tech-agent (confidence high)" or with the display name, so the full name is tried too.
     */
    protected Responder resolveResponder(String selectedAgent) {
        if (selectedAgent == null || selectedAgent.isBlank()) {
            return null;
        }
        Map<String, Responder> table = responders;
        String token = selectedAgent.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
        Responder byToken = table.get(token);
        if (byToken != null) {
            return byToken;
        }
        return table.get(AbstractResponder.generateKeyFromName(selectedAgent));
    }

    protected String buildSystemPrompt(List<Message> history) {
        Map<String, String> variables;
        String template;
        synchronized (this) {
            variables = new HashMap<>(customVariables);
            template = promptTemplate;
        }
        variables.put("AGENT_DESCRIPTIONS", formatDescriptions(responders));
        variables.put("HISTORY", formatHistory(history));
        return PromptTemplate.render(template, variables);
    }

    static String formatDescriptions(Map<String, Responder> responders) {
        return responders.values().stream()
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .map(r -> r.getId() + ":" + r.getDescription())
                .collect(Collectors.joining("\n\n"));
    }

    static String formatHistory(List<Message> history) {
        return history.stream()
                .map(m -> m.getRole() + ": " + m.getText())
                .collect(Collectors.joining("\n"));
    }
}
