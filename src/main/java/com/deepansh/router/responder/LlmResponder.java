package com.deepansh.router.responder;

import com.deepansh.router.exception.ResponderException;
import com.deepansh.router.llm.LlmClient;
import com.deepansh.router.llm.LlmRequest;
import com.deepansh.router.llm.LlmStreamEvent;
import com.deepansh.router.llm.PromptTemplate;
import com.deepansh.router.model.Message;
import com.deepansh.router.tool.ToolDefinition;
import com.deepansh.router.tool.ToolHandler;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Model-backed responder.
 *
 * Flow per turn:
 *   1. Render the system prompt from the template and its variables
 *   2. If a {@link Retriever} is configured, append the retrieved context to the prompt
 *   3. Send history + the user turn to the model
 *   4. With tools configured, run the {@link ToolUseLoop} until the model stops asking
 *
 * In streaming mode the reply is a cold {@link Flux} of text fragments. Without tools it is
 * the provider stream itself. With tools, steps 3-4 run on the router executor once the
 * caller subscribes, and every fragment of every round goes through a unicast sink; a
 * cancelled subscription stops the loop before its next model call.
 */
@Slf4j
public class LlmResponder extends AbstractResponder {

    static final String DEFAULT_PROMPT_TEMPLATE = """
            You are a {{NAME}}. {{DESCRIPTION}}
            Provide helpful and accurate information based on your expertise.
            The human may ask follow-up questions about your previous answer or switch to an
            unrelated topic at any point; follow them and keep your answers focused on the latest request.
            Ask for clarification when a request is ambiguous.""";

    static final String CONTEXT_PREFIX = "\nHere is the context to use to answer the user's question:\n";

    private final LlmClient llmClient;
    private final String promptTemplate;
    private final Map<String, String> promptVariables;
    private final List<ToolDefinition> tools;
    private final ToolUseLoop toolLoop;
    private final Retriever retriever;
    private final Executor executor;
    private final Integer maxTokens;
    private final Double temperature;
    private final Double topP;
    private final List<String> stopSequences;

    @Builder
    public LlmResponder(String name,
                        String description,
                        LlmClient llmClient,
                        boolean streaming,
                        Boolean saveChat,
                        String promptTemplate,
                        @Singular Map<String, String> promptVariables,
                        @Singular List<ToolDefinition> tools,
                        ToolHandler toolHandler,
                        Integer toolMaxRecursions,
                        Retriever retriever,
                        Executor executor,
                        Integer maxTokens,
                        Double temperature,
                        Double topP,
                        @Singular List<String> stopSequences) {
        super(name, description,
                new ResponderCapabilities(streaming, toolHandler != null, retriever != null),
                saveChat == null || saveChat);
        if (llmClient == null) {
            throw new IllegalArgumentException("llmClient is required for responder " + name);
        }
        if (streaming && toolHandler != null && executor == null) {
            throw new IllegalArgumentException("streaming tool responder " + name + " needs an executor");
        }
        this.llmClient = llmClient;
        this.promptTemplate = promptTemplate != null && !promptTemplate.isBlank()
                ? promptTemplate : DEFAULT_PROMPT_TEMPLATE;

        Map<String, String> vars = new HashMap<>();
        vars.put("NAME", name);
        vars.put("DESCRIPTION", description != null ? description : "");
        vars.putAll(promptVariables);
        this.promptVariables = Map.copyOf(vars);

        this.tools = List.copyOf(tools);
        this.toolLoop = toolHandler != null
                ? new ToolUseLoop(toolHandler, toolMaxRecursions != null
                        ? toolMaxRecursions : ToolUseLoop.DEFAULT_MAX_RECURSIONS)
                : null;
        this.retriever = retriever;
        this.executor = executor;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.topP = topP;
        this.stopSequences = List.copyOf(stopSequences);
    }

    @Override
    protected ResponderOutput respond(ResponderRequest request) {
        LlmRequest template = LlmRequest.builder()
                .systemPrompt(buildSystemPrompt(request.getInputText()))
                .tools(tools)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .topP(topP)
                .stopSequences(stopSequences)
                .build();

        List<Message> conversation = new ArrayList<>(request.getHistory());
        conversation.add(Message.userText(request.getInputText()));

        if (!getCapabilities().streaming()) {
            if (toolLoop == null) {
                Message reply = llmClient.chat(template.toBuilder().messages(conversation).build()).getMessage();
                return ResponderOutput.of(textOnly(reply));
            }
            ToolUseLoop.Outcome outcome = toolLoop.run(conversation,
                    conv -> llmClient.chat(template.toBuilder().messages(conv).build()).getMessage());
            return ResponderOutput.of(finalMessage(outcome));
        }

        if (toolLoop == null) {
            return ResponderOutput.of(llmClient.stream(template.toBuilder().messages(conversation).build())
                    .mapNotNull(LlmStreamEvent::getFragment)
                    .onErrorMap(e -> !(e instanceof ResponderException), this::streamFailure));
        }
        return ResponderOutput.of(Flux.defer(() -> {
            Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
            Cancellation cancellation = new Cancellation();
            executor.execute(() -> streamToolTurn(template, conversation, sink, cancellation));
            return sink.asFlux().doOnCancel(cancellation::cancel);
        }));
    }

    private void streamToolTurn(LlmRequest template, List<Message> conversation,
                                Sinks.Many<String> sink, Cancellation cancellation) {
        try {
            toolLoop.run(conversation,
                    conv -> streamRound(template.toBuilder().messages(conv).build(), sink, cancellation));
            sink.tryEmitComplete();
        } catch (CancellationException e) {
            log.debug("Streaming turn stopped [responder={}]: {}", getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Streaming turn failed [responder={}]: {}", getId(), e.getMessage());
            sink.tryEmitError(e instanceof ResponderException ? e : streamFailure(e));
        }
    }

    /** Forwards one round's fragments and returns the assembled turn, or throws once the caller is gone. */
    private Message streamRound(LlmRequest request, Sinks.Many<String> sink, Cancellation cancellation) {
        if (cancellation.isCancelled()) {
            throw new CancellationException("caller cancelled the stream");
        }
        LlmStreamEvent last = llmClient.stream(request)
                .doOnNext(event -> {
                    if (event.getFragment() != null) {
                        sink.tryEmitNext(event.getFragment());
                    }
                })
                .takeUntilOther(cancellation.signal())
                .blockLast();
        if (last == null || !last.isCompleted()) {
            throw new CancellationException("caller cancelled the stream");
        }
        return last.getResponse().getMessage();
    }

    private ResponderException streamFailure(Throwable e) {
        return new ResponderException("Responder '" + getId() + "' failed while streaming: " + e.getMessage(), e);
    }

    private String buildSystemPrompt(String inputText) {
        String systemPrompt = PromptTemplate.render(promptTemplate, promptVariables);
        if (retriever == null) {
            return systemPrompt;
        }
        String context;
        try {
            context = retriever.retrieveAndCombine(inputText);
        } catch (RuntimeException e) {
            throw new ResponderException("Retriever failed for responder '" + getId() + "': " + e.getMessage(), e);
        }
        return systemPrompt + CONTEXT_PREFIX + (context != null ? context : "");
    }

    /**
     * An exhausted loop ends on a reply that still asks for tools. Its tool uses have no
     * results, so only its text is kept; history must never hold an unanswered ToolUse.
     */
    private Message finalMessage(ToolUseLoop.Outcome outcome) {
        if (!outcome.exhausted()) {
            return outcome.lastMessage();
        }
        String text = outcome.lastMessage().getText();
        if (text.isBlank()) {
            text = outcome.accumulatedText();
        }
        if (text.isBlank()) {
            throw new ResponderException("Responder '" + getId() + "' exhausted " + outcome.invocations()
                    + " tool rounds without producing any text");
        }
        return Message.assistantText(text);
    }

    /** Without a tool handler nothing answers ToolUse blocks, so only the text is kept. */
    private static Message textOnly(Message reply) {
        return reply.hasToolUse() ? Message.assistantText(reply.getText()) : reply;
    }

    public String getPromptTemplate() {
        return promptTemplate;
    }

    /** Set once by the caller's cancel; read as a flag between rounds and as a signal during one. */
    private static final class Cancellation {

        private final AtomicBoolean flag = new AtomicBoolean();
        private final Sinks.One<Boolean> signal = Sinks.one();

        void cancel() {
            flag.set(true);
            signal.tryEmitValue(true);
        }

        boolean isCancelled() {
            return flag.get();
        }

        Mono<Boolean> signal() {
            return signal.asMono();
        }
    }
}
