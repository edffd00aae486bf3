package com.deepansh.router.core;

import com.deepansh.router.classifier.Classifier;
import com.deepansh.router.classifier.ClassifierResult;
import com.deepansh.router.config.RouterProperties;
import com.deepansh.router.exception.ClassificationException;
import com.deepansh.router.exception.ClassificationFailedException;
import com.deepansh.router.exception.ResponderException;
import com.deepansh.router.exception.StorageUnavailableException;
import com.deepansh.router.memory.ChatHistoryStore;
import com.deepansh.router.model.Message;
import com.deepansh.router.observability.TraceService;
import com.deepansh.router.responder.Responder;
import com.deepansh.router.responder.ResponderOutput;
import com.deepansh.router.responder.ResponderRegistration;
import com.deepansh.router.responder.ResponderRequest;
import com.deepansh.router.stream.StreamRelay;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Routes one user turn to one responder.
 *
 * Per-request flow:
 * 1. Validate the request
 * 2. Classify (skipped for a forced selection), retrying up to router.max-retries
 * 3. Dispatch to the selected responder, or fall back to the default, or reject
 * 4. Load that responder's bounded history and invoke it under the responder timeout
 * 5. Persist the user turn and the reply as one pair; for streams, once the caller has
 *    received the last fragment and before its stream completes
 * 6. Async: persist the route trace
 *
 * Failures never escape as exceptions except for invalid requests: classification failures
 * end in fallback or rejection, responder failures in the general error message, and storage
 * failures are logged and traced while the answer is still delivered.
 */
@Slf4j
public class Orchestrator {

    private final RouterProperties props;
    private final Classifier classifier;
    private final ChatHistoryStore historyStore;
    private final ResponderRegistry registry;
    private final TraceService traceService;
    private final CallTimeouts timeouts;
    private final StreamRelay streamRelay;

    public Orchestrator(RouterProperties props,
                        Classifier classifier,
                        ChatHistoryStore historyStore,
                        ResponderRegistry registry,
                        Executor executor,
                        TraceService traceService) {
        this.props = props;
        this.classifier = classifier;
        this.historyStore = historyStore;
        this.registry = registry;
        this.traceService = traceService;
        this.timeouts = new CallTimeouts(executor, props.getClassifierTimeout(), props.getResponderTimeout());
        this.streamRelay = new StreamRelay(props.getStreamIdleTimeout());
        registry.onChange(classifier::setResponders);
    }

    public void addResponder(Responder responder) {
        registry.register(responder);
    }

    public List<ResponderRegistration> getResponders() {
        return registry.registrations();
    }

    public ResponseEnvelope route(RouteRequest request) {
        validate(request);
        RouteContext ctx = new RouteContext(request);

        log.info("Routing request [request={}, user={}, session={}]",
                ctx.getRequestId(), request.getUserId(), request.getSessionId());

        Responder selected;
        double confidence;

        ForcedSelection forced = request.getForcedSelection();
        if (forced != null) {
            selected = registry.find(forced.responderId())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown responder '" + forced.responderId() + "'"));
            confidence = forced.confidence();
            log.info("Classification skipped, forced responder {} [request={}]", selected.getId(), ctx.getRequestId());
        } else {
            ctx.transition(RouteState.CLASSIFYING);
            ClassifierResult result;
            try {
                result = classifyWithRetries(request, ctx);
            } catch (ClassificationFailedException e) {
                log.error("Classification failed after {} attempt(s) [request={}]: {}",
                        e.getAttempts(), ctx.getRequestId(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                ctx.error(RouteErrorType.CLASSIFICATION_FAILED, e.getMessage());
                return fallbackOrReject(request, ctx, null);
            }
            if (!result.isSelected()) {
                return fallbackOrReject(request, ctx, result.confidence());
            }
            selected = result.selectedResponder();
            confidence = result.confidence();
        }

        ctx.transition(RouteState.DISPATCHING);
        return dispatch(request, selected, confidence, ctx);
    }

    // ─── Classification ────────────────────────────────────────────────────────

    private ClassifierResult classifyWithRetries(RouteRequest request, RouteContext ctx) {
        List<Message> timeline = loadTimeline(request, ctx);
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= props.getMaxRetries(); attempt++) {
            ctx.recordClassifierAttempt();
            try {
                ClassifierResult result = timeouts.classifier(
                        () -> classifier.classify(request.getInput(), timeline));
                if (props.isLogClassifierOutput()) {
                    log.info("Classifier output [request={}, responder={}, confidence={}]", ctx.getRequestId(),
                            result.isSelected() ? result.selectedResponder().getId() : null, result.confidence());
                }
                return result;
            } catch (TimeoutException e) {
                lastError = new ClassificationException("Classifier timed out after "
                        + props.getClassifierTimeoutMs() + "ms", e);
                log.warn("Classifier attempt {}/{} timed out [request={}]",
                        attempt, props.getMaxRetries(), ctx.getRequestId());
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Classifier attempt {}/{} failed [request={}]: {}",
                        attempt, props.getMaxRetries(), ctx.getRequestId(), e.getMessage());
            }
        }
        throw new ClassificationFailedException(props.getMaxRetries(), lastError);
    }

    private List<Message> loadTimeline(RouteRequest request, RouteContext ctx) {
        try {
            return historyStore.loadSessionTimeline(request.getUserId(), request.getSessionId());
        } catch (StorageUnavailableException e) {
            log.warn("Session timeline unavailable, classifying without history [request={}]: {}",
                    ctx.getRequestId(), e.getMessage());
            ctx.storageFailed(e.getMessage());
            return List.of();
        }
    }

    private ResponseEnvelope fallbackOrReject(RouteRequest request, RouteContext ctx, Double confidence) {
        Responder fallback = defaultResponder();
        if (props.isUseDefaultAgentIfNoneIdentified() && fallback != null) {
            log.warn("No responder identified, falling back to default {} [request={}]",
                    fallback.getId(), ctx.getRequestId());
            ctx.transition(RouteState.FALLBACK);
            ctx.error(null, null);
            return dispatch(request, fallback, confidence != null ? confidence : 0.0, ctx);
        }

        if (props.isUseDefaultAgentIfNoneIdentified()) {
            log.warn("No responder identified and no default responder configured [request={}]", ctx.getRequestId());
        }
        ctx.transition(RouteState.REJECTED);

        boolean classificationFailed = ctx.getErrorType() == RouteErrorType.CLASSIFICATION_FAILED;
        if (!classificationFailed) {
            ctx.error(RouteErrorType.NO_AGENT_SELECTED, "No responder selected");
        }
        String text = classificationFailed && props.getClassificationErrorMessage() != null
                ? props.getClassificationErrorMessage()
                : props.getNoSelectedAgentMessage();

        RequestMetadata metadata = metadata(request)
                .agentId(RequestMetadata.NO_AGENT_ID)
                .agentName(RequestMetadata.NO_AGENT_NAME)
                .confidence(confidence)
                .errorType(ctx.getErrorType())
                .build();

        finish(ctx);
        return ResponseEnvelope.ofMessage(metadata, Message.assistantText(text));
    }

    private Responder defaultResponder() {
        String id = props.getDefaultResponder();
        if (id == null || id.isBlank()) {
            return null;
        }
        return registry.find(id).orElse(null);
    }

    // ─── Dispatch ──────────────────────────────────────────────────────────────

    private ResponseEnvelope dispatch(RouteRequest request, Responder responder, double confidence, RouteContext ctx) {
        ctx.selected(responder.getId(), confidence);
        log.info("Dispatching to {} [request={}, confidence={}]", responder.getId(), ctx.getRequestId(), confidence);

        RequestMetadata.RequestMetadataBuilder metadata = metadata(request)
                .agentId(responder.getId())
                .agentName(responder.getName())
                .confidence(confidence);

        List<Message> history = loadHistory(request, responder, ctx);
        ResponderRequest responderRequest = ResponderRequest.builder()
                .inputText(request.getInput())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .history(history)
                .additionalParams(paramsOf(request))
                .build();

        ResponderOutput output;
        try {
            output = timeouts.responder(() -> responder.process(responderRequest));
        } catch (TimeoutException e) {
            return responderFailure(metadata, ctx, responder, new ResponderException(
                    "Responder '" + responder.getId() + "' timed out after " + props.getResponderTimeoutMs() + "ms", e));
        } catch (RuntimeException e) {
            return responderFailure(metadata, ctx, responder, e);
        }

        if (!output.isStreaming()) {
            Message reply = output.getMessage();
            ctx.transition(RouteState.PERSISTING);
            persist(request, responder, reply, ctx);
            finish(ctx);
            return ResponseEnvelope.ofMessage(metadata.build(), reply);
        }

        ctx.streaming();
        Flux<String> stream = streamRelay.relay(output.getStream(), new StreamRelay.CompletionCallback() {
            @Override
            public void onComplete(String fullText, int fragmentCount) {
                ctx.transition(RouteState.PERSISTING);
                persist(request, responder, Message.assistantText(fullText), ctx);
                finish(ctx);
            }

            @Override
            public void onAbandoned(String reason) {
                log.info("Stream from {} ended without a complete reply ({}) [request={}]",
                        responder.getId(), reason, ctx.getRequestId());
                ctx.abandoned(reason);
                finish(ctx);
            }
        });
        return ResponseEnvelope.ofStream(metadata.build(), stream);
    }

    private List<Message> loadHistory(RouteRequest request, Responder responder, RouteContext ctx) {
        try {
            return historyStore.loadRecent(request.getUserId(), request.getSessionId(), responder.getId(),
                    props.getMaxMessagePairsPerAgent());
        } catch (StorageUnavailableException e) {
            log.warn("History unavailable for {}, continuing without it [request={}]: {}",
                    responder.getId(), ctx.getRequestId(), e.getMessage());
            ctx.storageFailed(e.getMessage());
            return List.of();
        }
    }

    private ResponseEnvelope responderFailure(RequestMetadata.RequestMetadataBuilder metadata, RouteContext ctx,
                                              Responder responder, RuntimeException e) {
        log.error("Responder {} failed [request={}]", responder.getId(), ctx.getRequestId(), e);
        ctx.error(RouteErrorType.RESPONDER_ERROR, e.getMessage());
        String text = props.getGeneralRoutingErrorMessage() != null
                ? props.getGeneralRoutingErrorMessage()
                : String.valueOf(e.getMessage());
        finish(ctx);
        return ResponseEnvelope.ofMessage(metadata.errorType(RouteErrorType.RESPONDER_ERROR).build(),
                Message.assistantText(text));
    }

    // ─── Persistence ───────────────────────────────────────────────────────────

    private void persist(RouteRequest request, Responder responder, Message reply, RouteContext ctx) {
        if (!responder.isSaveChat()) {
            log.debug("Responder {} does not save chat, exchange not persisted", responder.getId());
            return;
        }
        try {
            historyStore.appendExchange(request.getUserId(), request.getSessionId(), responder.getId(),
                    Message.userText(request.getInput()), reply, props.getMaxMessagePairsPerAgent());
            ctx.persisted();
        } catch (StorageUnavailableException e) {
            log.warn("Exchange not persisted for {} [request={}]: {}",
                    responder.getId(), ctx.getRequestId(), e.getMessage());
            ctx.storageFailed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Exchange rejected by history store for {} [request={}]",
                    responder.getId(), ctx.getRequestId(), e);
            ctx.storageFailed(e.getMessage());
        }
    }

    private void finish(RouteContext ctx) {
        ctx.transition(RouteState.DONE);
        if (props.isLogExecutionTimes()) {
            log.info("Execution times [request={}, total={}ms]: {}",
                    ctx.getRequestId(), ctx.elapsedMs(), ctx.getPhaseLatenciesMs());
        }
        log.info("Route complete [request={}, states={}]", ctx.getRequestId(), ctx.getStates());
        if (traceService != null) {
            traceService.persistTrace(ctx.toTrace());
        }
    }

    // ─── Helpers ───────────────────────────────────────────────────────────────

    private static RequestMetadata.RequestMetadataBuilder metadata(RouteRequest request) {
        return RequestMetadata.builder()
                .userInput(request.getInput())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .additionalParams(paramsOf(request));
    }

    private static Map<String, String> paramsOf(RouteRequest request) {
        return request.getAdditionalParams() != null ? request.getAdditionalParams() : Map.of();
    }

    private static void validate(RouteRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        requireText(request.getInput(), "input");
        requireText(request.getUserId(), "userId");
        requireText(request.getSessionId(), "sessionId");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
