package com.deepansh.router.api;

import com.deepansh.router.core.ForcedSelection;
import com.deepansh.router.core.Orchestrator;
import com.deepansh.router.core.ResponseEnvelope;
import com.deepansh.router.core.RouteRequest;
import com.deepansh.router.responder.ResponderRegistration;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Subscription;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Routing endpoints.
 *
 * POST /api/v1/router/route         → JSON; a streamed reply is joined before returning
 * POST /api/v1/router/route/stream  → SSE: "metadata", then "fragment" events, then "done"
 *                                      (or "error"); a client disconnect cancels the stream
 * GET  /api/v1/router/agents        → registered responders
 * GET  /api/v1/router/health
 */
@RestController
@RequestMapping("/api/v1/router")
@Slf4j
public class RouterController {

    private static final long SSE_TIMEOUT_MS = 5 * 60 * 1000L;

    private final Orchestrator orchestrator;
    private final Scheduler scheduler;

    public RouterController(Orchestrator orchestrator, @Qualifier("routerTaskExecutor") Executor executor) {
        this.orchestrator = orchestrator;
        this.scheduler = Schedulers.fromExecutor(executor);
    }

    @PostMapping("/route")
    public ResponseEntity<RouteApiResponse> route(@Valid @RequestBody RouteApiRequest request) {
        ResponseEnvelope envelope = orchestrator.route(toRouteRequest(request));
        return ResponseEntity.ok(RouteApiResponse.builder()
                .metadata(envelope.getMetadata())
                .output(envelope.getText())
                .streaming(envelope.isStreaming())
                .build());
    }

    @PostMapping(value = "/route/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter routeStream(@Valid @RequestBody RouteApiRequest request) {
        ResponseEnvelope envelope = orchestrator.route(toRouteRequest(request));
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);

        Flux<String> stream = envelope.isStreaming()
                ? envelope.getStream()
                : Flux.just(envelope.getMessage().getText());
        SseForwarder forwarder = new SseForwarder(envelope, emitter);
        emitter.onCompletion(forwarder::dispose);
        emitter.onTimeout(forwarder::dispose);
        emitter.onError(e -> forwarder.dispose());

        stream.subscribeOn(scheduler).subscribe(forwarder);
        return emitter;
    }

    /**
     * Sends "metadata" on subscribe, one "fragment" per element, then "done" or "error".
     * A failed send means the client is gone; cancelling upstream keeps the reply out of history.
     */
    private static final class SseForwarder extends BaseSubscriber<String> {

        private final ResponseEnvelope envelope;
        private final SseEmitter emitter;

        SseForwarder(ResponseEnvelope envelope, SseEmitter emitter) {
            this.envelope = envelope;
            this.emitter = emitter;
        }

        @Override
        protected void hookOnSubscribe(Subscription subscription) {
            if (send(SseEmitter.event().name("metadata").data(envelope.getMetadata(), MediaType.APPLICATION_JSON))) {
                requestUnbounded();
            }
        }

        @Override
        protected void hookOnNext(String fragment) {
            send(SseEmitter.event().name("fragment").data(fragment));
        }

        @Override
        protected void hookOnComplete() {
            if (send(SseEmitter.event().name("done").data(""))) {
                emitter.complete();
            }
        }

        @Override
        protected void hookOnError(Throwable error) {
            log.error("Stream failed [session={}]", envelope.getMetadata().getSessionId(), error);
            if (send(SseEmitter.event().name("error").data(String.valueOf(error.getMessage())))) {
                emitter.complete();
            }
        }

        private boolean send(SseEmitter.SseEventBuilder event) {
            try {
                emitter.send(event);
                return true;
            } catch (IOException | IllegalStateException e) {
                log.info("SSE client disconnected [session={}]: {}", envelope.getMetadata().getSessionId(), e.getMessage());
                cancel();
                emitter.completeWithError(e);
                return false;
            }
        }
    }

    @GetMapping("/agents")
    public ResponseEntity<List<ResponderRegistration>> agents() {
        return ResponseEntity.ok(orchestrator.getResponders());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private static RouteRequest toRouteRequest(RouteApiRequest request) {
        ForcedSelection forced = request.getResponderId() != null && !request.getResponderId().isBlank()
                ? new ForcedSelection(request.getResponderId(),
                        request.getConfidence() != null ? request.getConfidence() : 1.0)
                : null;
        return RouteRequest.builder()
                .input(request.getInput())
                .userId(request.getUserId() != null && !request.getUserId().isBlank() ? request.getUserId() : "default")
                .sessionId(request.getSessionId() != null && !request.getSessionId().isBlank()
                        ? request.getSessionId() : UUID.randomUUID().toString())
                .additionalParams(request.getAdditionalParams() != null ? request.getAdditionalParams() : Map.of())
                .forcedSelection(forced)
                .build();
    }
}
