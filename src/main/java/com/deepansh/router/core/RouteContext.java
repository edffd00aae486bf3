package com.deepansh.router.core;

import com.deepansh.router.observability.RouteTrace;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable per-request record of the routing state machine.
 *
 * Streaming requests finish on the relay thread, so every method is synchronized.
 * Kept separate from the envelope so observability never leaks into what callers see.
 */
@Slf4j
public class RouteContext {

    private final String requestId = UUID.randomUUID().toString();
    private final RouteRequest request;
    private final long startNanos = System.nanoTime();

    private final List<RouteState> states = new ArrayList<>(List.of(RouteState.START));
    private final Map<String, Long> phaseLatenciesMs = new LinkedHashMap<>();
    private long phaseStartNanos = startNanos;

    private int classifierAttempts;
    private String responderId;
    private Double confidence;
    private boolean streaming;
    private boolean persisted;
    private RouteErrorType errorType;
    private String errorMessage;
    private String storageError;
    private String abandonReason;

    public RouteContext(RouteRequest request) {
        this.request = request;
    }

    /** Closes the current phase's timer and enters {@code next}. */
    public synchronized void transition(RouteState next) {
        RouteState current = getState();
        long now = System.nanoTime();
        phaseLatenciesMs.merge(current.name(), (now - phaseStartNanos) / 1_000_000, Long::sum);
        phaseStartNanos = now;
        states.add(next);
        log.debug("Route {} -> {} [request={}]", current, next, requestId);
    }

    public synchronized RouteState getState() {
        return states.get(states.size() - 1);
    }

    public synchronized List<RouteState> getStates() {
        return List.copyOf(states);
    }

    public synchronized Map<String, Long> getPhaseLatenciesMs() {
        return new LinkedHashMap<>(phaseLatenciesMs);
    }

    public synchronized int recordClassifierAttempt() {
        return ++classifierAttempts;
    }

    public synchronized int getClassifierAttempts() {
        return classifierAttempts;
    }

    public synchronized void selected(String responderId, Double confidence) {
        this.responderId = responderId;
        this.confidence = confidence;
    }

    public synchronized void streaming() {
        this.streaming = true;
    }

    public synchronized void persisted() {
        this.persisted = true;
    }

    public synchronized boolean isPersisted() {
        return persisted;
    }

    public synchronized void error(RouteErrorType type, String message) {
        this.errorType = type;
        this.errorMessage = message;
    }

    public synchronized RouteErrorType getErrorType() {
        return errorType;
    }

    public synchronized void storageFailed(String message) {
        this.storageError = message;
    }

    public synchronized String getStorageError() {
        return storageError;
    }

    public synchronized void abandoned(String reason) {
        this.abandonReason = reason;
    }

    public String getRequestId() {
        return requestId;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public synchronized RouteTrace toTrace() {
        return RouteTrace.builder()
                .requestId(requestId)
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .userInput(request.getInput())
                .status(status())
                .responderId(responderId)
                .confidence(confidence)
                .classifierAttempts(classifierAttempts)
                .forced(request.getForcedSelection() != null)
                .streaming(streaming)
                .persisted(persisted)
                .states(states.stream().map(Enum::name).toList())
                .phaseLatenciesMs(new LinkedHashMap<>(phaseLatenciesMs))
                .totalLatencyMs(elapsedMs())
                .errorType(errorType != null ? errorType.name() : null)
                .errorMessage(errorMessage != null ? errorMessage : abandonReason)
                .storageError(storageError)
                .build();
    }

    private RouteTrace.Status status() {
        if (states.contains(RouteState.REJECTED)) {
            return RouteTrace.Status.REJECTED;
        }
        if (errorType == RouteErrorType.RESPONDER_ERROR) {
            return RouteTrace.Status.ERROR;
        }
        if (abandonReason != null) {
            return RouteTrace.Status.ABANDONED;
        }
        return states.contains(RouteState.FALLBACK) ? RouteTrace.Status.FALLBACK : RouteTrace.Status.SUCCESS;
    }
}
