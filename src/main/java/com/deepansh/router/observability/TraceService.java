package com.deepansh.router.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists route traces and exposes them for inspection.
 *
 * Persistence is @Async: it never delays the routed answer, and a failing trace store
 * never fails a request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int MAX_INPUT_CHARS = 4000;

    private final RouteTraceRepository traceRepository;

    @Async("routerTaskExecutor")
    public void persistTrace(RouteTrace trace) {
        try {
            trace.setUserInput(truncate(trace.getUserInput(), MAX_INPUT_CHARS));
            traceRepository.save(trace);
            log.debug("Trace persisted [request={}, status={}, latency={}ms]",
                    trace.getRequestId(), trace.getStatus(), trace.getTotalLatencyMs());
        } catch (Exception e) {
            log.error("Failed to persist route trace [request={}]", trace.getRequestId(), e);
        }
    }

    public List<RouteTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<RouteTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    /** How often each responder answered this user. */
    public Map<String, Long> getResponderBreakdown(String userId) {
        return traceRepository.responderBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        r -> r.id() != null ? r.id() : "none",
                        RouteTraceRepository.ResponderCount::count,
                        Long::sum));
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
