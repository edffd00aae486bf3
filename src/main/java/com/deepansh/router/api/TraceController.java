package com.deepansh.router.api;

import com.deepansh.router.observability.RouteTrace;
import com.deepansh.router.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read access to route traces.
 *
 * GET /api/v1/traces/{userId}              — all traces for a user, newest first
 * GET /api/v1/traces/session/{sessionId}   — traces for one session
 * GET /api/v1/traces/{userId}/responders   — how often each responder answered the user
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class TraceController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<RouteTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<RouteTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/{userId}/responders")
    public ResponseEntity<Map<String, Long>> getResponderBreakdown(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getResponderBreakdown(userId));
    }
}
