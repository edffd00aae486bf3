package com.deepansh.router.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One routed request, as stored in the {@code route_traces} collection.
 *
 * Captures the routing decision (selected responder, confidence, classifier attempts,
 * fallback), per-phase latencies and whether the exchange reached history. A storage
 * failure is recorded here even though the caller still got its answer.
 */
@Document(collection = "route_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteTrace {

    public enum Status { SUCCESS, FALLBACK, REJECTED, ERROR, ABANDONED }

    @Id
    private String id;

    private String requestId;

    @Indexed
    private String userId;

    @Indexed
    private String sessionId;

    private String userInput;

    @Indexed
    private Status status;

    private String responderId;
    private Double confidence;
    private int classifierAttempts;
    private boolean forced;
    private boolean streaming;
    private boolean persisted;

    private List<String> states;
    private Map<String, Long> phaseLatenciesMs;
    private long totalLatencyMs;

    private String errorType;
    private String errorMessage;
    private String storageError;

    @CreatedDate
    private Instant createdAt;
}
