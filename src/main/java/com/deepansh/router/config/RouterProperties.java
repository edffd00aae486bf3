package com.deepansh.router.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed routing configuration.
 * Bound from application.yml under the "router" prefix.
 */
@ConfigurationProperties(prefix = "router")
@Validated
@Data
public class RouterProperties {

    /** Classifier attempts per request before the fallback policy applies. */
    @Min(1)
    private int maxRetries = 3;

    private boolean useDefaultAgentIfNoneIdentified = true;

    /** Id of the responder used when classification selects nobody. Blank means none. */
    private String defaultResponder = "";

    @NotBlank
    private String noSelectedAgentMessage =
            "I'm sorry, I couldn't determine how to handle your request. Could you please rephrase it?";

    /** Sent instead of {@link #noSelectedAgentMessage} when the classifier itself kept failing. */
    private String classificationErrorMessage;

    /** Sent when the selected responder fails. Unset means the error text itself is sent. */
    private String generalRoutingErrorMessage;

    @Min(1)
    private int maxMessagePairsPerAgent = 100;

    /** 0 disables the limit. */
    @Min(0)
    private long classifierTimeoutMs = 30_000;

    /** 0 disables the limit. Bounds the call that produces the reply, not the stream after it. */
    @Min(0)
    private long responderTimeoutMs = 120_000;

    /** Longest wait for the first fragment of a stream and between fragments. 0 disables the limit. */
    @Min(0)
    private long streamIdleTimeoutMs = 60_000;

    private boolean logExecutionTimes = false;
    private boolean logClassifierOutput = false;

    @Valid
    private History history = new History();

    @Valid
    private ClassifierSettings classifier = new ClassifierSettings();

    @Valid
    private List<ResponderProperties> responders = new ArrayList<>();

    @Data
    public static class History {
        /** memory | redis */
        private String store = "memory";
        private Duration ttl = Duration.ofDays(7);
    }

    @Data
    public static class ClassifierSettings {
        /** llm | keyword */
        private String type = "llm";
        private int maxTokens = 1000;
        private double temperature = 0.0;
        private String promptTemplate;
        /** Keyword classifier vocabulary per responder id; responders without an entry use their description. */
        private Map<String, List<String>> keywords = new HashMap<>();
    }

    public Duration getClassifierTimeout() {
        return Duration.ofMillis(classifierTimeoutMs);
    }

    public Duration getResponderTimeout() {
        return Duration.ofMillis(responderTimeoutMs);
    }

    public Duration getStreamIdleTimeout() {
        return Duration.ofMillis(streamIdleTimeoutMs);
    }
}
