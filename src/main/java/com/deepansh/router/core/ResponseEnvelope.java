package com.deepansh.router.core;

import com.deepansh.router.model.Message;
import lombok.Getter;
import reactor.core.publisher.Flux;

import java.util.stream.Collectors;

/**
 * What the orchestrator hands back: request metadata plus either the reply message or a
 * single-subscription stream of reply fragments.
 */
@Getter
public final class ResponseEnvelope {

    private final RequestMetadata metadata;
    private final Message message;
    private final Flux<String> stream;
    private final boolean streaming;

    private ResponseEnvelope(RequestMetadata metadata, Message message, Flux<String> stream) {
        this.metadata = metadata;
        this.message = message;
        this.stream = stream;
        this.streaming = stream != null;
    }

    public static ResponseEnvelope ofMessage(RequestMetadata metadata, Message message) {
        return new ResponseEnvelope(metadata, message, null);
    }

    public static ResponseEnvelope ofStream(RequestMetadata metadata, Flux<String> stream) {
        return new ResponseEnvelope(metadata, null, stream);
    }

    /** Reply text; for a streaming envelope this subscribes and blocks until the stream ends. */
    public String getText() {
        return streaming ? stream.collect(Collectors.joining()).block() : message.getText();
    }

    public boolean isError() {
        return metadata.getErrorType() != null;
    }
}
