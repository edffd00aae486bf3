package com.deepansh.router.responder;

import com.deepansh.router.model.Message;
import reactor.core.publisher.Flux;

import java.util.Objects;

/**
 * Either a complete assistant message or a lazy stream of text fragments.
 * The stream is cold: nothing is produced before the caller subscribes, and it is
 * meant to be subscribed once.
 */
public final class ResponderOutput {

    private final Message message;
    private final Flux<String> stream;

    private ResponderOutput(Message message, Flux<String> stream) {
        this.message = message;
        this.stream = stream;
    }

    public static ResponderOutput of(Message message) {
        return new ResponderOutput(Objects.requireNonNull(message, "message"), null);
    }

    public static ResponderOutput of(Flux<String> stream) {
        return new ResponderOutput(null, Objects.requireNonNull(stream, "stream"));
    }

    public boolean isStreaming() {
        return stream != null;
    }

    public Message getMessage() {
        if (message == null) {
            throw new IllegalStateException("streaming output has no message; consume getStream()");
        }
        return message;
    }

    public Flux<String> getStream() {
        if (stream == null) {
            throw new IllegalStateException("non-streaming output has no stream; use getMessage()");
        }
        return stream;
    }
}
