package com.deepansh.router.stream;

import com.deepansh.router.exception.ResponderException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards a responder's fragments unchanged to the caller while accumulating them.
 *
 * Ordering per subscription: every fragment is delivered to the caller's subscriber,
 * then the completion callback runs with the joined text, and only then does the
 * caller see completion. A caller that cancels, at any point up to that callback,
 * gets {@link CompletionCallback#onAbandoned} instead, as does a failed, stalled or
 * empty stream, so a partial reply is never stored as a complete turn.
 */
@Slf4j
public class StreamRelay {

    @FunctionalInterface
    public interface CompletionCallback {
        void onComplete(String fullText, int fragmentCount);

        /** The stream ended without a complete reply: cancelled, failed or empty. */
        default void onAbandoned(String reason) {
        }
    }

    private final Duration idleTimeout;

    /**
     * @param idleTimeout longest gap allowed before the first fragment and between fragments;
     *                    zero disables the limit
     */
    public StreamRelay(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Flux<String> relay(Flux<String> upstream, CompletionCallback callback) {
        return Flux.defer(() -> {
            StreamAccumulator accumulator = new StreamAccumulator();
            AtomicBoolean settled = new AtomicBoolean();

            return withIdleTimeout(upstream)
                    .doOnNext(accumulator::append)
                    .concatWith(Mono.fromRunnable(() -> {
                        if (settled.compareAndSet(false, true)) {
                            complete(accumulator, callback);
                        }
                    }))
                    .doOnError(e -> {
                        if (settled.compareAndSet(false, true)) {
                            log.error("Responder stream failed after {} fragments: {}",
                                    accumulator.getFragmentCount(), e.getMessage());
                            abandon(callback, "failed: " + e.getMessage());
                        }
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            log.info("Caller cancelled stream after {} fragments; partial reply discarded",
                                    accumulator.getFragmentCount());
                            abandon(callback, "cancelled");
                        }
                    });
        });
    }

    private Flux<String> withIdleTimeout(Flux<String> upstream) {
        if (idleTimeout.isZero()) {
            return upstream;
        }
        return upstream
                .timeout(idleTimeout)
                .onErrorMap(TimeoutException.class, e -> new ResponderException(
                        "Stream stalled: no fragment within " + idleTimeout.toMillis() + "ms", e));
    }

    private static void complete(StreamAccumulator accumulator, CompletionCallback callback) {
        log.debug("Streaming completed: {} fragments", accumulator.getFragmentCount());
        if (accumulator.isEmpty()) {
            log.warn("No data accumulated from stream, exchange not saved");
            abandon(callback, "empty");
            return;
        }
        try {
            callback.onComplete(accumulator.getAccumulated(), accumulator.getFragmentCount());
        } catch (RuntimeException e) {
            log.error("Stream completion callback failed", e);
        }
    }

    private static void abandon(CompletionCallback callback, String reason) {
        try {
            callback.onAbandoned(reason);
        } catch (RuntimeException e) {
            log.error("Stream abandon callback failed", e);
        }
    }
}
