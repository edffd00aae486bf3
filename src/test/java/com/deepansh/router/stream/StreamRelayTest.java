package com.deepansh.router.stream;

import com.deepansh.router.exception.ResponderException;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamRelayTest {

    private final StreamRelay relay = new StreamRelay(Duration.ZERO);
    private final List<String> events = new CopyOnWriteArrayList<>();

    @Test
    void relay_callbackRunsAfterLastFragmentIsDeliveredAndBeforeCompletion() {
        relay.relay(Flux.just("TCP ", "is ", "a protocol"), recorder())
                .subscribe(f -> events.add("fragment:" + f), e -> events.add("error"), () -> events.add("end"));

        assertThat(events).containsExactly(
                "fragment:TCP ", "fragment:is ", "fragment:a protocol",
                "complete:TCP is a protocol:3",
                "end");
    }

    @Test
    void relay_emptyUpstream_abandonsAsEmpty() {
        assertThat(relay.relay(Flux.empty(), recorder()).collectList().block()).isEmpty();
        assertThat(events).containsExactly("abandoned:empty");
    }

    @Test
    void relay_upstreamFails_propagatesErrorAndNeverCompletes() {
        Flux<String> upstream = Flux.just("half").concatWith(Flux.error(new ResponderException("boom")));

        assertThatThrownBy(() -> relay.relay(upstream, recorder()).blockLast())
                .isInstanceOf(ResponderException.class);
        assertThat(events).containsExactly("abandoned:failed: boom");
    }

    @Test
    void relay_callerCancelsWithoutReading_neverPersists() {
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        Flux<String> upstream = Flux.just("TCP ", "is a protocol").doOnCancel(() -> upstreamCancelled.set(true));

        BaseSubscriber<String> idleCaller = new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                // requests nothing
            }
        };
        relay.relay(upstream, recorder()).subscribe(idleCaller);
        idleCaller.dispose();

        assertThat(upstreamCancelled).isTrue();
        assertThat(events).containsExactly("abandoned:cancelled");
    }

    @Test
    void relay_callerCancelsAfterFirstFragment_skipsPersistence() {
        List<String> received = relay.relay(Flux.just("f0", "f1", "f2"), recorder())
                .take(1)
                .collectList()
                .block();

        assertThat(received).containsExactly("f0");
        assertThat(events).containsExactly("abandoned:cancelled");
    }

    @Test
    void relay_upstreamStalls_failsWithResponderErrorAndSkipsPersistence() {
        StreamRelay bounded = new StreamRelay(Duration.ofMillis(50));
        Flux<String> stalled = Flux.just("TCP ").concatWith(Flux.never());

        assertThatThrownBy(() -> bounded.relay(stalled, recorder()).blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(ResponderException.class)
                .hasMessageContaining("no fragment within 50ms");
        assertThat(events).hasSize(1);
        assertThat(events.get(0)).startsWith("abandoned:failed: Stream stalled");
    }

    private StreamRelay.CompletionCallback recorder() {
        return new StreamRelay.CompletionCallback() {
            @Override
            public void onComplete(String fullText, int fragmentCount) {
                events.add("complete:" + fullText + ":" + fragmentCount);
            }

            @Override
            public void onAbandoned(String reason) {
                events.add("abandoned:" + reason);
            }
        };
    }
}
