package com.deepansh.router.core;

import com.deepansh.router.exception.AgentException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs classifier and responder calls under a Resilience4j {@link TimeLimiter}.
 * A zero or negative timeout runs the call inline with no limit.
 */
public class CallTimeouts {

    private final Executor executor;
    private final TimeLimiter classifierLimiter;
    private final TimeLimiter responderLimiter;

    public CallTimeouts(Executor executor, Duration classifierTimeout, Duration responderTimeout) {
        this.executor = executor;
        this.classifierLimiter = limiter("classifier", classifierTimeout);
        this.responderLimiter = limiter("responder", responderTimeout);
    }

    private static TimeLimiter limiter(String name, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return null;
        }
        return TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    public <T> T classifier(Supplier<T> call) throws TimeoutException {
        return run(classifierLimiter, call);
    }

    public <T> T responder(Supplier<T> call) throws TimeoutException {
        return run(responderLimiter, call);
    }

    private <T> T run(TimeLimiter limiter, Supplier<T> call) throws TimeoutException {
        if (limiter == null) {
            return call.get();
        }
        try {
            return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted while waiting for " + limiter.getName(), e);
        } catch (Exception e) {
            throw new AgentException(limiter.getName() + " call failed: " + e.getMessage(), e);
        }
    }
}
