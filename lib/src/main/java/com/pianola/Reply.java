package com.pianola;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Represents the pending reply to an ask.
 * Provides three tiers of API:
 * 1. Simple: get() - blocks and returns the value, throwing on failure
 * 2. Safe: await() - returns the {@link Outcome} for explicit dispatch
 * 3. Advanced: future() - a CompletableFuture of the value
 *
 * @param <T> the type of the reply value
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns the value.
     *
     * @throws HandlerException if the handler reported a failure
     * @throws TransportException if the request could not be delivered or answered
     */
    T get();

    /**
     * Blocks until the reply is available or the wait expires.
     *
     * @throws TransportException with kind {@code TIMEOUT} if the wait expires first
     */
    T get(Duration timeout);

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the outcome is available. The ask timeout bounds this wait.
     */
    Outcome<T> await();

    /**
     * Blocks until the outcome is available or the wait expires.
     * Returns a {@code TransportFailure(TIMEOUT)} when the wait expires; the ask
     * itself stays pending.
     */
    Outcome<T> await(Duration timeout);

    /**
     * Non-blocking check. Returns empty if the outcome is not available yet.
     */
    Optional<Outcome<T>> poll();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * A future of the value, completed exceptionally with the failure's exception.
     */
    CompletableFuture<T> future();

    /**
     * Transform the value when it arrives. Failures pass through unchanged.
     */
    <U> Reply<U> map(Function<T, U> fn);

    /**
     * Register a callback that receives the outcome once it is available.
     */
    void onComplete(Consumer<Outcome<T>> callback);

    // ========== FACTORY METHODS ==========

    static <T> Reply<T> from(String actorId, CompletableFuture<Outcome<T>> outcome) {
        return new PendingReply<>(actorId, outcome);
    }

    static <T> Reply<T> completed(String actorId, Outcome<T> outcome) {
        return new PendingReply<>(actorId, CompletableFuture.completedFuture(outcome));
    }
}
