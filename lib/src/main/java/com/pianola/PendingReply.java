package com.pianola;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by the ask's completion slot.
 * The slot always completes normally with an {@link Outcome}.
 */
record PendingReply<T>(String actorId, CompletableFuture<Outcome<T>> outcome) implements Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    @Override
    public T get() {
        return await().getOrThrow();
    }

    @Override
    public T get(Duration timeout) {
        return await(timeout).getOrThrow();
    }

    // ========== TIER 2: SAFE API ==========

    @Override
    public Outcome<T> await() {
        try {
            return outcome.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    @Override
    public Outcome<T> await(Duration timeout) {
        try {
            return outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return Outcome.transportFailure(TransportException.Kind.TIMEOUT, actorId,
                    "No reply from actor " + actorId + " within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.transportFailure(TransportException.Kind.TIMEOUT, actorId,
                    "Interrupted while waiting for a reply from actor " + actorId);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    @Override
    public Optional<Outcome<T>> poll() {
        if (!outcome.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    // ========== TIER 3: ADVANCED API ==========

    @Override
    public CompletableFuture<T> future() {
        return outcome.thenCompose(result -> {
            if (result instanceof Outcome.Success<T> success) {
                return CompletableFuture.completedFuture(success.value());
            }
            if (result instanceof Outcome.HandlerFailure<T> failure) {
                return CompletableFuture.failedFuture(failure.error());
            }
            return CompletableFuture.failedFuture(((Outcome.TransportFailure<T>) result).error());
        });
    }

    @Override
    public <U> Reply<U> map(Function<T, U> fn) {
        return new PendingReply<>(actorId, outcome.thenApply(result -> result.map(fn)));
    }

    @Override
    public void onComplete(Consumer<Outcome<T>> callback) {
        outcome.thenAccept(callback);
    }

    // Only a failing map function can complete the slot exceptionally.
    private static RuntimeException unwrap(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }
}
