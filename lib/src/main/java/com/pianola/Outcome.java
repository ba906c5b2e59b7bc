package com.pianola;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The outcome of an ask: a value, a failure reported by the handler, or a failure of
 * the delivery itself. Sealed so that callers dispatch on the failure kind explicitly.
 *
 * @param <T> the type of the value
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.HandlerFailure, Outcome.TransportFailure {

    /**
     * The handler replied with a value.
     */
    record Success<T>(T value) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<T, U> fn) {
            return new Success<>(fn.apply(value));
        }
    }

    /**
     * The message was delivered and the handler reported a failure.
     */
    record HandlerFailure<T>(HandlerException error) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw error;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<T, U> fn) {
            return new HandlerFailure<>(error);
        }
    }

    /**
     * The message could not be delivered or no response arrived.
     */
    record TransportFailure<T>(TransportException error) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw error;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<T, U> fn) {
            return new TransportFailure<>(error);
        }
    }

    boolean isSuccess();

    /**
     * Returns the value, or throws the {@link HandlerException} or
     * {@link TransportException} carried by a failure.
     */
    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> Outcome<U> map(Function<T, U> fn);

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<RuntimeException> consumer) {
        if (this instanceof HandlerFailure<T> failure) {
            consumer.accept(failure.error());
        } else if (this instanceof TransportFailure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> handlerFailure(HandlerException error) {
        return new HandlerFailure<>(error);
    }

    static <T> Outcome<T> transportFailure(TransportException error) {
        return new TransportFailure<>(error);
    }

    static <T> Outcome<T> transportFailure(TransportException.Kind kind, String actorId, String message) {
        return new TransportFailure<>(new TransportException(kind, actorId, message));
    }
}
