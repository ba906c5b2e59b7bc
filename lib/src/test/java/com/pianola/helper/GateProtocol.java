package com.pianola.helper;

import com.pianola.ActorContext;
import com.pianola.HandlerException;
import com.pianola.Request;
import com.pianola.handler.Handler;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Requests that make an actor reply, fail, stay silent, or hold its thread until released.
 */
public sealed interface GateProtocol {

    record Echo(String text) implements GateProtocol, Request<String> {
    }

    /** Holds the actor thread until {@code release} opens or the thread is interrupted. */
    record Hold(CountDownLatch started, CountDownLatch release) implements GateProtocol, Request<String> {
    }

    record Fail(HandlerException error) implements GateProtocol, Request<String> {
    }

    record Crash(String reason) implements GateProtocol, Request<String> {
    }

    record Fatal() implements GateProtocol, Request<String> {
    }

    record Silent() implements GateProtocol, Request<String> {
    }

    class FatalError extends Error {
        public FatalError() {
            super("fatal failure in handler");
        }
    }

    class GateHandler implements Handler<GateProtocol> {

        private final Queue<String> processed = new ConcurrentLinkedQueue<>();
        private final List<RuntimeException> errors = new CopyOnWriteArrayList<>();

        @Override
        public void receive(GateProtocol message, ActorContext context) {
            if (message instanceof Echo echo) {
                processed.add(echo.text());
                context.reply(echo, "echo:" + echo.text());
            } else if (message instanceof Hold hold) {
                hold.started().countDown();
                try {
                    hold.release().await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                context.reply(hold, "released");
            } else if (message instanceof Fail fail) {
                throw fail.error();
            } else if (message instanceof Crash crash) {
                throw new IllegalStateException(crash.reason());
            } else if (message instanceof Fatal) {
                throw new FatalError();
            }
        }

        @Override
        public void onError(GateProtocol message, RuntimeException exception, ActorContext context) {
            errors.add(exception);
        }

        public Queue<String> processed() {
            return processed;
        }

        public List<RuntimeException> errors() {
            return errors;
        }
    }
}
