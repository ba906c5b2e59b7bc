package com.pianola;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralizes supervision logic for handling actor errors according to the configured strategy.
 */
public final class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private Supervisor() {
    }

    /**
     * Handles an unexpected exception thrown during message processing of an actor.
     * The asker, if any, has already received a handler failure.
     *
     * @param actor     The actor that experienced the error
     * @param message   The message being processed when the error occurred
     * @param exception The exception that was thrown
     * @param <T>       The actor's message type
     */
    public static <T> void handleException(Actor<T> actor, T message, RuntimeException exception) {
        try {
            actor.onError(message, exception);
        } catch (RuntimeException e) {
            logger.error("Actor {} failed in onError", actor.getActorId(), e);
        }
        switch (actor.getSupervisionStrategy()) {
            case RESUME -> logger.debug("Actor {} resuming after error", actor.getActorId());
            case STOP -> {
                logger.info("Stopping actor {} due to error", actor.getActorId());
                actor.stop();
            }
            default -> throw new IllegalStateException("Unknown supervision strategy: " + actor.getSupervisionStrategy());
        }
    }
}
