package com.pianola;

import java.util.concurrent.CompletableFuture;

/**
 * A request travelling through a mailbox together with the one-shot slot its reply
 * completes. The first completion wins; later ones are ignored.
 *
 * @param <R> the reply type
 */
final class AskEnvelope<R> {

    private final String askId;
    private final Request<R> message;
    private final CompletableFuture<Outcome<R>> slot;

    AskEnvelope(String askId, Request<R> message, CompletableFuture<Outcome<R>> slot) {
        this.askId = askId;
        this.message = message;
        this.slot = slot;
    }

    String askId() {
        return askId;
    }

    Request<R> message() {
        return message;
    }

    boolean isCompleted() {
        return slot.isDone();
    }

    /**
     * Completes the slot with the given outcome.
     *
     * @return true if this call completed the slot
     */
    boolean complete(Outcome<R> outcome) {
        return slot.complete(outcome);
    }

    @SuppressWarnings("unchecked")
    boolean completeWithReply(Object response) {
        return slot.complete(Outcome.success((R) response));
    }

    @Override
    public String toString() {
        return "AskEnvelope[" + askId + ", " + message + "]";
    }
}
