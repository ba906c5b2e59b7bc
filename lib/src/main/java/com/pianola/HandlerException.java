package com.pianola;

/**
 * A failure reported by a message handler while processing a request.
 * <p>
 * Handler failures are business outcomes: the message was delivered and processed,
 * and the handler decided it could not produce a result. They reach the asker as
 * {@link Outcome.HandlerFailure} and never trigger supervision.
 */
public class HandlerException extends RuntimeException {

    /**
     * Classifies handler failures so callers can pick a remediation.
     */
    public enum Code {
        /** The handler threw something other than a {@code HandlerException}. */
        UNEXPECTED,
        /** The handler returned without replying to an ask. */
        NO_REPLY,
        /** The backing store has no connection. */
        STORE_UNAVAILABLE,
        /** The request carries values the handler does not accept. */
        INVALID_REQUEST
    }

    private final Code code;

    public HandlerException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public HandlerException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Wraps an unexpected exception thrown by a handler.
     *
     * @param actorId the actor whose handler failed
     * @param cause the exception thrown by the handler
     * @return a handler exception with code {@link Code#UNEXPECTED}
     */
    public static HandlerException unexpected(String actorId, Throwable cause) {
        return new HandlerException(Code.UNEXPECTED,
                "Handler of actor " + actorId + " failed: " + cause, cause);
    }

    public Code getCode() {
        return code;
    }
}
