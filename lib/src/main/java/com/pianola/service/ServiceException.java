package com.pianola.service;

/**
 * A request to the service could not be completed.
 * The kind tells whether the request never got a response ({@link ErrorKind#TRANSPORT})
 * or the actor answered with a failure ({@link ErrorKind#HANDLER}).
 */
public class ServiceException extends RuntimeException {

    public enum ErrorKind {
        TRANSPORT,
        HANDLER
    }

    private final ErrorKind kind;

    public ServiceException(ErrorKind kind, String message, RuntimeException cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
