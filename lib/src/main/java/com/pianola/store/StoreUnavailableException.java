package com.pianola.store;

import com.pianola.HandlerException;

/**
 * The store actor has no connection to the backing store.
 */
public class StoreUnavailableException extends HandlerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(Code.STORE_UNAVAILABLE, message, cause);
    }
}
