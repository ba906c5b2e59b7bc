package com.pianola.store;

import com.pianola.Request;

/**
 * Asks the store actor whether it holds a connection. Answered even when disconnected.
 */
public record StoreStatusRequest() implements StoreMessage, Request<StoreStatus> {
}
