package com.pianola.store;

/**
 * @param connected whether the store actor holds a connection
 * @param songCount songs in the store, 0 when disconnected
 * @param noteCount note events in the store, 0 when disconnected
 */
public record StoreStatus(boolean connected, int songCount, int noteCount) {
}
