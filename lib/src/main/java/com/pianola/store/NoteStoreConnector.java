package com.pianola.store;

/**
 * Opens connections to the backing store.
 */
@FunctionalInterface
public interface NoteStoreConnector {

    /**
     * Opens a connection.
     *
     * @return a connection owned exclusively by the caller
     * @throws RuntimeException if the store cannot be reached
     */
    NoteStoreConnection connect();
}
