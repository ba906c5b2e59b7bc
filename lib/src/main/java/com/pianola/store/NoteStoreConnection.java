package com.pianola.store;

import java.util.List;

/**
 * A single connection to the backing store. Implementations need not be thread-safe:
 * the store actor is the only user of its connection.
 */
public interface NoteStoreConnection extends AutoCloseable {

    /**
     * Returns the user's note events ordered by timestamp, newest first.
     *
     * @param userId the user
     * @param limit  maximum number of events, positive
     */
    List<NoteEvent> recentNotes(String userId, int limit);

    /**
     * Stores a song and returns its newly assigned id.
     */
    long saveSong(String userId, String songName, List<Integer> notes);

    /**
     * Appends a note event and returns it as stored.
     *
     * @throws com.pianola.HandlerException with code {@code INVALID_REQUEST} if the
     *         key number or velocity is out of range
     */
    NoteEvent recordNote(String userId, int keyNumber, double velocity, long timestamp);

    int songCount();

    int noteCount();

    @Override
    void close();
}
