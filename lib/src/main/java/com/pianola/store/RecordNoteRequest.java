package com.pianola.store;

import com.pianola.Request;

import java.util.Objects;

/**
 * Appends a note event to the store.
 */
public record RecordNoteRequest(String userId, int keyNumber, double velocity, long timestamp)
        implements StoreMessage, Request<NoteEvent> {

    public RecordNoteRequest {
        Objects.requireNonNull(userId, "userId");
    }
}
