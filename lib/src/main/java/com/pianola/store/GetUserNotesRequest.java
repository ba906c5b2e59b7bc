package com.pianola.store;

import com.pianola.Request;

import java.util.List;
import java.util.Objects;

/**
 * Reads a user's most recent note events, newest first. A non-positive limit yields
 * an empty list.
 */
public record GetUserNotesRequest(String userId, int limit) implements StoreMessage, Request<List<NoteEvent>> {

    public GetUserNotesRequest {
        Objects.requireNonNull(userId, "userId");
    }
}
