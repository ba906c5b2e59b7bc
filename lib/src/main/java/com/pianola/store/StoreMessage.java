package com.pianola.store;

/**
 * Messages understood by the store actor.
 */
public sealed interface StoreMessage
        permits GetUserNotesRequest, SaveSongRequest, RecordNoteRequest, StoreStatusRequest {
}
