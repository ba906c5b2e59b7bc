package com.pianola.note;

import com.pianola.Request;

import java.util.Objects;

/**
 * A single played note to be processed by a worker.
 *
 * @param userId    the user who played the note
 * @param keyNumber MIDI-style key number, 69 is A4
 * @param velocity  how hard the key was struck, 0.0 to 1.0
 * @param timestamp when the note was played, epoch millis
 */
public record ProcessNoteRequest(String userId, int keyNumber, double velocity, long timestamp)
        implements NoteProcessorMessage, Request<NoteProcessedResult> {

    public ProcessNoteRequest {
        Objects.requireNonNull(userId, "userId");
    }
}
