package com.pianola.service;

import java.util.Objects;

/**
 * A note as submitted by a client. Velocity and timestamp are optional.
 *
 * @param userId    the user who played the note
 * @param keyNumber the key number
 * @param velocity  0.0 to 1.0, or null for the default of 0.8
 * @param timestamp epoch millis, or null for the time of submission
 */
public record NoteSubmission(String userId, int keyNumber, Double velocity, Long timestamp) {

    public NoteSubmission {
        Objects.requireNonNull(userId, "userId");
    }

    public static NoteSubmission of(String userId, int keyNumber) {
        return new NoteSubmission(userId, keyNumber, null, null);
    }
}
