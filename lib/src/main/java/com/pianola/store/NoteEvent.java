package com.pianola.store;

/**
 * A stored note event.
 *
 * @param userId    the user who played the note
 * @param keyNumber the key number
 * @param velocity  how hard the key was struck, 0.0 to 1.0
 * @param timestamp when the note was played, epoch millis
 */
public record NoteEvent(String userId, int keyNumber, double velocity, long timestamp) {
}
