package com.pianola.note;

/**
 * Result of processing one note.
 *
 * @param keyNumber            the key that was processed
 * @param processed            always true for a successful result
 * @param workerId             id of the worker that processed the note
 * @param processingTimeMicros time spent in the handler, never negative
 */
public record NoteProcessedResult(int keyNumber, boolean processed, int workerId, long processingTimeMicros) {
}
