package com.pianola.service;

/**
 * What a client sees after a note was processed.
 */
public record NoteResponse(
        String backend,
        String architecture,
        int keyNumber,
        boolean processed,
        int workerId,
        long processingTimeMicros,
        int poolSize) {
}
