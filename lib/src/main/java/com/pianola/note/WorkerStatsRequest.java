package com.pianola.note;

import com.pianola.Request;

/**
 * Asks a worker for its counters.
 */
public record WorkerStatsRequest() implements NoteProcessorMessage, Request<WorkerStats> {
}
