package com.pianola.note;

/**
 * Messages understood by a note processor worker.
 */
public sealed interface NoteProcessorMessage permits ProcessNoteRequest, WorkerStatsRequest {
}
