package com.pianola.note;

/**
 * Snapshot of a worker's state, taken on the worker's own thread.
 *
 * @param workerId        the worker's id
 * @param processedCount  notes processed so far
 * @param lastFrequencyHz frequency of the most recent note, 0 before the first one
 */
public record WorkerStats(int workerId, long processedCount, double lastFrequencyHz) {
}
