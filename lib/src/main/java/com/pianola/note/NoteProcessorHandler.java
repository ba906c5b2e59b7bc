package com.pianola.note;

import com.pianola.ActorContext;
import com.pianola.handler.Handler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * One worker of the note processing pool.
 * <p>
 * The worker's counters are plain fields: the actor runtime guarantees that only the
 * worker's own thread ever touches them. Processing a note never fails and never
 * writes to the store.
 */
public class NoteProcessorHandler implements Handler<NoteProcessorMessage> {

    private final int workerId;
    private final long simulatedWorkNanos;

    private long processedCount;
    private double lastFrequencyHz;

    /**
     * @param workerId     the worker's id, fixed for its lifetime
     * @param simulatedWork time spent per note to stand in for real work, may be zero
     */
    public NoteProcessorHandler(int workerId, Duration simulatedWork) {
        if (simulatedWork.isNegative()) {
            throw new IllegalArgumentException("simulatedWork must not be negative: " + simulatedWork);
        }
        this.workerId = workerId;
        this.simulatedWorkNanos = simulatedWork.toNanos();
    }

    @Override
    public void receive(NoteProcessorMessage message, ActorContext context) {
        if (message instanceof ProcessNoteRequest request) {
            context.reply(request, process(request));
        } else if (message instanceof WorkerStatsRequest request) {
            context.reply(request, new WorkerStats(workerId, processedCount, lastFrequencyHz));
        }
    }

    @Override
    public void preStart(ActorContext context) {
        context.getLogger().debug("Worker {} ready", workerId);
    }

    @Override
    public void postStop(ActorContext context) {
        context.getLogger().info("Worker {} stopped after {} notes", workerId, processedCount);
    }

    private NoteProcessedResult process(ProcessNoteRequest request) {
        long start = System.nanoTime();
        if (simulatedWorkNanos > 0) {
            LockSupport.parkNanos(simulatedWorkNanos);
        }
        lastFrequencyHz = NoteFrequency.hz(request.keyNumber());
        processedCount++;
        long elapsedMicros = Math.max(0L, TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start));
        return new NoteProcessedResult(request.keyNumber(), true, workerId, elapsedMicros);
    }

    public int getWorkerId() {
        return workerId;
    }
}
