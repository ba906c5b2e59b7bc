package com.pianola.service;

import com.pianola.Outcome;
import com.pianola.Pid;
import com.pianola.note.NoteProcessedResult;
import com.pianola.note.ProcessNoteRequest;
import com.pianola.pool.ActorPoolManager;
import com.pianola.pool.PoolHealth;
import com.pianola.store.GetUserNotesRequest;
import com.pianola.store.NoteEvent;
import com.pianola.store.RecordNoteRequest;
import com.pianola.store.SaveSongRequest;
import com.pianola.store.SongSavedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Entry point for callers outside the actor runtime. Turns client input into typed
 * requests, sends them to the pool, and turns outcomes into responses or
 * {@link ServiceException}s. Never retries.
 */
public class PianoService {

    private static final Logger logger = LoggerFactory.getLogger(PianoService.class);

    public static final String BACKEND = "java";
    public static final String ARCHITECTURE = "Concurrent Actor Model";
    public static final double DEFAULT_VELOCITY = 0.8;
    public static final List<String> FEATURES = List.of(
            "Actor-based Concurrency", "Message Passing", "Worker Pool", "Async I/O");

    private final ActorPoolManager pool;
    private final Clock clock;

    public PianoService(ActorPoolManager pool) {
        this(pool, Clock.systemUTC());
    }

    public PianoService(ActorPoolManager pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    /**
     * Processes a note on the next worker in round-robin order.
     *
     * @throws ServiceException if the worker could not be reached or failed
     */
    public NoteResponse processNote(NoteSubmission submission) {
        Pid worker = pool.nextWorker();
        ProcessNoteRequest request = new ProcessNoteRequest(
                submission.userId(),
                submission.keyNumber(),
                velocityOf(submission),
                timestampOf(submission));
        NoteProcessedResult result = unwrap(worker.ask(request, askTimeout()).await(), "process note");
        return new NoteResponse(
                BACKEND,
                ARCHITECTURE,
                result.keyNumber(),
                result.processed(),
                result.workerId(),
                result.processingTimeMicros(),
                pool.poolSize());
    }

    /**
     * Stores a note event so it shows up in {@link #recentNotes(String, int)}.
     *
     * @throws ServiceException if the store could not be reached or failed
     */
    public NoteEvent recordNote(NoteSubmission submission) {
        RecordNoteRequest request = new RecordNoteRequest(
                submission.userId(),
                submission.keyNumber(),
                velocityOf(submission),
                timestampOf(submission));
        return unwrap(pool.storeActor().ask(request, askTimeout()).await(), "record note");
    }

    /**
     * @throws ServiceException if the store could not be reached or failed
     */
    public SongSavedResult saveSong(String userId, String songName, List<Integer> notes) {
        SaveSongRequest request = new SaveSongRequest(userId, songName, notes);
        return unwrap(pool.storeActor().ask(request, askTimeout()).await(), "save song");
    }

    /**
     * Returns the user's most recent notes, newest first.
     *
     * @throws ServiceException if the store could not be reached or failed
     */
    public List<NoteEvent> recentNotes(String userId, int limit) {
        GetUserNotesRequest request = new GetUserNotesRequest(userId, limit);
        return unwrap(pool.storeActor().ask(request, askTimeout()).await(), "read notes");
    }

    /**
     * Reports the pool configuration. Sends no message.
     */
    public HealthResponse health() {
        PoolHealth poolHealth = pool.health();
        return new HealthResponse(poolHealth.status(), BACKEND, ARCHITECTURE, FEATURES, poolHealth.workerCount());
    }

    private Duration askTimeout() {
        return pool.config().getAskTimeout();
    }

    private double velocityOf(NoteSubmission submission) {
        return submission.velocity() != null ? submission.velocity() : DEFAULT_VELOCITY;
    }

    private long timestampOf(NoteSubmission submission) {
        return submission.timestamp() != null ? submission.timestamp() : clock.millis();
    }

    private static <T> T unwrap(Outcome<T> outcome, String operation) {
        if (outcome instanceof Outcome.Success<T> success) {
            return success.value();
        }
        if (outcome instanceof Outcome.HandlerFailure<T> failure) {
            logger.warn("Failed to {}: {}", operation, failure.error().getMessage());
            throw new ServiceException(ServiceException.ErrorKind.HANDLER,
                    "Failed to " + operation + ": " + failure.error().getMessage(), failure.error());
        }
        Outcome.TransportFailure<T> failure = (Outcome.TransportFailure<T>) outcome;
        logger.warn("Actor communication error during {}: {}", operation, failure.error().getMessage());
        throw new ServiceException(ServiceException.ErrorKind.TRANSPORT,
                "Actor communication error: " + failure.error().getMessage(), failure.error());
    }
}
