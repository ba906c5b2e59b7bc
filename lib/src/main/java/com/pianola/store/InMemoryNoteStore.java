package com.pianola.store;

import com.pianola.HandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A backing store kept in memory. Song ids start at 1 and increase with every save.
 * Note events must have a key number in {@code 0..127} and a velocity in {@code 0.0..1.0}.
 * <p>
 * Not thread-safe: all access goes through connections, and each connection is
 * owned by a single store actor.
 */
public class InMemoryNoteStore implements NoteStoreConnector {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryNoteStore.class);

    static final int MIN_KEY_NUMBER = 0;
    static final int MAX_KEY_NUMBER = 127;

    private final Map<Long, StoredSong> songs = new LinkedHashMap<>();
    private final List<NoteEvent> notes = new ArrayList<>();
    private long lastSongId;

    @Override
    public NoteStoreConnection connect() {
        logger.debug("Opening in-memory store connection");
        return new Connection();
    }

    /**
     * Returns the stored song with the given id, or null.
     */
    public StoredSong getSong(long songId) {
        return songs.get(songId);
    }

    /**
     * A saved song.
     */
    public record StoredSong(long songId, String userId, String songName, List<Integer> notes) {
    }

    private final class Connection implements NoteStoreConnection {

        private boolean closed;

        @Override
        public List<NoteEvent> recentNotes(String userId, int limit) {
            ensureOpen();
            List<NoteEvent> userNotes = new ArrayList<>();
            // newest insert first, so equal timestamps keep most-recent-first order after the stable sort
            for (int i = notes.size() - 1; i >= 0; i--) {
                NoteEvent event = notes.get(i);
                if (event.userId().equals(userId)) {
                    userNotes.add(event);
                }
            }
            userNotes.sort(Comparator.comparingLong(NoteEvent::timestamp).reversed());
            return List.copyOf(userNotes.subList(0, Math.min(limit, userNotes.size())));
        }

        @Override
        public long saveSong(String userId, String songName, List<Integer> songNotes) {
            ensureOpen();
            long songId = ++lastSongId;
            songs.put(songId, new StoredSong(songId, userId, songName, List.copyOf(songNotes)));
            return songId;
        }

        @Override
        public NoteEvent recordNote(String userId, int keyNumber, double velocity, long timestamp) {
            ensureOpen();
            if (keyNumber < MIN_KEY_NUMBER || keyNumber > MAX_KEY_NUMBER) {
                throw new HandlerException(HandlerException.Code.INVALID_REQUEST,
                        "Key number must be between " + MIN_KEY_NUMBER + " and " + MAX_KEY_NUMBER + ": " + keyNumber);
            }
            if (!(velocity >= 0.0 && velocity <= 1.0)) {
                throw new HandlerException(HandlerException.Code.INVALID_REQUEST,
                        "Velocity must be between 0.0 and 1.0: " + velocity);
            }
            NoteEvent event = new NoteEvent(userId, keyNumber, velocity, timestamp);
            notes.add(event);
            return event;
        }

        @Override
        public int songCount() {
            ensureOpen();
            return songs.size();
        }

        @Override
        public int noteCount() {
            ensureOpen();
            return notes.size();
        }

        @Override
        public void close() {
            closed = true;
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Connection is closed");
            }
        }
    }
}
