package com.pianola.store;

import com.pianola.ActorContext;
import com.pianola.handler.Handler;

import java.util.List;

/**
 * The single gateway to the backing store. Owns at most one connection, opened once
 * when the actor starts and closed when it stops; every read and write runs on the
 * actor thread, one at a time.
 * <p>
 * If the connection cannot be opened the actor stays up without one and answers
 * every data request with a {@link StoreUnavailableException}. There is no reconnect.
 */
public class StoreHandler implements Handler<StoreMessage> {

    private final NoteStoreConnector connector;

    private NoteStoreConnection connection;
    private RuntimeException connectFailure;

    public StoreHandler(NoteStoreConnector connector) {
        this.connector = connector;
    }

    @Override
    public void preStart(ActorContext context) {
        try {
            connection = connector.connect();
            context.getLogger().info("Store connection established");
        } catch (RuntimeException e) {
            connectFailure = e;
            context.getLogger().error("Store connection failed, serving without a connection", e);
        }
    }

    @Override
    public void receive(StoreMessage message, ActorContext context) {
        if (message instanceof StoreStatusRequest request) {
            context.reply(request, status());
        } else if (message instanceof GetUserNotesRequest request) {
            NoteStoreConnection conn = requireConnection();
            List<NoteEvent> notes = request.limit() <= 0
                    ? List.of()
                    : conn.recentNotes(request.userId(), request.limit());
            context.reply(request, notes);
        } else if (message instanceof SaveSongRequest request) {
            long songId = requireConnection().saveSong(request.userId(), request.songName(), request.notes());
            context.getLogger().debug("Saved song {} for user {}", songId, request.userId());
            context.reply(request, new SongSavedResult(songId, true));
        } else if (message instanceof RecordNoteRequest request) {
            NoteEvent event = requireConnection().recordNote(
                    request.userId(), request.keyNumber(), request.velocity(), request.timestamp());
            context.reply(request, event);
        }
    }

    @Override
    public void postStop(ActorContext context) {
        if (connection != null) {
            connection.close();
            connection = null;
            context.getLogger().info("Store connection closed");
        }
    }

    private StoreStatus status() {
        if (connection == null) {
            return new StoreStatus(false, 0, 0);
        }
        return new StoreStatus(true, connection.songCount(), connection.noteCount());
    }

    private NoteStoreConnection requireConnection() {
        if (connection == null) {
            throw new StoreUnavailableException("No connection to the backing store", connectFailure);
        }
        return connection;
    }
}
