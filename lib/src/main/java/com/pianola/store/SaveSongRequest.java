package com.pianola.store;

import com.pianola.Request;

import java.util.List;
import java.util.Objects;

/**
 * Saves a recorded song.
 *
 * @param userId   the owner of the song
 * @param songName display name
 * @param notes    key numbers in playing order
 */
public record SaveSongRequest(String userId, String songName, List<Integer> notes)
        implements StoreMessage, Request<SongSavedResult> {

    public SaveSongRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(songName, "songName");
        notes = List.copyOf(notes);
    }
}
