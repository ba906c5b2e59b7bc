package com.pianola.store;

/**
 * @param songId id assigned by the store
 * @param saved  always true for a successful save
 */
public record SongSavedResult(long songId, boolean saved) {
}
