package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackMetadata;

/**
 * Observer of a playlist. Notifications are delivered synchronously on the owner thread, after the playlist
 * has restored all of its invariants, so listeners may query or even mutate the playlist.
 */
public interface PlaylistListener {

    /**
     * Entries were inserted, removed or rearranged.
     */
    default void structureChanged(StructureChange change) {
    }

    /**
     * The entry at {@code row} changed in place.
     */
    default void dataChanged(int row) {
    }

    /**
     * The current item changed. Either side is null when there was or is no current item.
     */
    default void currentItemChanged(TrackMetadata previous, TrackMetadata current) {
    }

    default void dynamicModeChanged(boolean dynamic) {
    }

    /**
     * Some tracks could not be loaded; the rest of the operation went ahead.
     */
    default void loadError(String message) {
    }

    /**
     * Playback of {@code row} should start now.
     */
    default void playRequested(int row) {
    }
}
