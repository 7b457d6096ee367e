package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.model.PlaylistSnapshot;

import java.util.Optional;

/**
 * Persistence interface for whole playlists. Saved playlists are written and read back as a unit.
 */
public interface PlaylistBackendPort {

    /**
     * Loads a saved playlist.
     *
     * @param playlistId the playlist identifier
     * @return the snapshot, or empty if the playlist was never saved
     */
    Optional<PlaylistSnapshot> load(String playlistId);

    /**
     * Replaces whatever was saved under the snapshot's playlist id.
     *
     * @param snapshot the playlist state to save
     */
    void save(PlaylistSnapshot snapshot);
}
