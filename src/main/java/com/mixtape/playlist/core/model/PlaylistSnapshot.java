package com.mixtape.playlist.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to persist and restore a playlist as a unit.
 * Pointer positions are store indices, -1 meaning none.
 */
public record PlaylistSnapshot(
        String playlistId,
        List<TrackEntry> entries,
        int currentRow,
        int lastPlayedRow,
        int stopAfterRow,
        RepeatMode repeatMode,
        ShuffleMode shuffleMode,
        String generatorKey
) {

    public PlaylistSnapshot {
        Objects.requireNonNull(playlistId, "playlistId must not be null");
        entries = List.copyOf(entries);
        repeatMode = Objects.requireNonNullElse(repeatMode, RepeatMode.OFF);
        shuffleMode = Objects.requireNonNullElse(shuffleMode, ShuffleMode.OFF);
    }

    public static PlaylistSnapshot empty(String playlistId) {
        return new PlaylistSnapshot(playlistId, List.of(), -1, -1, -1, RepeatMode.OFF, ShuffleMode.OFF, null);
    }
}
