package com.mixtape.playlist.infrastructure.api.dto;

import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;

import java.util.List;

/**
 * Response DTO for a page of a playlist and its playback state. Rows are -1 where there is none.
 */
public record PlaylistResponse(
        String playlistId,
        List<PlaylistItemResponse> items,
        PageInfo page,
        int totalCount,
        long totalLengthSeconds,
        int currentRow,
        int lastPlayedRow,
        int stopAfterRow,
        int nextRow,
        int previousRow,
        ShuffleMode shuffleMode,
        RepeatMode repeatMode,
        boolean dynamic,
        String generatorKey,
        List<Integer> queue,
        List<Integer> playOrder,
        String undoDescription,
        String redoDescription,
        List<String> recentErrors
) {}
