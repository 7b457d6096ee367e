package com.mixtape.playlist.infrastructure.api.dto;

import com.mixtape.playlist.core.model.TrackKind;

/**
 * Response DTO for a single playlist row. Title, artist and album are the effective values, including
 * metadata a stream reported.
 */
public record PlaylistItemResponse(
        int row,
        TrackKind kind,
        Long libraryId,
        String title,
        String artist,
        String album,
        int lengthSeconds,
        String url,
        float rating,
        boolean valid,
        boolean visible
) {}
