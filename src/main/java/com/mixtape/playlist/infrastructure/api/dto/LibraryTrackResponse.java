package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO for a library track.
 */
public record LibraryTrackResponse(
        long id,
        String title,
        String artist,
        String album,
        String albumArtist,
        String genre,
        int year,
        int trackNumber,
        int lengthSeconds,
        String url,
        float rating,
        boolean compilation
) {}
