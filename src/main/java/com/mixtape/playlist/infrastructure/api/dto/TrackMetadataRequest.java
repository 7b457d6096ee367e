package com.mixtape.playlist.infrastructure.api.dto;

import com.mixtape.playlist.core.model.TrackMetadata;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO carrying track metadata, used for ready-made entries and library tracks.
 */
public record TrackMetadataRequest(
        @NotNull(message = "title is required")
        String title,
        String artist,
        String album,
        String albumArtist,
        String genre,
        @Min(0) int year,
        @Min(0) int trackNumber,
        @Min(0) int lengthSeconds,
        String url,
        @DecimalMin("0.0") @DecimalMax("1.0") float rating,
        boolean compilation
) {

    public TrackMetadata toMetadata() {
        return new TrackMetadata(title, artist, album, albumArtist, genre, year, trackNumber, lengthSeconds, url,
                rating, compilation);
    }
}
