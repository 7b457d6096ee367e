package com.mixtape.playlist.core.model;

import java.util.Objects;

/**
 * Static metadata of a track.
 * Pure value object with no framework dependencies.
 */
public record TrackMetadata(
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
) {

    public TrackMetadata {
        title = Objects.requireNonNullElse(title, "");
        artist = Objects.requireNonNullElse(artist, "");
        album = Objects.requireNonNullElse(album, "");
        albumArtist = Objects.requireNonNullElse(albumArtist, "");
        genre = Objects.requireNonNullElse(genre, "");
    }

    /**
     * Creates metadata carrying only the most common fields.
     */
    public static TrackMetadata of(String title, String artist, String album, int lengthSeconds, String url) {
        return new TrackMetadata(title, artist, album, "", "", 0, 0, lengthSeconds, url, 0f, false);
    }

    public static TrackMetadata titled(String title) {
        return of(title, "", "", 0, null);
    }

    /**
     * Key identifying the album this track belongs to.
     * Compilations are grouped by album name only.
     */
    public String albumKey() {
        if (compilation) {
            return "\u0000compilation|" + album;
        }
        String owner = albumArtist.isEmpty() ? artist : albumArtist;
        return owner + "|" + album;
    }

    public TrackMetadata withRating(float rating) {
        return new TrackMetadata(title, artist, album, albumArtist, genre, year, trackNumber,
                lengthSeconds, url, rating, compilation);
    }
}
