package com.mixtape.playlist.core.model;

import java.util.Comparator;

/**
 * Fields a playlist can be sorted by.
 */
public enum SortField {
    TITLE(Comparator.comparing(TrackMetadata::title, String.CASE_INSENSITIVE_ORDER)),
    ARTIST(Comparator.comparing(TrackMetadata::artist, String.CASE_INSENSITIVE_ORDER)),
    ALBUM(Comparator.comparing(TrackMetadata::album, String.CASE_INSENSITIVE_ORDER)),
    ALBUM_ARTIST(Comparator.comparing(TrackMetadata::albumArtist, String.CASE_INSENSITIVE_ORDER)),
    GENRE(Comparator.comparing(TrackMetadata::genre, String.CASE_INSENSITIVE_ORDER)),
    YEAR(Comparator.comparingInt(TrackMetadata::year)),
    TRACK(Comparator.comparingInt(TrackMetadata::trackNumber)),
    LENGTH(Comparator.comparingInt(TrackMetadata::lengthSeconds)),
    RATING(Comparator.comparingDouble(TrackMetadata::rating));

    private final Comparator<TrackMetadata> comparator;

    SortField(Comparator<TrackMetadata> comparator) {
        this.comparator = comparator;
    }

    public Comparator<TrackMetadata> comparator() {
        return comparator;
    }
}
