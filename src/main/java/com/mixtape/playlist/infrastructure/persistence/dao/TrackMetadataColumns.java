package com.mixtape.playlist.infrastructure.persistence.dao;

import com.mixtape.playlist.core.model.TrackMetadata;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Track metadata stored inline, shared by library tracks and playlist items.
 */
@Embeddable
public class TrackMetadataColumns {

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "artist", nullable = false, length = 500)
    private String artist;

    @Column(name = "album", nullable = false, length = 500)
    private String album;

    @Column(name = "album_artist", nullable = false, length = 500)
    private String albumArtist;

    @Column(name = "genre", nullable = false, length = 200)
    private String genre;

    @Column(name = "release_year", nullable = false)
    private int year;

    @Column(name = "track_number", nullable = false)
    private int trackNumber;

    @Column(name = "length_seconds", nullable = false)
    private int lengthSeconds;

    @Column(name = "url", length = 2000)
    private String url;

    @Column(name = "rating", nullable = false)
    private float rating;

    @Column(name = "compilation", nullable = false)
    private boolean compilation;

    public TrackMetadataColumns() {
    }

    public static TrackMetadataColumns from(TrackMetadata metadata) {
        TrackMetadataColumns columns = new TrackMetadataColumns();
        columns.title = metadata.title();
        columns.artist = metadata.artist();
        columns.album = metadata.album();
        columns.albumArtist = metadata.albumArtist();
        columns.genre = metadata.genre();
        columns.year = metadata.year();
        columns.trackNumber = metadata.trackNumber();
        columns.lengthSeconds = metadata.lengthSeconds();
        columns.url = metadata.url();
        columns.rating = metadata.rating();
        columns.compilation = metadata.compilation();
        return columns;
    }

    public TrackMetadata toMetadata() {
        return new TrackMetadata(title, artist, album, albumArtist, genre, year, trackNumber, lengthSeconds, url,
                rating, compilation);
    }
}
