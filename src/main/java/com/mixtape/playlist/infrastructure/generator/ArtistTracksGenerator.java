package com.mixtape.playlist.infrastructure.generator;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.model.TrackEntry;

import java.util.List;

/**
 * Plays through everything of one artist in album order, then is exhausted.
 */
final class ArtistTracksGenerator implements PlaylistGenerator {

    static final String PREFIX = "artist:";

    private final LibraryPort libraryPort;
    private final String artist;
    private int position;

    ArtistTracksGenerator(LibraryPort libraryPort, String artist) {
        this.libraryPort = libraryPort;
        this.artist = artist;
    }

    @Override
    public String key() {
        return PREFIX + artist;
    }

    @Override
    public boolean isDynamic() {
        return true;
    }

    @Override
    public synchronized List<TrackEntry> generate(int count) {
        List<TrackEntry> tracks = libraryPort.findByArtist(artist);
        if (position >= tracks.size()) {
            return List.of();
        }
        int end = Math.min(tracks.size(), position + count);
        List<TrackEntry> batch = List.copyOf(tracks.subList(position, end));
        position = end;
        return batch;
    }
}
