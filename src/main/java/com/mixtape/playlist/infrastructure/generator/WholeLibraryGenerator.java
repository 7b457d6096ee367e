package com.mixtape.playlist.infrastructure.generator;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.model.TrackEntry;

import java.util.List;

/**
 * One-shot generator inserting the library in id order.
 */
final class WholeLibraryGenerator implements PlaylistGenerator {

    static final String KEY = "all";

    private final LibraryPort libraryPort;

    WholeLibraryGenerator(LibraryPort libraryPort) {
        this.libraryPort = libraryPort;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public boolean isDynamic() {
        return false;
    }

    @Override
    public List<TrackEntry> generate(int count) {
        List<TrackEntry> library = libraryPort.findAll();
        return count >= library.size() ? library : List.copyOf(library.subList(0, count));
    }
}
