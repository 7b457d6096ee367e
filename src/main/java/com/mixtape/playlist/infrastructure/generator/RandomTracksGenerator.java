package com.mixtape.playlist.infrastructure.generator;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.model.TrackEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Endless random picks from the whole library, never returning the same track twice in a row.
 * Exhausted only while the library is empty.
 */
final class RandomTracksGenerator implements PlaylistGenerator {

    static final String KEY = "random";

    private final LibraryPort libraryPort;
    private final Random random;
    private Long lastPicked;

    RandomTracksGenerator(LibraryPort libraryPort, Random random) {
        this.libraryPort = libraryPort;
        this.random = random;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public boolean isDynamic() {
        return true;
    }

    @Override
    public synchronized List<TrackEntry> generate(int count) {
        List<TrackEntry> library = libraryPort.findAll();
        if (library.isEmpty()) {
            return List.of();
        }
        List<TrackEntry> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TrackEntry entry = library.get(random.nextInt(library.size()));
            if (library.size() > 1 && entry.getLibraryId().equals(lastPicked)) {
                entry = library.get((library.indexOf(entry) + 1) % library.size());
            }
            lastPicked = entry.getLibraryId();
            picked.add(entry);
        }
        return picked;
    }
}
