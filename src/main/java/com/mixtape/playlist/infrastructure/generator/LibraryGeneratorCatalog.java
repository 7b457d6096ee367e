package com.mixtape.playlist.infrastructure.generator;

import com.mixtape.playlist.application.port.GeneratorCatalogPort;
import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Generators drawing from the track library.
 * <p>
 * Keys: {@code random} (dynamic, endless), {@code artist:<name>} (dynamic, ends after the artist's last track)
 * and {@code all} (one-shot). Every lookup returns a fresh generator.
 */
@Component
public class LibraryGeneratorCatalog implements GeneratorCatalogPort {

    private final LibraryPort libraryPort;
    private final Random random = new Random();

    public LibraryGeneratorCatalog(LibraryPort libraryPort) {
        this.libraryPort = libraryPort;
    }

    @Override
    public Optional<PlaylistGenerator> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        if (RandomTracksGenerator.KEY.equals(key)) {
            return Optional.of(new RandomTracksGenerator(libraryPort, random));
        }
        if (WholeLibraryGenerator.KEY.equals(key)) {
            return Optional.of(new WholeLibraryGenerator(libraryPort));
        }
        if (key.startsWith(ArtistTracksGenerator.PREFIX) && key.length() > ArtistTracksGenerator.PREFIX.length()) {
            return Optional.of(new ArtistTracksGenerator(libraryPort, key.substring(ArtistTracksGenerator.PREFIX.length())));
        }
        return Optional.empty();
    }

    @Override
    public List<String> keys() {
        return List.of(RandomTracksGenerator.KEY, ArtistTracksGenerator.PREFIX + "<artist>", WholeLibraryGenerator.KEY);
    }
}
