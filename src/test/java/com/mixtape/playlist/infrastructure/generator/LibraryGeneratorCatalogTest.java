package com.mixtape.playlist.infrastructure.generator;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryGeneratorCatalogTest {

    private final ListLibrary library = new ListLibrary();
    private final LibraryGeneratorCatalog catalog = new LibraryGeneratorCatalog(library);

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static final class ListLibrary implements LibraryPort {

        private final List<TrackEntry> tracks = new ArrayList<>();

        private void add(String title, String artist, String album, int trackNumber) {
            TrackMetadata metadata = new TrackMetadata(title, artist, album, "", "", 2001, trackNumber, 200, null,
                    0f, false);
            tracks.add(TrackEntry.library(tracks.size() + 1L, metadata));
        }

        @Override
        public Optional<TrackEntry> findById(long libraryId) {
            return tracks.stream().filter(track -> track.getLibraryId() == libraryId).findFirst();
        }

        @Override
        public List<TrackEntry> findAll() {
            return List.copyOf(tracks);
        }

        @Override
        public List<TrackEntry> findByArtist(String artist) {
            return tracks.stream()
                    .filter(track -> track.getMetadata().artist().equalsIgnoreCase(artist))
                    .sorted(Comparator.comparing((TrackEntry track) -> track.getMetadata().album())
                            .thenComparingInt(track -> track.getMetadata().trackNumber()))
                    .toList();
        }

        @Override
        public TrackEntry create(TrackMetadata metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Optional<TrackEntry> update(long libraryId, TrackMetadata metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void addChangeListener(Consumer<List<TrackEntry>> listener) {
        }
    }

    private static List<String> titles(List<TrackEntry> entries) {
        return entries.stream().map(TrackEntry::getTitle).toList();
    }

    // ========================================================================

    @Test
    @DisplayName("Unknown keys are not found")
    void unknownKey() {
        assertThat(catalog.find("nope")).isEmpty();
        assertThat(catalog.find("artist:")).isEmpty();
        assertThat(catalog.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Random picks never repeat the previous track")
    void randomNeverRepeats() {
        library.add("A", "X", "One", 1);
        library.add("B", "Y", "Two", 1);
        PlaylistGenerator generator = catalog.find("random").orElseThrow();

        List<TrackEntry> picks = new ArrayList<>(generator.generate(10));
        picks.addAll(generator.generate(10));

        assertThat(generator.isDynamic()).isTrue();
        assertThat(picks).hasSize(20);
        for (int i = 1; i < picks.size(); i++) {
            assertThat(picks.get(i).getLibraryId()).isNotEqualTo(picks.get(i - 1).getLibraryId());
        }
    }

    @Test
    @DisplayName("Random is exhausted while the library is empty")
    void randomOnEmptyLibrary() {
        assertThat(catalog.find("random").orElseThrow().generate(3)).isEmpty();
    }

    @Test
    @DisplayName("An artist generator plays the artist in album order, then ends")
    void artist() {
        library.add("Second", "Band", "Alpha", 2);
        library.add("Other", "Solo", "Alpha", 1);
        library.add("Third", "band", "Beta", 1);
        library.add("First", "Band", "Alpha", 1);
        PlaylistGenerator generator = catalog.find("artist:Band").orElseThrow();

        assertThat(generator.key()).isEqualTo("artist:Band");
        assertThat(titles(generator.generate(2))).containsExactly("First", "Second");
        assertThat(titles(generator.generate(2))).containsExactly("Third");
        assertThat(generator.generate(2)).isEmpty();
    }

    @Test
    @DisplayName("The whole library generator is one-shot and honours the count")
    void wholeLibrary() {
        library.add("A", "X", "One", 1);
        library.add("B", "X", "One", 2);
        library.add("C", "X", "One", 3);
        PlaylistGenerator generator = catalog.find("all").orElseThrow();

        assertThat(generator.isDynamic()).isFalse();
        assertThat(titles(generator.generate(2))).containsExactly("A", "B");
        assertThat(titles(generator.generate(10))).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Every lookup returns a fresh generator")
    void freshGenerators() {
        library.add("A", "Band", "One", 1);

        PlaylistGenerator first = catalog.find("artist:Band").orElseThrow();
        first.generate(1);

        assertThat(catalog.find("artist:Band").orElseThrow().generate(1)).hasSize(1);
        assertThat(catalog.keys()).contains("random", "all");
    }
}
