package com.mixtape.playlist.application.service;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.application.port.UrlResolverPort;
import com.mixtape.playlist.application.service.InsertionPipeline.InsertOptions;
import com.mixtape.playlist.application.service.InsertionPipeline.InsertOutcome;
import com.mixtape.playlist.core.engine.BackgroundTasks;
import com.mixtape.playlist.core.engine.EngineSettings;
import com.mixtape.playlist.core.engine.Playlist;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.engine.PlaylistListener;
import com.mixtape.playlist.core.exception.ResolutionFailedException;
import com.mixtape.playlist.core.model.RadioStation;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackKind;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class InsertionPipelineTest {

    private FakeLibrary library;
    private FakeResolver resolver;
    private DeferredTasks tasks;
    private Playlist playlist;
    private InsertionPipeline pipeline;
    private List<String> loadErrors;

    @BeforeEach
    void setUp() {
        library = new FakeLibrary();
        resolver = new FakeResolver();
        tasks = new DeferredTasks();
        playlist = new Playlist("main", EngineSettings.defaults(), tasks);
        pipeline = new InsertionPipeline(tasks, library, resolver);
        loadErrors = new ArrayList<>();
        playlist.addListener(new PlaylistListener() {
            @Override
            public void loadError(String message) {
                loadErrors.add(message);
            }
        });
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static TrackEntry track(String title) {
        return TrackEntry.url(TrackMetadata.of(title, "Artist", "Album", 60, "file:///music/" + title + ".mp3"));
    }

    private List<String> titles() {
        return playlist.items().stream().map(TrackEntry::getTitle).toList();
    }

    private <T> T complete(CompletableFuture<T> future) {
        tasks.runAll();
        assertThat(future).isDone();
        return future.join();
    }

    private static final class FakeLibrary implements LibraryPort {

        private final Map<Long, TrackMetadata> tracks = new HashMap<>();

        @Override
        public Optional<TrackEntry> findById(long libraryId) {
            return Optional.ofNullable(tracks.get(libraryId)).map(metadata -> TrackEntry.library(libraryId, metadata));
        }

        @Override
        public List<TrackEntry> findAll() {
            return tracks.keySet().stream().sorted().map(id -> TrackEntry.library(id, tracks.get(id))).toList();
        }

        @Override
        public List<TrackEntry> findByArtist(String artist) {
            return findAll().stream().filter(entry -> entry.getMetadata().artist().equalsIgnoreCase(artist)).toList();
        }

        @Override
        public TrackEntry create(TrackMetadata metadata) {
            long id = tracks.size() + 1L;
            tracks.put(id, metadata);
            return TrackEntry.library(id, metadata);
        }

        @Override
        public Optional<TrackEntry> update(long libraryId, TrackMetadata metadata) {
            if (!tracks.containsKey(libraryId)) {
                return Optional.empty();
            }
            tracks.put(libraryId, metadata);
            return findById(libraryId);
        }

        @Override
        public void addChangeListener(Consumer<List<TrackEntry>> listener) {
        }
    }

    private static final class FakeResolver implements UrlResolverPort {

        private final Map<URI, List<TrackEntry>> known = new HashMap<>();

        @Override
        public List<TrackEntry> resolve(URI uri) {
            List<TrackEntry> entries = known.get(uri);
            if (entries == null) {
                throw new ResolutionFailedException(uri.toString(), "Unsupported URL: " + uri);
            }
            return entries;
        }

        @Override
        public boolean isAvailable(TrackEntry entry) {
            return true;
        }
    }

    /**
     * Holds background work until the test releases it, standing in for the owner thread round trip.
     */
    private static final class DeferredTasks implements BackgroundTasks {

        private final List<Runnable> pending = new ArrayList<>();

        @Override
        public <T> void submit(String name, Supplier<T> work, Consumer<T> onSuccess,
                               Consumer<RuntimeException> onFailure) {
            pending.add(() -> BackgroundTasks.inline().submit(name, work, onSuccess, onFailure));
        }

        private void runAll() {
            while (!pending.isEmpty()) {
                pending.remove(0).run();
            }
        }
    }

    // ========================================================================

    @Nested
    @DisplayName("Library items")
    class LibraryItems {

        @Test
        @DisplayName("Found tracks are inserted, missing ones reported")
        void partialSuccess() {
            TrackEntry created = library.create(TrackMetadata.of("Known", "Band", "Record", 180, null));

            InsertOutcome outcome = complete(pipeline.insertLibraryItems(playlist,
                    List.of(created.getLibraryId(), 99L), InsertOptions.append()));

            assertThat(outcome.inserted()).isEqualTo(1);
            assertThat(outcome.errors()).containsExactly("Library track 99 not found");
            assertThat(loadErrors).containsExactly("Library track 99 not found");
            assertThat(playlist.item(0).getKind()).isEqualTo(TrackKind.LIBRARY);
            assertThat(playlist.libraryItemsById(created.getLibraryId())).hasSize(1);
        }

        @Test
        @DisplayName("Nothing is inserted before the background work completes")
        void waitsForBackgroundWork() {
            TrackEntry created = library.create(TrackMetadata.titled("Known"));

            CompletableFuture<InsertOutcome> future = pipeline.insertLibraryItems(playlist,
                    List.of(created.getLibraryId()), InsertOptions.append());

            assertThat(future).isNotDone();
            assertThat(playlist.size()).isZero();
        }
    }

    @Nested
    @DisplayName("URLs")
    class Urls {

        @Test
        @DisplayName("Resolvable URLs are inserted as one undo step, the rest reported")
        void resolvesUrls() {
            URI list = URI.create("file:///music/list.m3u");
            resolver.known.put(list, List.of(track("one"), track("two")));

            InsertOutcome outcome = complete(pipeline.insertUrls(playlist,
                    List.of(list, URI.create("gopher://nowhere")), InsertOptions.append()));

            assertThat(titles()).containsExactly("one", "two");
            assertThat(outcome.inserted()).isEqualTo(2);
            assertThat(outcome.errors()).hasSize(1);
            assertThat(loadErrors).hasSize(1);
            assertThat(loadErrors.get(0)).contains("gopher://nowhere");
            assertThat(playlist.mutationLog().undoDepth()).isEqualTo(1);
        }

        @Test
        @DisplayName("Play now starts the first resolved entry")
        void playNow() {
            URI stream = URI.create("http://radio.example/live");
            resolver.known.put(stream, List.of(track("live")));

            complete(pipeline.insertUrls(playlist, List.of(stream), new InsertOptions(-1, true, false)));

            assertThat(playlist.currentRow()).isZero();
        }
    }

    @Nested
    @DisplayName("Concurrent changes")
    class ConcurrentChanges {

        @Test
        @DisplayName("Results for a playlist cleared in the meantime are dropped")
        void staleAfterClear() {
            URI uri = URI.create("file:///music/a.mp3");
            resolver.known.put(uri, List.of(track("a")));
            CompletableFuture<InsertOutcome> future = pipeline.insertUrls(playlist, List.of(uri), InsertOptions.append());

            playlist.clear();
            InsertOutcome outcome = complete(future);

            assertThat(outcome.discarded()).isTrue();
            assertThat(playlist.size()).isZero();
        }

        @Test
        @DisplayName("Insertion follows the entry that was at the requested position")
        void followsAnchor() {
            playlist.insertItems(List.of(track("A"), track("B"), track("C")));
            URI uri = URI.create("file:///music/x.mp3");
            resolver.known.put(uri, List.of(track("X")));
            CompletableFuture<InsertOutcome> future = pipeline.insertUrls(playlist, List.of(uri),
                    new InsertOptions(1, false, false));

            playlist.removeItems(0, 1);
            InsertOutcome outcome = complete(future);

            assertThat(outcome.position()).isZero();
            assertThat(titles()).containsExactly("X", "B", "C");
        }

        @Test
        @DisplayName("If the anchor is gone the requested position is clamped")
        void anchorRemoved() {
            playlist.insertItems(List.of(track("A"), track("B"), track("C")));
            URI uri = URI.create("file:///music/x.mp3");
            resolver.known.put(uri, List.of(track("X")));
            CompletableFuture<InsertOutcome> future = pipeline.insertUrls(playlist, List.of(uri),
                    new InsertOptions(2, false, false));

            playlist.removeRows(List.of(1, 2));
            complete(future);

            assertThat(titles()).containsExactly("A", "X");
        }
    }

    @Nested
    @DisplayName("Generators")
    class Generators {

        private PlaylistGenerator generator(boolean dynamic, List<TrackEntry> output) {
            return new PlaylistGenerator() {
                @Override
                public String key() {
                    return dynamic ? "endless" : "once";
                }

                @Override
                public boolean isDynamic() {
                    return dynamic;
                }

                @Override
                public List<TrackEntry> generate(int count) {
                    return output.subList(0, Math.min(count, output.size()));
                }
            };
        }

        @Test
        @DisplayName("A one-shot generator's tracks are inserted once, without vetoes")
        void oneShot() {
            playlist.addVetoListener((existing, candidates) -> candidates);

            InsertOutcome outcome = complete(pipeline.insertFromGenerator(playlist,
                    generator(false, List.of(track("g1"), track("g2"), track("g3"))), 2, InsertOptions.append()));

            assertThat(outcome.inserted()).isEqualTo(2);
            assertThat(titles()).containsExactly("g1", "g2");
            assertThat(playlist.isDynamic()).isFalse();
            assertThat(playlist.mutationLog().canUndo()).isTrue();
        }

        @Test
        @DisplayName("A dynamic generator turns the playlist dynamic")
        void dynamic() {
            CompletableFuture<InsertOutcome> future = pipeline.insertFromGenerator(playlist,
                    generator(true, List.of(track("g1"))), 5, InsertOptions.append());

            assertThat(future).isDone();
            assertThat(playlist.isDynamic()).isTrue();
            assertThat(playlist.dynamicGenerator()).map(PlaylistGenerator::key).contains("endless");
        }
    }

    @Test
    @DisplayName("Radio stations are inserted right away")
    void radioStations() {
        CompletableFuture<InsertOutcome> future = pipeline.insertRadioStations(playlist,
                List.of(new RadioStation("Jazz FM", URI.create("http://jazz.example/stream"))), InsertOptions.append());

        assertThat(future).isDone();
        assertThat(playlist.item(0).getKind()).isEqualTo(TrackKind.RADIO);
        assertThat(playlist.item(0).getTitle()).isEqualTo("Jazz FM");
    }

    @Test
    @DisplayName("Reloading refreshes library entries and greys out vanished ones")
    void reload() {
        TrackEntry kept = library.create(TrackMetadata.titled("Before"));
        playlist.insertItems(List.of(kept, TrackEntry.library(42, TrackMetadata.titled("Gone"))));
        library.update(kept.getLibraryId(), TrackMetadata.titled("After"));

        int reloaded = complete(pipeline.reloadItems(playlist, List.of(0, 1)));

        assertThat(reloaded).isEqualTo(1);
        assertThat(titles()).containsExactly("After", "Gone");
        assertThat(playlist.item(1).isValid()).isFalse();
    }

    @Test
    @DisplayName("Entries without a URL are greyed out instead of failing the reload")
    void reloadWithoutUrl() {
        TrackEntry kept = library.create(TrackMetadata.titled("Before"));
        playlist.insertItems(List.of(TrackEntry.url(TrackMetadata.titled("No url")), kept));
        library.update(kept.getLibraryId(), TrackMetadata.titled("After"));

        int reloaded = complete(pipeline.reloadItems(playlist, List.of(0, 1)));

        assertThat(reloaded).isEqualTo(1);
        assertThat(titles()).containsExactly("No url", "After");
        assertThat(playlist.item(0).isValid()).isFalse();
    }
}
