package com.mixtape.playlist.application.service;

import com.mixtape.playlist.application.port.GeneratorCatalogPort;
import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.application.port.PlaylistBackendPort;
import com.mixtape.playlist.application.port.UrlResolverPort;
import com.mixtape.playlist.application.service.InsertionPipeline.InsertOptions;
import com.mixtape.playlist.application.service.InsertionPipeline.InsertOutcome;
import com.mixtape.playlist.core.engine.EngineSettings;
import com.mixtape.playlist.core.engine.Playlist;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.engine.PlaylistListener;
import com.mixtape.playlist.core.exception.InvalidPaginationException;
import com.mixtape.playlist.core.exception.ResourceNotFoundException;
import com.mixtape.playlist.core.model.PlaylistSnapshot;
import com.mixtape.playlist.core.model.RadioStation;
import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;
import com.mixtape.playlist.core.model.SortField;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Service for playlist operations.
 * <p>
 * Owns every playlist instance. Playlists are loaded from the backend on first use and only ever touched on the
 * {@link OwnerThread}; the public methods hop onto it and may be called from any other thread.
 */
@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private static final int MIN_LIMIT = 1;
    private static final int MAX_LIMIT = 100;
    private static final int MAX_RECENT_ERRORS = 20;

    private final PlaylistBackendPort backendPort;
    private final GeneratorCatalogPort generatorCatalog;
    private final UrlResolverPort urlResolver;
    private final OwnerThread ownerThread;
    private final EngineSettings settings;
    private final InsertionPipeline pipeline;
    private final Random random = new Random();

    // Confined to the owner thread
    private final Map<String, Playlist> playlists = new HashMap<>();
    private final Map<String, Deque<String>> recentErrors = new HashMap<>();

    public PlaylistService(PlaylistBackendPort backendPort,
                           LibraryPort libraryPort,
                           UrlResolverPort urlResolver,
                           GeneratorCatalogPort generatorCatalog,
                           OwnerThread ownerThread,
                           EngineSettings settings) {
        this.backendPort = backendPort;
        this.generatorCatalog = generatorCatalog;
        this.urlResolver = urlResolver;
        this.ownerThread = ownerThread;
        this.settings = settings;
        this.pipeline = new InsertionPipeline(ownerThread, libraryPort, urlResolver);
        libraryPort.addChangeListener(records -> ownerThread.post(() -> {
            for (Playlist playlist : playlists.values()) {
                playlist.libraryItemsChanged(records);
            }
        }));
    }

    /**
     * One row of a playlist page.
     */
    public record PlaylistRow(int row, TrackEntry entry, boolean visible) {}

    /**
     * Result record containing a page of playlist rows and the playlist state.
     */
    public record PlaylistState(
            String playlistId,
            List<PlaylistRow> rows,
            int totalCount,
            long totalLengthSeconds,
            int currentRow,
            int lastPlayedRow,
            int stopAfterRow,
            int nextRow,
            int previousRow,
            ShuffleMode shuffleMode,
            RepeatMode repeatMode,
            boolean dynamic,
            String generatorKey,
            List<Integer> queue,
            List<Integer> playOrder,
            String undoDescription,
            String redoDescription,
            List<String> recentErrors
    ) {}

    /**
     * Gets a page of a playlist together with its state.
     *
     * @param playlistId the playlist identifier
     * @param offset     the number of rows to skip (0-based)
     * @param limit      the maximum number of rows to return
     */
    public PlaylistState getPlaylist(String playlistId, int offset, int limit) {
        validatePagination(offset, limit);
        return onPlaylist(playlistId, playlist -> {
            List<PlaylistRow> rows = new ArrayList<>();
            int end = Math.min(playlist.size(), offset + limit);
            for (int row = offset; row < end; row++) {
                rows.add(new PlaylistRow(row, playlist.item(row), playlist.isVisible(row)));
            }
            return new PlaylistState(
                    playlist.id(),
                    rows,
                    playlist.size(),
                    playlist.totalLengthSeconds(),
                    playlist.currentRow(),
                    playlist.lastPlayedRow(),
                    playlist.stopAfterRow(),
                    playlist.nextRow(),
                    playlist.previousRow(),
                    playlist.shuffleMode(),
                    playlist.repeatMode(),
                    playlist.isDynamic(),
                    playlist.dynamicGenerator().map(PlaylistGenerator::key).orElse(null),
                    playlist.queue().rows(),
                    playlist.playbackOrder().order(),
                    playlist.mutationLog().undoDescription().orElse(null),
                    playlist.mutationLog().redoDescription().orElse(null),
                    List.copyOf(recentErrors.getOrDefault(playlistId, new ArrayDeque<>())));
        });
    }

    // ========================================================================
    // Insertion
    // ========================================================================

    public InsertOutcome insertEntries(String playlistId, List<TrackEntry> entries, InsertOptions options) {
        return await(onPlaylist(playlistId, playlist -> pipeline.insertEntries(playlist, entries, options)));
    }

    public InsertOutcome insertLibraryItems(String playlistId, List<Long> libraryIds, InsertOptions options) {
        return await(onPlaylist(playlistId, playlist -> pipeline.insertLibraryItems(playlist, libraryIds, options)));
    }

    public InsertOutcome insertUrls(String playlistId, List<URI> urls, InsertOptions options) {
        return await(onPlaylist(playlistId, playlist -> pipeline.insertUrls(playlist, urls, options)));
    }

    public InsertOutcome insertRadioStations(String playlistId, List<RadioStation> stations, InsertOptions options) {
        return await(onPlaylist(playlistId, playlist -> pipeline.insertRadioStations(playlist, stations, options)));
    }

    /**
     * Inserts from the generator registered under {@code generatorKey}. Dynamic generators turn the playlist
     * into a dynamic playlist.
     *
     * @throws ResourceNotFoundException if there is no such generator
     */
    public InsertOutcome insertFromGenerator(String playlistId, String generatorKey, int count,
                                             InsertOptions options) {
        PlaylistGenerator generator = generatorCatalog.find(generatorKey)
                .orElseThrow(() -> new ResourceNotFoundException("Generator not found: " + generatorKey));
        return await(onPlaylist(playlistId,
                playlist -> pipeline.insertFromGenerator(playlist, generator, count, options)));
    }

    // ========================================================================
    // Structural changes
    // ========================================================================

    public List<TrackEntry> removeRows(String playlistId, Collection<Integer> rows) {
        return onPlaylist(playlistId, playlist -> playlist.removeRows(rows));
    }

    public List<TrackEntry> removeItemsNotInQueue(String playlistId) {
        return onPlaylist(playlistId, Playlist::removeItemsNotInQueue);
    }

    /**
     * @return the row the moved entries now start at
     */
    public int moveItems(String playlistId, Collection<Integer> sources, int destination) {
        return onPlaylist(playlistId, playlist -> playlist.moveItems(sources, destination));
    }

    public boolean undo(String playlistId) {
        return onPlaylist(playlistId, Playlist::undo);
    }

    public boolean redo(String playlistId) {
        return onPlaylist(playlistId, Playlist::redo);
    }

    public void sort(String playlistId, SortField field, boolean ascending) {
        runOnPlaylist(playlistId, playlist -> playlist.sort(field, ascending));
    }

    public void shuffle(String playlistId) {
        runOnPlaylist(playlistId, Playlist::shuffle);
    }

    public void clear(String playlistId) {
        runOnPlaylist(playlistId, playlist -> {
            playlist.clear();
            recentErrors.remove(playlistId);
        });
    }

    // ========================================================================
    // Playback state
    // ========================================================================

    /**
     * Changes the modes that are not null.
     */
    public void setModes(String playlistId, ShuffleMode shuffleMode, RepeatMode repeatMode) {
        runOnPlaylist(playlistId, playlist -> {
            if (shuffleMode != null) {
                playlist.setShuffleMode(shuffleMode);
            }
            if (repeatMode != null) {
                playlist.setRepeatMode(repeatMode);
            }
        });
    }

    public void setCurrentRow(String playlistId, int row) {
        runOnPlaylist(playlistId, playlist -> playlist.setCurrentRow(row));
    }

    public int playNext(String playlistId) {
        return onPlaylist(playlistId, Playlist::playNext);
    }

    public int playPrevious(String playlistId) {
        return onPlaylist(playlistId, Playlist::playPrevious);
    }

    public void setStopAfter(String playlistId, int row) {
        runOnPlaylist(playlistId, playlist -> playlist.setStopAfter(row));
    }

    public void enqueue(String playlistId, List<Integer> rows) {
        runOnPlaylist(playlistId, playlist -> playlist.enqueue(rows));
    }

    public void setStreamMetadata(String playlistId, String url, TrackMetadata metadata) {
        runOnPlaylist(playlistId, playlist -> playlist.setStreamMetadata(url, metadata));
    }

    // ========================================================================
    // Entry updates
    // ========================================================================

    public void rateItem(String playlistId, int row, float rating) {
        runOnPlaylist(playlistId, playlist -> playlist.rateItem(row, rating));
    }

    public void setFilterText(String playlistId, String text) {
        runOnPlaylist(playlistId, playlist -> playlist.setFilterText(text));
    }

    /**
     * @return the number of entries refreshed
     */
    public int reloadItems(String playlistId, Collection<Integer> rows) {
        return await(onPlaylist(playlistId, playlist -> pipeline.reloadItems(playlist, rows)));
    }

    /**
     * Greys out entries whose tracks disappeared and restores those that came back. Checks files on the
     * owner thread, so this is meant for playlists of modest size.
     *
     * @return the number of entries whose validity changed
     */
    public int invalidateDeletedItems(String playlistId) {
        return onPlaylist(playlistId, playlist -> playlist.invalidateDeletedItems(urlResolver::isAvailable));
    }

    // ========================================================================
    // Dynamic playlist
    // ========================================================================

    public void turnOffDynamicPlaylist(String playlistId) {
        runOnPlaylist(playlistId, Playlist::turnOffDynamicPlaylist);
    }

    public void repopulateDynamicPlaylist(String playlistId) {
        runOnPlaylist(playlistId, Playlist::repopulateDynamicPlaylist);
    }

    public List<String> generatorKeys() {
        return generatorCatalog.keys();
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public void save(String playlistId) {
        runOnPlaylist(playlistId, playlist -> {
            PlaylistSnapshot snapshot = playlist.snapshot();
            backendPort.save(snapshot);
            log.info("Saved playlist {} with {} items", playlistId, snapshot.entries().size());
        });
    }

    // ========================================================================

    private <T> T onPlaylist(String playlistId, Function<Playlist, T> operation) {
        return ownerThread.call(() -> operation.apply(playlist(playlistId)));
    }

    private void runOnPlaylist(String playlistId, Consumer<Playlist> operation) {
        ownerThread.run(() -> operation.accept(playlist(playlistId)));
    }

    private Playlist playlist(String playlistId) {
        Playlist existing = playlists.get(playlistId);
        if (existing != null) {
            return existing;
        }
        Playlist playlist = new Playlist(playlistId, settings, ownerThread, random);
        playlist.addListener(new PlaylistListener() {
            @Override
            public void loadError(String message) {
                Deque<String> errors = recentErrors.computeIfAbsent(playlistId, id -> new ArrayDeque<>());
                errors.addLast(message);
                while (errors.size() > MAX_RECENT_ERRORS) {
                    errors.removeFirst();
                }
            }
        });
        backendPort.load(playlistId).ifPresent(snapshot -> {
            PlaylistGenerator generator = null;
            if (snapshot.generatorKey() != null) {
                generator = generatorCatalog.find(snapshot.generatorKey()).orElse(null);
                if (generator == null) {
                    log.warn("Generator '{}' of playlist {} no longer exists, restoring it as a static playlist",
                            snapshot.generatorKey(), playlistId);
                }
            }
            playlist.restore(snapshot, generator);
        });
        playlists.put(playlistId, playlist);
        return playlist;
    }

    /**
     * Waits for an insertion started on the owner thread. Must not be called on the owner thread itself.
     */
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private void validatePagination(int offset, int limit) {
        if (offset < 0) {
            throw new InvalidPaginationException("Offset must be non-negative");
        }
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new InvalidPaginationException("Limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
        }
    }
}
