package com.mixtape.playlist.application.service;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.application.port.UrlResolverPort;
import com.mixtape.playlist.core.engine.BackgroundTasks;
import com.mixtape.playlist.core.engine.Playlist;
import com.mixtape.playlist.core.engine.PlaylistGenerator;
import com.mixtape.playlist.core.engine.Range;
import com.mixtape.playlist.core.exception.ResolutionFailedException;
import com.mixtape.playlist.core.model.ItemRef;
import com.mixtape.playlist.core.model.RadioStation;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackKind;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Resolves insertion sources into track entries off the owner thread and inserts them into a playlist.
 * <p>
 * Must be called on the owner thread; results are delivered back to it by {@link BackgroundTasks}. Sources that
 * fail to resolve are reported as load errors and left out, the rest is inserted as one undoable step.
 * Results for a playlist that was cleared in the meantime are dropped.
 */
public class InsertionPipeline {

    private static final Logger log = LoggerFactory.getLogger(InsertionPipeline.class);

    private final BackgroundTasks tasks;
    private final LibraryPort libraryPort;
    private final UrlResolverPort urlResolver;

    public InsertionPipeline(BackgroundTasks tasks, LibraryPort libraryPort, UrlResolverPort urlResolver) {
        this.tasks = tasks;
        this.libraryPort = libraryPort;
        this.urlResolver = urlResolver;
    }

    /**
     * Where and how resolved entries are inserted.
     *
     * @param position insert position; negative appends
     * @param playNow  play the first inserted entry
     * @param enqueue  queue the inserted entries
     */
    public record InsertOptions(int position, boolean playNow, boolean enqueue) {

        public static InsertOptions append() {
            return new InsertOptions(-1, false, false);
        }
    }

    /**
     * What an insertion did.
     *
     * @param position  first inserted row
     * @param inserted  number of entries inserted after vetoes
     * @param errors    sources that could not be resolved
     * @param discarded true if the playlist was cleared before the results arrived
     */
    public record InsertOutcome(int position, int inserted, List<String> errors, boolean discarded) {

        public InsertOutcome {
            errors = List.copyOf(errors);
        }

        static InsertOutcome stale() {
            return new InsertOutcome(-1, 0, List.of(), true);
        }
    }

    private record Resolution(List<TrackEntry> entries, List<String> errors) {
    }

    // ========================================================================
    // Sources
    // ========================================================================

    public CompletableFuture<InsertOutcome> insertEntries(Playlist playlist, List<TrackEntry> entries,
                                                          InsertOptions options) {
        Range range = playlist.insertItems(entries, options.position(), options.playNow(), options.enqueue());
        return CompletableFuture.completedFuture(new InsertOutcome(range.start(), range.count(), List.of(), false));
    }

    public CompletableFuture<InsertOutcome> insertRadioStations(Playlist playlist, List<RadioStation> stations,
                                                                InsertOptions options) {
        List<TrackEntry> entries = new ArrayList<>(stations.size());
        for (RadioStation station : stations) {
            entries.add(TrackEntry.radio(station));
        }
        return insertEntries(playlist, entries, options);
    }

    public CompletableFuture<InsertOutcome> insertLibraryItems(Playlist playlist, List<Long> libraryIds,
                                                               InsertOptions options) {
        return resolveAndInsert(playlist, "library lookup", options, false, () -> {
            List<TrackEntry> entries = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (Long libraryId : libraryIds) {
                Optional<TrackEntry> entry = libraryPort.findById(libraryId);
                if (entry.isPresent()) {
                    entries.add(entry.get());
                } else {
                    errors.add("Library track " + libraryId + " not found");
                }
            }
            return new Resolution(entries, errors);
        });
    }

    public CompletableFuture<InsertOutcome> insertUrls(Playlist playlist, List<URI> urls, InsertOptions options) {
        return resolveAndInsert(playlist, "url resolution", options, false, () -> {
            List<TrackEntry> entries = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (URI url : urls) {
                try {
                    entries.addAll(urlResolver.resolve(url));
                } catch (ResolutionFailedException ex) {
                    log.warn("Could not resolve {}: {}", ex.getSource(), ex.getMessage());
                    errors.add(ex.getMessage());
                }
            }
            return new Resolution(entries, errors);
        });
    }

    /**
     * Inserts a generator's tracks. A dynamic generator turns the playlist into a dynamic playlist instead,
     * which then fills itself.
     *
     * @param count how many tracks to ask a one-shot generator for
     */
    public CompletableFuture<InsertOutcome> insertFromGenerator(Playlist playlist, PlaylistGenerator generator,
                                                                int count, InsertOptions options) {
        if (generator.isDynamic()) {
            int before = playlist.size();
            playlist.turnOnDynamicPlaylist(generator);
            return CompletableFuture.completedFuture(
                    new InsertOutcome(before, playlist.size() - before, List.of(), false));
        }
        return resolveAndInsert(playlist, "generate " + generator.key(), options, true,
                () -> new Resolution(generator.generate(count), List.of()));
    }

    // ========================================================================
    // Reload
    // ========================================================================

    /**
     * Re-reads the metadata of the given rows from the library or the URL they came from. Entries that can no
     * longer be found are marked invalid.
     *
     * @return the number of entries refreshed
     */
    public CompletableFuture<Integer> reloadItems(Playlist playlist, Collection<Integer> rows) {
        long epoch = playlist.epoch();
        List<ItemRef> refs = new ArrayList<>();
        List<TrackEntry> entries = new ArrayList<>();
        for (int row : new TreeSet<>(rows)) {
            refs.add(playlist.store().refAt(row));
            entries.add(playlist.item(row));
        }

        CompletableFuture<Integer> result = new CompletableFuture<>();
        tasks.submit("reload " + entries.size() + " tracks",
                () -> reload(entries),
                reloaded -> {
                    if (playlist.epoch() != epoch) {
                        log.debug("Dropping stale reload for playlist {}", playlist.id());
                        result.complete(0);
                        return;
                    }
                    int applied = 0;
                    for (int i = 0; i < refs.size(); i++) {
                        TrackMetadata metadata = reloaded.get(i);
                        int row = playlist.store().indexOf(refs.get(i));
                        if (row < 0) {
                            continue;
                        }
                        if (metadata == null) {
                            playlist.updateEntry(row, entry -> entry.withValid(false));
                        } else if (playlist.applyReloadedMetadata(refs.get(i), metadata)) {
                            applied++;
                        }
                    }
                    result.complete(applied);
                },
                ex -> {
                    playlist.reportLoadError("Reload failed: " + ex.getMessage());
                    result.completeExceptionally(ex);
                });
        return result;
    }

    private List<TrackMetadata> reload(List<TrackEntry> entries) {
        List<TrackMetadata> reloaded = new ArrayList<>(entries.size());
        for (TrackEntry entry : entries) {
            reloaded.add(reloadOne(entry));
        }
        return reloaded;
    }

    private TrackMetadata reloadOne(TrackEntry entry) {
        if (entry.isLibraryItem()) {
            return libraryPort.findById(entry.getLibraryId()).map(TrackEntry::getStaticMetadata).orElse(null);
        }
        if (entry.getKind() == TrackKind.RADIO) {
            return entry.getStaticMetadata();
        }
        String url = entry.getStaticMetadata().url();
        if (url == null) {
            return null;
        }
        try {
            List<TrackEntry> resolved = urlResolver.resolve(URI.create(url));
            return resolved.isEmpty() ? null : resolved.get(0).getStaticMetadata();
        } catch (ResolutionFailedException | IllegalArgumentException ex) {
            log.debug("Could not reload {}: {}", url, ex.getMessage());
            return null;
        }
    }

    // ========================================================================

    private CompletableFuture<InsertOutcome> resolveAndInsert(Playlist playlist, String taskName,
                                                              InsertOptions options, boolean generated,
                                                              Supplier<Resolution> resolver) {
        long epoch = playlist.epoch();
        int requested = options.position();
        ItemRef anchor = requested >= 0 && playlist.store().hasItemAt(requested)
                ? playlist.store().refAt(requested)
                : null;

        CompletableFuture<InsertOutcome> result = new CompletableFuture<>();
        tasks.submit(taskName, resolver,
                resolution -> {
                    if (playlist.epoch() != epoch) {
                        log.debug("Dropping stale {} results for playlist {}", taskName, playlist.id());
                        result.complete(InsertOutcome.stale());
                        return;
                    }
                    for (String error : resolution.errors()) {
                        playlist.reportLoadError(error);
                    }
                    int position = reanchor(playlist, anchor, requested);
                    Range range = generated
                            ? playlist.insertGeneratedItems(resolution.entries(), position, options.playNow(),
                                    options.enqueue())
                            : playlist.insertItems(resolution.entries(), position, options.playNow(),
                                    options.enqueue());
                    result.complete(new InsertOutcome(range.start(), range.count(), resolution.errors(), false));
                },
                ex -> {
                    if (playlist.epoch() != epoch) {
                        result.complete(InsertOutcome.stale());
                        return;
                    }
                    String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                    playlist.reportLoadError(message);
                    result.complete(new InsertOutcome(-1, 0, List.of(message), false));
                });
        return result;
    }

    /**
     * Finds where the entry that sat at the requested position went while resolution was running.
     * If it was removed the requested position is clamped to the current size.
     */
    private static int reanchor(Playlist playlist, ItemRef anchor, int requested) {
        if (requested < 0) {
            return -1;
        }
        int row = playlist.store().indexOf(anchor);
        if (row >= 0) {
            return row;
        }
        return Math.min(requested, playlist.size());
    }
}
