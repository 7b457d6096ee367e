package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.ItemRef;
import com.mixtape.playlist.core.model.TrackEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps a dynamic playlist topped up from its generator.
 * <p>
 * While active, at most {@code history} entries are kept before the current one and the playlist is
 * replenished until {@code future} entries follow it. At most one generator request is in flight. Replenishing
 * is triggered when playback advances off a generated entry (or starts from nothing), never when the user jumps
 * backwards or plays a track they added themselves.
 */
public final class DynamicPlaylistController {

    public enum State {
        INACTIVE,
        ACTIVE
    }

    private static final Logger log = LoggerFactory.getLogger(DynamicPlaylistController.class);

    private final Playlist playlist;
    private final BackgroundTasks tasks;
    private final int history;
    private final int future;

    private State state = State.INACTIVE;
    private PlaylistGenerator generator;
    private final Set<ItemRef> generated = new HashSet<>();
    private boolean requestPending;
    // Changes on every activation and deactivation so that answers for an earlier generator are dropped
    private long session;

    DynamicPlaylistController(Playlist playlist, BackgroundTasks tasks, int history, int future) {
        this.playlist = playlist;
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
        this.history = history;
        this.future = future;
    }

    public State state() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    public Optional<PlaylistGenerator> generator() {
        return Optional.ofNullable(generator);
    }

    public int history() {
        return history;
    }

    public int future() {
        return future;
    }

    public boolean isRequestPending() {
        return requestPending;
    }

    /**
     * Whether the entry behind {@code ref} was added by the generator.
     */
    public boolean isGenerated(ItemRef ref) {
        return generated.contains(ref);
    }

    void activate(PlaylistGenerator generator) {
        resume(generator);
        request(future);
    }

    /**
     * Activates without asking for tracks, used when a saved dynamic playlist is restored.
     */
    void resume(PlaylistGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        if (!generator.isDynamic()) {
            throw new IllegalArgumentException("Generator '" + generator.key() + "' is not dynamic");
        }
        boolean wasActive = isActive();
        this.generator = generator;
        state = State.ACTIVE;
        session++;
        requestPending = false;
        generated.clear();
        log.info("Playlist {} is now dynamic, generator '{}'", playlist.id(), generator.key());
        if (!wasActive) {
            playlist.dynamicModeChanged(true);
        }
    }

    void deactivate() {
        if (!isActive()) {
            return;
        }
        log.info("Playlist {} is no longer dynamic", playlist.id());
        state = State.INACTIVE;
        generator = null;
        session++;
        requestPending = false;
        generated.clear();
        playlist.dynamicModeChanged(false);
    }

    /**
     * Drops everything after the current entry and asks the generator for a fresh batch.
     */
    void repopulate() {
        if (!isActive()) {
            return;
        }
        int firstUpcoming = playlist.currentRow() + 1;
        int size = playlist.size();
        if (firstUpcoming < size) {
            playlist.removeItemsWithoutUndo(firstUpcoming, size - firstUpcoming);
        }
        replenish();
    }

    void currentItemChanged(ItemRef previous, int previousRow, int row) {
        if (!isActive() || row < 0) {
            return;
        }
        boolean advanced = previousRow < 0 || row > previousRow;
        if (!advanced || (previous != null && !generated.contains(previous))) {
            return;
        }
        trimHistory();
        replenish();
    }

    private void trimHistory() {
        int excess = playlist.currentRow() - history;
        if (excess > 0) {
            log.debug("Trimming {} played entries from playlist {}", excess, playlist.id());
            playlist.removeItemsWithoutUndo(0, excess);
        }
    }

    private void replenish() {
        generated.removeIf(ref -> !playlist.store().contains(ref));
        int upcoming = playlist.size() - 1 - playlist.currentRow();
        int missing = future - upcoming;
        if (missing > 0) {
            request(missing);
        }
    }

    private void request(int count) {
        if (requestPending) {
            return;
        }
        requestPending = true;
        PlaylistGenerator source = generator;
        long expectedSession = session;
        long expectedEpoch = playlist.epoch();
        log.debug("Asking generator '{}' for {} tracks", source.key(), count);
        tasks.submit("generate " + source.key(),
                () -> source.generate(count),
                entries -> onGenerated(source, expectedSession, expectedEpoch, entries),
                ex -> onFailed(source, expectedSession, expectedEpoch, ex));
    }

    private boolean isStale(long expectedSession, long expectedEpoch) {
        return expectedSession != session || expectedEpoch != playlist.epoch();
    }

    private void onGenerated(PlaylistGenerator source, long expectedSession, long expectedEpoch,
                             List<TrackEntry> entries) {
        if (isStale(expectedSession, expectedEpoch)) {
            log.debug("Dropping stale tracks from generator '{}'", source.key());
            return;
        }
        requestPending = false;
        if (entries == null || entries.isEmpty()) {
            log.info("Generator '{}' is exhausted", source.key());
            deactivate();
            return;
        }
        Range range = playlist.appendDynamicItems(entries);
        if (range.isEmpty()) {
            log.debug("All tracks from generator '{}' were vetoed", source.key());
            return;
        }
        for (int row = range.start(); row < range.end(); row++) {
            generated.add(playlist.store().refAt(row));
        }
        replenish();
    }

    private void onFailed(PlaylistGenerator source, long expectedSession, long expectedEpoch, RuntimeException ex) {
        if (isStale(expectedSession, expectedEpoch)) {
            return;
        }
        requestPending = false;
        log.warn("Generator '{}' failed", source.key(), ex);
        playlist.reportLoadError("Generator '" + source.key() + "' failed: " + ex.getMessage());
    }
}
