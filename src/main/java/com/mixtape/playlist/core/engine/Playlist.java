package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.exception.OutOfRangeException;
import com.mixtape.playlist.core.model.ItemRef;
import com.mixtape.playlist.core.model.PlaylistSnapshot;
import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;
import com.mixtape.playlist.core.model.SortField;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A playlist: an ordered collection of track entries together with its playback order, undo history,
 * current-item pointers, queue, display filter and dynamic playlist state.
 * <p>
 * Not thread safe. All calls must come from one owner thread; slow work is handed to {@link BackgroundTasks}
 * and re-enters on the owner thread. Every structural mutation leaves the invariants restored before any
 * listener is notified.
 */
public class Playlist {

    private static final Logger log = LoggerFactory.getLogger(Playlist.class);

    private final String id;
    private final EngineSettings settings;
    private final Random random;
    private final ItemStore store = new ItemStore();
    private final PlaybackOrder order;
    private final MutationLog mutationLog;
    private final DynamicPlaylistController dynamic;

    private final Map<Long, PlaylistListener> listeners = new LinkedHashMap<>();
    private final Map<Long, InsertVetoListener> vetoListeners = new LinkedHashMap<>();
    private long nextHandle = 1;

    private PlaybackQueue queue = new IndexQueue();
    private DisplayFilter filter = DisplayFilter.ACCEPT_ALL;

    private ItemRef currentRef;
    private ItemRef lastPlayedRef;
    private ItemRef stopAfterRef;

    private ShuffleMode shuffleMode = ShuffleMode.OFF;
    private RepeatMode repeatMode = RepeatMode.OFF;

    // Bumped by clear(); background results carrying an older epoch are discarded
    private long epoch;

    public Playlist(String id, EngineSettings settings, BackgroundTasks tasks) {
        this(id, settings, tasks, new Random());
    }

    public Playlist(String id, EngineSettings settings, BackgroundTasks tasks, Random random) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.order = new PlaybackOrder(store, random, this::currentRow);
        this.mutationLog = new MutationLog(settings.undoLimit());
        this.dynamic = new DynamicPlaylistController(this, tasks, settings.dynamicHistory(), settings.dynamicFuture());
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String id() {
        return id;
    }

    public ItemStore store() {
        return store;
    }

    public PlaybackOrder playbackOrder() {
        return order;
    }

    public MutationLog mutationLog() {
        return mutationLog;
    }

    public DynamicPlaylistController dynamicController() {
        return dynamic;
    }

    public int size() {
        return store.size();
    }

    public TrackEntry item(int row) {
        return store.get(row);
    }

    public List<TrackEntry> items() {
        return store.entries();
    }

    public long epoch() {
        return epoch;
    }

    public long totalLengthSeconds() {
        return store.totalLengthSeconds();
    }

    public List<TrackEntry> libraryItemsById(long libraryId) {
        List<TrackEntry> entries = new ArrayList<>();
        for (int row : store.indicesForLibraryId(libraryId)) {
            entries.add(store.get(row));
        }
        return entries;
    }

    public PlaybackQueue queue() {
        return queue;
    }

    public void setQueue(PlaybackQueue queue) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
    }

    /**
     * Queues rows to be played ahead of the playback order.
     */
    public void enqueue(List<Integer> rows) {
        for (int row : rows) {
            store.checkIndex(row);
        }
        queue.enqueue(rows);
    }

    public DisplayFilter displayFilter() {
        return filter;
    }

    public void setDisplayFilter(DisplayFilter filter) {
        this.filter = filter == null ? DisplayFilter.ACCEPT_ALL : filter;
    }

    /**
     * Shows only entries matching the text; a blank text removes the filter.
     */
    public void setFilterText(String text) {
        if (text == null || text.isBlank()) {
            setDisplayFilter(DisplayFilter.ACCEPT_ALL);
        } else {
            setDisplayFilter(new MetadataFilter(store, text.trim()));
        }
    }

    public boolean isVisible(int row) {
        return store.hasItemAt(row) && filter.accepts(row);
    }

    // ========================================================================
    // Pointers
    // ========================================================================

    public int currentRow() {
        return store.indexOf(currentRef);
    }

    public int lastPlayedRow() {
        return store.indexOf(lastPlayedRef);
    }

    public int stopAfterRow() {
        return store.indexOf(stopAfterRef);
    }

    public boolean stopAfterCurrent() {
        return stopAfterRef != null && stopAfterRef.equals(currentRef);
    }

    public Optional<TrackEntry> currentItem() {
        int row = currentRow();
        return row < 0 ? Optional.empty() : Optional.of(store.get(row));
    }

    public TrackMetadata currentItemMetadata() {
        return currentItem().map(TrackEntry::getMetadata).orElse(null);
    }

    /**
     * Makes {@code row} the current item, or clears the current item for -1.
     * Any streamed metadata of the previous current item is dropped.
     */
    public void setCurrentRow(int row) {
        if (row != -1) {
            store.checkIndex(row);
        }
        ItemRef previousRef = currentRef;
        int previousRow = currentRow();
        TrackMetadata previous = currentItemMetadata();

        if (previousRow >= 0 && store.get(previousRow).hasTemporaryMetadata()) {
            store.update(previousRow, TrackEntry::withoutTemporaryMetadata);
            fire(l -> l.dataChanged(previousRow));
        }

        currentRef = row >= 0 ? store.refAt(row) : null;
        if (currentRef != null) {
            lastPlayedRef = currentRef;
        }

        TrackMetadata current = currentItemMetadata();
        fire(l -> l.currentItemChanged(previous, current));
        dynamic.currentItemChanged(previousRef, previousRow, row);
    }

    /**
     * Toggles the stop-after marker on {@code row}; -1 clears it.
     */
    public void setStopAfter(int row) {
        int previous = stopAfterRow();
        if (row == -1) {
            stopAfterRef = null;
        } else {
            ItemRef ref = store.refAt(row);
            stopAfterRef = ref.equals(stopAfterRef) ? null : ref;
        }
        if (previous >= 0) {
            fire(l -> l.dataChanged(previous));
        }
        if (row >= 0 && row != previous) {
            fire(l -> l.dataChanged(row));
        }
    }

    // ========================================================================
    // Traversal
    // ========================================================================

    /**
     * The row that will be played after the current one. Queued rows take priority.
     *
     * @return the row, or -1 if playback would stop
     */
    public int nextRow() {
        if (!queue.isEmpty()) {
            return queue.peekNext();
        }
        return order.next(currentRow(), filter);
    }

    public int previousRow() {
        return order.previous(currentRow(), filter);
    }

    /**
     * The row played after {@code row} according to the playback order, ignoring the queue.
     */
    public int nextRow(int row) {
        return order.next(row, filter);
    }

    public int previousRow(int row) {
        return order.previous(row, filter);
    }

    /**
     * Moves on to the next track: the head of the queue if there is one, otherwise the next row in playback
     * order. Honours the stop-after marker.
     *
     * @return the new current row, or -1 if playback stops
     */
    public int playNext() {
        if (stopAfterCurrent()) {
            stopAfterRef = null;
            setCurrentRow(-1);
            return -1;
        }
        int next = queue.isEmpty() ? order.next(currentRow(), filter) : queue.takeNext();
        if (!store.hasItemAt(next)) {
            next = -1;
        }
        setCurrentRow(next);
        // A dynamic playlist may have trimmed its history, so the row is read back from the pointer
        return currentRow();
    }

    /**
     * Goes back to the previous track, if there is one.
     *
     * @return the new current row, or -1 if there was nothing to go back to
     */
    public int playPrevious() {
        int previous = previousRow();
        if (previous >= 0) {
            setCurrentRow(previous);
        }
        return previous;
    }

    // ========================================================================
    // Modes
    // ========================================================================

    public ShuffleMode shuffleMode() {
        return shuffleMode;
    }

    public RepeatMode repeatMode() {
        return repeatMode;
    }

    /**
     * Changes the shuffle mode and regenerates the playback order. Ignored for traversal while the playlist
     * is dynamic; the mode then takes effect once the dynamic playlist is turned off.
     */
    public void setShuffleMode(ShuffleMode mode) {
        shuffleMode = Objects.requireNonNull(mode, "mode must not be null");
        if (dynamic.isActive()) {
            log.debug("Playlist {} is dynamic, shuffle mode {} deferred", id, mode);
            return;
        }
        order.setShuffleMode(mode);
    }

    public void setRepeatMode(RepeatMode mode) {
        repeatMode = Objects.requireNonNull(mode, "mode must not be null");
        order.setRepeatMode(dynamic.isActive() ? RepeatMode.OFF : mode);
    }

    private void applyEffectiveModes() {
        boolean dynamicActive = dynamic.isActive();
        order.setShuffleMode(dynamicActive ? ShuffleMode.OFF : shuffleMode);
        order.setRepeatMode(dynamicActive ? RepeatMode.OFF : repeatMode);
    }

    // ========================================================================
    // Listeners
    // ========================================================================

    public ListenerHandle addListener(PlaylistListener listener) {
        ListenerHandle handle = new ListenerHandle(nextHandle++);
        listeners.put(handle.id(), Objects.requireNonNull(listener, "listener must not be null"));
        return handle;
    }

    /**
     * @return false if the handle was not (or no longer) registered
     */
    public boolean removeListener(ListenerHandle handle) {
        return handle != null && listeners.remove(handle.id()) != null;
    }

    public ListenerHandle addVetoListener(InsertVetoListener listener) {
        ListenerHandle handle = new ListenerHandle(nextHandle++);
        vetoListeners.put(handle.id(), Objects.requireNonNull(listener, "listener must not be null"));
        return handle;
    }

    public boolean removeVetoListener(ListenerHandle handle) {
        return handle != null && vetoListeners.remove(handle.id()) != null;
    }

    public void reportLoadError(String message) {
        log.warn("Playlist {}: {}", id, message);
        fire(l -> l.loadError(message));
    }

    // ========================================================================
    // Undoable changes
    // ========================================================================

    public Range insertItems(List<TrackEntry> entries) {
        return insertItems(entries, -1, false, false);
    }

    /**
     * Inserts entries as one undoable step after the veto listeners had their say.
     *
     * @param position where to insert; negative appends
     * @param playNow  make the first inserted entry current and request playback
     * @param enqueue  append the inserted rows to the queue
     * @return the rows actually inserted
     */
    public Range insertItems(List<TrackEntry> entries, int position, boolean playNow, boolean enqueue) {
        return insert(exerciseVetoes(entries), position, playNow, enqueue);
    }

    /**
     * Inserts the output of a one-shot generator as one undoable step. Veto listeners are consulted only if
     * the engine is configured to veto generator output.
     */
    public Range insertGeneratedItems(List<TrackEntry> entries, int position, boolean playNow, boolean enqueue) {
        List<TrackEntry> accepted = settings.vetoGeneratorOutput() ? exerciseVetoes(entries) : List.copyOf(entries);
        return insert(accepted, position, playNow, enqueue);
    }

    private Range insert(List<TrackEntry> accepted, int position, boolean playNow, boolean enqueue) {
        if (accepted.isEmpty()) {
            return new Range(store.clampInsertPosition(position), 0);
        }
        InsertItemsCommand command = new InsertItemsCommand(this, accepted, position, enqueue);
        mutationLog.execute(command);
        ItemRef first = store.refAt(command.position());
        if (playNow) {
            setCurrentRow(command.position());
            int row = currentRow();
            fire(l -> l.playRequested(row));
        }
        return new Range(store.indexOf(first), accepted.size());
    }

    /**
     * Removes {@code count} entries starting at {@code position} as one undoable step.
     *
     * @return the removed entries
     * @throws OutOfRangeException if the range is not fully contained in the playlist
     */
    public List<TrackEntry> removeItems(int position, int count) {
        RemoveItemsCommand command = new RemoveItemsCommand(this, position, count);
        mutationLog.execute(command);
        return command.removedEntries();
    }

    /**
     * Removes the given rows, which need not be contiguous, as one undoable step.
     */
    public List<TrackEntry> removeRows(Collection<Integer> rows) {
        for (int row : rows) {
            store.checkIndex(row);
        }
        if (rows.isEmpty()) {
            return List.of();
        }
        RemoveItemsCommand command = new RemoveItemsCommand(this, rows);
        mutationLog.execute(command);
        return command.removedEntries();
    }

    /**
     * Moves the entries at {@code sources} so that they start at {@code destination} in the resulting order.
     *
     * @return the row the moved block now starts at
     */
    public int moveItems(Collection<Integer> sources, int destination) {
        for (int source : sources) {
            store.checkIndex(source);
        }
        MoveItemsCommand command = new MoveItemsCommand(this, sources, destination);
        mutationLog.execute(command);
        return command.start();
    }

    /**
     * Moves the contiguous block starting at {@code start} to the given ascending destinations.
     */
    public void moveItemsTo(int start, List<Integer> destinations) {
        mutationLog.execute(new MoveBlockCommand(this, start, destinations));
    }

    public void sort(SortField field, boolean ascending) {
        Comparator<Integer> comparator = Comparator.comparing(row -> store.get(row).getMetadata(), field.comparator());
        if (!ascending) {
            comparator = comparator.reversed();
        }
        List<Integer> rows = identity(store.size());
        rows.sort(comparator);
        mutationLog.execute(new ReorderItemsCommand(this, toArray(rows),
                "sort by " + field.name().toLowerCase(Locale.ROOT)));
    }

    /**
     * Shuffles the display order as one undoable step. In a dynamic playlist only the entries after the
     * current one are shuffled.
     */
    public void shuffle() {
        List<Integer> rows = identity(store.size());
        int begin = dynamic.isActive() ? currentRow() + 1 : 0;
        Collections.shuffle(rows.subList(begin, rows.size()), random);
        mutationLog.execute(new ReorderItemsCommand(this, toArray(rows), "shuffle playlist"));
    }

    public boolean undo() {
        return mutationLog.undo();
    }

    public boolean redo() {
        return mutationLog.redo();
    }

    // ========================================================================
    // Changes without undo
    // ========================================================================

    /**
     * Removes rows without recording an undo step. Clears the undo history.
     */
    public List<TrackEntry> removeItemsWithoutUndo(Collection<Integer> rows) {
        for (int row : rows) {
            store.checkIndex(row);
        }
        if (rows.isEmpty()) {
            return List.of();
        }
        mutationLog.clear();
        List<Range> ranges = RemoveItemsCommand.toRanges(rows);
        List<TrackEntry> removed = new ArrayList<>();
        for (int i = ranges.size() - 1; i >= 0; i--) {
            removed.addAll(0, applyRemove(ranges.get(i).start(), ranges.get(i).count()));
        }
        return removed;
    }

    public List<TrackEntry> removeItemsWithoutUndo(int position, int count) {
        mutationLog.clear();
        return applyRemove(position, count);
    }

    /**
     * Drops every entry that is not queued. Not undoable.
     */
    public List<TrackEntry> removeItemsNotInQueue() {
        List<Integer> rows = new ArrayList<>();
        for (int row = 0; row < store.size(); row++) {
            if (!queue.contains(row)) {
                rows.add(row);
            }
        }
        return removeItemsWithoutUndo(rows);
    }

    /**
     * Appends generator output for the dynamic playlist. Not undoable.
     */
    Range appendDynamicItems(List<TrackEntry> entries) {
        List<TrackEntry> accepted = settings.vetoGeneratorOutput() ? exerciseVetoes(entries) : List.copyOf(entries);
        if (accepted.isEmpty()) {
            return new Range(store.size(), 0);
        }
        mutationLog.clear();
        return applyInsert(accepted, -1, false);
    }

    /**
     * Removes everything, turns off the dynamic playlist and discards pending background results.
     */
    public void clear() {
        TrackMetadata previous = currentItemMetadata();
        int count = store.size();
        epoch++;
        dynamic.deactivate();
        mutationLog.clear();
        store.clear();
        order.invalidate();
        queue.clear();
        currentRef = null;
        lastPlayedRef = null;
        stopAfterRef = null;
        fire(l -> l.structureChanged(new StructureChange(StructureChange.Kind.CLEARED, 0, count)));
        if (previous != null) {
            fire(l -> l.currentItemChanged(previous, null));
        }
    }

    // ========================================================================
    // In-place updates
    // ========================================================================

    /**
     * Replaces the entry at {@code row} with the mutator's result without renumbering.
     */
    public TrackEntry updateEntry(int row, UnaryOperator<TrackEntry> mutator) {
        TrackEntry updated = store.update(row, mutator);
        fire(l -> l.dataChanged(row));
        return updated;
    }

    public void rateItem(int row, float rating) {
        if (rating < 0f || rating > 1f) {
            throw new IllegalArgumentException("Rating must be between 0 and 1");
        }
        updateEntry(row, entry -> entry.withRating(rating));
    }

    /**
     * Overrides the metadata of the current item with what a stream reported, if the current item is the
     * stream at {@code url}.
     */
    public void setStreamMetadata(String url, TrackMetadata metadata) {
        int row = currentRow();
        if (row < 0) {
            return;
        }
        TrackEntry current = store.get(row);
        if (!Objects.equals(current.getStaticMetadata().url(), url)) {
            return;
        }
        TrackMetadata previous = current.getMetadata();
        store.update(row, entry -> entry.withTemporaryMetadata(metadata));
        fire(l -> l.dataChanged(row));
        fire(l -> l.currentItemChanged(previous, metadata));
    }

    public void clearStreamMetadata() {
        int row = currentRow();
        if (row < 0 || !store.get(row).hasTemporaryMetadata()) {
            return;
        }
        store.update(row, TrackEntry::withoutTemporaryMetadata);
        fire(l -> l.dataChanged(row));
    }

    /**
     * Marks the current item valid or invalid (greyed out) if it is the track at {@code url}.
     *
     * @return whether this playlist had a current item
     */
    public boolean applyValidityOnCurrentItem(String url, boolean valid) {
        int row = currentRow();
        if (row < 0) {
            return false;
        }
        TrackEntry current = store.get(row);
        if (Objects.equals(current.getStaticMetadata().url(), url) && current.isValid() != valid) {
            updateEntry(row, entry -> entry.withValid(valid));
        }
        return true;
    }

    /**
     * Greys out entries that are no longer available and restores those that came back.
     *
     * @return the number of entries whose validity changed
     */
    public int invalidateDeletedItems(Predicate<TrackEntry> available) {
        int changed = 0;
        for (int row = 0; row < store.size(); row++) {
            TrackEntry entry = store.get(row);
            boolean valid = available.test(entry);
            if (valid != entry.isValid()) {
                updateEntry(row, e -> e.withValid(valid));
                changed++;
            }
        }
        return changed;
    }

    /**
     * Refreshes every entry backed by one of the given library records.
     */
    public void libraryItemsChanged(List<TrackEntry> records) {
        for (TrackEntry record : records) {
            if (record.getLibraryId() == null) {
                continue;
            }
            for (int row : store.indicesForLibraryId(record.getLibraryId())) {
                updateEntry(row, entry -> entry.withMetadata(record.getStaticMetadata()));
            }
        }
    }

    /**
     * Applies freshly reloaded metadata to the slot behind {@code ref}.
     *
     * @return false if the slot no longer exists
     */
    public boolean applyReloadedMetadata(ItemRef ref, TrackMetadata metadata) {
        int row = store.indexOf(ref);
        if (row < 0) {
            return false;
        }
        updateEntry(row, entry -> entry.withMetadata(metadata).withValid(true));
        return true;
    }

    // ========================================================================
    // Dynamic playlist
    // ========================================================================

    public boolean isDynamic() {
        return dynamic.isActive();
    }

    public Optional<PlaylistGenerator> dynamicGenerator() {
        return dynamic.generator();
    }

    public void turnOnDynamicPlaylist(PlaylistGenerator generator) {
        dynamic.activate(generator);
    }

    public void turnOffDynamicPlaylist() {
        dynamic.deactivate();
    }

    public void repopulateDynamicPlaylist() {
        dynamic.repopulate();
    }

    void dynamicModeChanged(boolean active) {
        applyEffectiveModes();
        fire(l -> l.dynamicModeChanged(active));
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public PlaylistSnapshot snapshot() {
        return new PlaylistSnapshot(id, store.entries(), currentRow(), lastPlayedRow(), stopAfterRow(),
                repeatMode, shuffleMode, dynamic.generator().map(PlaylistGenerator::key).orElse(null));
    }

    /**
     * Replaces the contents with a snapshot. Not undoable.
     *
     * @param generator the generator named by the snapshot, or null to restore it as a static playlist
     */
    public void restore(PlaylistSnapshot snapshot, PlaylistGenerator generator) {
        clear();
        shuffleMode = snapshot.shuffleMode();
        repeatMode = snapshot.repeatMode();
        Range range = store.insert(0, snapshot.entries());
        currentRef = store.hasItemAt(snapshot.currentRow()) ? store.refAt(snapshot.currentRow()) : null;
        lastPlayedRef = store.hasItemAt(snapshot.lastPlayedRow()) ? store.refAt(snapshot.lastPlayedRow()) : null;
        stopAfterRef = store.hasItemAt(snapshot.stopAfterRow()) ? store.refAt(snapshot.stopAfterRow()) : null;
        applyEffectiveModes();
        if (generator != null) {
            dynamic.resume(generator);
        }
        log.info("Restored playlist {} with {} items", id, range.count());
        fire(l -> l.structureChanged(new StructureChange(StructureChange.Kind.INSERTED, 0, range.count())));
        TrackMetadata current = currentItemMetadata();
        if (current != null) {
            fire(l -> l.currentItemChanged(null, current));
        }
    }

    // ========================================================================
    // Primitives used by the mutation commands. They never touch the log.
    // ========================================================================

    Range applyInsert(List<TrackEntry> entries, int position, boolean enqueue) {
        Mutation mutation = beginMutation();
        Range range = store.insert(position, entries);
        reconcile(mutation);
        if (enqueue && !range.isEmpty()) {
            List<Integer> rows = new ArrayList<>(range.count());
            for (int row = range.start(); row < range.end(); row++) {
                rows.add(row);
            }
            queue.enqueue(rows);
        }
        publish(mutation, new StructureChange(StructureChange.Kind.INSERTED, range.start(), range.count()));
        return range;
    }

    List<TrackEntry> applyRemove(int position, int count) {
        Mutation mutation = beginMutation();
        List<TrackEntry> removed = store.remove(position, count);
        reconcile(mutation);
        publish(mutation, new StructureChange(StructureChange.Kind.REMOVED, position, count));
        return removed;
    }

    int applyMove(List<Integer> sources, int destination) {
        Mutation mutation = beginMutation();
        int start = store.move(sources, destination);
        reconcile(mutation);
        int first = sources.isEmpty() ? start : Math.min(start, Collections.min(sources));
        publish(mutation, new StructureChange(StructureChange.Kind.MOVED, first, sources.size()));
        return start;
    }

    void applyMoveBlock(int start, List<Integer> destinations) {
        Mutation mutation = beginMutation();
        store.moveBlock(start, destinations);
        reconcile(mutation);
        int first = destinations.isEmpty() ? start : Math.min(start, Collections.min(destinations));
        publish(mutation, new StructureChange(StructureChange.Kind.MOVED, first, destinations.size()));
    }

    void applyReorder(int[] permutation) {
        Mutation mutation = beginMutation();
        store.reorder(permutation);
        reconcile(mutation);
        publish(mutation, new StructureChange(StructureChange.Kind.REORDERED, 0, permutation.length));
    }

    private static final class Mutation {
        private final List<ItemRef> refsBefore;
        private final TrackMetadata currentBefore;
        private boolean currentLost;

        private Mutation(List<ItemRef> refsBefore, TrackMetadata currentBefore) {
            this.refsBefore = refsBefore;
            this.currentBefore = currentBefore;
        }
    }

    private Mutation beginMutation() {
        // Old positions are only needed to renumber a non-empty queue
        List<ItemRef> refsBefore = queue.isEmpty() ? List.of() : store.refs();
        return new Mutation(refsBefore, currentItemMetadata());
    }

    private void reconcile(Mutation mutation) {
        order.invalidate();
        if (currentRef != null && !store.contains(currentRef)) {
            currentRef = null;
            mutation.currentLost = true;
        }
        if (lastPlayedRef != null && !store.contains(lastPlayedRef)) {
            lastPlayedRef = null;
        }
        if (stopAfterRef != null && !store.contains(stopAfterRef)) {
            stopAfterRef = null;
        }
        if (!mutation.refsBefore.isEmpty()) {
            List<ItemRef> before = mutation.refsBefore;
            queue.remap(row -> row >= 0 && row < before.size() ? store.indexOf(before.get(row)) : -1);
        }
    }

    private void publish(Mutation mutation, StructureChange change) {
        fire(l -> l.structureChanged(change));
        if (mutation.currentLost) {
            TrackMetadata previous = mutation.currentBefore;
            fire(l -> l.currentItemChanged(previous, null));
        }
    }

    // ========================================================================

    private List<TrackEntry> exerciseVetoes(List<TrackEntry> entries) {
        List<TrackEntry> candidates = List.copyOf(entries);
        if (vetoListeners.isEmpty() || candidates.isEmpty()) {
            return candidates;
        }
        List<TrackEntry> existing = store.entries();
        Set<TrackEntry> vetoed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (InsertVetoListener listener : List.copyOf(vetoListeners.values())) {
            List<TrackEntry> invalid = listener.aboutToInsert(existing, candidates);
            if (invalid != null) {
                vetoed.addAll(invalid);
            }
        }
        if (vetoed.isEmpty()) {
            return candidates;
        }
        List<TrackEntry> accepted = new ArrayList<>(candidates.size());
        for (TrackEntry candidate : candidates) {
            if (!vetoed.contains(candidate)) {
                accepted.add(candidate);
            }
        }
        log.debug("Playlist {}: {} of {} tracks vetoed", id, candidates.size() - accepted.size(), candidates.size());
        return accepted;
    }

    private void fire(Consumer<PlaylistListener> event) {
        for (PlaylistListener listener : List.copyOf(listeners.values())) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("Listener of playlist {} failed", id, ex);
            }
        }
    }

    private static List<Integer> identity(int size) {
        List<Integer> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rows.add(i);
        }
        return rows;
    }

    private static int[] toArray(List<Integer> rows) {
        int[] array = new int[rows.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = rows.get(i);
        }
        return array;
    }
}
