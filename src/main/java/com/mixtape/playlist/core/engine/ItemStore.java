package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.exception.OutOfRangeException;
import com.mixtape.playlist.core.model.ItemRef;
import com.mixtape.playlist.core.model.TrackEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Ordered sequence of track entries, the unit of truth for what is in a playlist and in which display order.
 * <p>
 * Every slot carries a stable key ({@link ItemRef}) that follows the entry through moves and reorders.
 * Store indices are only valid until the next structural mutation.
 * <p>
 * Reading is public. Mutating is package-private and reserved to {@link Playlist}, which restores the
 * dependent invariants (pointers, playback order, queue) and emits notifications afterwards.
 */
public final class ItemStore {

    private final List<Slot> slots = new ArrayList<>();
    // library id -> keys of the slots referencing it
    private final Map<Long, Set<Long>> libraryIndex = new HashMap<>();
    private final Map<Long, Integer> positions = new HashMap<>();
    private boolean positionsStale;
    private long nextKey = 1;

    private static final class Slot {
        private final long key;
        private TrackEntry entry;

        private Slot(long key, TrackEntry entry) {
            this.key = key;
            this.entry = entry;
        }
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public TrackEntry get(int position) {
        checkIndex(position);
        return slots.get(position).entry;
    }

    public boolean hasItemAt(int position) {
        return position >= 0 && position < slots.size();
    }

    /**
     * Returns a copy of all entries in display order.
     */
    public List<TrackEntry> entries() {
        List<TrackEntry> entries = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            entries.add(slot.entry);
        }
        return Collections.unmodifiableList(entries);
    }

    public ItemRef refAt(int position) {
        checkIndex(position);
        return new ItemRef(slots.get(position).key);
    }

    /**
     * Returns the stable references of all slots in display order.
     */
    public List<ItemRef> refs() {
        List<ItemRef> refs = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            refs.add(new ItemRef(slot.key));
        }
        return refs;
    }

    /**
     * Resolves a stable reference to its current store index.
     *
     * @return the index, or -1 if the reference is null or its slot was removed
     */
    public int indexOf(ItemRef ref) {
        if (ref == null) {
            return -1;
        }
        if (positionsStale) {
            positions.clear();
            for (int i = 0; i < slots.size(); i++) {
                positions.put(slots.get(i).key, i);
            }
            positionsStale = false;
        }
        Integer position = positions.get(ref.key());
        return position == null ? -1 : position;
    }

    public boolean contains(ItemRef ref) {
        return indexOf(ref) != -1;
    }

    /**
     * Returns the store indices of all entries referencing the given library record, ascending.
     */
    public List<Integer> indicesForLibraryId(long libraryId) {
        Set<Long> keys = libraryIndex.get(libraryId);
        if (keys == null) {
            return List.of();
        }
        TreeSet<Integer> indices = new TreeSet<>();
        for (Long key : keys) {
            indices.add(indexOf(new ItemRef(key)));
        }
        return List.copyOf(indices);
    }

    /**
     * Snapshot of the reverse library index as library id to ascending store indices.
     */
    public Map<Long, List<Integer>> libraryIndex() {
        Map<Long, List<Integer>> snapshot = new TreeMap<>();
        for (Long libraryId : libraryIndex.keySet()) {
            snapshot.put(libraryId, indicesForLibraryId(libraryId));
        }
        return snapshot;
    }

    public long totalLengthSeconds() {
        long total = 0;
        for (Slot slot : slots) {
            total += Math.max(0, slot.entry.getMetadata().lengthSeconds());
        }
        return total;
    }

    // ------------------------------------------------------------------------
    // Mutations, reserved to Playlist
    // ------------------------------------------------------------------------

    /**
     * Inserts entries at the given position, clamped to [0, size]. A negative position appends.
     */
    Range insert(int position, List<TrackEntry> entries) {
        int start = clampInsertPosition(position);
        if (entries.isEmpty()) {
            return new Range(start, 0);
        }
        List<Slot> added = new ArrayList<>(entries.size());
        for (TrackEntry entry : entries) {
            Slot slot = new Slot(nextKey++, Objects.requireNonNull(entry, "entry must not be null"));
            added.add(slot);
            indexLibraryReference(slot);
        }
        slots.addAll(start, added);
        positionsStale = true;
        return new Range(start, added.size());
    }

    /**
     * Removes {@code count} entries starting at {@code position}.
     *
     * @return the removed entries in their former order
     * @throws OutOfRangeException if the range is not fully contained in the store
     */
    List<TrackEntry> remove(int position, int count) {
        checkRemoveRange(position, count);
        List<Slot> range = slots.subList(position, position + count);
        List<TrackEntry> removed = new ArrayList<>(count);
        for (Slot slot : range) {
            removed.add(slot.entry);
            unindexLibraryReference(slot);
        }
        range.clear();
        positionsStale = true;
        return removed;
    }

    /**
     * Relocates the entries at {@code sources} so that they begin at {@code destination} in the resulting
     * order, keeping their relative order. A negative destination moves them to the end.
     *
     * @return the index at which the moved block now starts
     */
    int move(Collection<Integer> sources, int destination) {
        TreeSet<Integer> sorted = new TreeSet<>(sources);
        for (int source : sorted) {
            checkIndex(source);
        }
        if (sorted.isEmpty()) {
            return destination < 0 ? slots.size() : Math.min(destination, slots.size());
        }
        List<Slot> moved = new ArrayList<>(sorted.size());
        for (int source : sorted) {
            moved.add(slots.get(source));
        }
        for (int source : sorted.descendingSet()) {
            slots.remove(source);
        }
        int start = destination < 0 ? slots.size() : Math.min(destination, slots.size());
        slots.addAll(start, moved);
        positionsStale = true;
        return start;
    }

    /**
     * Takes the contiguous block starting at {@code start} and places its entries, in order, at the given
     * ascending destinations. Inverse of {@link #move(Collection, int)}.
     */
    void moveBlock(int start, List<Integer> destinations) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(destinations));
        if (sorted.size() != destinations.size()) {
            throw new IllegalArgumentException("Destinations must be distinct: " + destinations);
        }
        if (sorted.isEmpty()) {
            return;
        }
        if (start < 0 || start + sorted.size() > slots.size()) {
            throw OutOfRangeException.forRange(start, sorted.size(), slots.size());
        }
        for (int destination : sorted) {
            checkIndex(destination);
        }
        List<Slot> block = new ArrayList<>(slots.subList(start, start + sorted.size()));
        slots.subList(start, start + sorted.size()).clear();
        for (int i = 0; i < sorted.size(); i++) {
            slots.add(sorted.get(i), block.get(i));
        }
        positionsStale = true;
    }

    /**
     * Rearranges the store so that new position {@code i} holds the entry previously at {@code order[i]}.
     */
    void reorder(int[] order) {
        if (order.length != slots.size()) {
            throw new IllegalArgumentException("Permutation has " + order.length + " elements, store has " + slots.size());
        }
        boolean[] seen = new boolean[order.length];
        List<Slot> reordered = new ArrayList<>(order.length);
        for (int source : order) {
            checkIndex(source);
            if (seen[source]) {
                throw new IllegalArgumentException("Not a permutation, index " + source + " appears twice");
            }
            seen[source] = true;
            reordered.add(slots.get(source));
        }
        slots.clear();
        slots.addAll(reordered);
        positionsStale = true;
    }

    /**
     * Replaces the entry at {@code position} with the mutator's result, without renumbering.
     *
     * @return the new entry
     */
    TrackEntry update(int position, UnaryOperator<TrackEntry> mutator) {
        checkIndex(position);
        Slot slot = slots.get(position);
        TrackEntry updated = Objects.requireNonNull(mutator.apply(slot.entry), "mutator must not return null");
        if (!Objects.equals(slot.entry.getLibraryId(), updated.getLibraryId())) {
            unindexLibraryReference(slot);
            slot.entry = updated;
            indexLibraryReference(slot);
        } else {
            slot.entry = updated;
        }
        return updated;
    }

    List<TrackEntry> clear() {
        List<TrackEntry> removed = entries();
        slots.clear();
        libraryIndex.clear();
        positionsStale = true;
        return removed;
    }

    // ------------------------------------------------------------------------

    int clampInsertPosition(int position) {
        if (position < 0 || position > slots.size()) {
            return slots.size();
        }
        return position;
    }

    void checkIndex(int position) {
        if (position < 0 || position >= slots.size()) {
            throw OutOfRangeException.forIndex(position, slots.size());
        }
    }

    private void checkRemoveRange(int position, int count) {
        if (count < 0 || position < 0 || position >= slots.size() || count > slots.size() - position) {
            throw OutOfRangeException.forRange(position, count, slots.size());
        }
    }

    private void indexLibraryReference(Slot slot) {
        Long libraryId = slot.entry.getLibraryId();
        if (libraryId != null) {
            libraryIndex.computeIfAbsent(libraryId, id -> new LinkedHashSet<>()).add(slot.key);
        }
    }

    private void unindexLibraryReference(Slot slot) {
        Long libraryId = slot.entry.getLibraryId();
        if (libraryId == null) {
            return;
        }
        Set<Long> keys = libraryIndex.get(libraryId);
        if (keys != null) {
            keys.remove(slot.key);
            if (keys.isEmpty()) {
                libraryIndex.remove(libraryId);
            }
        }
    }
}
