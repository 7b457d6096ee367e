package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;
import com.mixtape.playlist.core.model.TrackMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.function.IntSupplier;

/**
 * The order in which the entries of an {@link ItemStore} will be played.
 * <p>
 * Holds a permutation of the store indices ("virtual items"). The permutation is invalidated by every
 * structural mutation and by shuffle mode changes, and rebuilt lazily on the next read. Display filters are
 * applied while traversing and never change the permutation.
 */
public final class PlaybackOrder {

    private final ItemStore store;
    private final Random random;
    private final IntSupplier currentRow;

    private final List<Integer> virtualItems = new ArrayList<>();
    private boolean stale = true;

    private ShuffleMode shuffleMode = ShuffleMode.OFF;
    private RepeatMode repeatMode = RepeatMode.OFF;

    /**
     * @param store      the entries to order
     * @param random     source of randomness for shuffling
     * @param currentRow supplies the store index of the current item (-1 for none); a shuffled order starts with it
     */
    public PlaybackOrder(ItemStore store, Random random, IntSupplier currentRow) {
        this.store = store;
        this.random = random;
        this.currentRow = currentRow;
    }

    public ShuffleMode shuffleMode() {
        return shuffleMode;
    }

    public RepeatMode repeatMode() {
        return repeatMode;
    }

    /**
     * Changes the shuffle mode. Always regenerates the permutation, so re-selecting a shuffle mode reshuffles.
     */
    void setShuffleMode(ShuffleMode shuffleMode) {
        this.shuffleMode = shuffleMode;
        invalidate();
    }

    void setRepeatMode(RepeatMode repeatMode) {
        this.repeatMode = repeatMode;
    }

    void invalidate() {
        stale = true;
    }

    /**
     * Returns the store indices in play order.
     */
    public List<Integer> order() {
        ensureBuilt();
        return List.copyOf(virtualItems);
    }

    /**
     * Returns the position of a store index in play order, or -1 for {@code row == -1}.
     */
    public int virtualIndexOf(int row) {
        if (row < 0) {
            return -1;
        }
        store.checkIndex(row);
        ensureBuilt();
        return virtualItems.indexOf(row);
    }

    /**
     * Returns the store index to play after {@code row}, honouring repeat mode and the filter.
     *
     * @param row the current store index, or -1 to start from the beginning
     * @return the next store index, or -1 if there is none
     */
    public int next(int row, DisplayFilter filter) {
        int count = store.size();
        if (count == 0) {
            return -1;
        }
        ensureBuilt();
        int i = virtualIndexOf(row);
        if (repeatMode == RepeatMode.TRACK && row >= 0) {
            return row;
        }

        boolean albumOnly = repeatMode == RepeatMode.ALBUM && row >= 0;
        String album = albumOnly ? albumKey(row) : null;

        int next = albumOnly ? nextOnAlbum(i, album, filter) : nextVisible(i, filter);
        if (next >= count) {
            // Gone off the end
            if (repeatMode == RepeatMode.OFF) {
                return -1;
            }
            next = albumOnly ? nextOnAlbum(-1, album, filter) : nextVisible(-1, filter);
        }
        return next >= 0 && next < count ? virtualItems.get(next) : -1;
    }

    /**
     * Returns the store index played before {@code row}, honouring repeat mode and the filter.
     *
     * @param row the current store index, or -1 to start from the end
     * @return the previous store index, or -1 if there is none
     */
    public int previous(int row, DisplayFilter filter) {
        int count = store.size();
        if (count == 0) {
            return -1;
        }
        ensureBuilt();
        int i = row < 0 ? count : virtualIndexOf(row);
        if (repeatMode == RepeatMode.TRACK && row >= 0) {
            return row;
        }

        boolean albumOnly = repeatMode == RepeatMode.ALBUM && row >= 0;
        String album = albumOnly ? albumKey(row) : null;

        int previous = albumOnly ? previousOnAlbum(i, album, filter) : previousVisible(i, filter);
        if (previous < 0) {
            if (repeatMode == RepeatMode.OFF) {
                return -1;
            }
            previous = albumOnly ? previousOnAlbum(count, album, filter) : previousVisible(count, filter);
        }
        return previous >= 0 && previous < count ? virtualItems.get(previous) : -1;
    }

    private int nextVisible(int i, DisplayFilter filter) {
        int j = i + 1;
        while (j < virtualItems.size() && !filter.accepts(virtualItems.get(j))) {
            j++;
        }
        return j;
    }

    private int previousVisible(int i, DisplayFilter filter) {
        int j = i - 1;
        while (j >= 0 && !filter.accepts(virtualItems.get(j))) {
            j--;
        }
        return j;
    }

    private int nextOnAlbum(int i, String album, DisplayFilter filter) {
        for (int j = i + 1; j < virtualItems.size(); j++) {
            int row = virtualItems.get(j);
            if (album.equals(albumKey(row)) && filter.accepts(row)) {
                return j;
            }
        }
        return virtualItems.size();
    }

    private int previousOnAlbum(int i, String album, DisplayFilter filter) {
        for (int j = i - 1; j >= 0; j--) {
            int row = virtualItems.get(j);
            if (album.equals(albumKey(row)) && filter.accepts(row)) {
                return j;
            }
        }
        return -1;
    }

    private void ensureBuilt() {
        int size = store.size();
        if (!stale && virtualItems.size() == size) {
            return;
        }
        virtualItems.clear();
        for (int row = 0; row < size; row++) {
            virtualItems.add(row);
        }
        int current = currentRow.getAsInt();
        boolean hasCurrent = current >= 0 && current < size;

        switch (shuffleMode) {
            case OFF -> {
            }
            case ALL -> {
                Collections.shuffle(virtualItems, random);
                if (hasCurrent) {
                    // The current item goes first so that everything else still follows it
                    Collections.swap(virtualItems, 0, virtualItems.indexOf(current));
                }
            }
            case BY_ALBUM -> shuffleGroups(this::albumKey, hasCurrent ? current : -1);
            case BY_ARTIST -> shuffleGroups(this::artistKey, hasCurrent ? current : -1);
        }
        stale = false;
    }

    private void shuffleGroups(Function<Integer, String> keyOf, int current) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int row : virtualItems) {
            groups.computeIfAbsent(keyOf.apply(row), key -> new ArrayList<>()).add(row);
        }
        List<String> keys = new ArrayList<>(groups.keySet());
        Collections.shuffle(keys, random);
        if (current >= 0) {
            String currentKey = keyOf.apply(current);
            keys.remove(currentKey);
            keys.add(0, currentKey);
        }
        virtualItems.clear();
        for (String key : keys) {
            virtualItems.addAll(groups.get(key));
        }
    }

    private String albumKey(int row) {
        return store.get(row).getMetadata().albumKey();
    }

    private String artistKey(int row) {
        TrackMetadata metadata = store.get(row).getMetadata();
        return metadata.artist();
    }
}
