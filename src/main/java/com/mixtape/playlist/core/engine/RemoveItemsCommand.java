package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Removes one or more ranges of entries in a single undo step.
 * The removed entries are captured on apply and put back on revert.
 */
final class RemoveItemsCommand implements MutationCommand {

    private final Playlist playlist;
    // ascending, non-overlapping
    private final List<Range> ranges;
    private final List<List<TrackEntry>> removed = new ArrayList<>();

    RemoveItemsCommand(Playlist playlist, int position, int count) {
        this.playlist = playlist;
        this.ranges = List.of(new Range(position, count));
    }

    RemoveItemsCommand(Playlist playlist, Collection<Integer> rows) {
        this.playlist = playlist;
        this.ranges = toRanges(rows);
    }

    @Override
    public void apply() {
        removed.clear();
        // Back to front, so earlier ranges keep their positions
        for (int i = ranges.size() - 1; i >= 0; i--) {
            Range range = ranges.get(i);
            removed.add(0, playlist.applyRemove(range.start(), range.count()));
        }
    }

    @Override
    public void revert() {
        for (int i = 0; i < ranges.size(); i++) {
            playlist.applyInsert(removed.get(i), ranges.get(i).start(), false);
        }
    }

    @Override
    public String description() {
        int count = ranges.stream().mapToInt(Range::count).sum();
        return count == 1 ? "remove 1 track" : "remove " + count + " tracks";
    }

    List<TrackEntry> removedEntries() {
        List<TrackEntry> entries = new ArrayList<>();
        for (List<TrackEntry> range : removed) {
            entries.addAll(range);
        }
        return entries;
    }

    static List<Range> toRanges(Collection<Integer> rows) {
        List<Range> ranges = new ArrayList<>();
        int start = -1;
        int previous = -2;
        for (int row : new TreeSet<>(rows)) {
            if (row != previous + 1) {
                if (start >= 0) {
                    ranges.add(new Range(start, previous - start + 1));
                }
                start = row;
            }
            previous = row;
        }
        if (start >= 0) {
            ranges.add(new Range(start, previous - start + 1));
        }
        return List.copyOf(ranges);
    }
}
