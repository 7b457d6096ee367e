package com.mixtape.playlist.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * In-memory {@link PlaybackQueue}. A row is queued at most once.
 */
public final class IndexQueue implements PlaybackQueue {

    private final List<Integer> rows = new ArrayList<>();

    @Override
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public int peekNext() {
        return rows.isEmpty() ? -1 : rows.get(0);
    }

    @Override
    public int takeNext() {
        return rows.isEmpty() ? -1 : rows.remove(0);
    }

    @Override
    public boolean contains(int row) {
        return rows.contains(row);
    }

    @Override
    public void enqueue(List<Integer> newRows) {
        for (Integer row : newRows) {
            if (!rows.contains(row)) {
                rows.add(row);
            }
        }
    }

    @Override
    public void remap(IntUnaryOperator oldToNew) {
        List<Integer> remapped = new ArrayList<>(rows.size());
        for (int row : rows) {
            int mapped = oldToNew.applyAsInt(row);
            if (mapped >= 0) {
                remapped.add(mapped);
            }
        }
        rows.clear();
        rows.addAll(remapped);
    }

    @Override
    public void clear() {
        rows.clear();
    }

    @Override
    public List<Integer> rows() {
        return List.copyOf(rows);
    }
}
