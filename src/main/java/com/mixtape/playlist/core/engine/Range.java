package com.mixtape.playlist.core.engine;

/**
 * A contiguous span of store indices.
 */
public record Range(int start, int count) {

    public int end() {
        return start + count;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
