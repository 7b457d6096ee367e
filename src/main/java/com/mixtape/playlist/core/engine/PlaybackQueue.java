package com.mixtape.playlist.core.engine;

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Externally owned list of store indices to play next, ahead of the playback order.
 * The playlist remaps it after every structural mutation.
 */
public interface PlaybackQueue {

    boolean isEmpty();

    /**
     * @return the row that would be played next, or -1 if the queue is empty
     */
    int peekNext();

    /**
     * Removes and returns the head of the queue, or -1 if the queue is empty.
     */
    int takeNext();

    boolean contains(int row);

    void enqueue(List<Integer> rows);

    /**
     * Renumbers all queued rows; rows mapped to -1 no longer exist and are dropped.
     */
    void remap(IntUnaryOperator oldToNew);

    void clear();

    List<Integer> rows();
}
