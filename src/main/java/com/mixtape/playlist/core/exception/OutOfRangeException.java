package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when a position or count lies outside the current bounds of a playlist.
 * Always a caller bug; never retried.
 */
public class OutOfRangeException extends RuntimeException {

    public OutOfRangeException(String message) {
        super(message);
    }

    public static OutOfRangeException forRange(int position, int count, int size) {
        return new OutOfRangeException("Range [" + position + ", " + (position + count) + ") is out of range. Playlist has "
                + size + " items");
    }

    public static OutOfRangeException forIndex(int index, int size) {
        return new OutOfRangeException("Index " + index + " is out of range. Valid range is 0 to " + (size - 1));
    }
}
