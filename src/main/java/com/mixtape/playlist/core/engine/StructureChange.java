package com.mixtape.playlist.core.engine;

/**
 * Describes one structural mutation of a playlist for observers.
 *
 * @param kind  what happened
 * @param start first affected store index
 * @param count number of affected entries
 */
public record StructureChange(Kind kind, int start, int count) {

    public enum Kind {
        INSERTED,
        REMOVED,
        MOVED,
        REORDERED,
        CLEARED
    }
}
