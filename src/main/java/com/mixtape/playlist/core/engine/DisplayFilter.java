package com.mixtape.playlist.core.engine;

/**
 * Predicate over store indices deciding which entries are visible.
 * Traversal skips invisible entries; the playback order itself is never changed by a filter.
 */
@FunctionalInterface
public interface DisplayFilter {

    DisplayFilter ACCEPT_ALL = row -> true;

    boolean accepts(int row);
}
