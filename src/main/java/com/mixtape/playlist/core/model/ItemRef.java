package com.mixtape.playlist.core.model;

/**
 * Opaque stable reference to a slot of an item store.
 * Survives moves and reorders; becomes dangling when the slot is removed.
 * Only meaningful for the store that issued it.
 */
public record ItemRef(long key) {
}
