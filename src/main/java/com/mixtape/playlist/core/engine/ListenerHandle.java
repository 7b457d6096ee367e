package com.mixtape.playlist.core.engine;

/**
 * Token returned when registering a listener; pass it back to unregister.
 */
public record ListenerHandle(long id) {
}
