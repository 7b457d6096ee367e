package com.mixtape.playlist.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * Reference to a radio station that can be added to a playlist.
 */
public record RadioStation(String name, URI streamUrl) {

    public RadioStation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(streamUrl, "streamUrl must not be null");
    }
}
