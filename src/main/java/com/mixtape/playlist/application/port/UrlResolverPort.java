package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.exception.ResolutionFailedException;
import com.mixtape.playlist.core.model.TrackEntry;

import java.net.URI;
import java.util.List;

/**
 * Turns URLs into playable entries. May block; only called off the owner thread.
 */
public interface UrlResolverPort {

    /**
     * Resolves a URL to one or more entries. A playlist file or a directory yields all the entries it holds.
     *
     * @throws ResolutionFailedException if the URL cannot be turned into entries
     */
    List<TrackEntry> resolve(URI uri);

    /**
     * Whether the track behind an entry can still be played. Streams are assumed to be available.
     */
    boolean isAvailable(TrackEntry entry);
}
