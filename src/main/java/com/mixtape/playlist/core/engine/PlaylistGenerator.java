package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackEntry;

import java.util.List;

/**
 * Rule-based source of tracks. Pull based: the playlist decides when to ask for more.
 * Implementations may be slow and are called off the owner thread.
 */
public interface PlaylistGenerator {

    /**
     * Identifier under which the generator can be found again after a restore.
     */
    String key();

    /**
     * Whether the playlist should keep asking this generator for more tracks as they are consumed.
     */
    boolean isDynamic();

    /**
     * @param count how many entries are wanted; the generator may return fewer
     * @return the generated entries; an empty list means the generator is exhausted
     */
    List<TrackEntry> generate(int count);
}
