package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackEntry;

import java.util.List;

/**
 * Collaborator that may prevent entries from being added to a playlist.
 * Before anything is inserted every registered listener is asked, in registration order, and each one picks
 * the candidates it considers invalid. The union of all picks is excluded from the insertion.
 */
@FunctionalInterface
public interface InsertVetoListener {

    /**
     * @param existing   entries currently in the playlist
     * @param candidates entries about to be added if nobody vetoes them
     * @return the candidates that must not be inserted; the very instances from {@code candidates}
     */
    List<TrackEntry> aboutToInsert(List<TrackEntry> existing, List<TrackEntry> candidates);
}
