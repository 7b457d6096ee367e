package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Access to the track library. Entries returned here are library entries carrying their record id.
 */
public interface LibraryPort {

    Optional<TrackEntry> findById(long libraryId);

    /**
     * @return all library tracks ordered by id
     */
    List<TrackEntry> findAll();

    /**
     * @return the tracks of an artist (case-insensitive), ordered by album and track number
     */
    List<TrackEntry> findByArtist(String artist);

    /**
     * Adds a track to the library.
     *
     * @return the new library entry
     */
    TrackEntry create(TrackMetadata metadata);

    /**
     * Replaces the metadata of a library track and notifies the change listeners.
     *
     * @return the updated entry, or empty if there is no such track
     */
    Optional<TrackEntry> update(long libraryId, TrackMetadata metadata);

    /**
     * Registers a callback receiving the entries of library tracks whose metadata changed.
     */
    void addChangeListener(Consumer<List<TrackEntry>> listener);
}
