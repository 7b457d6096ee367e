package com.mixtape.playlist.infrastructure.persistence.dao;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * JPA data access object for a track of the library.
 */
@Entity
@Table(
        name = "library_tracks",
        indexes = @Index(name = "idx_library_artist", columnList = "artist")
)
public class LibraryTrackDao {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Embedded
    private TrackMetadataColumns metadata;

    public LibraryTrackDao() {
    }

    public LibraryTrackDao(TrackMetadataColumns metadata) {
        this.metadata = metadata;
    }

    public Long getId() {
        return id;
    }

    public TrackMetadataColumns getMetadata() {
        return metadata;
    }

    public void setMetadata(TrackMetadataColumns metadata) {
        this.metadata = metadata;
    }
}
