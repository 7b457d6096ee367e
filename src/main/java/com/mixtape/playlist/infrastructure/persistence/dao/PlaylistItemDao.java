package com.mixtape.playlist.infrastructure.persistence.dao;

import com.mixtape.playlist.core.model.TrackKind;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * JPA data access object for one entry of a saved playlist.
 * Separate from the core domain entity to keep persistence concerns isolated.
 */
@Entity
@Table(
        name = "playlist_items",
        indexes = {
                @Index(name = "idx_playlist_index", columnList = "playlist_id, item_index"),
                @Index(name = "idx_playlist_id", columnList = "playlist_id")
        }
)
public class PlaylistItemDao {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "playlist_id", nullable = false, length = 100)
    private String playlistId;

    @Column(name = "item_index", nullable = false)
    private int index;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private TrackKind kind;

    @Column(name = "library_id")
    private Long libraryId;

    @Column(name = "is_valid", nullable = false)
    private boolean valid;

    @Embedded
    private TrackMetadataColumns metadata;

    public PlaylistItemDao() {
    }

    public PlaylistItemDao(String id, String playlistId, int index, TrackKind kind, Long libraryId, boolean valid,
                           TrackMetadataColumns metadata) {
        this.id = id;
        this.playlistId = playlistId;
        this.index = index;
        this.kind = kind;
        this.libraryId = libraryId;
        this.valid = valid;
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public String getPlaylistId() {
        return playlistId;
    }

    public int getIndex() {
        return index;
    }

    public TrackKind getKind() {
        return kind;
    }

    public Long getLibraryId() {
        return libraryId;
    }

    public boolean isValid() {
        return valid;
    }

    public TrackMetadataColumns getMetadata() {
        return metadata;
    }
}
