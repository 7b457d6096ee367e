package com.mixtape.playlist.infrastructure.persistence.dao;

import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * JPA data access object for the state of a saved playlist. The entries live in {@link PlaylistItemDao}.
 */
@Entity
@Table(name = "playlists")
public class PlaylistDao {

    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "current_row", nullable = false)
    private int currentRow;

    @Column(name = "last_played_row", nullable = false)
    private int lastPlayedRow;

    @Column(name = "stop_after_row", nullable = false)
    private int stopAfterRow;

    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_mode", nullable = false, length = 20)
    private RepeatMode repeatMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "shuffle_mode", nullable = false, length = 20)
    private ShuffleMode shuffleMode;

    @Column(name = "generator_key", length = 500)
    private String generatorKey;

    public PlaylistDao() {
    }

    public PlaylistDao(String id, int currentRow, int lastPlayedRow, int stopAfterRow,
                       RepeatMode repeatMode, ShuffleMode shuffleMode, String generatorKey) {
        this.id = id;
        this.currentRow = currentRow;
        this.lastPlayedRow = lastPlayedRow;
        this.stopAfterRow = stopAfterRow;
        this.repeatMode = repeatMode;
        this.shuffleMode = shuffleMode;
        this.generatorKey = generatorKey;
    }

    public String getId() {
        return id;
    }

    public int getCurrentRow() {
        return currentRow;
    }

    public int getLastPlayedRow() {
        return lastPlayedRow;
    }

    public int getStopAfterRow() {
        return stopAfterRow;
    }

    public RepeatMode getRepeatMode() {
        return repeatMode;
    }

    public ShuffleMode getShuffleMode() {
        return shuffleMode;
    }

    public String getGeneratorKey() {
        return generatorKey;
    }
}
