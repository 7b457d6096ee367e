package com.mixtape.playlist.infrastructure.persistence.repository;

import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistItemDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the entries of saved playlists.
 */
@Repository
public interface PlaylistItemJpaRepository extends JpaRepository<PlaylistItemDao, String> {

    /**
     * Finds all entries of a playlist in display order.
     */
    List<PlaylistItemDao> findByPlaylistIdOrderByIndexAsc(String playlistId);

    int countByPlaylistId(String playlistId);

    /**
     * Deletes all entries of a playlist, used before writing a new snapshot.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PlaylistItemDao p WHERE p.playlistId = :playlistId")
    void deleteByPlaylistId(@Param("playlistId") String playlistId);
}
