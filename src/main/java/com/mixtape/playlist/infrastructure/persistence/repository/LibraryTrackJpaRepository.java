package com.mixtape.playlist.infrastructure.persistence.repository;

import com.mixtape.playlist.infrastructure.persistence.dao.LibraryTrackDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for library tracks.
 */
@Repository
public interface LibraryTrackJpaRepository extends JpaRepository<LibraryTrackDao, Long> {

    List<LibraryTrackDao> findAllByOrderByIdAsc();

    /**
     * Finds the tracks of an artist ignoring case, in album and track order.
     */
    @Query("SELECT t FROM LibraryTrackDao t WHERE LOWER(t.metadata.artist) = LOWER(:artist) "
            + "ORDER BY t.metadata.album ASC, t.metadata.trackNumber ASC")
    List<LibraryTrackDao> findByArtist(@Param("artist") String artist);
}
