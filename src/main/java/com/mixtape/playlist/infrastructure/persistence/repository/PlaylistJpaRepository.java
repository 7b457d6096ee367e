package com.mixtape.playlist.infrastructure.persistence.repository;

import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for saved playlist state.
 */
@Repository
public interface PlaylistJpaRepository extends JpaRepository<PlaylistDao, String> {
}
