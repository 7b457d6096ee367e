package com.mixtape.playlist.infrastructure.persistence.adapter;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import com.mixtape.playlist.infrastructure.persistence.dao.LibraryTrackDao;
import com.mixtape.playlist.infrastructure.persistence.dao.TrackMetadataColumns;
import com.mixtape.playlist.infrastructure.persistence.repository.LibraryTrackJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Adapter implementing LibraryPort using Spring Data JPA.
 * Maps between library track DAOs and library entries.
 */
@Component
public class LibraryAdapter implements LibraryPort {

    private static final Logger log = LoggerFactory.getLogger(LibraryAdapter.class);

    private final LibraryTrackJpaRepository jpaRepository;
    private final List<Consumer<List<TrackEntry>>> changeListeners = new CopyOnWriteArrayList<>();

    public LibraryAdapter(LibraryTrackJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackEntry> findById(long libraryId) {
        return jpaRepository.findById(libraryId).map(this::toCoreEntity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackEntry> findAll() {
        return jpaRepository.findAllByOrderByIdAsc()
                .stream()
                .map(this::toCoreEntity)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackEntry> findByArtist(String artist) {
        return jpaRepository.findByArtist(artist)
                .stream()
                .map(this::toCoreEntity)
                .toList();
    }

    @Override
    @Transactional
    public TrackEntry create(TrackMetadata metadata) {
        LibraryTrackDao saved = jpaRepository.save(new LibraryTrackDao(TrackMetadataColumns.from(metadata)));
        log.debug("Added library track {} '{}'", saved.getId(), metadata.title());
        return toCoreEntity(saved);
    }

    @Override
    @Transactional
    public Optional<TrackEntry> update(long libraryId, TrackMetadata metadata) {
        Optional<LibraryTrackDao> existing = jpaRepository.findById(libraryId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        LibraryTrackDao dao = existing.get();
        dao.setMetadata(TrackMetadataColumns.from(metadata));
        TrackEntry updated = toCoreEntity(jpaRepository.save(dao));
        for (Consumer<List<TrackEntry>> listener : changeListeners) {
            listener.accept(List.of(updated));
        }
        return Optional.of(updated);
    }

    @Override
    public void addChangeListener(Consumer<List<TrackEntry>> listener) {
        changeListeners.add(listener);
    }

    private TrackEntry toCoreEntity(LibraryTrackDao dao) {
        return TrackEntry.library(dao.getId(), dao.getMetadata().toMetadata());
    }
}
