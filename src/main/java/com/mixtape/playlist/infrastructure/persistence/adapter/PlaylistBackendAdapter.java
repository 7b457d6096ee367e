package com.mixtape.playlist.infrastructure.persistence.adapter;

import com.mixtape.playlist.application.port.PlaylistBackendPort;
import com.mixtape.playlist.core.model.PlaylistSnapshot;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistDao;
import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistItemDao;
import com.mixtape.playlist.infrastructure.persistence.dao.TrackMetadataColumns;
import com.mixtape.playlist.infrastructure.persistence.repository.PlaylistItemJpaRepository;
import com.mixtape.playlist.infrastructure.persistence.repository.PlaylistJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing PlaylistBackendPort using Spring Data JPA.
 * A playlist is saved as one state row plus one row per entry and always replaced as a whole.
 * Streamed metadata overrides are transient and not saved.
 */
@Component
public class PlaylistBackendAdapter implements PlaylistBackendPort {

    private final PlaylistJpaRepository playlistRepository;
    private final PlaylistItemJpaRepository itemRepository;

    public PlaylistBackendAdapter(PlaylistJpaRepository playlistRepository, PlaylistItemJpaRepository itemRepository) {
        this.playlistRepository = playlistRepository;
        this.itemRepository = itemRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PlaylistSnapshot> load(String playlistId) {
        return playlistRepository.findById(playlistId).map(playlist -> {
            List<TrackEntry> entries = itemRepository.findByPlaylistIdOrderByIndexAsc(playlistId)
                    .stream()
                    .map(this::toCoreEntity)
                    .toList();
            return new PlaylistSnapshot(
                    playlist.getId(),
                    entries,
                    playlist.getCurrentRow(),
                    playlist.getLastPlayedRow(),
                    playlist.getStopAfterRow(),
                    playlist.getRepeatMode(),
                    playlist.getShuffleMode(),
                    playlist.getGeneratorKey());
        });
    }

    @Override
    @Transactional
    public void save(PlaylistSnapshot snapshot) {
        String playlistId = snapshot.playlistId();
        playlistRepository.save(new PlaylistDao(
                playlistId,
                snapshot.currentRow(),
                snapshot.lastPlayedRow(),
                snapshot.stopAfterRow(),
                snapshot.repeatMode(),
                snapshot.shuffleMode(),
                snapshot.generatorKey()));

        itemRepository.deleteByPlaylistId(playlistId);
        List<PlaylistItemDao> items = new ArrayList<>(snapshot.entries().size());
        for (int i = 0; i < snapshot.entries().size(); i++) {
            items.add(toDao(playlistId, i, snapshot.entries().get(i)));
        }
        itemRepository.saveAll(items);
    }

    private TrackEntry toCoreEntity(PlaylistItemDao dao) {
        return new TrackEntry(
                dao.getKind(),
                dao.getMetadata().toMetadata(),
                dao.getLibraryId(),
                dao.isValid(),
                null
        );
    }

    private PlaylistItemDao toDao(String playlistId, int index, TrackEntry entry) {
        return new PlaylistItemDao(
                UUID.randomUUID().toString(),
                playlistId,
                index,
                entry.getKind(),
                entry.getLibraryId(),
                entry.isValid(),
                TrackMetadataColumns.from(entry.getStaticMetadata())
        );
    }
}
