package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.engine.PlaylistGenerator;

import java.util.List;
import java.util.Optional;

/**
 * Looks up playlist generators by the key they are persisted under.
 */
public interface GeneratorCatalogPort {

    Optional<PlaylistGenerator> find(String key);

    /**
     * @return example keys of the generators on offer
     */
    List<String> keys();
}
