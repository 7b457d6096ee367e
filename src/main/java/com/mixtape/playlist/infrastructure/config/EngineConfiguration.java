package com.mixtape.playlist.infrastructure.config;

import com.mixtape.playlist.application.service.OwnerThread;
import com.mixtape.playlist.core.engine.EngineSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free engine into the Spring context.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public EngineSettings engineSettings(PlaylistEngineProperties properties) {
        return new EngineSettings(
                properties.undoLimit(),
                properties.dynamicHistory(),
                properties.dynamicFuture(),
                properties.vetoGeneratorOutput());
    }

    @Bean(destroyMethod = "close")
    public OwnerThread playlistOwnerThread(PlaylistEngineProperties properties) {
        return new OwnerThread("playlist-owner", properties.resolverThreads());
    }
}
