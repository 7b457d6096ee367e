package com.mixtape.playlist.infrastructure.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Engine tuning, bound from {@code playlist.engine.*}.
 *
 * @param undoLimit           commands kept on each playlist's undo history
 * @param dynamicHistory      played tracks a dynamic playlist keeps before the current one
 * @param dynamicFuture       tracks a dynamic playlist keeps queued up after the current one
 * @param vetoGeneratorOutput whether generated tracks go through the insert veto listeners
 * @param resolverThreads     size of the background pool resolving URLs and running generators
 */
@Validated
@ConfigurationProperties(prefix = "playlist.engine")
public record PlaylistEngineProperties(
        @DefaultValue("100") @Min(0) int undoLimit,
        @DefaultValue("5") @Min(0) int dynamicHistory,
        @DefaultValue("15") @Min(1) int dynamicFuture,
        @DefaultValue("false") boolean vetoGeneratorOutput,
        @DefaultValue("4") @Min(1) int resolverThreads
) {}
