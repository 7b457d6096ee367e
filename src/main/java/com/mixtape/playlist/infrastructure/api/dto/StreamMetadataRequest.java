package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for metadata reported by the stream that is playing.
 */
public record StreamMetadataRequest(
        @NotBlank(message = "url is required")
        String url,
        @NotNull @Valid
        TrackMetadataRequest metadata
) {}
