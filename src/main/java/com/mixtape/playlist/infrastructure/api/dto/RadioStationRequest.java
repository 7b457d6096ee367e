package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for a radio station to add.
 */
public record RadioStationRequest(
        @NotBlank(message = "name must not be blank")
        String name,
        @NotBlank(message = "streamUrl must not be blank")
        String streamUrl
) {}
