package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Request DTO for the display filter; blank text shows everything.
 */
public record FilterRequest(
        String text
) {}
