package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO carrying the current row after playback moved, -1 if playback stopped.
 */
public record CurrentRowResponse(
        int currentRow
) {}
