package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO for a move.
 */
public record MoveItemsResponse(
        int start
) {}
