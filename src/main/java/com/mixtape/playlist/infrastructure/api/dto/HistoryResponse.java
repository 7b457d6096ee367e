package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO for undo and redo; {@code applied} is false if there was nothing to undo or redo.
 */
public record HistoryResponse(
        boolean applied
) {}
