package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Request DTO naming a single row, -1 for none.
 */
public record RowRequest(
        int row
) {}
