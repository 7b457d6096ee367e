package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO naming playlist rows, used to remove, queue and reload.
 */
public record RowsRequest(
        @NotEmpty(message = "rows must not be empty")
        List<Integer> rows
) {}
