package com.mixtape.playlist.infrastructure.api.dto;

import com.mixtape.playlist.core.model.SortField;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for sorting a playlist.
 */
public record SortRequest(
        @NotNull(message = "field is required")
        SortField field,
        boolean descending
) {}
