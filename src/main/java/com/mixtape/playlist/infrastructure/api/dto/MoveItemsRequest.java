package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for moving rows. {@code destination} is where the first moved row ends up.
 */
public record MoveItemsRequest(
        @NotEmpty(message = "sources must not be empty")
        List<Integer> sources,
        int destination
) {}
