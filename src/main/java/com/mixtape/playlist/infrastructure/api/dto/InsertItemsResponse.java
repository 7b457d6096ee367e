package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for an insertion. {@code errors} lists the sources that could not be loaded.
 */
public record InsertItemsResponse(
        int position,
        int inserted,
        List<String> errors,
        boolean discarded
) {}
