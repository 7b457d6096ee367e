package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a removal, listing the titles of the removed entries.
 */
public record RemoveItemsResponse(
        int removed,
        List<String> titles
) {}
