package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO for operations reporting how many entries they touched.
 */
public record CountResponse(
        int count
) {}
