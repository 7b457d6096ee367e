package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Request DTO for inserting tracks. Exactly one source must be given: ready-made entries, library ids, URLs,
 * radio stations or a generator key.
 *
 * @param position       insert position; absent or negative appends
 * @param generatorCount how many tracks to ask a one-shot generator for
 */
public record InsertItemsRequest(
        List<@Valid TrackMetadataRequest> entries,
        List<Long> libraryIds,
        List<String> urls,
        List<@Valid RadioStationRequest> radioStations,
        String generatorKey,
        Integer generatorCount,
        Integer position,
        boolean playNow,
        boolean enqueue
) {}
