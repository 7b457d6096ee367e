package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.application.service.InsertionPipeline.InsertOptions;
import com.mixtape.playlist.application.service.InsertionPipeline.InsertOutcome;
import com.mixtape.playlist.application.service.PlaylistService;
import com.mixtape.playlist.core.model.RadioStation;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import com.mixtape.playlist.infrastructure.api.dto.CountResponse;
import com.mixtape.playlist.infrastructure.api.dto.CurrentRowResponse;
import com.mixtape.playlist.infrastructure.api.dto.FilterRequest;
import com.mixtape.playlist.infrastructure.api.dto.HistoryResponse;
import com.mixtape.playlist.infrastructure.api.dto.InsertItemsRequest;
import com.mixtape.playlist.infrastructure.api.dto.InsertItemsResponse;
import com.mixtape.playlist.infrastructure.api.dto.ModeRequest;
import com.mixtape.playlist.infrastructure.api.dto.MoveItemsRequest;
import com.mixtape.playlist.infrastructure.api.dto.MoveItemsResponse;
import com.mixtape.playlist.infrastructure.api.dto.PageInfo;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistItemResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistResponse;
import com.mixtape.playlist.infrastructure.api.dto.RatingRequest;
import com.mixtape.playlist.infrastructure.api.dto.RemoveItemsResponse;
import com.mixtape.playlist.infrastructure.api.dto.RowRequest;
import com.mixtape.playlist.infrastructure.api.dto.RowsRequest;
import com.mixtape.playlist.infrastructure.api.dto.SortRequest;
import com.mixtape.playlist.infrastructure.api.dto.StreamMetadataRequest;
import com.mixtape.playlist.infrastructure.api.dto.TrackMetadataRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * REST controller for playlist operations.
 */
@RestController
@RequestMapping("/api/playlists/{playlistId}")
public class PlaylistController {

    private static final int DEFAULT_GENERATOR_COUNT = 20;

    private final PlaylistService playlistService;

    public PlaylistController(PlaylistService playlistService) {
        this.playlistService = playlistService;
    }

    @GetMapping
    public ResponseEntity<PlaylistResponse> getPlaylist(
            @PathVariable String playlistId,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "50") int limit
    ) {
        PlaylistService.PlaylistState state = playlistService.getPlaylist(playlistId, offset, limit);

        List<PlaylistItemResponse> items = state.rows().stream()
                .map(row -> toResponse(row.row(), row.entry(), row.visible()))
                .toList();

        boolean hasMore = offset + items.size() < state.totalCount();
        Integer nextOffset = hasMore ? offset + limit : null;
        PageInfo pageInfo = new PageInfo(limit, offset, nextOffset, hasMore);

        return ResponseEntity.ok(new PlaylistResponse(
                state.playlistId(),
                items,
                pageInfo,
                state.totalCount(),
                state.totalLengthSeconds(),
                state.currentRow(),
                state.lastPlayedRow(),
                state.stopAfterRow(),
                state.nextRow(),
                state.previousRow(),
                state.shuffleMode(),
                state.repeatMode(),
                state.dynamic(),
                state.generatorKey(),
                state.queue(),
                state.playOrder(),
                state.undoDescription(),
                state.redoDescription(),
                state.recentErrors()
        ));
    }

    // ========================================================================
    // Structure
    // ========================================================================

    @PostMapping("/items")
    public ResponseEntity<InsertItemsResponse> insertItems(
            @PathVariable String playlistId,
            @Valid @RequestBody InsertItemsRequest request
    ) {
        long sources = Stream.of(request.entries(), request.libraryIds(), request.urls(), request.radioStations(),
                        request.generatorKey())
                .filter(source -> source != null)
                .count();
        if (sources != 1) {
            throw new IllegalArgumentException(
                    "Exactly one of entries, libraryIds, urls, radioStations or generatorKey must be given");
        }

        InsertOptions options = new InsertOptions(
                request.position() == null ? -1 : request.position(),
                request.playNow(),
                request.enqueue());

        InsertOutcome outcome;
        if (request.entries() != null) {
            List<TrackEntry> entries = request.entries().stream()
                    .map(TrackMetadataRequest::toMetadata)
                    .map(TrackEntry::url)
                    .toList();
            outcome = playlistService.insertEntries(playlistId, entries, options);
        } else if (request.libraryIds() != null) {
            outcome = playlistService.insertLibraryItems(playlistId, request.libraryIds(), options);
        } else if (request.urls() != null) {
            outcome = playlistService.insertUrls(playlistId, toUris(request.urls()), options);
        } else if (request.radioStations() != null) {
            List<RadioStation> stations = request.radioStations().stream()
                    .map(station -> new RadioStation(station.name(), toUri(station.streamUrl())))
                    .toList();
            outcome = playlistService.insertRadioStations(playlistId, stations, options);
        } else {
            int count = request.generatorCount() == null ? DEFAULT_GENERATOR_COUNT : request.generatorCount();
            outcome = playlistService.insertFromGenerator(playlistId, request.generatorKey(), count, options);
        }

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new InsertItemsResponse(outcome.position(), outcome.inserted(), outcome.errors(),
                        outcome.discarded()));
    }

    @DeleteMapping("/items")
    public ResponseEntity<RemoveItemsResponse> removeItems(
            @PathVariable String playlistId,
            @Valid @RequestBody RowsRequest request
    ) {
        List<TrackEntry> removed = playlistService.removeRows(playlistId, request.rows());
        return ResponseEntity.ok(toRemoveResponse(removed));
    }

    @PostMapping("/items/remove-unqueued")
    public ResponseEntity<RemoveItemsResponse> removeItemsNotInQueue(@PathVariable String playlistId) {
        List<TrackEntry> removed = playlistService.removeItemsNotInQueue(playlistId);
        return ResponseEntity.ok(toRemoveResponse(removed));
    }

    @PostMapping("/items/move")
    public ResponseEntity<MoveItemsResponse> moveItems(
            @PathVariable String playlistId,
            @Valid @RequestBody MoveItemsRequest request
    ) {
        int start = playlistService.moveItems(playlistId, request.sources(), request.destination());
        return ResponseEntity.ok(new MoveItemsResponse(start));
    }

    @PostMapping("/undo")
    public ResponseEntity<HistoryResponse> undo(@PathVariable String playlistId) {
        return ResponseEntity.ok(new HistoryResponse(playlistService.undo(playlistId)));
    }

    @PostMapping("/redo")
    public ResponseEntity<HistoryResponse> redo(@PathVariable String playlistId) {
        return ResponseEntity.ok(new HistoryResponse(playlistService.redo(playlistId)));
    }

    @PostMapping("/sort")
    public ResponseEntity<Void> sort(
            @PathVariable String playlistId,
            @Valid @RequestBody SortRequest request
    ) {
        playlistService.sort(playlistId, request.field(), !request.descending());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/shuffle")
    public ResponseEntity<Void> shuffle(@PathVariable String playlistId) {
        playlistService.shuffle(playlistId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/clear")
    public ResponseEntity<Void> clear(@PathVariable String playlistId) {
        playlistService.clear(playlistId);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Playback
    // ========================================================================

    @PutMapping("/mode")
    public ResponseEntity<Void> setMode(
            @PathVariable String playlistId,
            @RequestBody ModeRequest request
    ) {
        playlistService.setModes(playlistId, request.shuffleMode(), request.repeatMode());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/current")
    public ResponseEntity<CurrentRowResponse> setCurrent(
            @PathVariable String playlistId,
            @RequestBody RowRequest request
    ) {
        playlistService.setCurrentRow(playlistId, request.row());
        return ResponseEntity.ok(new CurrentRowResponse(request.row()));
    }

    @PostMapping("/next")
    public ResponseEntity<CurrentRowResponse> next(@PathVariable String playlistId) {
        return ResponseEntity.ok(new CurrentRowResponse(playlistService.playNext(playlistId)));
    }

    @PostMapping("/previous")
    public ResponseEntity<CurrentRowResponse> previous(@PathVariable String playlistId) {
        return ResponseEntity.ok(new CurrentRowResponse(playlistService.playPrevious(playlistId)));
    }

    @PostMapping("/stop-after")
    public ResponseEntity<Void> stopAfter(
            @PathVariable String playlistId,
            @RequestBody RowRequest request
    ) {
        playlistService.setStopAfter(playlistId, request.row());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/queue")
    public ResponseEntity<Void> enqueue(
            @PathVariable String playlistId,
            @Valid @RequestBody RowsRequest request
    ) {
        playlistService.enqueue(playlistId, request.rows());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/stream-metadata")
    public ResponseEntity<Void> setStreamMetadata(
            @PathVariable String playlistId,
            @Valid @RequestBody StreamMetadataRequest request
    ) {
        TrackMetadata metadata = request.metadata().toMetadata();
        playlistService.setStreamMetadata(playlistId, request.url(), metadata);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Entries
    // ========================================================================

    @PutMapping("/items/{row}/rating")
    public ResponseEntity<Void> rate(
            @PathVariable String playlistId,
            @PathVariable int row,
            @Valid @RequestBody RatingRequest request
    ) {
        playlistService.rateItem(playlistId, row, request.rating());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/filter")
    public ResponseEntity<Void> setFilter(
            @PathVariable String playlistId,
            @RequestBody FilterRequest request
    ) {
        playlistService.setFilterText(playlistId, request.text());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/items/reload")
    public ResponseEntity<CountResponse> reload(
            @PathVariable String playlistId,
            @Valid @RequestBody RowsRequest request
    ) {
        return ResponseEntity.ok(new CountResponse(playlistService.reloadItems(playlistId, request.rows())));
    }

    @PostMapping("/items/check-availability")
    public ResponseEntity<CountResponse> checkAvailability(@PathVariable String playlistId) {
        return ResponseEntity.ok(new CountResponse(playlistService.invalidateDeletedItems(playlistId)));
    }

    // ========================================================================
    // Dynamic playlist and persistence
    // ========================================================================

    @DeleteMapping("/dynamic")
    public ResponseEntity<Void> turnOffDynamic(@PathVariable String playlistId) {
        playlistService.turnOffDynamicPlaylist(playlistId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/dynamic/repopulate")
    public ResponseEntity<Void> repopulate(@PathVariable String playlistId) {
        playlistService.repopulateDynamicPlaylist(playlistId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/save")
    public ResponseEntity<Void> save(@PathVariable String playlistId) {
        playlistService.save(playlistId);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================

    private static PlaylistItemResponse toResponse(int row, TrackEntry entry, boolean visible) {
        TrackMetadata metadata = entry.getMetadata();
        return new PlaylistItemResponse(
                row,
                entry.getKind(),
                entry.getLibraryId(),
                metadata.title(),
                metadata.artist(),
                metadata.album(),
                metadata.lengthSeconds(),
                entry.getStaticMetadata().url(),
                metadata.rating(),
                entry.isValid(),
                visible
        );
    }

    private static RemoveItemsResponse toRemoveResponse(List<TrackEntry> removed) {
        return new RemoveItemsResponse(removed.size(), removed.stream().map(TrackEntry::getTitle).toList());
    }

    private static List<URI> toUris(List<String> urls) {
        List<URI> uris = new ArrayList<>(urls.size());
        for (String url : urls) {
            uris.add(toUri(url));
        }
        return uris;
    }

    private static URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
    }
}
