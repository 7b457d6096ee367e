package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.application.port.LibraryPort;
import com.mixtape.playlist.core.exception.ResourceNotFoundException;
import com.mixtape.playlist.core.model.TrackEntry;
import com.mixtape.playlist.core.model.TrackMetadata;
import com.mixtape.playlist.infrastructure.api.dto.LibraryTrackResponse;
import com.mixtape.playlist.infrastructure.api.dto.TrackMetadataRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the track library. Updating a track refreshes it in every loaded playlist.
 */
@RestController
@RequestMapping("/api/library/tracks")
public class LibraryController {

    private final LibraryPort libraryPort;

    public LibraryController(LibraryPort libraryPort) {
        this.libraryPort = libraryPort;
    }

    @GetMapping
    public ResponseEntity<List<LibraryTrackResponse>> getTracks(@RequestParam(required = false) String artist) {
        List<TrackEntry> tracks = artist == null ? libraryPort.findAll() : libraryPort.findByArtist(artist);
        return ResponseEntity.ok(tracks.stream().map(LibraryController::toResponse).toList());
    }

    @GetMapping("/{trackId}")
    public ResponseEntity<LibraryTrackResponse> getTrack(@PathVariable long trackId) {
        TrackEntry track = libraryPort.findById(trackId)
                .orElseThrow(() -> new ResourceNotFoundException("Library track not found: " + trackId));
        return ResponseEntity.ok(toResponse(track));
    }

    @PostMapping
    public ResponseEntity<LibraryTrackResponse> createTrack(@Valid @RequestBody TrackMetadataRequest request) {
        TrackEntry created = libraryPort.create(request.toMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @PutMapping("/{trackId}")
    public ResponseEntity<LibraryTrackResponse> updateTrack(
            @PathVariable long trackId,
            @Valid @RequestBody TrackMetadataRequest request
    ) {
        TrackEntry updated = libraryPort.update(trackId, request.toMetadata())
                .orElseThrow(() -> new ResourceNotFoundException("Library track not found: " + trackId));
        return ResponseEntity.ok(toResponse(updated));
    }

    private static LibraryTrackResponse toResponse(TrackEntry track) {
        TrackMetadata metadata = track.getStaticMetadata();
        return new LibraryTrackResponse(
                track.getLibraryId(),
                metadata.title(),
                metadata.artist(),
                metadata.album(),
                metadata.albumArtist(),
                metadata.genre(),
                metadata.year(),
                metadata.trackNumber(),
                metadata.lengthSeconds(),
                metadata.url(),
                metadata.rating(),
                metadata.compilation()
        );
    }
}
