package com.mixtape.playlist.core.model;

import java.util.Objects;

/**
 * Domain entity representing one entry of a playlist.
 * Immutable: runtime flags are changed by creating a modified copy, which the
 * item store swaps in place of the old one.
 */
public final class TrackEntry {

    private final TrackKind kind;
    private final TrackMetadata metadata;
    private final Long libraryId;
    private final boolean valid;
    private final TrackMetadata temporaryMetadata;

    public TrackEntry(TrackKind kind, TrackMetadata metadata, Long libraryId, boolean valid,
                      TrackMetadata temporaryMetadata) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.libraryId = libraryId;
        this.valid = valid;
        this.temporaryMetadata = temporaryMetadata;
    }

    public static TrackEntry library(long libraryId, TrackMetadata metadata) {
        return new TrackEntry(TrackKind.LIBRARY, metadata, libraryId, true, null);
    }

    public static TrackEntry url(TrackMetadata metadata) {
        return new TrackEntry(TrackKind.URL, metadata, null, true, null);
    }

    public static TrackEntry radio(RadioStation station) {
        TrackMetadata metadata = TrackMetadata.of(station.name(), "", "", 0, station.streamUrl().toString());
        return new TrackEntry(TrackKind.RADIO, metadata, null, true, null);
    }

    public TrackKind getKind() {
        return kind;
    }

    /**
     * Returns the effective metadata: the temporary streamed metadata if set, the static metadata otherwise.
     */
    public TrackMetadata getMetadata() {
        return temporaryMetadata != null ? temporaryMetadata : metadata;
    }

    public TrackMetadata getStaticMetadata() {
        return metadata;
    }

    public TrackMetadata getTemporaryMetadata() {
        return temporaryMetadata;
    }

    public boolean hasTemporaryMetadata() {
        return temporaryMetadata != null;
    }

    public Long getLibraryId() {
        return libraryId;
    }

    public boolean isLibraryItem() {
        return kind == TrackKind.LIBRARY && libraryId != null;
    }

    public boolean isValid() {
        return valid;
    }

    public String getTitle() {
        return getMetadata().title();
    }

    public TrackEntry withValid(boolean valid) {
        if (valid == this.valid) {
            return this;
        }
        return new TrackEntry(kind, metadata, libraryId, valid, temporaryMetadata);
    }

    public TrackEntry withTemporaryMetadata(TrackMetadata temporaryMetadata) {
        return new TrackEntry(kind, metadata, libraryId, valid, temporaryMetadata);
    }

    public TrackEntry withoutTemporaryMetadata() {
        if (temporaryMetadata == null) {
            return this;
        }
        return new TrackEntry(kind, metadata, libraryId, valid, null);
    }

    public TrackEntry withMetadata(TrackMetadata metadata) {
        return new TrackEntry(kind, metadata, libraryId, valid, temporaryMetadata);
    }

    public TrackEntry withRating(float rating) {
        return new TrackEntry(kind, metadata.withRating(rating), libraryId, valid, temporaryMetadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrackEntry that = (TrackEntry) o;
        return valid == that.valid
                && kind == that.kind
                && metadata.equals(that.metadata)
                && Objects.equals(libraryId, that.libraryId)
                && Objects.equals(temporaryMetadata, that.temporaryMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, metadata, libraryId, valid, temporaryMetadata);
    }

    @Override
    public String toString() {
        return "TrackEntry{" + kind + ", '" + getTitle() + "'" + (libraryId != null ? ", lib=" + libraryId : "") + "}";
    }
}
