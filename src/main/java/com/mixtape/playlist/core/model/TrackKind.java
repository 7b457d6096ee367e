package com.mixtape.playlist.core.model;

/**
 * Where a playlist entry came from.
 */
public enum TrackKind {
    /** A track resident in the local library, carrying a library back-reference. */
    LIBRARY,
    /** An ad-hoc file or stream URL. */
    URL,
    /** A radio station stream. */
    RADIO
}
