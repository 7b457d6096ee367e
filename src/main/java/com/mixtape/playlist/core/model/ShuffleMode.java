package com.mixtape.playlist.core.model;

public enum ShuffleMode {
    OFF,
    ALL,
    /** Albums are played in random order, tracks inside an album keep their order. */
    BY_ALBUM,
    /** Artists are played in random order, tracks of one artist keep their order. */
    BY_ARTIST
}
