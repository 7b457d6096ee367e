package com.mixtape.playlist.core.model;

public enum RepeatMode {
    OFF,
    TRACK,
    ALBUM,
    PLAYLIST
}
