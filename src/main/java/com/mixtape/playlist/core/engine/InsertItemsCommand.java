package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackEntry;

import java.util.List;

final class InsertItemsCommand implements MutationCommand {

    private final Playlist playlist;
    private final List<TrackEntry> entries;
    private final boolean enqueue;
    private int position;

    InsertItemsCommand(Playlist playlist, List<TrackEntry> entries, int position, boolean enqueue) {
        this.playlist = playlist;
        this.entries = List.copyOf(entries);
        this.position = position;
        this.enqueue = enqueue;
    }

    @Override
    public void apply() {
        // Pin the clamped position so that redo lands exactly where the first apply did
        position = playlist.applyInsert(entries, position, enqueue).start();
    }

    @Override
    public void revert() {
        playlist.applyRemove(position, entries.size());
    }

    @Override
    public String description() {
        return entries.size() == 1 ? "add 1 track" : "add " + entries.size() + " tracks";
    }

    int position() {
        return position;
    }
}
