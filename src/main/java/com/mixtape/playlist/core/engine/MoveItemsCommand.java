package com.mixtape.playlist.core.engine;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

final class MoveItemsCommand implements MutationCommand {

    private final Playlist playlist;
    private final List<Integer> sources;
    private final int destination;
    private int start;

    MoveItemsCommand(Playlist playlist, Collection<Integer> sources, int destination) {
        this.playlist = playlist;
        this.sources = List.copyOf(new TreeSet<>(sources));
        this.destination = destination;
    }

    @Override
    public void apply() {
        start = playlist.applyMove(sources, destination);
    }

    @Override
    public void revert() {
        playlist.applyMoveBlock(start, sources);
    }

    @Override
    public String description() {
        return sources.size() == 1 ? "move 1 track" : "move " + sources.size() + " tracks";
    }

    int start() {
        return start;
    }
}
