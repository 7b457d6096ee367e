package com.mixtape.playlist.core.engine;

import java.util.List;

/**
 * Spreads a contiguous block over the given destinations. Reverted by moving them back together.
 */
final class MoveBlockCommand implements MutationCommand {

    private final Playlist playlist;
    private final int start;
    private final List<Integer> destinations;

    MoveBlockCommand(Playlist playlist, int start, List<Integer> destinations) {
        this.playlist = playlist;
        this.start = start;
        this.destinations = List.copyOf(destinations);
    }

    @Override
    public void apply() {
        playlist.applyMoveBlock(start, destinations);
    }

    @Override
    public void revert() {
        playlist.applyMove(destinations, start);
    }

    @Override
    public String description() {
        return destinations.size() == 1 ? "move 1 track" : "move " + destinations.size() + " tracks";
    }
}
