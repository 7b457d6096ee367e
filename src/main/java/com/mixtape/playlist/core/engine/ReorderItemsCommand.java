package com.mixtape.playlist.core.engine;

/**
 * Rearranges the whole playlist, used by sorting and shuffling.
 * New position {@code i} receives the entry that was at {@code order[i]}.
 */
final class ReorderItemsCommand implements MutationCommand {

    private final Playlist playlist;
    private final int[] order;
    private final int[] inverse;
    private final String description;

    ReorderItemsCommand(Playlist playlist, int[] order, String description) {
        this.playlist = playlist;
        this.order = order.clone();
        this.inverse = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            inverse[order[i]] = i;
        }
        this.description = description;
    }

    @Override
    public void apply() {
        playlist.applyReorder(order);
    }

    @Override
    public void revert() {
        playlist.applyReorder(inverse);
    }

    @Override
    public String description() {
        return description;
    }
}
