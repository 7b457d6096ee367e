package com.mixtape.playlist.core.engine;

/**
 * A reversible structural change of a playlist.
 * Commands reach into the playlist through its package-private {@code apply*} methods, which mutate without
 * touching the mutation log.
 */
interface MutationCommand {

    /**
     * Applies the change. Called when the command is executed and again on redo.
     */
    void apply();

    /**
     * Reverts the change. Only ever called on a playlist in the state left by {@link #apply()}.
     */
    void revert();

    String description();
}
