package com.mixtape.playlist.core.engine;

/**
 * Tuning of a playlist engine instance.
 *
 * @param undoLimit           maximum number of commands kept on the mutation log
 * @param dynamicHistory      played entries kept before the current one in dynamic mode
 * @param dynamicFuture       entries kept after the current one in dynamic mode
 * @param vetoGeneratorOutput whether generated entries go through the veto listeners
 */
public record EngineSettings(
        int undoLimit,
        int dynamicHistory,
        int dynamicFuture,
        boolean vetoGeneratorOutput
) {

    public EngineSettings {
        if (undoLimit < 0 || dynamicHistory < 0 || dynamicFuture < 1) {
            throw new IllegalArgumentException("Invalid engine settings: undoLimit=" + undoLimit
                    + ", dynamicHistory=" + dynamicHistory + ", dynamicFuture=" + dynamicFuture);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(100, 5, 15, false);
    }
}
