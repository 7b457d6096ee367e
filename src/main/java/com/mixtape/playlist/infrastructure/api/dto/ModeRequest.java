package com.mixtape.playlist.infrastructure.api.dto;

import com.mixtape.playlist.core.model.RepeatMode;
import com.mixtape.playlist.core.model.ShuffleMode;

/**
 * Request DTO for changing shuffle and repeat; absent modes stay as they are.
 */
public record ModeRequest(
        ShuffleMode shuffleMode,
        RepeatMode repeatMode
) {}
