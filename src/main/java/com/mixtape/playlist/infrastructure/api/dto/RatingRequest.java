package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record RatingRequest(
        @DecimalMin("0.0") @DecimalMax("1.0") float rating
) {}
