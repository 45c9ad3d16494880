package app.lexis.core.review.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

public record StudyPreferencesDto(
        @NotNull @Positive Integer dailyLimit,
        Instant updatedAt
) {
}
