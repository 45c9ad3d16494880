package app.lexis.core.review.domain.dto;

import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.entity.ReviewLogEntity;

import java.time.Instant;

public record ReviewLogDTO(
        String logId,
        String cardId,
        Rating rating,
        Instant reviewedAt
) {
    public static ReviewLogDTO of(ReviewLogEntity e) {
        return new ReviewLogDTO(e.getLogId(), e.getCardId(), e.getRating(), e.getReviewedAt());
    }
}
