package app.lexis.core.review.controller.dto;

import app.lexis.core.review.algorithm.IntervalPreview;
import app.lexis.core.review.domain.Rating;

import java.util.Map;

/**
 * What each rating button would schedule, e.g. {@code again=1m good=10m}.
 */
public record CardPreviewResponse(
        String cardId,
        IntervalPreview again,
        IntervalPreview hard,
        IntervalPreview good,
        IntervalPreview easy
) {
    public static CardPreviewResponse of(String cardId, Map<Rating, IntervalPreview> previews) {
        return new CardPreviewResponse(
                cardId,
                previews.get(Rating.AGAIN),
                previews.get(Rating.HARD),
                previews.get(Rating.GOOD),
                previews.get(Rating.EASY)
        );
    }
}
