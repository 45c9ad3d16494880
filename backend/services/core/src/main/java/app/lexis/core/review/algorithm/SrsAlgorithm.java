package app.lexis.core.review.algorithm;

import app.lexis.core.review.domain.Rating;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

public interface SrsAlgorithm {

    SchedulingState initialState();

    ReviewComputation computeNext(SchedulingState state, Rating rating, Instant now);

    default Map<Rating, IntervalPreview> preview(SchedulingState state, Instant now) {
        Map<Rating, IntervalPreview> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            ReviewComputation c = computeNext(state, r, now);
            double days = c.state().intervalDays();
            out.put(r, new IntervalPreview(days, c.nextReviewAt(), IntervalPreview.describe(days)));
        }
        return out;
    }

    record ReviewComputation(
            SchedulingState state,
            Instant nextReviewAt
    ) {
        public static ReviewComputation at(SchedulingState state, Instant now) {
            long millis = Math.round(state.intervalDays() * Duration.ofDays(1).toMillis());
            return new ReviewComputation(state, now.plusMillis(millis));
        }
    }
}
