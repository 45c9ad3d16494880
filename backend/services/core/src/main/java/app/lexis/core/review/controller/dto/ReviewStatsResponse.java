package app.lexis.core.review.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record ReviewStatsResponse(
        String deckId,
        Today today,
        Counts counts,
        Summary summary,
        Forecast forecast,
        List<IntervalBucket> intervals
) {
    public record Today(
            long studied,
            int dailyLimit,
            long againCount,
            long passedCount
    ) {
    }

    /**
     * Exclusive buckets; mature includes mastered cards.
     */
    public record Counts(
            long newCards,
            long learning,
            long young,
            long mature,
            long total
    ) {
    }

    public record Summary(
            int due,
            int backlog,
            long mastered
    ) {
    }

    public record Forecast(
            List<ForecastDay> days,
            long beyondHorizon
    ) {
    }

    public record ForecastDay(
            int dayOffset,
            LocalDate date,
            long young,
            long mature
    ) {
    }

    public record IntervalBucket(
            String label,
            long count
    ) {
    }
}
