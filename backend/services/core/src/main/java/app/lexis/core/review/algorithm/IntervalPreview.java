package app.lexis.core.review.algorithm;

import java.time.Instant;
import java.util.Locale;

public record IntervalPreview(
        double intervalDays,
        Instant nextReviewAt,
        String display
) {
    private static final double MINUTES_PER_DAY = 24 * 60;
    private static final double DAYS_PER_YEAR = 365.0;

    static String describe(double intervalDays) {
        if (intervalDays < 1.0) {
            long minutes = Math.max(1, Math.round(intervalDays * MINUTES_PER_DAY));
            return minutes + "m";
        }
        if (intervalDays < DAYS_PER_YEAR) {
            return Math.round(intervalDays) + "d";
        }
        return String.format(Locale.ROOT, "%.1fy", intervalDays / DAYS_PER_YEAR);
    }
}
