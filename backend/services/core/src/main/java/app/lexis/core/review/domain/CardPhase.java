package app.lexis.core.review.domain;

/**
 * Scheduling phase of a card, derived from its interval.
 * <pre>
 *  LEARNING - interval below one day, walking the minute ladder
 *  REVIEW   - day-granularity intervals
 *  MASTERED - interval at or beyond {@link #MASTERED_INTERVAL_DAYS}, never due again
 * </pre>
 * All phase checks go through {@link #of(double)}.
 */
public enum CardPhase {
    LEARNING,
    REVIEW,
    MASTERED;

    public static final double MASTERED_INTERVAL_DAYS = 10000.0;

    public static CardPhase of(double intervalDays) {
        if (intervalDays >= MASTERED_INTERVAL_DAYS) return MASTERED;
        if (intervalDays >= 1.0) return REVIEW;
        return LEARNING;
    }

    public boolean isMastered() {
        return this == MASTERED;
    }
}
