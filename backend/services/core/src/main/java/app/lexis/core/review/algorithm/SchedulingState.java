package app.lexis.core.review.algorithm;

import app.lexis.core.review.domain.CardPhase;

public record SchedulingState(
        double intervalDays,
        double easeFactor,
        int repetitions,
        int step
) {
    public static final double MINIMUM_EASE_FACTOR = 1.3;

    public SchedulingState {
        intervalDays = Math.max(0.0, intervalDays);
        easeFactor = Math.max(MINIMUM_EASE_FACTOR, easeFactor);
        repetitions = Math.max(0, repetitions);
        step = Math.max(0, step);
    }

    public static SchedulingState fresh(double initialEaseFactor) {
        return new SchedulingState(0.0, initialEaseFactor, 0, 0);
    }

    public CardPhase phase() {
        return CardPhase.of(intervalDays);
    }

    /**
     * Accumulated progress used to pick between two replicas of one card.
     */
    public double progress() {
        return repetitions + intervalDays;
    }
}
