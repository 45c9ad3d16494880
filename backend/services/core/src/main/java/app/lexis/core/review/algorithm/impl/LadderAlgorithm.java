package app.lexis.core.review.algorithm.impl;

import app.lexis.core.config.StudyProps;
import app.lexis.core.review.algorithm.SchedulingState;
import app.lexis.core.review.algorithm.SrsAlgorithm;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * SM-2 style scheduler with a minute-granularity learning ladder.
 * <p>
 * New and lapsed cards walk the ladder; "good" on the last step graduates the
 * card to a one day interval. Review cards grow by the ease factor. "easy" is
 * an escape hatch that parks the card at {@link CardPhase#MASTERED_INTERVAL_DAYS}.
 */
@Component
public class LadderAlgorithm implements SrsAlgorithm {

    static final double GRADUATING_INTERVAL_DAYS = 1.0;
    static final double HARD_INTERVAL_MULTIPLIER = 1.2;
    static final double LAPSE_EASE_PENALTY = 0.2;
    static final double HARD_EASE_PENALTY = 0.15;

    private static final double MINUTES_PER_DAY = 24 * 60;

    private final List<Integer> stepsMinutes;
    private final int hardStepMinutes;
    private final double initialEaseFactor;

    public LadderAlgorithm(StudyProps props) {
        this.stepsMinutes = props.learningStepsMinutes();
        this.hardStepMinutes = props.hardStepMinutes();
        this.initialEaseFactor = props.initialEaseFactor();
    }

    @Override
    public SchedulingState initialState() {
        return SchedulingState.fresh(initialEaseFactor);
    }

    @Override
    public ReviewComputation computeNext(SchedulingState state, Rating rating, Instant now) {
        SchedulingState st = state == null ? initialState() : state;

        if (rating == Rating.EASY) {
            SchedulingState next = new SchedulingState(
                    CardPhase.MASTERED_INTERVAL_DAYS,
                    st.easeFactor(),
                    st.repetitions() + 1,
                    0
            );
            return ReviewComputation.at(next, now);
        }

        SchedulingState next = switch (st.phase()) {
            case LEARNING -> learning(st, rating);
            case REVIEW, MASTERED -> review(st, rating);
        };
        return ReviewComputation.at(next, now);
    }

    private SchedulingState learning(SchedulingState st, Rating rating) {
        int lastStep = stepsMinutes.size() - 1;
        int step = Math.min(st.step(), lastStep);

        return switch (rating) {
            case AGAIN -> new SchedulingState(stepDays(0), st.easeFactor(), st.repetitions(), 0);
            case HARD -> new SchedulingState(minutesToDays(hardStepMinutes), st.easeFactor(), st.repetitions() + 1, step);
            case GOOD -> {
                if (step >= lastStep) {
                    yield new SchedulingState(GRADUATING_INTERVAL_DAYS, st.easeFactor(), st.repetitions() + 1, 0);
                }
                int nextStep = step + 1;
                yield new SchedulingState(stepDays(nextStep), st.easeFactor(), st.repetitions() + 1, nextStep);
            }
            case EASY -> throw new IllegalStateException("easy is handled before phase dispatch");
        };
    }

    private SchedulingState review(SchedulingState st, Rating rating) {
        double ef = st.easeFactor();
        double interval = st.intervalDays();

        return switch (rating) {
            case AGAIN -> {
                // lapse re-enters the ladder one step in, never at the top
                int lapseStep = Math.min(1, stepsMinutes.size() - 1);
                yield new SchedulingState(stepDays(lapseStep), ef - LAPSE_EASE_PENALTY, 0, lapseStep);
            }
            case HARD -> new SchedulingState(interval * HARD_INTERVAL_MULTIPLIER, ef - HARD_EASE_PENALTY, st.repetitions() + 1, 0);
            case GOOD -> new SchedulingState(interval * ef, ef, st.repetitions() + 1, 0);
            case EASY -> throw new IllegalStateException("easy is handled before phase dispatch");
        };
    }

    private double stepDays(int index) {
        return minutesToDays(stepsMinutes.get(index));
    }

    private static double minutesToDays(int minutes) {
        return Math.max(1, minutes) / MINUTES_PER_DAY;
    }
}
