package app.lexis.core.review.service;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.review.controller.dto.ReviewHistoryResponse;
import app.lexis.core.review.controller.dto.ReviewStatsResponse;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.review.domain.HistoryRange;
import app.lexis.core.review.entity.ReviewLogEntity;
import app.lexis.core.review.repository.ReviewLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregates over cards and the review log. Nothing is cached;
 * every call recomputes from the store.
 */
@Service
public class ReviewStatsService {

    static final int FORECAST_DAYS = 365;
    static final double MATURE_INTERVAL_DAYS = 21.0;

    // inclusive upper bounds in days; the last bucket is open
    private static final double[] HISTOGRAM_UPPER = {1, 7, 30, 90, 180, 365};
    private static final String[] HISTOGRAM_LABELS = {"0-1d", "2-7d", "8-30d", "31-90d", "91-180d", "181-365d", ">365d"};

    private final CardRepository cardRepository;
    private final ReviewLogRepository reviewLogRepository;
    private final StudyPreferencesService preferencesService;
    private final Clock clock;

    public ReviewStatsService(CardRepository cardRepository,
                              ReviewLogRepository reviewLogRepository,
                              StudyPreferencesService preferencesService,
                              Clock clock) {
        this.cardRepository = cardRepository;
        this.reviewLogRepository = reviewLogRepository;
        this.preferencesService = preferencesService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ReviewStatsResponse stats(String deckId) {
        Instant now = clock.instant();
        List<CardEntity> cards = deckId == null
                ? cardRepository.findAll()
                : cardRepository.findByDeckId(deckId);

        ReviewStatsResponse.Today today = today();
        return new ReviewStatsResponse(
                deckId,
                today,
                counts(cards),
                summary(deckId, cards, today, now),
                forecast(cards),
                intervalHistogram(cards)
        );
    }

    @Transactional(readOnly = true)
    public ReviewHistoryResponse history(HistoryRange range) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(range.days() - 1L);

        Map<LocalDate, Long> perDay = new HashMap<>();
        for (ReviewLogEntity entry : reviewLogRepository.findByReviewedAtGreaterThanEqual(from.atStartOfDay(zone).toInstant())) {
            perDay.merge(entry.getReviewedAt().atZone(zone).toLocalDate(), 1L, Long::sum);
        }

        List<ReviewHistoryResponse.DayPoint> days = new ArrayList<>(range.days());
        long total = 0;
        for (LocalDate d = from; !d.isAfter(today); d = d.plusDays(1)) {
            long count = perDay.getOrDefault(d, 0L);
            total += count;
            days.add(new ReviewHistoryResponse.DayPoint(d, count));
        }
        return new ReviewHistoryResponse(range, total, days);
    }

    ReviewStatsResponse.Today today() {
        List<ReviewLogEntity> logs = reviewLogRepository.findByReviewedAtGreaterThanEqual(startOfToday());
        long again = logs.stream().filter(l -> l.getRating().isLapse()).count();
        return new ReviewStatsResponse.Today(
                logs.size(),
                preferencesService.getDailyLimit(),
                again,
                logs.size() - again
        );
    }

    private Instant startOfToday() {
        return LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    }

    static ReviewStatsResponse.Counts counts(List<CardEntity> cards) {
        long fresh = 0;
        long learning = 0;
        long young = 0;
        long mature = 0;
        for (CardEntity c : cards) {
            double interval = c.getIntervalDays();
            if (c.getRepetitions() == 0 && interval == 0.0) {
                fresh++;
            } else if (interval < 1.0) {
                learning++;
            } else if (interval < MATURE_INTERVAL_DAYS) {
                young++;
            } else {
                mature++;
            }
        }
        return new ReviewStatsResponse.Counts(fresh, learning, young, mature, cards.size());
    }

    private ReviewStatsResponse.Summary summary(String deckId,
                                                List<CardEntity> cards,
                                                ReviewStatsResponse.Today today,
                                                Instant now) {
        int due = (deckId == null
                ? cardRepository.findDueCandidates(now, CardPhase.MASTERED_INTERVAL_DAYS)
                : cardRepository.findDueCandidatesInDeck(deckId, now, CardPhase.MASTERED_INTERVAL_DAYS)).size();
        long remaining = Math.max(0, today.dailyLimit() - today.studied());
        int backlog = (int) Math.max(0, due - remaining);
        long mastered = cards.stream()
                .filter(c -> CardPhase.of(c.getIntervalDays()).isMastered())
                .count();
        return new ReviewStatsResponse.Summary(due, backlog, mastered);
    }

    /**
     * Daily due counts for the next year. Overdue cards land on day 0, cards
     * due later than the horizon are only counted in {@code beyondHorizon}.
     */
    ReviewStatsResponse.Forecast forecast(List<CardEntity> cards) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        long[] young = new long[FORECAST_DAYS];
        long[] mature = new long[FORECAST_DAYS];
        long beyond = 0;

        for (CardEntity c : cards) {
            if (c.getNextReviewAt() == null || CardPhase.of(c.getIntervalDays()).isMastered()) {
                continue;
            }
            long offset = ChronoUnit.DAYS.between(today, c.getNextReviewAt().atZone(zone).toLocalDate());
            if (offset >= FORECAST_DAYS) {
                beyond++;
                continue;
            }
            int day = (int) Math.max(0, offset);
            if (c.getIntervalDays() >= MATURE_INTERVAL_DAYS) {
                mature[day]++;
            } else {
                young[day]++;
            }
        }

        List<ReviewStatsResponse.ForecastDay> days = new ArrayList<>(FORECAST_DAYS);
        for (int i = 0; i < FORECAST_DAYS; i++) {
            days.add(new ReviewStatsResponse.ForecastDay(i, today.plusDays(i), young[i], mature[i]));
        }
        return new ReviewStatsResponse.Forecast(days, beyond);
    }

    static List<ReviewStatsResponse.IntervalBucket> intervalHistogram(List<CardEntity> cards) {
        long[] counts = new long[HISTOGRAM_LABELS.length];
        for (CardEntity c : cards) {
            double interval = c.getIntervalDays();
            if (CardPhase.of(interval).isMastered()) {
                continue;
            }
            counts[bucketOf(interval)]++;
        }
        List<ReviewStatsResponse.IntervalBucket> out = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            out.add(new ReviewStatsResponse.IntervalBucket(HISTOGRAM_LABELS[i], counts[i]));
        }
        return out;
    }

    private static int bucketOf(double intervalDays) {
        for (int i = 0; i < HISTOGRAM_UPPER.length; i++) {
            if (intervalDays <= HISTOGRAM_UPPER[i]) {
                return i;
            }
        }
        return HISTOGRAM_UPPER.length;
    }
}
