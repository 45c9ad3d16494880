package app.lexis.core.review.service;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.review.controller.dto.ReviewHistoryResponse;
import app.lexis.core.review.controller.dto.ReviewStatsResponse;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.review.domain.HistoryRange;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.entity.ReviewLogEntity;
import app.lexis.core.review.repository.ReviewLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static app.lexis.core.support.CardFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewStatsServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final Instant MIDNIGHT = Instant.parse("2024-03-10T00:00:00Z");

    @Mock
    CardRepository cardRepository;

    @Mock
    ReviewLogRepository reviewLogRepository;

    @Mock
    StudyPreferencesService preferencesService;

    ReviewStatsService service;

    @BeforeEach
    void setup() {
        service = new ReviewStatsService(
                cardRepository,
                reviewLogRepository,
                preferencesService,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void counts_areExclusiveAndMatureIncludesMastered() {
        List<CardEntity> cards = List.of(
                card("new", null, 0.0, 0, NOW),
                card("learning", null, 10.0 / 1440, 1, NOW),
                card("relearning", null, 1.0 / 1440, 0, NOW),
                card("young", null, 20.9, 4, NOW),
                card("mature", null, 21.0, 6, NOW),
                card("mastered", null, 10000.0, 3, NOW)
        );

        ReviewStatsResponse.Counts counts = ReviewStatsService.counts(cards);

        assertThat(counts.newCards()).isEqualTo(1);
        assertThat(counts.learning()).isEqualTo(2);
        assertThat(counts.young()).isEqualTo(1);
        assertThat(counts.mature()).isEqualTo(2);
        assertThat(counts.total()).isEqualTo(6);
        assertThat(counts.newCards() + counts.learning() + counts.young() + counts.mature()).isEqualTo(counts.total());
    }

    @Test
    void forecast_bucketsAddUpToNonMasteredCardsWithDueDate() {
        List<CardEntity> cards = List.of(
                card("overdue", null, 3.0, 2, NOW.minus(Duration.ofDays(4))),
                card("today", null, 10.0 / 1440, 1, NOW.plus(Duration.ofMinutes(10))),
                card("in5", null, 30.0, 5, NOW.plus(Duration.ofDays(5))),
                card("far", null, 500.0, 9, NOW.plus(Duration.ofDays(400))),
                card("mastered", null, 10000.0, 3, NOW.plus(Duration.ofDays(10000))),
                card("unscheduled", null, 0.0, 0, null)
        );

        ReviewStatsResponse.Forecast forecast = service.forecast(cards);

        assertThat(forecast.days()).hasSize(ReviewStatsService.FORECAST_DAYS);
        assertThat(forecast.days().get(0).young()).isEqualTo(2);
        assertThat(forecast.days().get(5).mature()).isEqualTo(1);
        assertThat(forecast.days().get(5).date()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(forecast.beyondHorizon()).isEqualTo(1);

        long inBuckets = forecast.days().stream().mapToLong(d -> d.young() + d.mature()).sum();
        assertThat(inBuckets + forecast.beyondHorizon()).isEqualTo(4);
    }

    @Test
    void intervalHistogram_hasInclusiveUpperBoundsAndSkipsMastered() {
        List<CardEntity> cards = List.of(
                card("a", null, 0.5, 1, NOW),
                card("b", null, 1.0, 1, NOW),
                card("c", null, 7.0, 2, NOW),
                card("d", null, 7.5, 2, NOW),
                card("e", null, 365.0, 8, NOW),
                card("f", null, 366.0, 8, NOW),
                card("g", null, 10000.0, 8, NOW)
        );

        List<ReviewStatsResponse.IntervalBucket> histogram = ReviewStatsService.intervalHistogram(cards);

        assertThat(histogram).extracting(ReviewStatsResponse.IntervalBucket::label)
                .containsExactly("0-1d", "2-7d", "8-30d", "31-90d", "91-180d", "181-365d", ">365d");
        assertThat(histogram).extracting(ReviewStatsResponse.IntervalBucket::count)
                .containsExactly(2L, 1L, 1L, 0L, 0L, 1L, 1L);
    }

    @Test
    void stats_reportsTodaySummaryAndDeckScope() {
        List<CardEntity> deckCards = List.of(
                card("c1", "d1", 3.0, 2, NOW.minusSeconds(60)),
                card("c2", "d1", 3.0, 2, NOW.minusSeconds(30)),
                card("c3", "d1", 10000.0, 4, NOW.plus(Duration.ofDays(10000)))
        );
        when(cardRepository.findByDeckId("d1")).thenReturn(deckCards);
        when(reviewLogRepository.findByReviewedAtGreaterThanEqual(MIDNIGHT)).thenReturn(List.of(
                new ReviewLogEntity("l1", "x", Rating.AGAIN, NOW.minusSeconds(3600)),
                new ReviewLogEntity("l2", "x", Rating.GOOD, NOW.minusSeconds(1800)),
                new ReviewLogEntity("l3", "y", Rating.EASY, NOW.minusSeconds(600))
        ));
        when(preferencesService.getDailyLimit()).thenReturn(4);
        when(cardRepository.findDueCandidatesInDeck("d1", NOW, CardPhase.MASTERED_INTERVAL_DAYS))
                .thenReturn(deckCards.subList(0, 2));

        ReviewStatsResponse stats = service.stats("d1");

        assertThat(stats.deckId()).isEqualTo("d1");
        assertThat(stats.today().studied()).isEqualTo(3);
        assertThat(stats.today().againCount()).isEqualTo(1);
        assertThat(stats.today().passedCount()).isEqualTo(2);
        assertThat(stats.today().dailyLimit()).isEqualTo(4);
        assertThat(stats.summary().due()).isEqualTo(2);
        assertThat(stats.summary().backlog()).isEqualTo(1);
        assertThat(stats.summary().mastered()).isEqualTo(1);
        assertThat(stats.counts().total()).isEqualTo(3);
    }

    @Test
    void history_countsReviewsPerLocalDayIncludingEmptyDays() {
        when(reviewLogRepository.findByReviewedAtGreaterThanEqual(any())).thenReturn(List.of(
                new ReviewLogEntity("l1", "a", Rating.GOOD, Instant.parse("2024-03-04T08:00:00Z")),
                new ReviewLogEntity("l2", "a", Rating.HARD, Instant.parse("2024-03-04T21:00:00Z")),
                new ReviewLogEntity("l3", "b", Rating.AGAIN, Instant.parse("2024-03-10T07:00:00Z"))
        ));

        ReviewHistoryResponse history = service.history(HistoryRange.WEEK);

        assertThat(history.days()).hasSize(7);
        assertThat(history.days().get(0).date()).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(history.days().get(0).reviewCount()).isEqualTo(2);
        assertThat(history.days().get(6).date()).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(history.days().get(6).reviewCount()).isEqualTo(1);
        assertThat(history.days().get(3).reviewCount()).isZero();
        assertThat(history.total()).isEqualTo(3);
    }
}
