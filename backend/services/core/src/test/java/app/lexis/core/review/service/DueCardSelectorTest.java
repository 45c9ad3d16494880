package app.lexis.core.review.service;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.review.repository.ReviewLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static app.lexis.core.support.CardFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DueCardSelectorTest {

    private static final Instant NOW = Instant.parse("2024-03-10T15:30:00Z");

    @Mock
    CardRepository cardRepository;

    @Mock
    ReviewLogRepository reviewLogRepository;

    @Mock
    StudyPreferencesService preferencesService;

    DueCardSelector selector;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(NOW, ZoneId.of("Europe/Berlin"));
        selector = new DueCardSelector(cardRepository, reviewLogRepository, preferencesService, clock);
    }

    @Test
    void dueCards_putsLearningBeforeReviewThenOrdersByDueTime() {
        CardEntity reviewEarly = card("r1", null, 3.0, 2, NOW.minusSeconds(7200));
        CardEntity reviewLate = card("r2", null, 3.0, 2, NOW.minusSeconds(60));
        CardEntity learningLate = card("l1", null, 10.0 / 1440, 1, NOW.minusSeconds(30));
        CardEntity learningEarly = card("l2", null, 1.0 / 1440, 0, NOW.minusSeconds(600));

        when(cardRepository.findDueCandidates(NOW, CardPhase.MASTERED_INTERVAL_DAYS))
                .thenReturn(List.of(reviewLate, learningLate, reviewEarly, learningEarly));
        when(preferencesService.getDailyLimit()).thenReturn(50);
        when(reviewLogRepository.countByReviewedAtGreaterThanEqual(any())).thenReturn(0L);

        List<CardEntity> due = selector.dueCards(null);

        assertThat(due).extracting(CardEntity::getCardId).containsExactly("l2", "l1", "r1", "r2");
    }

    @Test
    void dueCards_breaksTiesById() {
        CardEntity b = card("b", null, 2.0, 1, NOW.minusSeconds(60));
        CardEntity a = card("a", null, 2.0, 1, NOW.minusSeconds(60));

        when(cardRepository.findDueCandidates(NOW, CardPhase.MASTERED_INTERVAL_DAYS)).thenReturn(List.of(b, a));
        when(preferencesService.getDailyLimit()).thenReturn(50);
        when(reviewLogRepository.countByReviewedAtGreaterThanEqual(any())).thenReturn(0L);

        assertThat(selector.dueCards(null)).extracting(CardEntity::getCardId).containsExactly("a", "b");
    }

    @Test
    void select_capsByWhatIsLeftOfDailyLimit() {
        List<CardEntity> candidates = List.of(
                card("c1", "d1", 2.0, 1, NOW.minusSeconds(500)),
                card("c2", "d1", 2.0, 1, NOW.minusSeconds(400)),
                card("c3", "d1", 2.0, 1, NOW.minusSeconds(300)),
                card("c4", "d1", 2.0, 1, NOW.minusSeconds(200))
        );
        when(cardRepository.findDueCandidatesInDeck("d1", NOW, CardPhase.MASTERED_INTERVAL_DAYS)).thenReturn(candidates);
        when(preferencesService.getDailyLimit()).thenReturn(10);
        when(reviewLogRepository.countByReviewedAtGreaterThanEqual(any())).thenReturn(8L);

        DueCardSelector.Selection selection = selector.select("d1");

        assertThat(selection.cards()).extracting(CardEntity::getCardId).containsExactly("c1", "c2");
        assertThat(selection.dueTotal()).isEqualTo(4);
        assertThat(selection.backlog()).isEqualTo(2);
        assertThat(selection.studiedToday()).isEqualTo(8);
    }

    @Test
    void dueCards_isEmptyWhenLimitAlreadyReached() {
        when(cardRepository.findDueCandidates(NOW, CardPhase.MASTERED_INTERVAL_DAYS))
                .thenReturn(List.of(card("c1", null, 2.0, 1, NOW.minusSeconds(10))));
        when(preferencesService.getDailyLimit()).thenReturn(5);
        when(reviewLogRepository.countByReviewedAtGreaterThanEqual(any())).thenReturn(7L);

        assertThat(selector.dueCards(null)).isEmpty();
    }

    @Test
    void studiedToday_countsFromLocalMidnight() {
        when(reviewLogRepository.countByReviewedAtGreaterThanEqual(any())).thenReturn(3L);

        assertThat(selector.studiedToday()).isEqualTo(3);

        // 2024-03-10 00:00 in Berlin (UTC+1)
        verify(reviewLogRepository).countByReviewedAtGreaterThanEqual(eq(Instant.parse("2024-03-09T23:00:00Z")));
    }
}
