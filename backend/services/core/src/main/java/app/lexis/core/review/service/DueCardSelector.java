package app.lexis.core.review.service;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.review.repository.ReviewLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the "study now" queue: due, non-mastered cards, learning cards first,
 * capped by what is left of today's review limit.
 */
@Service
public class DueCardSelector {

    static final Comparator<CardEntity> STUDY_ORDER = Comparator
            .comparing((CardEntity c) -> CardPhase.of(c.getIntervalDays()) != CardPhase.LEARNING)
            .thenComparing(CardEntity::getNextReviewAt)
            .thenComparing(CardEntity::getCardId);

    private final CardRepository cardRepository;
    private final ReviewLogRepository reviewLogRepository;
    private final StudyPreferencesService preferencesService;
    private final Clock clock;

    public DueCardSelector(CardRepository cardRepository,
                           ReviewLogRepository reviewLogRepository,
                           StudyPreferencesService preferencesService,
                           Clock clock) {
        this.cardRepository = cardRepository;
        this.reviewLogRepository = reviewLogRepository;
        this.preferencesService = preferencesService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<CardEntity> dueCards(String deckId) {
        return select(deckId).cards();
    }

    /**
     * Same as {@link #dueCards(String)} with the numbers behind the cut.
     */
    @Transactional(readOnly = true)
    public Selection select(String deckId) {
        Instant now = clock.instant();
        List<CardEntity> due = allDue(deckId, now);

        int limit = preferencesService.getDailyLimit();
        long studied = studiedToday();
        int quota = (int) Math.max(0, limit - studied);

        List<CardEntity> cards = due.size() > quota ? due.subList(0, quota) : due;
        return new Selection(List.copyOf(cards), due.size(), studied, limit);
    }

    /**
     * All due, non-mastered cards in study order, without the daily cap.
     */
    @Transactional(readOnly = true)
    public List<CardEntity> allDue(String deckId, Instant now) {
        List<CardEntity> candidates = deckId == null
                ? cardRepository.findDueCandidates(now, CardPhase.MASTERED_INTERVAL_DAYS)
                : cardRepository.findDueCandidatesInDeck(deckId, now, CardPhase.MASTERED_INTERVAL_DAYS);
        return candidates.stream()
                .sorted(STUDY_ORDER)
                .toList();
    }

    @Transactional(readOnly = true)
    public long studiedToday() {
        return reviewLogRepository.countByReviewedAtGreaterThanEqual(startOfToday());
    }

    Instant startOfToday() {
        return LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    }

    public record Selection(
            List<CardEntity> cards,
            int dueTotal,
            long studiedToday,
            int dailyLimit
    ) {
        public int backlog() {
            return dueTotal - cards.size();
        }
    }
}
