package app.lexis.core.sync.client;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.dto.DeckDTO;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.entity.DeckEntity;
import app.lexis.core.review.algorithm.SchedulingState;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.domain.dto.ReviewLogDTO;
import app.lexis.core.review.entity.ReviewLogEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Converts between local records and remote documents. Remote documents that
 * cannot be adopted (no id, no term, unknown rating, a field longer than its
 * column) map to {@code null}.
 */
@Component
public class RemoteRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(RemoteRecordMapper.class);

    private static final double DEFAULT_EASE_FACTOR = 2.5;

    private final Clock clock;

    public RemoteRecordMapper(Clock clock) {
        this.clock = clock;
    }

    public RemoteCard toRemote(CardDTO card) {
        return new RemoteCard(
                card.cardId(),
                card.term(),
                card.meaning(),
                card.explanation(),
                card.phonetic(),
                card.deckId(),
                toMillis(card.createdAt()),
                toMillis(card.updatedAt()),
                card.easeFactor(),
                card.intervalDays(),
                card.repetitions(),
                card.step(),
                toMillis(card.nextReviewAt())
        );
    }

    public RemoteDeck toRemote(DeckDTO deck) {
        return new RemoteDeck(deck.deckId(), deck.name(), deck.description(), toMillis(deck.createdAt()));
    }

    public RemoteReviewLog toRemote(ReviewLogDTO reviewLog) {
        return new RemoteReviewLog(
                reviewLog.logId(),
                reviewLog.cardId(),
                reviewLog.rating().code(),
                toMillis(reviewLog.reviewedAt())
        );
    }

    public Object toRemote(Object snapshot) {
        if (snapshot instanceof CardDTO card) return toRemote(card);
        if (snapshot instanceof DeckDTO deck) return toRemote(deck);
        if (snapshot instanceof ReviewLogDTO reviewLog) return toRemote(reviewLog);
        throw new IllegalArgumentException("Unsupported snapshot type: " + snapshot.getClass().getName());
    }

    public CardEntity toEntity(RemoteCard remote) {
        if (remote == null || isBlank(remote.id()) || isBlank(remote.term())) {
            log.warn("Skipping remote card without id or term: {}", remote == null ? null : remote.id());
            return null;
        }
        if (exceeds(remote.id(), CardEntity.ID_MAX_LENGTH)
                || exceeds(remote.term().trim(), CardEntity.TERM_MAX_LENGTH)
                || exceeds(remote.meaning(), CardEntity.MEANING_MAX_LENGTH)
                || exceeds(remote.explanation(), CardEntity.EXPLANATION_MAX_LENGTH)
                || exceeds(remote.phonetic(), CardEntity.PHONETIC_MAX_LENGTH)
                || exceeds(remote.deckId(), CardEntity.ID_MAX_LENGTH)) {
            log.warn("Skipping remote card {}: a field exceeds its local column size", abbreviate(remote.id()));
            return null;
        }
        Instant now = clock.instant();

        // normalizes interval/ease/repetitions into their valid ranges
        SchedulingState state = new SchedulingState(
                orZero(remote.interval()),
                remote.easeFactor() == null ? DEFAULT_EASE_FACTOR : remote.easeFactor(),
                remote.repetitions() == null ? 0 : remote.repetitions(),
                remote.step() == null ? 0 : remote.step()
        );

        CardEntity e = new CardEntity();
        e.setCardId(remote.id());
        e.setTerm(remote.term().trim());
        e.setMeaning(remote.meaning());
        e.setExplanation(remote.explanation());
        e.setPhonetic(remote.phonetic());
        e.setDeckId(isBlank(remote.deckId()) ? null : remote.deckId());
        e.setCreatedAt(remote.createdAt() == null ? now : Instant.ofEpochMilli(remote.createdAt()));
        e.applySchedulingState(
                state,
                remote.nextReview() == null ? null : Instant.ofEpochMilli(remote.nextReview()),
                remote.lastUpdated() == null ? e.getCreatedAt() : Instant.ofEpochMilli(remote.lastUpdated())
        );
        return e;
    }

    public DeckEntity toEntity(RemoteDeck remote) {
        if (remote == null || isBlank(remote.id()) || isBlank(remote.name())) {
            log.warn("Skipping remote deck without id or name: {}", remote == null ? null : remote.id());
            return null;
        }
        if (exceeds(remote.id(), DeckEntity.ID_MAX_LENGTH)
                || exceeds(remote.name(), DeckEntity.NAME_MAX_LENGTH)
                || exceeds(remote.description(), DeckEntity.DESCRIPTION_MAX_LENGTH)) {
            log.warn("Skipping remote deck {}: a field exceeds its local column size", abbreviate(remote.id()));
            return null;
        }
        Instant createdAt = remote.createdAt() == null ? clock.instant() : Instant.ofEpochMilli(remote.createdAt());
        return new DeckEntity(remote.id(), remote.name(), remote.description(), createdAt);
    }

    public ReviewLogEntity toEntity(RemoteReviewLog remote) {
        if (remote == null || isBlank(remote.id()) || isBlank(remote.cardId()) || remote.timestamp() == null) {
            log.warn("Skipping incomplete remote review log: {}", remote == null ? null : remote.id());
            return null;
        }
        if (exceeds(remote.id(), ReviewLogEntity.ID_MAX_LENGTH) || exceeds(remote.cardId(), ReviewLogEntity.ID_MAX_LENGTH)) {
            log.warn("Skipping remote review log {}: id exceeds its local column size", abbreviate(remote.id()));
            return null;
        }
        Rating rating;
        try {
            rating = Rating.fromString(remote.rating());
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping remote review log {}: {}", remote.id(), ex.getMessage());
            return null;
        }
        return new ReviewLogEntity(remote.id(), remote.cardId(), rating, Instant.ofEpochMilli(remote.timestamp()));
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static double orZero(Double v) {
        return v == null || v.isNaN() ? 0.0 : v;
    }

    private static boolean exceeds(String value, int max) {
        return value != null && value.length() > max;
    }

    private static String abbreviate(String id) {
        return id.length() <= 64 ? id : id.substring(0, 64) + "...";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
