package app.lexis.core.deck.domain.dto;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.review.domain.CardPhase;

import java.time.Instant;

public record CardDTO(
        String cardId,
        String term,
        String meaning,
        String explanation,
        String phonetic,
        String deckId,
        Instant createdAt,
        Instant updatedAt,
        double intervalDays,
        double easeFactor,
        int repetitions,
        int step,
        Instant nextReviewAt,
        CardPhase phase
) {
    public static CardDTO of(CardEntity e) {
        return new CardDTO(
                e.getCardId(),
                e.getTerm(),
                e.getMeaning(),
                e.getExplanation(),
                e.getPhonetic(),
                e.getDeckId(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.getIntervalDays(),
                e.getEaseFactor(),
                e.getRepetitions(),
                e.getStep(),
                e.getNextReviewAt(),
                CardPhase.of(e.getIntervalDays())
        );
    }
}
