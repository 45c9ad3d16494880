package app.lexis.core.support;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.review.algorithm.SchedulingState;

import java.time.Instant;

public final class CardFixtures {

    private CardFixtures() {
    }

    public static CardEntity card(String id, String deckId, double intervalDays, int repetitions, Instant nextReviewAt) {
        CardEntity c = new CardEntity();
        c.setCardId(id);
        c.setTerm("term-" + id);
        c.setMeaning("meaning-" + id);
        c.setDeckId(deckId);
        c.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        c.applySchedulingState(new SchedulingState(intervalDays, 2.5, repetitions, 0), nextReviewAt, c.getCreatedAt());
        return c;
    }
}
