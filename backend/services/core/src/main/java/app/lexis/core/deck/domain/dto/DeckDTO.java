package app.lexis.core.deck.domain.dto;

import app.lexis.core.deck.domain.entity.DeckEntity;

import java.time.Instant;

public record DeckDTO(
        String deckId,
        String name,
        String description,
        Instant createdAt
) {
    public static DeckDTO of(DeckEntity e) {
        return new DeckDTO(e.getDeckId(), e.getName(), e.getDescription(), e.getCreatedAt());
    }
}
