package app.lexis.core.sync.domain;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.dto.DeckDTO;
import app.lexis.core.review.domain.dto.ReviewLogDTO;

/**
 * A committed local write that should be mirrored remotely.
 * {@code snapshot} is {@code null} for deletions.
 */
public record LocalChangeEvent(
        RemoteEntityKind kind,
        String id,
        Object snapshot
) {
    public static LocalChangeEvent upsert(CardDTO card) {
        return new LocalChangeEvent(RemoteEntityKind.CARDS, card.cardId(), card);
    }

    public static LocalChangeEvent upsert(DeckDTO deck) {
        return new LocalChangeEvent(RemoteEntityKind.DECKS, deck.deckId(), deck);
    }

    public static LocalChangeEvent upsert(ReviewLogDTO log) {
        return new LocalChangeEvent(RemoteEntityKind.REVIEW_LOGS, log.logId(), log);
    }

    public static LocalChangeEvent delete(RemoteEntityKind kind, String id) {
        return new LocalChangeEvent(kind, id, null);
    }

    public boolean isDelete() {
        return snapshot == null;
    }
}
