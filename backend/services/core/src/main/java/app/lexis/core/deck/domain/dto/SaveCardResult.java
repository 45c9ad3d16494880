package app.lexis.core.deck.domain.dto;

/**
 * Outcome of saving a lookup result as a card. A duplicate term is reported,
 * not thrown.
 */
public record SaveCardResult(
        boolean added,
        CardDTO card,
        String reason
) {
    public static SaveCardResult added(CardDTO card) {
        return new SaveCardResult(true, card, null);
    }

    public static SaveCardResult duplicate(String term) {
        return new SaveCardResult(false, null, "Card already exists: " + term);
    }
}
