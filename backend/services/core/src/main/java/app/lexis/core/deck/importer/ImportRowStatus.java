package app.lexis.core.deck.importer;

public enum ImportRowStatus {
    ADDED,
    DUPLICATE,
    INVALID
}
