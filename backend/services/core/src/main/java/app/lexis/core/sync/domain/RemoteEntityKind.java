package app.lexis.core.sync.domain;

public enum RemoteEntityKind {
    CARDS("flashcards"),
    DECKS("decks"),
    REVIEW_LOGS("logs");

    private final String collection;

    RemoteEntityKind(String collection) {
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }
}
