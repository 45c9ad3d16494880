package app.lexis.core.deck.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "decks")
public class DeckEntity {

    public static final int ID_MAX_LENGTH = 64;
    public static final int NAME_MAX_LENGTH = 255;
    public static final int DESCRIPTION_MAX_LENGTH = 2000;

    @Id
    @Column(name = "deck_id", nullable = false, length = ID_MAX_LENGTH)
    private String deckId;

    @Column(name = "name", nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(name = "description", length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public DeckEntity() {
    }

    public DeckEntity(String deckId, String name, String description, Instant createdAt) {
        this.deckId = deckId;
        this.name = name;
        this.description = description;
        this.createdAt = createdAt;
    }

    public String getDeckId() {
        return deckId;
    }

    public void setDeckId(String deckId) {
        this.deckId = deckId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
