package app.lexis.core.deck.domain.entity;

import app.lexis.core.review.algorithm.SchedulingState;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "cards")
public class CardEntity {

    public static final int ID_MAX_LENGTH = 64;
    public static final int TERM_MAX_LENGTH = 255;
    public static final int MEANING_MAX_LENGTH = 255;
    public static final int EXPLANATION_MAX_LENGTH = 4000;
    public static final int PHONETIC_MAX_LENGTH = 255;

    @Id
    @Column(name = "card_id", nullable = false, length = ID_MAX_LENGTH)
    private String cardId;

    @Column(name = "term", nullable = false, length = TERM_MAX_LENGTH)
    private String term;

    @Column(name = "meaning", length = MEANING_MAX_LENGTH)
    private String meaning;

    @Column(name = "explanation", length = EXPLANATION_MAX_LENGTH)
    private String explanation;

    @Column(name = "phonetic", length = PHONETIC_MAX_LENGTH)
    private String phonetic;

    @Column(name = "deck_id", length = ID_MAX_LENGTH)
    private String deckId; // NULL = uncategorized

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "interval_days", nullable = false)
    private double intervalDays;

    @Column(name = "ease_factor", nullable = false)
    private double easeFactor;

    @Column(name = "repetitions", nullable = false)
    private int repetitions;

    @Column(name = "step", nullable = false)
    private int step;

    @Column(name = "next_review_at")
    private Instant nextReviewAt;

    public CardEntity() {
    }

    public SchedulingState schedulingState() {
        return new SchedulingState(intervalDays, easeFactor, repetitions, step);
    }

    public void applySchedulingState(SchedulingState state, Instant nextReviewAt, Instant now) {
        this.intervalDays = state.intervalDays();
        this.easeFactor = state.easeFactor();
        this.repetitions = state.repetitions();
        this.step = state.step();
        this.nextReviewAt = nextReviewAt;
        this.updatedAt = now;
    }

    public String getCardId() {
        return cardId;
    }

    public void setCardId(String cardId) {
        this.cardId = cardId;
    }

    public String getTerm() {
        return term;
    }

    public void setTerm(String term) {
        this.term = term;
    }

    public String getMeaning() {
        return meaning;
    }

    public void setMeaning(String meaning) {
        this.meaning = meaning;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    public String getPhonetic() {
        return phonetic;
    }

    public void setPhonetic(String phonetic) {
        this.phonetic = phonetic;
    }

    public String getDeckId() {
        return deckId;
    }

    public void setDeckId(String deckId) {
        this.deckId = deckId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public double getIntervalDays() {
        return intervalDays;
    }

    public void setIntervalDays(double intervalDays) {
        this.intervalDays = intervalDays;
    }

    public double getEaseFactor() {
        return easeFactor;
    }

    public void setEaseFactor(double easeFactor) {
        this.easeFactor = easeFactor;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public void setRepetitions(int repetitions) {
        this.repetitions = repetitions;
    }

    public int getStep() {
        return step;
    }

    public void setStep(int step) {
        this.step = step;
    }

    public Instant getNextReviewAt() {
        return nextReviewAt;
    }

    public void setNextReviewAt(Instant nextReviewAt) {
        this.nextReviewAt = nextReviewAt;
    }
}
