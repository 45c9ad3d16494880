package app.lexis.core.review.entity;

import app.lexis.core.review.domain.Rating;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * One rating submission. Rows are only ever inserted.
 */
@Entity
@Table(name = "review_logs")
public class ReviewLogEntity {

    public static final int ID_MAX_LENGTH = 64;

    @Id
    @Column(name = "log_id", nullable = false, length = ID_MAX_LENGTH)
    private String logId;

    @Column(name = "card_id", nullable = false, length = ID_MAX_LENGTH)
    private String cardId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating", nullable = false, length = 16)
    private Rating rating;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    public ReviewLogEntity() {
    }

    public ReviewLogEntity(String logId, String cardId, Rating rating, Instant reviewedAt) {
        this.logId = logId;
        this.cardId = cardId;
        this.rating = rating;
        this.reviewedAt = reviewedAt;
    }

    public String getLogId() {
        return logId;
    }

    public String getCardId() {
        return cardId;
    }

    public Rating getRating() {
        return rating;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }
}
