package app.lexis.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "study_preferences")
public class StudyPreferencesEntity {

    public static final short SINGLETON_ID = 1;

    @Id
    @Column(name = "preferences_id", nullable = false)
    private Short preferencesId;

    @Column(name = "daily_limit", nullable = false)
    private int dailyLimit;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Short getPreferencesId() {
        return preferencesId;
    }

    public void setPreferencesId(Short preferencesId) {
        this.preferencesId = preferencesId;
    }

    public int getDailyLimit() {
        return dailyLimit;
    }

    public void setDailyLimit(int dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
