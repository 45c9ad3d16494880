package app.lexis.core.review.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Rating {
    AGAIN, HARD, GOOD, EASY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Rating is required");
        }
        String normalized = v.trim().toUpperCase(Locale.ROOT);
        for (Rating r : values()) {
            if (r.name().equals(normalized)) return r;
        }
        throw new IllegalArgumentException("Unsupported rating: " + v);
    }

    public boolean isLapse() {
        return this == AGAIN;
    }
}
