package app.lexis.core.review.domain;

import java.util.Locale;

public enum HistoryRange {
    WEEK(7),
    MONTH(30),
    YEAR(365);

    private final int days;

    HistoryRange(int days) {
        this.days = days;
    }

    public int days() {
        return days;
    }

    public static HistoryRange fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return WEEK;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown history range: " + raw);
        }
    }
}
