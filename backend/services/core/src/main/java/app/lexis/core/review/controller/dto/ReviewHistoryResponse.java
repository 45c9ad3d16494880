package app.lexis.core.review.controller.dto;

import app.lexis.core.review.domain.HistoryRange;

import java.time.LocalDate;
import java.util.List;

public record ReviewHistoryResponse(
        HistoryRange range,
        long total,
        List<DayPoint> days
) {
    public record DayPoint(
            LocalDate date,
            long reviewCount
    ) {
    }
}
