package app.lexis.core.review.controller.dto;

import app.lexis.core.deck.domain.dto.CardDTO;

import java.util.List;

public record ReviewQueueResponse(
        List<QueueCard> cards,
        long studiedToday,
        int dailyLimit,
        int dueTotal,
        int backlog
) {
    public record QueueCard(
            CardDTO card,
            CardPreviewResponse preview
    ) {
    }
}
