package app.lexis.core.review.controller.dto;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.review.domain.dto.ReviewLogDTO;

public record ReviewAnswerResponse(
        CardDTO card,
        ReviewLogDTO log
) {
}
