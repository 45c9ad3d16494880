package app.lexis.core.review.controller;

import app.lexis.core.review.controller.dto.ReviewHistoryResponse;
import app.lexis.core.review.controller.dto.ReviewStatsResponse;
import app.lexis.core.review.domain.HistoryRange;
import app.lexis.core.review.service.ReviewStatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/review/stats")
public class ReviewStatsController {

    private final ReviewStatsService reviewStatsService;

    public ReviewStatsController(ReviewStatsService reviewStatsService) {
        this.reviewStatsService = reviewStatsService;
    }

    // GET /review/stats?deckId=...
    @GetMapping
    public ReviewStatsResponse stats(@RequestParam(required = false) String deckId) {
        return reviewStatsService.stats(deckId);
    }

    // GET /review/stats/history?range=week|month|year
    @GetMapping("/history")
    public ReviewHistoryResponse history(@RequestParam(required = false) String range) {
        return reviewStatsService.history(HistoryRange.fromString(range));
    }
}
