package app.lexis.core.review.controller;

import app.lexis.core.review.controller.dto.AnswerCardRequest;
import app.lexis.core.review.controller.dto.CardPreviewResponse;
import app.lexis.core.review.controller.dto.ReviewAnswerResponse;
import app.lexis.core.review.controller.dto.ReviewQueueResponse;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/review")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    // GET /review/queue?deckId=...
    @GetMapping("/queue")
    public ReviewQueueResponse queue(@RequestParam(required = false) String deckId) {
        return reviewService.queue(deckId);
    }

    // GET /review/cards/{cardId}/preview
    @GetMapping("/cards/{cardId}/preview")
    public CardPreviewResponse preview(@PathVariable String cardId) {
        return reviewService.preview(cardId);
    }

    // POST /review/cards/{cardId}/answer
    @PostMapping("/cards/{cardId}/answer")
    public ReviewAnswerResponse answer(@PathVariable String cardId,
                                       @Valid @RequestBody AnswerCardRequest req) {
        Rating rating = Rating.fromString(req.rating());
        return reviewService.submitReview(cardId, rating);
    }
}
