package app.lexis.core.review.service;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.review.algorithm.SrsAlgorithm;
import app.lexis.core.review.controller.dto.CardPreviewResponse;
import app.lexis.core.review.controller.dto.ReviewAnswerResponse;
import app.lexis.core.review.controller.dto.ReviewQueueResponse;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.domain.dto.ReviewLogDTO;
import app.lexis.core.review.entity.ReviewLogEntity;
import app.lexis.core.review.repository.ReviewLogRepository;
import app.lexis.core.sync.domain.LocalChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final CardRepository cardRepository;
    private final ReviewLogRepository reviewLogRepository;
    private final SrsAlgorithm algorithm;
    private final DueCardSelector dueCardSelector;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public ReviewService(CardRepository cardRepository,
                         ReviewLogRepository reviewLogRepository,
                         SrsAlgorithm algorithm,
                         DueCardSelector dueCardSelector,
                         ApplicationEventPublisher events,
                         Clock clock) {
        this.cardRepository = cardRepository;
        this.reviewLogRepository = reviewLogRepository;
        this.algorithm = algorithm;
        this.dueCardSelector = dueCardSelector;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ReviewQueueResponse queue(String deckId) {
        DueCardSelector.Selection selection = dueCardSelector.select(deckId);
        Instant now = clock.instant();

        List<ReviewQueueResponse.QueueCard> cards = selection.cards().stream()
                .map(c -> new ReviewQueueResponse.QueueCard(
                        CardDTO.of(c),
                        CardPreviewResponse.of(c.getCardId(), algorithm.preview(c.schedulingState(), now))))
                .toList();

        return new ReviewQueueResponse(
                cards,
                selection.studiedToday(),
                selection.dailyLimit(),
                selection.dueTotal(),
                selection.backlog()
        );
    }

    @Transactional(readOnly = true)
    public CardPreviewResponse preview(String cardId) {
        CardEntity card = findCard(cardId);
        return CardPreviewResponse.of(cardId, algorithm.preview(card.schedulingState(), clock.instant()));
    }

    /**
     * Applies a rating: reschedules the card and appends a review log entry in
     * the same transaction. Both writes are mirrored remotely after commit.
     */
    @Transactional
    public ReviewAnswerResponse submitReview(String cardId, Rating rating) {
        if (rating == null) {
            throw new IllegalArgumentException("Rating is required");
        }
        CardEntity card = findCard(cardId);
        Instant now = clock.instant();

        SrsAlgorithm.ReviewComputation next = algorithm.computeNext(card.schedulingState(), rating, now);
        card.applySchedulingState(next.state(), next.nextReviewAt(), now);
        CardDTO saved = CardDTO.of(cardRepository.save(card));

        ReviewLogEntity entry = new ReviewLogEntity(UUID.randomUUID().toString(), cardId, rating, now);
        ReviewLogDTO logged = ReviewLogDTO.of(reviewLogRepository.save(entry));

        events.publishEvent(LocalChangeEvent.upsert(saved));
        events.publishEvent(LocalChangeEvent.upsert(logged));

        log.debug("Card {} rated {}: interval={}d, next={}", cardId, rating.code(),
                saved.intervalDays(), saved.nextReviewAt());
        return new ReviewAnswerResponse(saved, logged);
    }

    private CardEntity findCard(String cardId) {
        return cardRepository.findById(cardId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found: " + cardId));
    }
}
