package app.lexis.core.deck.service;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.dto.SaveCardResult;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.request.CreateCardRequest;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.deck.repository.DeckRepository;
import app.lexis.core.review.algorithm.SrsAlgorithm;
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
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private final CardRepository cardRepository;
    private final DeckRepository deckRepository;
    private final SrsAlgorithm algorithm;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public CardService(CardRepository cardRepository,
                       DeckRepository deckRepository,
                       SrsAlgorithm algorithm,
                       ApplicationEventPublisher events,
                       Clock clock) {
        this.cardRepository = cardRepository;
        this.deckRepository = deckRepository;
        this.algorithm = algorithm;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<CardDTO> getCards(String deckId) {
        List<CardEntity> cards = deckId == null
                ? cardRepository.findAllByOrderByCreatedAtAsc()
                : cardRepository.findByDeckIdOrderByCreatedAtAsc(deckId);
        return cards.stream().map(CardDTO::of).toList();
    }

    /**
     * Saves a new card, immediately due. A term already present in the same
     * deck (compared trimmed, ignoring case) is reported as a duplicate.
     */
    @Transactional
    public SaveCardResult saveCard(CreateCardRequest req) {
        if (req.term() == null || req.term().isBlank()) {
            throw new IllegalArgumentException("Term is required");
        }
        String violation = lengthViolation(req);
        if (violation != null) {
            throw new IllegalArgumentException(violation);
        }
        String term = req.term().trim();
        String deckId = blankToNull(req.deckId());

        if (deckId != null && !deckRepository.existsById(deckId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Deck not found: " + deckId);
        }
        if (isDuplicate(deckId, term)) {
            log.debug("Duplicate card '{}' in deck {}", term, deckId);
            return SaveCardResult.duplicate(term);
        }

        Instant now = clock.instant();
        CardEntity card = new CardEntity();
        card.setCardId(UUID.randomUUID().toString());
        card.setTerm(term);
        card.setMeaning(req.meaning());
        card.setExplanation(req.explanation());
        card.setPhonetic(req.phonetic());
        card.setDeckId(deckId);
        card.setCreatedAt(now);
        card.applySchedulingState(algorithm.initialState(), now, now);

        CardDTO saved = CardDTO.of(cardRepository.save(card));
        events.publishEvent(LocalChangeEvent.upsert(saved));
        return SaveCardResult.added(saved);
    }

    @Transactional(readOnly = true)
    public boolean isDuplicate(String deckId, String term) {
        String normalized = term.trim();
        return deckId == null
                ? cardRepository.existsByDeckIdIsNullAndTermIgnoreCase(normalized)
                : cardRepository.existsByDeckIdAndTermIgnoreCase(deckId, normalized);
    }

    /**
     * Describes the first field that does not fit its column, or returns
     * {@code null} when the request fits.
     */
    public static String lengthViolation(CreateCardRequest req) {
        if (req.term() != null && req.term().trim().length() > CardEntity.TERM_MAX_LENGTH) {
            return tooLong("Term", CardEntity.TERM_MAX_LENGTH);
        }
        if (exceeds(req.meaning(), CardEntity.MEANING_MAX_LENGTH)) {
            return tooLong("Meaning", CardEntity.MEANING_MAX_LENGTH);
        }
        if (exceeds(req.explanation(), CardEntity.EXPLANATION_MAX_LENGTH)) {
            return tooLong("Explanation", CardEntity.EXPLANATION_MAX_LENGTH);
        }
        if (exceeds(req.phonetic(), CardEntity.PHONETIC_MAX_LENGTH)) {
            return tooLong("Phonetic", CardEntity.PHONETIC_MAX_LENGTH);
        }
        String deckId = blankToNull(req.deckId());
        if (exceeds(deckId, CardEntity.ID_MAX_LENGTH)) {
            return tooLong("Deck id", CardEntity.ID_MAX_LENGTH);
        }
        return null;
    }

    private static boolean exceeds(String value, int max) {
        return value != null && value.length() > max;
    }

    private static String tooLong(String field, int max) {
        return field + " is longer than " + max + " characters";
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
