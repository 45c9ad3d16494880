package app.lexis.core.deck.service;

import app.lexis.core.deck.domain.dto.DeckDTO;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.entity.DeckEntity;
import app.lexis.core.deck.domain.request.CreateDeckRequest;
import app.lexis.core.deck.domain.request.UpdateDeckRequest;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.deck.repository.DeckRepository;
import app.lexis.core.sync.domain.LocalChangeEvent;
import app.lexis.core.sync.domain.RemoteEntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class DeckService {

    private static final Logger log = LoggerFactory.getLogger(DeckService.class);

    private final DeckRepository deckRepository;
    private final CardRepository cardRepository;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public DeckService(DeckRepository deckRepository,
                       CardRepository cardRepository,
                       ApplicationEventPublisher events,
                       Clock clock) {
        this.deckRepository = deckRepository;
        this.cardRepository = cardRepository;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<DeckDTO> getDecks() {
        return deckRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(DeckDTO::of)
                .toList();
    }

    @Transactional
    public DeckDTO createDeck(CreateDeckRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new IllegalArgumentException("Deck name is required");
        }
        DeckEntity deck = new DeckEntity(
                UUID.randomUUID().toString(),
                req.name().trim(),
                req.description(),
                clock.instant()
        );
        DeckDTO saved = DeckDTO.of(deckRepository.save(deck));
        events.publishEvent(LocalChangeEvent.upsert(saved));
        return saved;
    }

    @Transactional
    public DeckDTO updateDeck(String deckId, UpdateDeckRequest req) {
        DeckEntity deck = findDeck(deckId);

        if (req.name() != null) {
            if (req.name().isBlank()) {
                throw new IllegalArgumentException("Deck name must not be blank");
            }
            deck.setName(req.name().trim());
        }
        if (req.description() != null) {
            deck.setDescription(req.description());
        }

        DeckDTO saved = DeckDTO.of(deckRepository.save(deck));
        events.publishEvent(LocalChangeEvent.upsert(saved));
        return saved;
    }

    /**
     * Removes the deck and every card filed under it. Uncategorized cards and
     * review logs are kept.
     */
    @Transactional
    public void deleteDeck(String deckId) {
        DeckEntity deck = findDeck(deckId);

        List<CardEntity> cards = cardRepository.findByDeckId(deckId);
        cardRepository.deleteAll(cards);
        deckRepository.delete(deck);

        for (CardEntity card : cards) {
            events.publishEvent(LocalChangeEvent.delete(RemoteEntityKind.CARDS, card.getCardId()));
        }
        events.publishEvent(LocalChangeEvent.delete(RemoteEntityKind.DECKS, deckId));
        log.info("Deleted deck {} with {} cards", deckId, cards.size());
    }

    private DeckEntity findDeck(String deckId) {
        return deckRepository.findById(deckId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Deck not found: " + deckId));
    }
}
