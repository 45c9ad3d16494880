package app.lexis.core.deck.controller;

import app.lexis.core.deck.domain.dto.DeckDTO;
import app.lexis.core.deck.domain.request.CreateDeckRequest;
import app.lexis.core.deck.domain.request.UpdateDeckRequest;
import app.lexis.core.deck.service.DeckService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/decks")
public class DeckController {

    private final DeckService deckService;

    public DeckController(DeckService deckService) {
        this.deckService = deckService;
    }

    // GET /decks
    @GetMapping
    public List<DeckDTO> getDecks() {
        return deckService.getDecks();
    }

    // POST /decks
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DeckDTO createDeck(@Valid @RequestBody CreateDeckRequest req) {
        return deckService.createDeck(req);
    }

    // PATCH /decks/{deckId}
    @PatchMapping("/{deckId}")
    public DeckDTO updateDeck(@PathVariable String deckId,
                              @Valid @RequestBody UpdateDeckRequest req) {
        return deckService.updateDeck(deckId, req);
    }

    // DELETE /decks/{deckId}
    @DeleteMapping("/{deckId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteDeck(@PathVariable String deckId) {
        deckService.deleteDeck(deckId);
    }
}
