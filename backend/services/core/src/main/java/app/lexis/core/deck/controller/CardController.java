package app.lexis.core.deck.controller;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.dto.SaveCardResult;
import app.lexis.core.deck.domain.request.CreateCardRequest;
import app.lexis.core.deck.importer.CardImportService;
import app.lexis.core.deck.importer.ImportReport;
import app.lexis.core.deck.service.CardService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/cards")
public class CardController {

    private final CardService cardService;
    private final CardImportService cardImportService;

    public CardController(CardService cardService, CardImportService cardImportService) {
        this.cardService = cardService;
        this.cardImportService = cardImportService;
    }

    // GET /cards?deckId=...
    @GetMapping
    public List<CardDTO> getCards(@RequestParam(required = false) String deckId) {
        return cardService.getCards(deckId);
    }

    // POST /cards
    @PostMapping
    public ResponseEntity<SaveCardResult> createCard(@Valid @RequestBody CreateCardRequest req) {
        SaveCardResult result = cardService.saveCard(req);
        HttpStatus status = result.added() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    // POST /cards/import?deckId=...  (text/csv body)
    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ImportReport importCards(@RequestParam(required = false) String deckId,
                                    @RequestBody String content) {
        return cardImportService.importCsv(deckId, content);
    }
}
