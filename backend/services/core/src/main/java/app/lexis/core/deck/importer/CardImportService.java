package app.lexis.core.deck.importer;

import app.lexis.core.deck.domain.dto.SaveCardResult;
import app.lexis.core.deck.domain.request.CreateCardRequest;
import app.lexis.core.deck.repository.DeckRepository;
import app.lexis.core.deck.service.CardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * Bulk card creation from CSV. Rows are independent: an invalid or duplicate
 * row is reported and the rest are still imported.
 */
@Service
public class CardImportService {

    private static final Logger log = LoggerFactory.getLogger(CardImportService.class);

    private final CsvCardImportParser parser;
    private final CardService cardService;
    private final DeckRepository deckRepository;

    public CardImportService(CsvCardImportParser parser,
                             CardService cardService,
                             DeckRepository deckRepository) {
        this.parser = parser;
        this.cardService = cardService;
        this.deckRepository = deckRepository;
    }

    @Transactional
    public ImportReport importCsv(String deckId, String content) {
        String targetDeck = deckId == null || deckId.isBlank() ? null : deckId.trim();
        if (targetDeck != null && !deckRepository.existsById(targetDeck)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Deck not found: " + targetDeck);
        }

        List<ImportReport.RowResult> results = new ArrayList<>();
        for (CsvCardRow row : parser.parse(content)) {
            results.add(importRow(targetDeck, row));
        }

        ImportReport report = ImportReport.of(targetDeck, results);
        log.info("CSV import into deck {}: added={}, duplicates={}, invalid={}",
                targetDeck, report.added(), report.duplicates(), report.invalid());
        return report;
    }

    private ImportReport.RowResult importRow(String deckId, CsvCardRow row) {
        if (row.term() == null || row.meaning() == null) {
            return new ImportReport.RowResult(row.rowNumber(), row.term(), ImportRowStatus.INVALID, null,
                    "Term and meaning are required");
        }
        CreateCardRequest request = new CreateCardRequest(
                row.term(), row.meaning(), row.explanation(), row.phonetic(), deckId);
        // checked up front: a failed insert would roll back the rows already imported
        String violation = CardService.lengthViolation(request);
        if (violation != null) {
            return new ImportReport.RowResult(row.rowNumber(), row.term(), ImportRowStatus.INVALID, null, violation);
        }
        SaveCardResult saved = cardService.saveCard(request);
        if (!saved.added()) {
            return new ImportReport.RowResult(row.rowNumber(), row.term(), ImportRowStatus.DUPLICATE, null,
                    saved.reason());
        }
        return new ImportReport.RowResult(row.rowNumber(), row.term(), ImportRowStatus.ADDED,
                saved.card().cardId(), null);
    }
}
