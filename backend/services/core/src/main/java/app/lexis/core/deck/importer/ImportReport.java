package app.lexis.core.deck.importer;

import java.util.List;

public record ImportReport(
        String deckId,
        int added,
        int duplicates,
        int invalid,
        List<RowResult> rows
) {
    public static ImportReport of(String deckId, List<RowResult> rows) {
        int added = 0;
        int duplicates = 0;
        int invalid = 0;
        for (RowResult row : rows) {
            switch (row.status()) {
                case ADDED -> added++;
                case DUPLICATE -> duplicates++;
                case INVALID -> invalid++;
            }
        }
        return new ImportReport(deckId, added, duplicates, invalid, List.copyOf(rows));
    }

    public record RowResult(
            int rowNumber,
            String term,
            ImportRowStatus status,
            String cardId,
            String message
    ) {
    }
}
