package app.lexis.core.deck.importer;

/**
 * One data row of an import file. {@code rowNumber} is 1-based and counts the
 * header line when there is one, so it matches what a spreadsheet shows.
 */
public record CsvCardRow(
        int rowNumber,
        String term,
        String meaning,
        String explanation,
        String phonetic
) {
}
