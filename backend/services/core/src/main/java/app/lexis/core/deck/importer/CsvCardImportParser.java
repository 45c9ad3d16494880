package app.lexis.core.deck.importer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads vocabulary rows from CSV text. A first line naming the columns
 * (term, meaning, explanation, phonetic or their usual synonyms) is used as a
 * header; otherwise columns are taken positionally in that order.
 */
@Component
public class CsvCardImportParser {

    static final String TERM = "term";
    static final String MEANING = "meaning";
    static final String EXPLANATION = "explanation";
    static final String PHONETIC = "phonetic";

    private static final List<String> POSITIONAL = List.of(TERM, MEANING, EXPLANATION, PHONETIC);

    private static final Map<String, String> SYNONYMS = Map.ofEntries(
            Map.entry("term", TERM),
            Map.entry("word", TERM),
            Map.entry("front", TERM),
            Map.entry("question", TERM),
            Map.entry("meaning", MEANING),
            Map.entry("definition", MEANING),
            Map.entry("translation", MEANING),
            Map.entry("back", MEANING),
            Map.entry("answer", MEANING),
            Map.entry("explanation", EXPLANATION),
            Map.entry("example", EXPLANATION),
            Map.entry("notes", EXPLANATION),
            Map.entry("phonetic", PHONETIC),
            Map.entry("pronunciation", PHONETIC),
            Map.entry("ipa", PHONETIC)
    );

    private final char delimiter;

    public CsvCardImportParser() {
        this(',');
    }

    CsvCardImportParser(char delimiter) {
        this.delimiter = delimiter;
    }

    public List<CsvCardRow> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                return List.of();
            }

            Map<String, Integer> columns = headerColumns(records.get(0));
            boolean usesHeader = columns != null;
            if (!usesHeader) {
                columns = new HashMap<>();
                for (int i = 0; i < POSITIONAL.size(); i++) {
                    columns.put(POSITIONAL.get(i), i);
                }
            }

            List<CsvCardRow> rows = new ArrayList<>();
            for (int i = usesHeader ? 1 : 0; i < records.size(); i++) {
                CSVRecord record = records.get(i);
                rows.add(new CsvCardRow(
                        (int) record.getRecordNumber(),
                        value(record, columns.get(TERM)),
                        value(record, columns.get(MEANING)),
                        value(record, columns.get(EXPLANATION)),
                        value(record, columns.get(PHONETIC))
                ));
            }
            return rows;
        } catch (IOException | UncheckedIOException ex) {
            throw new IllegalArgumentException("Malformed CSV: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return canonical column name to index, or {@code null} when the record
     * does not look like a header
     */
    private Map<String, Integer> headerColumns(CSVRecord first) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < first.size(); i++) {
            String canonical = SYNONYMS.get(first.get(i).toLowerCase(Locale.ROOT));
            if (canonical != null) {
                columns.putIfAbsent(canonical, i);
            }
        }
        // a header has to say at least where the term is
        return columns.containsKey(TERM) ? columns : null;
    }

    private static String value(CSVRecord record, Integer index) {
        if (index == null || index >= record.size()) {
            return null;
        }
        String v = record.get(index);
        return v == null || v.isBlank() ? null : v;
    }
}
