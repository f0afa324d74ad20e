package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV and TSV with RFC 4180 quoting.
 *
 * <p>The document becomes one {@link Table} and a text rendering with one line per row,
 * non-empty cells separated by a space. CSV delimiters are detected from the first ten lines.</p>
 */
public final class CsvExtractor implements DocumentExtractor {
    private static final char[] DELIMITER_CANDIDATES = {',', '\t', '|', ';'};
    private static final int SAMPLE_LINES = 10;

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) {
        String text = Texts.decode(data);
        char delimiter = MimeTypes.TSV.equals(mimeType) ? '\t' : detectDelimiter(text);
        List<List<String>> rows = parse(text, delimiter);

        StringBuilder content = new StringBuilder();
        int columns = 0;
        for (List<String> row : rows) {
            columns = Math.max(columns, row.size());
            StringBuilder line = new StringBuilder();
            for (String cell : row) {
                String trimmed = cell.trim();
                if (!trimmed.isEmpty()) {
                    if (line.length() > 0) {
                        line.append(' ');
                    }
                    line.append(trimmed);
                }
            }
            if (line.length() > 0) {
                if (content.length() > 0) {
                    content.append('\n');
                }
                content.append(line);
            }
        }

        ExtractionResult.Builder builder = ExtractionResult.builder(mimeType)
            .content(content.toString())
            .metadata(Metadata.builder()
                .additional("row_count", rows.size())
                .additional("column_count", columns)
                .additional("delimiter", String.valueOf(delimiter))
                .build());
        if (!rows.isEmpty()) {
            builder.addTable(Table.of(rows, 1));
        }
        return builder.build();
    }

    static char detectDelimiter(String text) {
        String sample = sampleLines(text);
        char best = ',';
        int bestScore = 0;
        for (char candidate : DELIMITER_CANDIDATES) {
            List<List<String>> rows = parse(sample, candidate);
            if (rows.size() < 2) {
                continue;
            }
            int first = rows.get(0).size();
            if (first <= 1) {
                continue;
            }
            int consistent = 0;
            for (List<String> row : rows) {
                if (row.size() == first) {
                    consistent++;
                }
            }
            int score = consistent * first;
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    private static String sampleLines(String text) {
        int index = 0;
        for (int line = 0; line < SAMPLE_LINES; line++) {
            int next = text.indexOf('\n', index);
            if (next < 0) {
                return text;
            }
            index = next + 1;
        }
        return text.substring(0, index);
    }

    /**
     * Split text into rows of fields. Quoted fields may contain delimiters, newlines and doubled quotes.
     * Rows whose fields are all empty are dropped.
     */
    static List<List<String>> parse(String text, char delimiter) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == delimiter) {
                row.add(field.toString());
                field.setLength(0);
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                row.add(field.toString());
                field.setLength(0);
                addRow(rows, row);
                row = new ArrayList<>();
            } else {
                field.append(c);
            }
        }
        if (field.length() > 0 || !row.isEmpty()) {
            row.add(field.toString());
            addRow(rows, row);
        }
        return rows;
    }

    private static void addRow(List<List<String>> rows, List<String> row) {
        for (String value : row) {
            if (!value.isEmpty()) {
                rows.add(row);
                return;
            }
        }
    }
}
