package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a table extracted from a document.
 *
 * <p>Tables are represented as a 2D grid of cells with a Markdown rendering
 * and page information.</p>
 *
 * @param cells the table cells as a 2D list (rows x columns)
 * @param markdown the Markdown representation of the table
 * @param pageNumber the page number where the table was found (1-indexed, 0 when not paginated)
 */
public record Table(
    @JsonProperty("cells") List<List<String>> cells,
    @JsonProperty("markdown") String markdown,
    @JsonProperty("page_number") int pageNumber
) {
    /**
     * Creates a new Table.
     *
     * @param cells the table cells (must not be null)
     * @param markdown the Markdown representation (must not be null)
     * @param pageNumber the page number (0 for non-paginated documents, >= 1 for paginated documents)
     * @throws NullPointerException if cells or markdown is null
     * @throws IllegalArgumentException if pageNumber is negative
     */
    @JsonCreator
    public Table(
        @JsonProperty("cells") List<List<String>> cells,
        @JsonProperty("markdown") String markdown,
        @JsonProperty("page_number") int pageNumber
    ) {
        Objects.requireNonNull(cells, "cells must not be null");
        Objects.requireNonNull(markdown, "markdown must not be null");
        if (pageNumber < 0) {
            throw new IllegalArgumentException("pageNumber must be non-negative, got " + pageNumber);
        }
        this.cells = deepCopyTable(cells);
        this.markdown = markdown;
        this.pageNumber = pageNumber;
    }

    /**
     * Creates a Table from cells, rendering the Markdown form.
     *
     * <p>The first row is treated as the header. Ragged rows are padded to the widest row.</p>
     *
     * @param cells the table cells
     * @param pageNumber the page number
     * @return a new Table
     */
    public static Table of(List<List<String>> cells, int pageNumber) {
        return new Table(cells, toMarkdown(cells), pageNumber);
    }

    @JsonIgnore
    public int getRowCount() {
        return cells.size();
    }

    /**
     * Returns the widest row's column count.
     *
     * @return the column count, 0 for an empty table
     */
    @JsonIgnore
    public int getColumnCount() {
        int width = 0;
        for (List<String> row : cells) {
            width = Math.max(width, row.size());
        }
        return width;
    }

    public String getCell(int row, int col) {
        return cells.get(row).get(col);
    }

    public List<String> getRow(int row) {
        return cells.get(row);
    }

    static String toMarkdown(List<List<String>> cells) {
        if (cells.isEmpty()) {
            return "";
        }
        int width = 0;
        for (List<String> row : cells) {
            width = Math.max(width, row.size());
        }
        if (width == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendRow(sb, cells.get(0), width);
        sb.append('|');
        for (int i = 0; i < width; i++) {
            sb.append(" --- |");
        }
        sb.append('\n');
        for (int r = 1; r < cells.size(); r++) {
            appendRow(sb, cells.get(r), width);
        }
        return sb.toString().stripTrailing();
    }

    private static void appendRow(StringBuilder sb, List<String> row, int width) {
        sb.append('|');
        for (int c = 0; c < width; c++) {
            String value = c < row.size() && row.get(c) != null ? row.get(c) : "";
            sb.append(' ').append(value.replace("|", "\\|").replace('\n', ' ').trim()).append(" |");
        }
        sb.append('\n');
    }

    @Override
    public String toString() {
        return "Table{"
            + "rows=" + getRowCount()
            + ", cols=" + getColumnCount()
            + ", page=" + pageNumber
            + '}';
    }

    private static List<List<String>> deepCopyTable(List<List<String>> table) {
        List<List<String>> copy = new ArrayList<>(table.size());
        for (List<String> row : table) {
            List<String> copiedRow = new ArrayList<>(row.size());
            for (String cell : row) {
                copiedRow.add(cell != null ? cell : "");
            }
            copy.add(Collections.unmodifiableList(copiedRow));
        }
        return Collections.unmodifiableList(copy);
    }
}
