package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * XLSX/XLSM spreadsheets, read directly from the package with StAX.
 *
 * <p>Cells are collected sparsely while the worksheet streams. A sheet is then rendered densely
 * (empty cells kept in place) only when {@link SizingGuard#allowsDense} accepts both its declared
 * {@code <dimension ref>} and its observed extent; otherwise only the populated rows are
 * rendered, each padded up to its last populated column, and the result is flagged with
 * {@code streaming_fallback}.</p>
 */
public final class XlsxExtractor implements DocumentExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(XlsxExtractor.class);

    private static final String WORKBOOK = "xl/workbook.xml";
    private static final String WORKBOOK_RELS = "xl/_rels/workbook.xml.rels";
    private static final String SHARED_STRINGS = "xl/sharedStrings.xml";
    private static final String CORE_PROPERTIES = "docProps/core.xml";
    /** Column count of a maximal worksheet, A through XFD. */
    static final int MAX_COLUMNS = 16_384;

    private final SizingGuard guard;

    public XlsxExtractor() {
        this(SizingGuard.defaults());
    }

    public XlsxExtractor(SizingGuard guard) {
        this.guard = guard;
    }

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Map<String, byte[]> parts = ZipParts.read(data,
            name -> name.startsWith("xl/") && name.endsWith(".xml") || name.endsWith(".rels")
                || CORE_PROPERTIES.equals(name));
        byte[] workbook = parts.get(WORKBOOK);
        if (workbook == null) {
            throw new QuarryException.Parsing("Not a spreadsheet package: " + WORKBOOK + " is missing");
        }
        List<String> sharedStrings = parts.containsKey(SHARED_STRINGS)
            ? readSharedStrings(parts.get(SHARED_STRINGS))
            : List.of();
        Map<String, String> targets = parts.containsKey(WORKBOOK_RELS)
            ? readRelationships(parts.get(WORKBOOK_RELS))
            : Map.of();

        ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
        StringBuilder content = new StringBuilder();
        List<String> sheetNames = new ArrayList<>();
        boolean streamed = false;
        int sheetIndex = 0;
        for (SheetRef sheet : readSheets(workbook)) {
            byte[] xml = parts.get(resolveTarget(targets.get(sheet.relationshipId)));
            if (xml == null) {
                continue;
            }
            sheetIndex++;
            sheetNames.add(sheet.name);
            SheetCells cells = readSheet(xml, sharedStrings);
            List<List<String>> rows;
            if (isDense(cells)) {
                rows = denseRows(cells);
            } else {
                LOG.warn("Sheet '{}' declares {} but holds {} cells; rendering populated cells only",
                    sheet.name, cells.dimension != null ? cells.dimension : "no dimension", cells.populated);
                rows = sparseRows(cells);
                streamed = true;
            }
            if (content.length() > 0) {
                content.append("\n\n");
            }
            content.append("## ").append(sheet.name).append('\n');
            for (List<String> row : rows) {
                content.append(String.join("\t", row).stripTrailing()).append('\n');
            }
            if (!rows.isEmpty()) {
                result.addTable(Table.of(rows, sheetIndex));
            }
        }

        Metadata.Builder metadata = parts.containsKey(CORE_PROPERTIES)
            ? CoreProperties.read(parts.get(CORE_PROPERTIES))
            : Metadata.builder();
        metadata.additional("sheet_count", sheetNames.size())
            .additional("sheet_names", sheetNames);
        if (streamed) {
            metadata.additional("streaming_fallback", true);
        }
        return result
            .content(content.toString().strip())
            .metadata(metadata.build())
            .build();
    }

    private boolean isDense(SheetCells cells) {
        if (cells.populated == 0) {
            return true;
        }
        if (cells.declaredRows >= 0 && !guard.allowsDense(cells.declaredRows, cells.declaredCols, cells.populated)) {
            return false;
        }
        long observedRows = (long) cells.maxRow - cells.minRow + 1;
        long observedCols = (long) cells.maxCol - cells.minCol + 1;
        return guard.allowsDense(observedRows, observedCols, cells.populated);
    }

    private static List<List<String>> denseRows(SheetCells cells) {
        List<List<String>> rows = new ArrayList<>();
        if (cells.populated == 0) {
            return rows;
        }
        for (int r = cells.minRow; r <= cells.maxRow; r++) {
            TreeMap<Integer, String> present = cells.rows.get(r);
            List<String> row = new ArrayList<>(cells.maxCol - cells.minCol + 1);
            for (int c = cells.minCol; c <= cells.maxCol; c++) {
                String value = present != null ? present.get(c) : null;
                row.add(value != null ? value : "");
            }
            rows.add(row);
        }
        return rows;
    }

    // Empty rows are dropped; columns keep their position up to the XFD limit, past it cells are appended.
    private static List<List<String>> sparseRows(SheetCells cells) {
        List<List<String>> rows = new ArrayList<>(cells.rows.size());
        for (TreeMap<Integer, String> present : cells.rows.values()) {
            List<String> row = new ArrayList<>();
            for (Map.Entry<Integer, String> cell : present.entrySet()) {
                long offset = (long) cell.getKey() - cells.minCol;
                while (offset < MAX_COLUMNS && row.size() < offset) {
                    row.add("");
                }
                row.add(cell.getValue());
            }
            rows.add(row);
        }
        return rows;
    }

    static SheetCells readSheet(byte[] xml, List<String> sharedStrings) throws QuarryException {
        SheetCells cells = new SheetCells();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            int rowNumber = -1;
            int nextCol = 0;
            String cellType = null;
            String cellRef = null;
            String value = null;
            boolean inCell = false;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    switch (reader.getLocalName()) {
                        case "dimension":
                            cells.setDimension(reader.getAttributeValue(null, "ref"));
                            break;
                        case "row":
                            String r = reader.getAttributeValue(null, "r");
                            rowNumber = r != null ? Integer.parseInt(r.trim()) - 1 : rowNumber + 1;
                            nextCol = 0;
                            break;
                        case "c":
                            inCell = true;
                            cellType = reader.getAttributeValue(null, "t");
                            cellRef = reader.getAttributeValue(null, "r");
                            value = null;
                            break;
                        case "v":
                            if (inCell) {
                                value = reader.getElementText();
                            }
                            break;
                        case "is":
                            if (inCell) {
                                value = readRichText(reader, "is");
                            }
                            break;
                        default:
                            break;
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && "c".equals(reader.getLocalName())) {
                    int row = Math.max(rowNumber, 0);
                    int col = nextCol;
                    if (cellRef != null) {
                        int[] position = parseCellRef(cellRef);
                        if (position != null) {
                            row = position[0];
                            col = position[1];
                        }
                    }
                    nextCol = col + 1;
                    String text = cellText(cellType, value, sharedStrings);
                    if (text != null && !text.isEmpty()) {
                        cells.put(row, col, text);
                    }
                    inCell = false;
                }
            }
        } catch (XMLStreamException | NumberFormatException e) {
            throw new QuarryException.Parsing("Malformed worksheet: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return cells;
    }

    private static String cellText(String type, String value, List<String> sharedStrings) throws QuarryException {
        if (value == null) {
            return null;
        }
        if ("s".equals(type)) {
            int index;
            try {
                index = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new QuarryException.Parsing("Invalid shared string index: " + value, e);
            }
            if (index < 0 || index >= sharedStrings.size()) {
                throw new QuarryException.Parsing("Shared string index out of range: " + index);
            }
            return sharedStrings.get(index);
        }
        if ("b".equals(type)) {
            return "1".equals(value.trim()) ? "TRUE" : "FALSE";
        }
        return value;
    }

    /**
     * Convert an A1-style reference to zero-based {row, col}.
     *
     * @return position, or null if the reference is malformed
     */
    static int[] parseCellRef(String ref) {
        int i = 0;
        long col = 0;
        String value = ref.trim().replace("$", "");
        while (i < value.length() && Character.isLetter(value.charAt(i))) {
            col = col * 26 + (Character.toUpperCase(value.charAt(i)) - 'A' + 1);
            if (col > Integer.MAX_VALUE) {
                return null;
            }
            i++;
        }
        if (i == 0 || i == value.length()) {
            return null;
        }
        long row;
        try {
            row = Long.parseLong(value.substring(i));
        } catch (NumberFormatException e) {
            return null;
        }
        if (row < 1 || row > Integer.MAX_VALUE) {
            return null;
        }
        return new int[] {(int) row - 1, (int) col - 1};
    }

    static List<String> readSharedStrings(byte[] xml) throws QuarryException {
        List<String> strings = new ArrayList<>();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && "si".equals(reader.getLocalName())) {
                    strings.add(readRichText(reader, "si"));
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed shared strings: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return strings;
    }

    /** Concatenate the {@code <t>} runs under the current element, skipping phonetic runs. */
    private static String readRichText(XMLStreamReader reader, String container) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        int phonetic = 0;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String name = reader.getLocalName();
                if ("rPh".equals(name)) {
                    phonetic++;
                } else if ("t".equals(name) && phonetic == 0) {
                    text.append(reader.getElementText());
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                String name = reader.getLocalName();
                if ("rPh".equals(name)) {
                    phonetic--;
                } else if (container.equals(name)) {
                    break;
                }
            }
        }
        return text.toString();
    }

    private static List<SheetRef> readSheets(byte[] workbook) throws QuarryException {
        List<SheetRef> sheets = new ArrayList<>();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(workbook));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && "sheet".equals(reader.getLocalName())) {
                    String name = reader.getAttributeValue(null, "name");
                    String id = null;
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        if ("id".equals(reader.getAttributeLocalName(i))) {
                            id = reader.getAttributeValue(i);
                        }
                    }
                    sheets.add(new SheetRef(name != null ? name : "Sheet" + (sheets.size() + 1), id));
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed workbook: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return sheets;
    }

    private static Map<String, String> readRelationships(byte[] xml) throws QuarryException {
        Map<String, String> targets = new HashMap<>();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT
                    && "Relationship".equals(reader.getLocalName())) {
                    targets.put(reader.getAttributeValue(null, "Id"), reader.getAttributeValue(null, "Target"));
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed workbook relationships: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return targets;
    }

    private static String resolveTarget(String target) {
        if (target == null) {
            return null;
        }
        if (target.startsWith("/")) {
            return target.substring(1);
        }
        return "xl/" + target;
    }

    private static final class SheetRef {
        private final String name;
        private final String relationshipId;

        SheetRef(String name, String relationshipId) {
            this.name = name;
            this.relationshipId = relationshipId;
        }
    }

    static final class SheetCells {
        final TreeMap<Integer, TreeMap<Integer, String>> rows = new TreeMap<>();
        String dimension;
        long declaredRows = -1;
        long declaredCols = -1;
        long populated;
        int minRow = Integer.MAX_VALUE;
        int maxRow = -1;
        int minCol = Integer.MAX_VALUE;
        int maxCol = -1;

        void put(int row, int col, String value) {
            if (rows.computeIfAbsent(row, k -> new TreeMap<>()).put(col, value) == null) {
                populated++;
            }
            minRow = Math.min(minRow, row);
            maxRow = Math.max(maxRow, row);
            minCol = Math.min(minCol, col);
            maxCol = Math.max(maxCol, col);
        }

        void setDimension(String ref) {
            if (ref == null || ref.isBlank()) {
                return;
            }
            dimension = ref.trim();
            String[] corners = dimension.split(":");
            int[] start = parseCellRef(corners[0]);
            int[] end = corners.length > 1 ? parseCellRef(corners[1]) : start;
            if (start == null || end == null) {
                return;
            }
            declaredRows = Math.abs((long) end[0] - start[0]) + 1;
            declaredCols = Math.abs((long) end[1] - start[1]) + 1;
        }
    }
}
