package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * OpenDocument text, spreadsheet and presentation files, read from {@code content.xml} and
 * {@code meta.xml} with StAX.
 *
 * <p>Spreadsheets are rendered like XLSX ({@code ## Sheet} then tab-separated rows). Repeated
 * rows and columns are never expanded beyond what the {@link SizingGuard} allows.</p>
 */
public final class OdfExtractor implements DocumentExtractor {
    private static final String TABLE_NS = "urn:oasis:names:tc:opendocument:xmlns:table:1.0";
    private static final String TEXT_NS = "urn:oasis:names:tc:opendocument:xmlns:text:1.0";
    private static final String DRAW_NS = "urn:oasis:names:tc:opendocument:xmlns:drawing:1.0";
    private static final int MAX_REPEAT = 1000;

    private final SizingGuard guard;

    public OdfExtractor() {
        this(SizingGuard.defaults());
    }

    public OdfExtractor(SizingGuard guard) {
        this.guard = guard;
    }

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Map<String, byte[]> parts = ZipParts.read(data, name -> "content.xml".equals(name) || "meta.xml".equals(name));
        byte[] content = parts.get("content.xml");
        if (content == null) {
            throw new QuarryException.Parsing("Not an OpenDocument package: content.xml is missing");
        }
        boolean spreadsheet = MimeTypes.ODS.equals(mimeType);
        ContentWalker walker = new ContentWalker(spreadsheet);
        walker.walk(content);

        ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
        for (Table table : walker.tables) {
            result.addTable(table);
        }
        Metadata.Builder metadata = parts.containsKey("meta.xml")
            ? readMeta(parts.get("meta.xml"))
            : Metadata.builder();
        if (walker.streamed) {
            metadata.additional("streaming_fallback", true);
        }
        if (!walker.pages.isEmpty()) {
            metadata.pageCount(walker.pages.size());
            return result
                .content(PageAssembler.assemble(walker.pages, config.getPages()))
                .pages(walker.pages)
                .metadata(metadata.build())
                .build();
        }
        return result
            .content(walker.out.toString().strip())
            .metadata(metadata.build())
            .build();
    }

    private static Metadata.Builder readMeta(byte[] xml) throws QuarryException {
        Metadata.Builder metadata = Metadata.builder();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            List<String> keywords = new ArrayList<>();
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (reader.getLocalName()) {
                    case "title":
                        metadata.title(reader.getElementText().trim());
                        break;
                    case "subject":
                        metadata.subject(reader.getElementText().trim());
                        break;
                    case "initial-creator":
                        String creator = reader.getElementText().trim();
                        metadata.createdBy(creator);
                        metadata.authors(creator.isEmpty() ? null : List.of(creator));
                        break;
                    case "creator":
                        metadata.modifiedBy(reader.getElementText().trim());
                        break;
                    case "keyword":
                        keywords.add(reader.getElementText().trim());
                        break;
                    case "creation-date":
                        metadata.createdAt(reader.getElementText().trim());
                        break;
                    case "date":
                        metadata.modifiedAt(reader.getElementText().trim());
                        break;
                    case "document-statistic":
                        String pages = reader.getAttributeValue(null, "page-count");
                        for (int i = 0; pages == null && i < reader.getAttributeCount(); i++) {
                            if ("page-count".equals(reader.getAttributeLocalName(i))) {
                                pages = reader.getAttributeValue(i);
                            }
                        }
                        if (pages != null) {
                            metadata.pageCount(Integer.parseInt(pages.trim()));
                        }
                        break;
                    default:
                        break;
                }
            }
            metadata.keywords(keywords);
        } catch (XMLStreamException | NumberFormatException e) {
            throw new QuarryException.Parsing("Malformed OpenDocument metadata: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return metadata;
    }

    private final class ContentWalker {
        private final boolean spreadsheet;
        private final StringBuilder out = new StringBuilder();
        private final List<Table> tables = new ArrayList<>();
        private final List<PageContent> pages = new ArrayList<>();
        private StringBuilder page;
        private StringBuilder paragraph;
        private int paragraphDepth;
        private String tableName;
        private List<List<String>> rows;
        private TreeMap<Long, String> row;
        private long rowRepeat;
        private long column;
        private long cellRepeat;
        private StringBuilder cell;
        private boolean streamed;

        ContentWalker(boolean spreadsheet) {
            this.spreadsheet = spreadsheet;
        }

        void walk(byte[] xml) throws QuarryException {
            XMLStreamReader reader = null;
            try {
                reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
                while (reader.hasNext()) {
                    int event = reader.next();
                    if (event == XMLStreamConstants.START_ELEMENT) {
                        start(reader);
                    } else if (event == XMLStreamConstants.END_ELEMENT) {
                        end(reader);
                    } else if ((event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA)
                        && paragraph != null) {
                        paragraph.append(reader.getText());
                    }
                }
            } catch (XMLStreamException | NumberFormatException e) {
                throw new QuarryException.Parsing("Malformed OpenDocument content: " + e.getMessage(), e);
            } finally {
                XmlExtractor.close(reader);
            }
        }

        private void start(XMLStreamReader reader) {
            String ns = reader.getNamespaceURI();
            String name = reader.getLocalName();
            if (DRAW_NS.equals(ns) && "page".equals(name)) {
                page = new StringBuilder();
            } else if (TABLE_NS.equals(ns)) {
                switch (name) {
                    case "table":
                        tableName = reader.getAttributeValue(TABLE_NS, "name");
                        rows = new ArrayList<>();
                        break;
                    case "table-row":
                        row = new TreeMap<>();
                        column = 0;
                        rowRepeat = repeat(reader, "number-rows-repeated");
                        break;
                    case "table-cell":
                    case "covered-table-cell":
                        cell = new StringBuilder();
                        cellRepeat = repeat(reader, "number-columns-repeated");
                        break;
                    default:
                        break;
                }
            } else if (TEXT_NS.equals(ns)) {
                switch (name) {
                    case "p":
                    case "h":
                        if (paragraphDepth++ == 0) {
                            paragraph = new StringBuilder();
                        }
                        break;
                    case "s":
                        if (paragraph != null) {
                            String count = reader.getAttributeValue(TEXT_NS, "c");
                            paragraph.append(" ".repeat(count != null ? Math.min(Integer.parseInt(count), 256) : 1));
                        }
                        break;
                    case "tab":
                        if (paragraph != null) {
                            paragraph.append('\t');
                        }
                        break;
                    case "line-break":
                        if (paragraph != null) {
                            paragraph.append('\n');
                        }
                        break;
                    default:
                        break;
                }
            }
        }

        private void end(XMLStreamReader reader) {
            String ns = reader.getNamespaceURI();
            String name = reader.getLocalName();
            if (TEXT_NS.equals(ns) && ("p".equals(name) || "h".equals(name))) {
                if (--paragraphDepth == 0) {
                    String text = paragraph.toString().strip();
                    paragraph = null;
                    if (text.isEmpty()) {
                        return;
                    }
                    if (cell != null) {
                        if (cell.length() > 0) {
                            cell.append('\n');
                        }
                        cell.append(text);
                    } else {
                        block(text);
                    }
                }
            } else if (DRAW_NS.equals(ns) && "page".equals(name) && page != null) {
                String text = page.toString().strip();
                pages.add(new PageContent(pages.size() + 1, text, false, text.isEmpty() ? 0.0 : 1.0));
                page = null;
            } else if (TABLE_NS.equals(ns)) {
                switch (name) {
                    case "table-cell":
                    case "covered-table-cell":
                        endCell();
                        break;
                    case "table-row":
                        endRow();
                        break;
                    case "table":
                        endTable();
                        break;
                    default:
                        break;
                }
            }
        }

        private void endCell() {
            String text = cell.toString();
            if (!text.isEmpty()) {
                long copies = Math.min(cellRepeat, MAX_REPEAT);
                for (long i = 0; i < copies; i++) {
                    row.put(column + i, text);
                }
            }
            column += cellRepeat;
            cell = null;
        }

        private void endRow() {
            if (row != null && !row.isEmpty()) {
                long width = row.lastKey() + 1;
                List<String> values;
                if (guard.allowsDense(1, width, row.size())) {
                    values = new ArrayList<>();
                    for (long c = 0; c < width; c++) {
                        values.add(row.getOrDefault(c, ""));
                    }
                } else {
                    values = new ArrayList<>(row.values());
                    streamed = true;
                }
                long copies = Math.min(rowRepeat, MAX_REPEAT);
                for (long i = 0; i < copies; i++) {
                    rows.add(values);
                }
            }
            row = null;
        }

        private void endTable() {
            if (rows == null) {
                return;
            }
            StringBuilder rendered = new StringBuilder();
            if (spreadsheet) {
                rendered.append("## ").append(tableName != null ? tableName : "Sheet" + (tables.size() + 1))
                    .append('\n');
            }
            for (List<String> values : rows) {
                rendered.append(String.join("\t", values).stripTrailing()).append('\n');
            }
            if (!rows.isEmpty()) {
                int pageNumber = spreadsheet ? tables.size() + 1 : pages.size() + (page != null ? 1 : 0);
                tables.add(Table.of(rows, pageNumber));
            }
            if (!rows.isEmpty() || spreadsheet) {
                block(rendered.toString().strip());
            }
            rows = null;
            tableName = null;
        }

        private void block(String text) {
            StringBuilder target = page != null ? page : out;
            if (target.length() > 0) {
                target.append("\n\n");
            }
            target.append(text);
        }

        private long repeat(XMLStreamReader reader, String attribute) {
            String value = reader.getAttributeValue(TABLE_NS, attribute);
            if (value == null) {
                return 1;
            }
            long parsed = Long.parseLong(value.trim());
            return parsed < 1 ? 1 : parsed;
        }
    }
}
