package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * DOCX via POI's {@link XWPFDocument}: body paragraphs and tables in document order.
 */
public final class DocxExtractor implements DocumentExtractor, MarkdownRendering {
    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(data))) {
            ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
            StringBuilder content = new StringBuilder();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph) {
                    appendBlock(content, ((XWPFParagraph) element).getText());
                } else if (element instanceof XWPFTable) {
                    List<List<String>> rows = tableRows((XWPFTable) element);
                    if (!rows.isEmpty()) {
                        result.addTable(Table.of(rows, 0));
                        StringBuilder text = new StringBuilder();
                        for (List<String> row : rows) {
                            text.append(String.join("\t", row)).append('\n');
                        }
                        appendBlock(content, text.toString());
                    }
                }
            }

            if (config.wantsImages()) {
                int index = 0;
                for (XWPFPictureData picture : document.getAllPictures()) {
                    result.addImage(PoiSupport.image(picture.getData(), picture.suggestFileExtension(), index++, null));
                }
            }

            Metadata.Builder metadata = PoiSupport.metadata(document.getProperties());
            int pages = document.getProperties().getExtendedProperties().getPages();
            if (pages > 0) {
                metadata.pageCount(pages);
            }
            metadata.additional("paragraph_count", document.getParagraphs().size())
                .additional("table_count", document.getTables().size());
            return result
                .content(content.toString().strip())
                .metadata(metadata.build())
                .build();
        } catch (IOException | POIXMLException | UnsupportedFileFormatException | OpenXML4JRuntimeException e) {
            throw new QuarryException.Parsing("Failed to parse DOCX: " + e.getMessage(), e);
        }
    }

    @Override
    public String renderMarkdown(byte[] data, String mimeType) throws QuarryException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(data))) {
            StringBuilder out = new StringBuilder();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph) {
                    XWPFParagraph paragraph = (XWPFParagraph) element;
                    String text = paragraph.getText().strip();
                    if (text.isEmpty()) {
                        continue;
                    }
                    int level = headingLevel(paragraph.getStyle());
                    if (level > 0) {
                        out.append("#".repeat(level)).append(' ');
                    } else if (paragraph.getNumID() != null) {
                        out.append("- ");
                    }
                    out.append(text).append("\n\n");
                } else if (element instanceof XWPFTable) {
                    List<List<String>> rows = tableRows((XWPFTable) element);
                    if (!rows.isEmpty()) {
                        out.append(Table.of(rows, 0).markdown()).append("\n\n");
                    }
                }
            }
            return out.toString().strip();
        } catch (IOException | POIXMLException | UnsupportedFileFormatException | OpenXML4JRuntimeException e) {
            throw new QuarryException.Parsing("Failed to parse DOCX: " + e.getMessage(), e);
        }
    }

    static int headingLevel(String style) {
        if (style == null) {
            return 0;
        }
        if ("Title".equalsIgnoreCase(style)) {
            return 1;
        }
        String lower = style.toLowerCase(Locale.ROOT);
        if (lower.startsWith("heading") && lower.length() > "heading".length()) {
            char digit = lower.charAt(lower.length() - 1);
            if (digit >= '1' && digit <= '6') {
                return digit - '0';
            }
        }
        return 0;
    }

    private static List<List<String>> tableRows(XWPFTable table) {
        List<List<String>> rows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                cells.add(cell.getText().strip());
            }
            rows.add(cells);
        }
        return rows;
    }

    private static void appendBlock(StringBuilder content, String text) {
        String block = text.strip();
        if (block.isEmpty()) {
            return;
        }
        if (content.length() > 0) {
            content.append("\n\n");
        }
        content.append(block);
    }
}
