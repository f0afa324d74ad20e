package dev.quarry.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.quarry.ExtractionResult;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.OutputFormat;
import dev.quarry.extraction.MarkdownRendering;
import dev.quarry.mime.MimeTypes;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Entities;

/**
 * Renders {@code content} in the configured output format and records the format in
 * {@code metadata.output_format}.
 */
public final class OutputFormatter {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> GRID_TYPES = Set.of(
        MimeTypes.CSV, MimeTypes.TSV, MimeTypes.XLSX, MimeTypes.XLSM, MimeTypes.ODS);

    /**
     * Format a result.
     *
     * @param result extraction after OCR
     * @param format requested format
     * @param rendering the extractor's own markdown rendering, or null
     * @param data document bytes for {@code rendering}
     * @return result with formatted content
     * @throws QuarryException if the markdown rendering fails
     */
    public ExtractionResult format(ExtractionResult result, OutputFormat format, MarkdownRendering rendering,
        byte[] data) throws QuarryException {
        OutputFormat effective = format != null ? format : OutputFormat.PLAIN;
        String content;
        switch (effective) {
            case MARKDOWN:
                content = rendering != null
                    ? rendering.renderMarkdown(data, result.getMimeType())
                    : markdown(result);
                break;
            case HTML:
                content = html(result);
                break;
            case STRUCTURED:
                content = structured(result);
                break;
            default:
                content = result.getContent();
                break;
        }
        return result.toBuilder()
            .content(content)
            .metadata(result.getMetadata().withAdditional("output_format", effective.wireName()))
            .build();
    }

    static String markdown(ExtractionResult result) {
        List<Table> tables = result.getTables();
        StringBuilder out = new StringBuilder();
        if (GRID_TYPES.contains(result.getMimeType()) && !tables.isEmpty()) {
            for (Table table : tables) {
                appendBlock(out, table.markdown().strip());
            }
            return out.toString();
        }
        for (String paragraph : result.getContent().split("\\n\\s*\\n")) {
            appendBlock(out, paragraph.strip());
        }
        for (Table table : tables) {
            appendBlock(out, table.markdown().strip());
        }
        return out.toString();
    }

    static String html(ExtractionResult result) {
        StringBuilder out = new StringBuilder();
        for (String paragraph : result.getContent().split("\\n\\s*\\n")) {
            String text = paragraph.strip();
            if (!text.isEmpty()) {
                out.append("<p>").append(Entities.escape(text).replace("\n", "<br>\n")).append("</p>\n");
            }
        }
        for (Table table : result.getTables()) {
            out.append("<table>\n");
            List<List<String>> cells = table.cells();
            for (int r = 0; r < cells.size(); r++) {
                String tag = r == 0 ? "th" : "td";
                out.append("<tr>");
                for (String cell : cells.get(r)) {
                    out.append('<').append(tag).append('>').append(Entities.escape(cell != null ? cell : ""))
                        .append("</").append(tag).append('>');
                }
                out.append("</tr>\n");
            }
            out.append("</table>\n");
        }
        return out.toString().stripTrailing();
    }

    static String structured(ExtractionResult result) throws QuarryException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("mime_type", result.getMimeType());
        root.put("text", result.getContent());
        ArrayNode pages = root.putArray("pages");
        for (PageContent page : result.getPages()) {
            pages.addObject()
                .put("page_number", page.pageNumber())
                .put("content", page.content());
        }
        ArrayNode tables = root.putArray("tables");
        for (Table table : result.getTables()) {
            ObjectNode node = tables.addObject();
            node.put("page_number", table.pageNumber());
            node.set("cells", MAPPER.valueToTree(table.cells()));
            node.put("markdown", table.markdown());
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new QuarryException.Parsing("Failed to render structured output: " + e.getOriginalMessage(), e);
        }
    }

    private static void appendBlock(StringBuilder out, String block) {
        if (block.isEmpty()) {
            return;
        }
        if (out.length() > 0) {
            out.append("\n\n");
        }
        out.append(block);
    }
}
