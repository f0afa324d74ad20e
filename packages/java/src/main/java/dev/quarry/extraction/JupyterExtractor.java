package dev.quarry.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.util.Iterator;

/**
 * Jupyter notebooks (nbformat 4, and 3 where the fields line up).
 *
 * <p>Markdown and raw cells are copied as they are. Code cells become fenced blocks in the kernel's
 * language, followed by their text outputs; rich outputs leave an {@code [Image: type]} placeholder
 * and errors a single {@code Error: name: value} line.</p>
 */
public final class JupyterExtractor implements DocumentExtractor {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        JsonNode root;
        try {
            root = MAPPER.readTree(Texts.decode(data));
        } catch (JsonProcessingException e) {
            throw new QuarryException.Parsing("Malformed notebook: " + e.getOriginalMessage(), e);
        }
        JsonNode cells = root != null ? root.get("cells") : null;
        if (cells == null || !cells.isArray()) {
            throw new QuarryException.Parsing("Notebook has no cells array");
        }
        JsonNode notebookMetadata = root.path("metadata");
        String kernel = notebookMetadata.path("kernelspec").path("name").asText(null);
        String language = notebookMetadata.path("language_info").path("name")
            .asText(notebookMetadata.path("kernelspec").path("language").asText(""));

        StringBuilder content = new StringBuilder();
        int code = 0;
        int markdown = 0;
        for (JsonNode cell : cells) {
            String type = cell.path("cell_type").asText("");
            String source = joined(cell.get("source")).strip();
            switch (type) {
                case "markdown":
                    markdown++;
                    appendBlock(content, source);
                    break;
                case "code":
                    code++;
                    if (!source.isEmpty()) {
                        appendBlock(content, "```" + language + "\n" + source + "\n```");
                    }
                    appendBlock(content, outputs(cell.path("outputs")));
                    break;
                default:
                    appendBlock(content, source);
                    break;
            }
        }

        Metadata.Builder metadata = Metadata.builder()
            .additional("cell_count", cells.size())
            .additional("code_cell_count", code)
            .additional("markdown_cell_count", markdown);
        if (kernel != null) {
            metadata.additional("kernel", kernel);
        }
        if (!language.isEmpty()) {
            metadata.additional("kernel_language", language);
        }
        if (root.has("nbformat")) {
            metadata.additional("nbformat", root.get("nbformat").asText() + "." + root.path("nbformat_minor").asInt(0));
        }
        if (notebookMetadata.path("title").isTextual()) {
            metadata.title(notebookMetadata.get("title").asText());
        }
        return ExtractionResult.builder(mimeType)
            .content(Texts.tidy(content.toString()))
            .metadata(metadata.build())
            .build();
    }

    static String outputs(JsonNode outputs) {
        StringBuilder out = new StringBuilder();
        for (JsonNode output : outputs) {
            String type = output.path("output_type").asText("");
            if ("stream".equals(type)) {
                line(out, joined(output.get("text")));
            } else if ("error".equals(type)) {
                line(out, "Error: " + output.path("ename").asText("") + ": " + output.path("evalue").asText(""));
            } else {
                JsonNode data = output.path("data");
                if (data.has("text/plain")) {
                    line(out, joined(data.get("text/plain")));
                }
                Iterator<String> types = data.fieldNames();
                while (types.hasNext()) {
                    String dataType = types.next();
                    if (dataType.startsWith("image/")) {
                        line(out, "[Image: " + dataType + "]");
                    }
                }
            }
        }
        return out.toString().strip();
    }

    /** Notebook text fields are either a string or a list of lines. */
    private static String joined(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : node) {
                text.append(part.asText());
            }
            return text.toString();
        }
        return node.asText();
    }

    private static void line(StringBuilder out, String text) {
        String stripped = Texts.normalizeNewlines(text).strip();
        if (!stripped.isEmpty()) {
            out.append(stripped).append('\n');
        }
    }

    private static void appendBlock(StringBuilder content, String block) {
        if (!block.isEmpty()) {
            content.append(block).append("\n\n");
        }
    }
}
