package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * HTML and XHTML via jsoup.
 *
 * <p>Block elements become separate paragraphs; {@code <table>} elements are also emitted as
 * {@link Table}s. Title and the author, description and keywords meta tags go to metadata.</p>
 */
public final class HtmlExtractor implements DocumentExtractor, MarkdownRendering {
    private static final Set<String> BLOCK_TAGS = Set.of(
        "p", "div", "section", "article", "header", "footer", "main", "aside", "nav", "blockquote", "pre",
        "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "li", "dl", "dt", "dd", "table", "tr", "figure",
        "figcaption", "address", "hr", "form", "fieldset");
    private static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "noscript", "template", "head");

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) {
        Document document = Jsoup.parse(Texts.decode(data));

        Metadata.Builder metadata = Metadata.builder();
        String title = document.title();
        if (!title.isBlank()) {
            metadata.title(title.trim());
        }
        String author = meta(document, "author");
        if (author != null) {
            metadata.authors(List.of(author));
        }
        String description = meta(document, "description");
        if (description != null) {
            metadata.subject(description);
        }
        String keywords = meta(document, "keywords");
        if (keywords != null) {
            List<String> values = new ArrayList<>();
            for (String keyword : keywords.split(",")) {
                if (!keyword.isBlank()) {
                    values.add(keyword.trim());
                }
            }
            metadata.keywords(values);
        }
        String language = document.select("html").attr("lang");
        if (!language.isBlank()) {
            metadata.language(language.trim());
        }

        ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
        for (Element table : document.select("table")) {
            List<List<String>> rows = tableRows(table);
            if (!rows.isEmpty()) {
                result.addTable(Table.of(rows, 0));
            }
        }

        Element root = document.body() != null ? document.body() : document;
        TextCollector collector = new TextCollector();
        NodeTraversor.traverse(collector, root);
        return result
            .content(Texts.tidy(collector.text()))
            .metadata(metadata.build())
            .build();
    }

    /**
     * Block-separated text of an HTML fragment or document, as {@link #extract} renders it.
     */
    static String text(String html) {
        Document document = Jsoup.parse(html);
        Element root = document.body() != null ? document.body() : document;
        TextCollector collector = new TextCollector();
        NodeTraversor.traverse(collector, root);
        return Texts.tidy(collector.text());
    }

    @Override
    public String renderMarkdown(byte[] data, String mimeType) {
        Document document = Jsoup.parse(Texts.decode(data));
        Element root = document.body() != null ? document.body() : document;
        StringBuilder out = new StringBuilder();
        for (Element element : root.select("h1, h2, h3, h4, h5, h6, p, li, pre, table")) {
            String tag = element.normalName();
            if (!"table".equals(tag) && element.parents().is("table")) {
                continue;
            }
            switch (tag) {
                case "table":
                    out.append(Table.of(tableRows(element), 0).markdown()).append("\n\n");
                    break;
                case "li":
                    out.append("- ").append(element.text()).append('\n');
                    break;
                case "pre":
                    out.append("```\n").append(element.wholeText().strip()).append("\n```\n\n");
                    break;
                case "p":
                    out.append(element.text()).append("\n\n");
                    break;
                default:
                    char[] hashes = new char[tag.charAt(1) - '0'];
                    Arrays.fill(hashes, '#');
                    out.append(hashes).append(' ').append(element.text()).append("\n\n");
                    break;
            }
        }
        return Texts.tidy(out.toString());
    }

    private static String meta(Document document, String name) {
        Element element = document.selectFirst("meta[name=" + name + "]");
        if (element == null) {
            return null;
        }
        String value = element.attr("content").trim();
        return value.isEmpty() ? null : value;
    }

    private static List<List<String>> tableRows(Element table) {
        List<List<String>> rows = new ArrayList<>();
        for (Element row : table.select("tr")) {
            if (row.closest("table") != table) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
                    cells.add(cell.text());
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }

    private static final class TextCollector implements NodeVisitor {
        private final StringBuilder out = new StringBuilder();
        private int skipDepth;

        @Override
        public void head(Node node, int depth) {
            if (node instanceof Element) {
                String tag = ((Element) node).normalName();
                if (SKIPPED_TAGS.contains(tag)) {
                    skipDepth++;
                } else if ("br".equals(tag)) {
                    out.append('\n');
                } else if (BLOCK_TAGS.contains(tag)) {
                    out.append("\n\n");
                } else if ("td".equals(tag) || "th".equals(tag)) {
                    out.append('\t');
                }
            } else if (node instanceof TextNode && skipDepth == 0) {
                String text = ((TextNode) node).text();
                if (!text.isBlank()) {
                    if (out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))
                        && Character.isWhitespace(text.charAt(0))) {
                        out.append(' ');
                    }
                    out.append(text.strip());
                    if (Character.isWhitespace(text.charAt(text.length() - 1))) {
                        out.append(' ');
                    }
                }
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element) {
                String tag = ((Element) node).normalName();
                if (SKIPPED_TAGS.contains(tag)) {
                    skipDepth--;
                } else if (BLOCK_TAGS.contains(tag)) {
                    out.append("\n\n");
                }
            }
        }

        String text() {
            return out.toString().replaceAll("[ \\t]*\\n[ \\t]*", "\n").replaceAll("\\t+", "\t");
        }
    }
}
