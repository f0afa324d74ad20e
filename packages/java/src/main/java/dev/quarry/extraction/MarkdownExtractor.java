package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.config.ExtractionConfig;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;

/**
 * Markdown via commonmark: plain text from the {@link TextContentRenderer}, title from the first heading.
 */
public final class MarkdownExtractor implements DocumentExtractor, MarkdownRendering {
    private static final Parser PARSER = Parser.builder().build();
    private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) {
        String source = Texts.normalizeNewlines(Texts.decode(data));
        Node document = PARSER.parse(source);
        String text = TEXT_RENDERER.render(document);

        HeadingVisitor headings = new HeadingVisitor();
        document.accept(headings);

        Metadata.Builder metadata = Metadata.builder()
            .title(headings.firstHeading)
            .additional("heading_count", headings.count)
            .additional("word_count", Texts.countWords(text));
        return ExtractionResult.builder(mimeType)
            .content(text.strip())
            .metadata(metadata.build())
            .build();
    }

    @Override
    public String renderMarkdown(byte[] data, String mimeType) {
        return Texts.normalizeNewlines(Texts.decode(data)).strip();
    }

    private static final class HeadingVisitor extends AbstractVisitor {
        private String firstHeading;
        private int count;

        @Override
        public void visit(Heading heading) {
            count++;
            if (firstHeading == null) {
                String title = textOf(heading).trim();
                if (!title.isEmpty()) {
                    firstHeading = title;
                }
            }
        }

        private static String textOf(Node node) {
            StringBuilder sb = new StringBuilder();
            collect(node, sb);
            return sb.toString();
        }

        private static void collect(Node node, StringBuilder sb) {
            if (node instanceof Text) {
                sb.append(((Text) node).getLiteral());
            } else if (node instanceof SoftLineBreak) {
                sb.append(' ');
            } else {
                for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                    collect(child, sb);
                }
            }
        }
    }
}
