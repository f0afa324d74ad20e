package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Text and markup extractors")
final class MarkupExtractorsTest {

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("HTML")
    final class HtmlTest {
        private final HtmlExtractor extractor = new HtmlExtractor();

        private static final String PAGE = "<html lang=\"en\"><head><title>Guide</title>"
            + "<meta name=\"author\" content=\"Ada\"><meta name=\"keywords\" content=\"a, b\">"
            + "<style>p { color: red }</style><script>var x = 1;</script></head>"
            + "<body><h1>Intro</h1><p>First paragraph.</p><p>Second paragraph.</p>"
            + "<table><tr><th>k</th><th>v</th></tr><tr><td>1</td><td>2</td></tr></table></body></html>";

        @Test
        void shouldSeparateBlocksAndSkipScripts() {
            ExtractionResult result = extractor.extract(utf8(PAGE), MimeTypes.HTML, ExtractionConfig.defaults());

            assertThat(result.getContent()).startsWith("Intro\n\nFirst paragraph.\n\nSecond paragraph.");
            assertThat(result.getContent()).doesNotContain("var x").doesNotContain("color");
        }

        @Test
        void shouldReadHeadMetadata() {
            ExtractionResult result = extractor.extract(utf8(PAGE), MimeTypes.HTML, ExtractionConfig.defaults());

            assertThat(result.getMetadata().getTitle()).contains("Guide");
            assertThat(result.getMetadata().getAuthors()).containsExactly("Ada");
            assertThat(result.getMetadata().getKeywords()).containsExactly("a", "b");
            assertThat(result.getMetadata().getLanguage()).contains("en");
        }

        @Test
        void shouldCollectTables() {
            ExtractionResult result = extractor.extract(utf8(PAGE), MimeTypes.HTML, ExtractionConfig.defaults());

            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells()).containsExactly(List.of("k", "v"), List.of("1", "2")));
        }

        @Test
        void shouldRenderMarkdown() {
            String markdown = extractor.renderMarkdown(utf8(PAGE), MimeTypes.HTML);

            assertThat(markdown).startsWith("# Intro\n\nFirst paragraph.").contains("| k | v |");
        }

        @Test
        void shouldOnlySkipBlocksNestedInsideATable() {
            String page = "<body><h1>Intro</h1><p>Body</p>"
                + "<table><tr><td><p>cell text</p></td></tr></table><p>After</p></body>";

            String markdown = extractor.renderMarkdown(utf8(page), MimeTypes.HTML);

            assertThat(markdown).contains("# Intro").contains("Body").contains("After");
            assertThat(markdown.indexOf("cell text")).isEqualTo(markdown.lastIndexOf("cell text"));
        }
    }

    @Nested
    @DisplayName("Markdown")
    final class MarkdownTest {
        private final MarkdownExtractor extractor = new MarkdownExtractor();

        @Test
        void shouldStripSyntaxAndTakeTitleFromFirstHeading() {
            byte[] source = utf8("# Release notes\n\nSome **bold** text.\n\n## Fixes\n\n- one\n");

            ExtractionResult result = extractor.extract(source, MimeTypes.MARKDOWN, ExtractionConfig.defaults());

            assertThat(result.getContent()).contains("Some bold text.").doesNotContain("**");
            assertThat(result.getMetadata().getTitle()).contains("Release notes");
            assertThat(result.getMetadata().get("heading_count")).contains(2);
        }
    }

    @Nested
    @DisplayName("JSON")
    final class JsonTest {
        private final JsonExtractor extractor = new JsonExtractor();

        @Test
        void shouldEmitPathValueLines() throws QuarryException {
            byte[] json = utf8("{\"title\": \"Doc\", \"tags\": [\"x\", \"y\"], \"n\": 3, \"nested\": {\"k\": \"v\"}}");

            ExtractionResult result = extractor.extract(json, MimeTypes.JSON, ExtractionConfig.defaults());

            assertThat(result.getContent()).isEqualTo("title: Doc\ntags[0]: x\ntags[1]: y\nnested.k: v");
            assertThat(result.getMetadata().getTitle()).contains("Doc");
            assertThat(result.getMetadata().get("string_leaf_count")).contains(4);
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> extractor.extract(utf8("{\"a\": "), MimeTypes.JSON, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class);
        }
    }

    @Nested
    @DisplayName("XML")
    final class XmlTest {
        private final XmlExtractor extractor = new XmlExtractor();

        @Test
        void shouldEmitElementAndAttributeLines() throws QuarryException {
            byte[] xml = utf8("<?xml version=\"1.0\"?>"
                + "<book id=\"7\"><title>Dune</title><author>Herbert</author></book>");

            ExtractionResult result = extractor.extract(xml, MimeTypes.XML, ExtractionConfig.defaults());

            assertThat(result.getContent()).contains("book[id]: 7").contains("title: Dune").contains("author: Herbert");
            assertThat(result.getMetadata().getTitle()).contains("Dune");
        }

        @Test
        void shouldNotResolveExternalEntities() throws QuarryException {
            byte[] xml = utf8("<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY e SYSTEM \"file:///etc/passwd\">]>"
                + "<r>before &e; after</r>");

            try {
                ExtractionResult result = extractor.extract(xml, MimeTypes.XML, ExtractionConfig.defaults());
                assertThat(result.getContent()).doesNotContain("root:");
            } catch (QuarryException.Parsing e) {
                assertThat(e.getMessage()).isNotBlank();
            }
        }

        @Test
        void shouldRejectMalformedXml() {
            assertThatThrownBy(() -> extractor.extract(utf8("<a><b></a>"), MimeTypes.XML, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class);
        }
    }

    @Nested
    @DisplayName("plain text")
    final class PlainTextTest {

        @Test
        void shouldDecodeUtf8WithBom() {
            byte[] data = new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i'};

            ExtractionResult result = new PlainTextExtractor().extract(data, MimeTypes.PLAIN_TEXT,
                ExtractionConfig.defaults());

            assertThat(result.getContent()).isEqualTo("hi");
        }
    }
}
