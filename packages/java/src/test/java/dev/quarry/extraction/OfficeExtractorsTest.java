package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.TestDocuments;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Office Open XML extractors")
final class OfficeExtractorsTest {

    @Nested
    @DisplayName("DOCX")
    final class DocxTest {
        private final DocxExtractor extractor = new DocxExtractor();

        @Test
        void shouldExtractParagraphsAndTitle() throws QuarryException {
            byte[] docx = TestDocuments.docx("Annual Report", "Revenue grew.", "Costs fell.");

            ExtractionResult result = extractor.extract(docx, MimeTypes.DOCX, ExtractionConfig.defaults());

            assertThat(result.getContent()).isEqualTo("Revenue grew.\n\nCosts fell.");
            assertThat(result.getMetadata().getTitle()).contains("Annual Report");
            assertThat(result.getMetadata().get("paragraph_count")).contains(2);
        }

        @Test
        void shouldEmitTablesInDocumentOrder() throws QuarryException {
            byte[] docx = TestDocuments.docxWithTable(List.of(List.of("Quarter", "Sales"), List.of("Q1", "10")));

            ExtractionResult result = extractor.extract(docx, MimeTypes.DOCX, ExtractionConfig.defaults());

            assertThat(result.getContent()).startsWith("Quarterly figures").contains("Quarter\tSales\nQ1\t10");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.markdown()).contains("| Quarter | Sales |"));
        }

        @Test
        void shouldRenderTableAsMarkdown() throws QuarryException {
            byte[] docx = TestDocuments.docxWithTable(List.of(List.of("A", "B"), List.of("1", "2")));

            String markdown = extractor.renderMarkdown(docx, MimeTypes.DOCX);

            assertThat(markdown).contains("Quarterly figures").contains("| A | B |");
        }

        @Test
        void shouldMapHeadingStyles() {
            assertThat(DocxExtractor.headingLevel("Heading2")).isEqualTo(2);
            assertThat(DocxExtractor.headingLevel("Title")).isEqualTo(1);
            assertThat(DocxExtractor.headingLevel("Normal")).isZero();
            assertThat(DocxExtractor.headingLevel(null)).isZero();
        }

        @Test
        void shouldRejectCorruptPackage() {
            byte[] notDocx = TestDocuments.zip(Map.of("word/document.xml", "<broken"));

            assertThatThrownBy(() -> extractor.extract(notDocx, MimeTypes.DOCX, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class);
        }
    }

    @Nested
    @DisplayName("PPTX")
    final class PptxTest {
        private final PptxExtractor extractor = new PptxExtractor();

        @Test
        void shouldTreatEachSlideAsPage() throws QuarryException {
            byte[] pptx = TestDocuments.pptx("Welcome", "Agenda");

            ExtractionResult result = extractor.extract(pptx, MimeTypes.PPTX, ExtractionConfig.defaults());

            assertThat(result.getPages()).extracting(PageContent::content).containsExactly("Welcome", "Agenda");
            assertThat(result.getContent()).isEqualTo("Welcome\n\nAgenda");
            assertThat(result.getMetadata().getPageCount()).contains(2);
        }

        @Test
        void shouldRejectSlideOutOfRange() {
            byte[] deck = TestDocuments.pptx("Only");

            assertThatThrownBy(() -> extractor.renderPage(deck, 2, 72, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("out of range");
        }
    }
}
