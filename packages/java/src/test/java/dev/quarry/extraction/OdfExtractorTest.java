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

@DisplayName("OdfExtractor")
final class OdfExtractorTest {
    private final OdfExtractor extractor = new OdfExtractor();

    private ExtractionResult extract(String mime, String body, String meta) throws QuarryException {
        return extractor.extract(TestDocuments.odf(mime, body, meta), mime, ExtractionConfig.defaults());
    }

    @Nested
    @DisplayName("text documents")
    final class TextTest {

        @Test
        void shouldExtractParagraphsAndMetadata() throws QuarryException {
            ExtractionResult result = extract(MimeTypes.ODT,
                "<office:text><text:h>Minutes</text:h>"
                    + "<text:p>Meeting<text:s text:c=\"2\"/>opened.</text:p></office:text>",
                "<dc:title>Board minutes</dc:title><meta:initial-creator>Sam</meta:initial-creator>"
                    + "<meta:keyword>board</meta:keyword>");

            assertThat(result.getContent()).isEqualTo("Minutes\n\nMeeting  opened.");
            assertThat(result.getMetadata().getTitle()).contains("Board minutes");
            assertThat(result.getMetadata().getAuthors()).containsExactly("Sam");
            assertThat(result.getMetadata().getKeywords()).containsExactly("board");
        }

        @Test
        void shouldRequireContentPart() {
            byte[] zip = TestDocuments.zip(Map.of("mimetype", MimeTypes.ODT));

            assertThatThrownBy(() -> extractor.extract(zip, MimeTypes.ODT, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("content.xml");
        }
    }

    @Nested
    @DisplayName("spreadsheets")
    final class SpreadsheetTest {

        @Test
        void shouldRenderSheetsWithHeadings() throws QuarryException {
            ExtractionResult result = extract(MimeTypes.ODS,
                "<office:spreadsheet><table:table table:name=\"Q1\">"
                    + "<table:table-row><table:table-cell><text:p>a</text:p></table:table-cell>"
                    + "<table:table-cell><text:p>b</text:p></table:table-cell></table:table-row>"
                    + "</table:table></office:spreadsheet>", null);

            assertThat(result.getContent()).isEqualTo("## Q1\na\tb");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells()).containsExactly(List.of("a", "b")));
        }

        @Test
        void shouldCapRepeatedRowsAndColumns() throws QuarryException {
            ExtractionResult result = extract(MimeTypes.ODS,
                "<office:spreadsheet><table:table table:name=\"Big\">"
                    + "<table:table-row table:number-rows-repeated=\"1048576\">"
                    + "<table:table-cell table:number-columns-repeated=\"3\"><text:p>x</text:p></table:table-cell>"
                    + "</table:table-row></table:table></office:spreadsheet>", null);

            assertThat(result.getTables()).singleElement().satisfies(table -> {
                assertThat(table.getRowCount()).isEqualTo(1000);
                assertThat(table.getRow(0)).containsExactly("x", "x", "x");
            });
        }

        @Test
        void shouldNotPadTrailingCellAtHugeColumnOffset() throws QuarryException {
            ExtractionResult result = extract(MimeTypes.ODS,
                "<office:spreadsheet><table:table table:name=\"Wide\"><table:table-row>"
                    + "<table:table-cell><text:p>first</text:p></table:table-cell>"
                    + "<table:table-cell table:number-columns-repeated=\"2000000\"/>"
                    + "<table:table-cell><text:p>last</text:p></table:table-cell>"
                    + "</table:table-row></table:table></office:spreadsheet>", null);

            assertThat(result.getContent()).isEqualTo("## Wide\nfirst\tlast");
            assertThat(result.getMetadata().get("streaming_fallback")).contains(true);
        }
    }

    @Nested
    @DisplayName("presentations")
    final class PresentationTest {

        @Test
        void shouldTreatDrawPagesAsPages() throws QuarryException {
            ExtractionResult result = extract(MimeTypes.ODP,
                "<office:presentation><draw:page><text:p>One</text:p></draw:page>"
                    + "<draw:page><text:p>Two</text:p></draw:page></office:presentation>", null);

            assertThat(result.getPages()).extracting(PageContent::content).containsExactly("One", "Two");
            assertThat(result.getMetadata().getPageCount()).contains(2);
        }
    }
}
