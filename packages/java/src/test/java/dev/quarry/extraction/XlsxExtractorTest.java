package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.TestDocuments;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("XlsxExtractor")
final class XlsxExtractorTest {
    private final XlsxExtractor extractor = new XlsxExtractor();

    private ExtractionResult extract(byte[] data) throws QuarryException {
        return extractor.extract(data, MimeTypes.XLSX, ExtractionConfig.defaults());
    }

    @Nested
    @DisplayName("ordinary workbooks")
    final class OrdinaryTest {

        @Test
        void shouldRenderSheetAsHeadingAndTabSeparatedRows() throws QuarryException {
            byte[] workbook = TestDocuments.xlsx("Budget", List.of(
                List.of("Item", "Cost"),
                List.of("Paper", "12")));

            ExtractionResult result = extract(workbook);

            assertThat(result.getContent()).isEqualTo("## Budget\nItem\tCost\nPaper\t12");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells()).containsExactly(
                    List.of("Item", "Cost"), List.of("Paper", "12")));
            assertThat(result.getMetadata().get("sheet_count")).contains(1);
            assertThat(result.getMetadata().get("sheet_names")).contains(List.of("Budget"));
            assertThat(result.getMetadata().get("streaming_fallback")).isEmpty();
        }

        @Test
        void shouldKeepGapsInsideCompactDeclaredRange() throws QuarryException {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put("A1", "a");
            cells.put("C1", "c");
            cells.put("A2", "x");
            cells.put("B2", "y");

            ExtractionResult result = extract(TestDocuments.sparseXlsx("A1:C2", cells));

            assertThat(result.getContent()).isEqualTo("## Huge\na\t\tc\nx\ty");
            assertThat(result.getMetadata().get("streaming_fallback")).isEmpty();
        }
    }

    @Nested
    @DisplayName("declared dimensions")
    final class DimensionTest {

        @Test
        void shouldNotTrustMaximalDimensionWithFewCells() throws QuarryException {
            Map<String, String> cells = new LinkedHashMap<>();
            for (char column = 'A'; column <= 'Z'; column++) {
                cells.put(column + "1", "v" + column);
            }

            ExtractionResult result = extract(TestDocuments.sparseXlsx("A1:XFD1048576", cells));

            assertThat(result.getContent()).startsWith("## Huge\nvA\tvB").contains("vZ");
            assertThat(result.getMetadata().get("streaming_fallback")).contains(true);
        }

        @Test
        void shouldRenderOnlyPopulatedCellsOfScatteredSheet() throws QuarryException {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put("A1", "top-left");
            cells.put("XFD1048576", "bottom-right");

            ExtractionResult result = extract(TestDocuments.sparseXlsx("A1:XFD1048576", cells));

            assertThat(result.getContent()).startsWith("## Huge\ntop-left\n").endsWith("\tbottom-right");
            assertThat(result.getTables()).singleElement().satisfies(table -> {
                assertThat(table.getRowCount()).isEqualTo(2);
                assertThat(table.getRow(1)).hasSize(XlsxExtractor.MAX_COLUMNS).endsWith("bottom-right");
            });
        }

        @Test
        void shouldKeepColumnPositionsWhenFallingBackToSparseRows() throws QuarryException {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put("A1", "label");
            cells.put("D2", "value");

            ExtractionResult result = extract(TestDocuments.sparseXlsx("A1:XFD1048576", cells));

            assertThat(result.getMetadata().get("streaming_fallback")).contains(true);
            assertThat(result.getContent()).isEqualTo("## Huge\nlabel\n\t\t\tvalue");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.getRow(1)).containsExactly("", "", "", "value"));
        }

        @Test
        void shouldRenderSmallSparseSheetDensely() throws QuarryException {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put("A1", "Region");
            cells.put("B1", "Q1");
            cells.put("A5", "North");
            cells.put("C9", "note");
            cells.put("H11", "Total");

            ExtractionResult result = extract(TestDocuments.sparseXlsx("A1:H11", cells));

            assertThat(result.getMetadata().get("streaming_fallback")).isEmpty();
            assertThat(result.getTables()).singleElement().satisfies(table -> {
                assertThat(table.getRowCount()).isEqualTo(11);
                assertThat(table.getColumnCount()).isEqualTo(8);
                assertThat(table.getCell(10, 7)).isEqualTo("Total");
                assertThat(table.getCell(8, 2)).isEqualTo("note");
            });
            assertThat(result.getContent()).endsWith("\t\t\t\t\t\t\tTotal");
        }

        @Test
        void shouldIgnoreMalformedDimension() throws QuarryException {
            ExtractionResult result = extract(TestDocuments.sparseXlsx("not-a-range", Map.of("B2", "only")));

            assertThat(result.getContent()).isEqualTo("## Huge\nonly");
        }
    }

    @Test
    void shouldParseCellReferences() {
        assertThat(XlsxExtractor.parseCellRef("A1")).containsExactly(0, 0);
        assertThat(XlsxExtractor.parseCellRef("$AB$12")).containsExactly(11, 27);
        assertThat(XlsxExtractor.parseCellRef("XFD1048576")).containsExactly(1_048_575, 16_383);
        assertThat(XlsxExtractor.parseCellRef("12")).isNull();
        assertThat(XlsxExtractor.parseCellRef("A0")).isNull();
    }

    @Test
    void shouldRejectPackageWithoutWorkbook() {
        byte[] zip = TestDocuments.zip(Map.of("xl/other.xml", "<x/>"));

        assertThatThrownBy(() -> extract(zip)).isInstanceOf(QuarryException.Parsing.class);
    }
}
