package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.awt.Rectangle;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.poi.hslf.usermodel.HSLFSlide;
import org.apache.poi.hslf.usermodel.HSLFSlideShow;
import org.apache.poi.hslf.usermodel.HSLFTextBox;
import org.apache.poi.hssf.usermodel.HSSFRow;
import org.apache.poi.hssf.usermodel.HSSFSheet;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OleExtractor")
final class OleExtractorTest {
    private final OleExtractor extractor = new OleExtractor();

    private static byte[] xls() throws IOException {
        try (HSSFWorkbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            HSSFSheet sheet = workbook.createSheet("Budget");
            HSSFRow header = sheet.createRow(0);
            header.createCell(0).setCellValue("Item");
            header.createCell(1).setCellValue("Cost");
            HSSFRow row = sheet.createRow(1);
            row.createCell(0).setCellValue("Rent");
            row.createCell(1).setCellValue(900);
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static byte[] ppt(String... slideTexts) throws IOException {
        try (HSLFSlideShow show = new HSLFSlideShow(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : slideTexts) {
                HSLFSlide slide = show.createSlide();
                HSLFTextBox box = slide.createTextBox();
                box.setText(text);
                box.setAnchor(new Rectangle(50, 50, 400, 100));
            }
            show.write(out);
            return out.toByteArray();
        }
    }

    private static byte[] oleWith(String... streamNames) throws IOException {
        try (POIFSFileSystem fs = new POIFSFileSystem(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String name : streamNames) {
                fs.createDocument(new ByteArrayInputStream(new byte[] {1, 2, 3, 4}), name);
            }
            fs.writeFilesystem(out);
            return out.toByteArray();
        }
    }

    @Nested
    @DisplayName("Excel 97")
    final class ExcelTest {

        @Test
        void shouldRenderSheetsAndTables() throws Exception {
            ExtractionResult result = extractor.extract(xls(), MimeTypes.XLS, ExtractionConfig.defaults());

            assertThat(result.getMimeType()).isEqualTo(MimeTypes.XLS);
            assertThat(result.getContent()).isEqualTo("## Budget\nItem\tCost\nRent\t900");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells())
                    .containsExactly(List.of("Item", "Cost"), List.of("Rent", "900")));
            assertThat(result.getMetadata().get("sheet_count")).contains(1);
            assertThat(result.getMetadata().get("sheet_names")).contains(List.of("Budget"));
        }

        @Test
        void shouldNameTheDetectedFormatForBareOleStorage() throws Exception {
            ExtractionResult result = extractor.extract(xls(), MimeTypes.OLE_STORAGE, ExtractionConfig.defaults());

            assertThat(result.getMimeType()).isEqualTo(MimeTypes.XLS);
            assertThat(result.getContent()).contains("Rent\t900");
        }
    }

    @Nested
    @DisplayName("PowerPoint 97")
    final class PowerPointTest {

        @Test
        void shouldProduceOnePagePerSlide() throws Exception {
            ExtractionResult result = extractor.extract(ppt("Quarterly review", "Next steps"), MimeTypes.PPT,
                ExtractionConfig.defaults());

            assertThat(result.getPages()).hasSize(2);
            assertThat(result.getPages().get(0).content()).contains("Quarterly review");
            assertThat(result.getPages().get(1).content()).contains("Next steps");
            assertThat(result.getContent()).contains("Quarterly review").contains("Next steps");
            assertThat(result.getMetadata().getPageCount()).contains(2);
        }
    }

    @Nested
    @DisplayName("container inspection")
    final class KindTest {

        @Test
        void shouldRecognizeOutlookStreams() throws Exception {
            try (POIFSFileSystem fs = new POIFSFileSystem(
                new ByteArrayInputStream(oleWith("__substg1.0_0037001F")))) {
                assertThat(OleExtractor.kindOf(fs.getRoot())).isEqualTo(OleExtractor.Kind.OUTLOOK);
            }
        }

        @Test
        void shouldRejectContainerWithoutKnownStreams() throws Exception {
            byte[] data = oleWith("Random");

            assertThatThrownBy(() -> extractor.extract(data, MimeTypes.OLE_STORAGE, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.UnsupportedFormat.class)
                .hasMessageContaining("Random");
        }

        @Test
        void shouldReportCorruptInputAsParsingError() {
            byte[] data = "not a compound document".getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> extractor.extract(data, MimeTypes.DOC, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("legacy Office");
        }
    }
}
