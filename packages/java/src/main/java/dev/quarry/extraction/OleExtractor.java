package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.hslf.usermodel.HSLFNotes;
import org.apache.poi.hslf.usermodel.HSLFPictureShape;
import org.apache.poi.hslf.usermodel.HSLFShape;
import org.apache.poi.hslf.usermodel.HSLFSlide;
import org.apache.poi.hslf.usermodel.HSLFSlideShow;
import org.apache.poi.hslf.usermodel.HSLFTextParagraph;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.poifs.filesystem.DirectoryNode;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.util.RecordFormatException;

/**
 * Legacy binary Office files (Word 97 {@code .doc}, Excel 97 {@code .xls}, PowerPoint 97
 * {@code .ppt}) through POI's HWPF, HSSF and HSLF.
 *
 * <p>The format is taken from the streams inside the OLE2 container rather than from the declared
 * type, so a bare {@code application/x-ole-storage} input is handled as well. Outlook messages found
 * that way are handed to {@link EmailExtractor}.</p>
 */
public final class OleExtractor implements DocumentExtractor {
    enum Kind {
        WORD(MimeTypes.DOC), EXCEL(MimeTypes.XLS), POWERPOINT(MimeTypes.PPT), OUTLOOK(MimeTypes.MSG);

        final String mimeType;

        Kind(String mimeType) {
            this.mimeType = mimeType;
        }
    }

    private final EmailExtractor email = new EmailExtractor();

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        try (POIFSFileSystem fs = new POIFSFileSystem(new ByteArrayInputStream(data))) {
            Kind kind = kindOf(fs.getRoot());
            String resultType = MimeTypes.OLE_STORAGE.equals(mimeType) ? kind.mimeType : mimeType;
            switch (kind) {
                case WORD:
                    return word(fs, resultType);
                case EXCEL:
                    return excel(fs, resultType);
                case POWERPOINT:
                    return powerPoint(fs, resultType, config);
                default:
                    return email.extract(data, MimeTypes.MSG, config).toBuilder().mimeType(resultType).build();
            }
        } catch (IOException | UnsupportedFileFormatException | EncryptedDocumentException | RecordFormatException e) {
            throw new QuarryException.Parsing("Failed to parse legacy Office file: " + e.getMessage(), e);
        }
    }

    static Kind kindOf(DirectoryNode root) throws QuarryException.UnsupportedFormat {
        if (root.hasEntry("WordDocument")) {
            return Kind.WORD;
        }
        if (root.hasEntry("Workbook") || root.hasEntry("WORKBOOK") || root.hasEntry("Book")) {
            return Kind.EXCEL;
        }
        if (root.hasEntry("PowerPoint Document")) {
            return Kind.POWERPOINT;
        }
        for (String name : root.getEntryNames()) {
            if (name.startsWith("__substg1.0_")) {
                return Kind.OUTLOOK;
            }
        }
        throw new QuarryException.UnsupportedFormat(
            "OLE2 container holds no Word, Excel, PowerPoint or Outlook stream: " + root.getEntryNames());
    }

    private static ExtractionResult word(POIFSFileSystem fs, String mimeType) throws IOException {
        try (WordExtractor extractor = new WordExtractor(fs)) {
            StringBuilder content = new StringBuilder();
            int paragraphs = 0;
            for (String paragraph : extractor.getParagraphText()) {
                String text = WordExtractor.stripFields(paragraph).strip();
                if (!text.isEmpty()) {
                    content.append(text).append("\n\n");
                    paragraphs++;
                }
            }
            SummaryInformation summary = extractor.getSummaryInformation();
            Metadata.Builder metadata = PoiSupport.metadata(summary)
                .additional("paragraph_count", paragraphs);
            if (summary != null && summary.getPageCount() > 0) {
                metadata.pageCount(summary.getPageCount());
            }
            return ExtractionResult.builder(mimeType)
                .content(Texts.tidy(content.toString()))
                .metadata(metadata.build())
                .build();
        }
    }

    private static ExtractionResult excel(POIFSFileSystem fs, String mimeType) throws IOException {
        try (HSSFWorkbook workbook = new HSSFWorkbook(fs)) {
            ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
            DataFormatter formatter = new DataFormatter();
            StringBuilder content = new StringBuilder();
            List<String> sheetNames = new ArrayList<>();
            for (int s = 0; s < workbook.getNumberOfSheets(); s++) {
                Sheet sheet = workbook.getSheetAt(s);
                sheetNames.add(sheet.getSheetName());
                List<List<String>> rows = new ArrayList<>();
                for (Row row : sheet) {
                    List<String> values = new ArrayList<>();
                    // HSSF rows have at most 256 columns.
                    for (int c = 0; c < Math.max(row.getLastCellNum(), 0); c++) {
                        Cell cell = row.getCell(c);
                        values.add(cell != null ? formatter.formatCellValue(cell) : "");
                    }
                    while (!values.isEmpty() && values.get(values.size() - 1).isEmpty()) {
                        values.remove(values.size() - 1);
                    }
                    if (!values.isEmpty()) {
                        rows.add(values);
                    }
                }
                if (content.length() > 0) {
                    content.append("\n\n");
                }
                content.append("## ").append(sheet.getSheetName()).append('\n');
                for (List<String> row : rows) {
                    content.append(String.join("\t", row).stripTrailing()).append('\n');
                }
                if (!rows.isEmpty()) {
                    result.addTable(Table.of(rows, s + 1));
                }
            }
            Metadata metadata = PoiSupport.metadata(workbook.getSummaryInformation())
                .additional("sheet_count", sheetNames.size())
                .additional("sheet_names", sheetNames)
                .build();
            return result
                .content(content.toString().strip())
                .metadata(metadata)
                .build();
        }
    }

    private static ExtractionResult powerPoint(POIFSFileSystem fs, String mimeType, ExtractionConfig config)
        throws IOException {
        try (HSLFSlideShow show = new HSLFSlideShow(fs)) {
            List<PageContent> pages = new ArrayList<>();
            ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
            int imageIndex = 0;
            for (HSLFSlide slide : show.getSlides()) {
                StringBuilder text = new StringBuilder();
                appendParagraphs(text, slide.getTextParagraphs());
                HSLFNotes notes = slide.getNotes();
                if (notes != null) {
                    StringBuilder noteText = new StringBuilder();
                    appendParagraphs(noteText, notes.getTextParagraphs());
                    if (noteText.length() > 0) {
                        text.append("Notes: ").append(noteText.toString().strip()).append('\n');
                    }
                }
                boolean pictures = false;
                for (HSLFShape shape : slide.getShapes()) {
                    if (shape instanceof HSLFPictureShape) {
                        pictures = true;
                        HSLFPictureShape picture = (HSLFPictureShape) shape;
                        if (config.wantsImages() && picture.getPictureData() != null) {
                            result.addImage(PoiSupport.image(picture.getPictureData().getData(),
                                picture.getPictureData().getType().extension.replace(".", ""),
                                imageIndex++, slide.getSlideNumber()));
                        }
                    }
                }
                String slideText = text.toString().strip();
                pages.add(new PageContent(slide.getSlideNumber(), slideText, pictures,
                    slideText.isEmpty() ? 0.0 : 1.0));
            }
            Metadata.Builder metadata = PoiSupport.metadata(show.getSlideShowImpl().getSummaryInformation());
            metadata.pageCount(pages.size());
            return result
                .content(PageAssembler.assemble(pages, config.getPages()))
                .metadata(metadata.build())
                .pages(pages)
                .build();
        }
    }

    private static void appendParagraphs(StringBuilder out, List<List<HSLFTextParagraph>> runs) {
        for (List<HSLFTextParagraph> paragraphs : runs) {
            String text = HSLFTextParagraph.getText(paragraphs).replace('\r', '\n').strip();
            if (!text.isEmpty()) {
                out.append(text).append('\n');
            }
        }
    }
}
