package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractedImage;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

/**
 * PPTX via POI's {@link XMLSlideShow}; each slide is a page.
 */
public final class PptxExtractor implements DocumentExtractor, PageRenderer {
    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        try (XMLSlideShow show = new XMLSlideShow(new ByteArrayInputStream(data))) {
            ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
            List<PageContent> pages = new ArrayList<>();
            boolean wantImages = config.wantsImages();
            int[] imageIndex = {0};
            int slideNumber = 0;
            for (XSLFSlide slide : show.getSlides()) {
                slideNumber++;
                SlideCollector collector = new SlideCollector(slideNumber, wantImages, result, imageIndex);
                collector.collect(slide.getShapes());
                XSLFNotes notes = slide.getNotes();
                if (notes != null) {
                    StringBuilder noteText = new StringBuilder();
                    for (XSLFShape shape : notes.getShapes()) {
                        if (shape instanceof XSLFTextShape) {
                            noteText.append(((XSLFTextShape) shape).getText()).append('\n');
                        }
                    }
                    collector.notes = noteText.toString().strip();
                }
                String text = collector.text();
                pages.add(new PageContent(slideNumber, text, collector.pictures > 0, text.isEmpty() ? 0.0 : 1.0));
            }

            Metadata.Builder metadata = PoiSupport.metadata(show.getProperties());
            metadata.pageCount(pages.size());
            return result
                .content(PageAssembler.assemble(pages, config.getPages()))
                .metadata(metadata.build())
                .pages(pages)
                .build();
        } catch (IOException | POIXMLException | UnsupportedFileFormatException | OpenXML4JRuntimeException e) {
            throw new QuarryException.Parsing("Failed to parse PPTX: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] renderPage(byte[] data, int pageNumber, int dpi, ExtractionConfig config) throws QuarryException {
        try (XMLSlideShow show = new XMLSlideShow(new ByteArrayInputStream(data))) {
            List<XSLFSlide> slides = show.getSlides();
            if (pageNumber < 1 || pageNumber > slides.size()) {
                throw new QuarryException.Parsing("Slide " + pageNumber + " is out of range (1-" + slides.size() + ")");
            }
            Dimension size = show.getPageSize();
            double scale = dpi / 72.0;
            BufferedImage image = new BufferedImage(
                Math.max(1, (int) Math.ceil(size.width * scale)),
                Math.max(1, (int) Math.ceil(size.height * scale)),
                BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = image.createGraphics();
            try {
                graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                graphics.setPaint(Color.WHITE);
                graphics.fill(new Rectangle2D.Double(0, 0, image.getWidth(), image.getHeight()));
                graphics.scale(scale, scale);
                slides.get(pageNumber - 1).draw(graphics);
            } finally {
                graphics.dispose();
            }
            return PdfExtractor.encodePng(image);
        } catch (IOException | POIXMLException | UnsupportedFileFormatException | OpenXML4JRuntimeException e) {
            throw new QuarryException.ImageProcessing(
                "Failed to render slide " + pageNumber + ": " + e.getMessage(), e);
        }
    }

    private static final class SlideCollector {
        private final int slideNumber;
        private final boolean wantImages;
        private final ExtractionResult.Builder result;
        private final int[] imageIndex;
        private final StringBuilder text = new StringBuilder();
        private String notes;
        private int pictures;

        SlideCollector(int slideNumber, boolean wantImages, ExtractionResult.Builder result, int[] imageIndex) {
            this.slideNumber = slideNumber;
            this.wantImages = wantImages;
            this.result = result;
            this.imageIndex = imageIndex;
        }

        void collect(List<XSLFShape> shapes) {
            for (XSLFShape shape : shapes) {
                if (shape instanceof XSLFGroupShape) {
                    collect(((XSLFGroupShape) shape).getShapes());
                } else if (shape instanceof XSLFTable) {
                    table((XSLFTable) shape);
                } else if (shape instanceof XSLFTextShape) {
                    append(((XSLFTextShape) shape).getText());
                } else if (shape instanceof XSLFPictureShape) {
                    pictures++;
                    if (wantImages) {
                        XSLFPictureData picture = ((XSLFPictureShape) shape).getPictureData();
                        ExtractedImage image = PoiSupport.image(picture.getData(), picture.suggestFileExtension(),
                            imageIndex[0]++, slideNumber);
                        result.addImage(image);
                    }
                }
            }
        }

        private void table(XSLFTable table) {
            List<List<String>> rows = new ArrayList<>();
            StringBuilder rendered = new StringBuilder();
            for (XSLFTableRow row : table.getRows()) {
                List<String> cells = new ArrayList<>();
                for (XSLFTableCell cell : row.getCells()) {
                    cells.add(cell.getText() != null ? cell.getText().strip() : "");
                }
                rows.add(cells);
                rendered.append(String.join("\t", cells)).append('\n');
            }
            if (!rows.isEmpty()) {
                result.addTable(Table.of(rows, slideNumber));
                append(rendered.toString());
            }
        }

        private void append(String value) {
            if (value == null || value.isBlank()) {
                return;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(value.strip());
        }

        String text() {
            if (notes != null && !notes.isEmpty()) {
                return text + (text.length() > 0 ? "\n\n" : "") + "Notes: " + notes;
            }
            return text.toString();
        }
    }
}
