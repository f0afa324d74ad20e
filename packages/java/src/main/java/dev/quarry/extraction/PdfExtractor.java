package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractedImage;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.config.PdfConfig;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PDF via PDFBox.
 *
 * <p>Text is stripped page by page. Each page reports its text coverage (glyph area over page
 * area) and whether it draws images, which the OCR orchestrator uses to decide on fallback OCR.
 * Pages are always returned; the engine drops them when {@code pages.extract_pages} is off.</p>
 */
public final class PdfExtractor implements DocumentExtractor, PageRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(PdfExtractor.class);

    /** Nested form XObjects are followed at most this deep when looking for images. */
    private static final int MAX_FORM_DEPTH = 8;

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        PdfConfig pdfConfig = config.getPdfOptions();
        try (PDDocument document = open(data, pdfConfig)) {
            int pageCount = document.getNumberOfPages();
            CoverageStripper stripper = new CoverageStripper();
            List<PageContent> pages = new ArrayList<>(pageCount);
            ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
            boolean images = config.wantsImages();
            int imageIndex = 0;

            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                PDPage page = document.getPage(pageNumber - 1);
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                stripper.resetCoverage();
                String text = Texts.normalizeNewlines(stripper.getText(document)).strip();
                double coverage = stripper.coverage(page);
                boolean visual = hasVisualContent(page.getResources(), 0);
                pages.add(new PageContent(pageNumber, text, visual, coverage));

                if (images && visual) {
                    for (ExtractedImage image : collectImages(page.getResources(), pageNumber, imageIndex)) {
                        result.addImage(image);
                        imageIndex++;
                    }
                }
            }

            Metadata.Builder metadata = pdfConfig == null || pdfConfig.isExtractMetadata()
                ? readMetadata(document.getDocumentInformation())
                : Metadata.builder();
            metadata.pageCount(pageCount);
            if (document.isEncrypted()) {
                metadata.additional("encrypted", true);
            }
            if (document.getVersion() > 0) {
                metadata.additional("pdf_version", String.valueOf(document.getVersion()));
            }

            return result
                .content(PageAssembler.assemble(pages, config.getPages()))
                .metadata(metadata.build())
                .pages(pages)
                .build();
        } catch (IOException e) {
            throw new QuarryException.Parsing("Failed to parse PDF: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] renderPage(byte[] data, int pageNumber, int dpi, ExtractionConfig config) throws QuarryException {
        try (PDDocument document = open(data, config.getPdfOptions())) {
            if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
                throw new QuarryException.Parsing("Page " + pageNumber + " is out of range (1-"
                    + document.getNumberOfPages() + ")");
            }
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(pageNumber - 1, dpi, ImageType.RGB);
            return encodePng(image);
        } catch (IOException e) {
            throw new QuarryException.ImageProcessing("Failed to render PDF page " + pageNumber + ": "
                + e.getMessage(), e);
        }
    }

    /**
     * Open a document, trying the empty password and then each configured one.
     */
    static PDDocument open(byte[] data, PdfConfig config) throws QuarryException {
        List<String> passwords = PdfConfig.candidatePasswords(config);
        for (String password : passwords) {
            try {
                return Loader.loadPDF(data, password);
            } catch (InvalidPasswordException e) {
                LOG.debug("PDF password rejected, {} candidates configured", passwords.size() - 1);
            } catch (IOException e) {
                throw new QuarryException.Parsing("Failed to open PDF: " + e.getMessage(), e);
            }
        }
        if (passwords.size() == 1) {
            throw new QuarryException.Parsing("PDF is encrypted and requires a password; set pdf_options.passwords");
        }
        throw new QuarryException.Parsing("PDF is encrypted and none of the " + (passwords.size() - 1)
            + " configured passwords was accepted");
    }

    private static Metadata.Builder readMetadata(PDDocumentInformation info) {
        Metadata.Builder metadata = Metadata.builder();
        if (info == null) {
            return metadata;
        }
        metadata.title(info.getTitle())
            .subject(info.getSubject())
            .createdAt(iso(info.getCreationDate()))
            .modifiedAt(iso(info.getModificationDate()));
        String author = info.getAuthor();
        if (author != null && !author.isBlank()) {
            metadata.authors(List.of(author.trim())).createdBy(author.trim());
        }
        metadata.keywords(CoreProperties.splitKeywords(info.getKeywords()));
        if (info.getCreator() != null) {
            metadata.additional("creator_tool", info.getCreator());
        }
        if (info.getProducer() != null) {
            metadata.additional("producer", info.getProducer());
        }
        return metadata;
    }

    private static String iso(Calendar calendar) {
        return calendar != null ? calendar.toInstant().toString() : null;
    }

    private static boolean hasVisualContent(PDResources resources, int depth) throws IOException {
        if (resources == null || depth > MAX_FORM_DEPTH) {
            return false;
        }
        for (COSName name : resources.getXObjectNames()) {
            PDXObject object = resources.getXObject(name);
            if (object instanceof PDImageXObject) {
                return true;
            }
            if (object instanceof PDFormXObject
                    && hasVisualContent(((PDFormXObject) object).getResources(), depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private static List<ExtractedImage> collectImages(PDResources resources, int pageNumber, int firstIndex) {
        List<ExtractedImage> images = new ArrayList<>();
        if (resources == null) {
            return images;
        }
        for (COSName name : resources.getXObjectNames()) {
            try {
                PDXObject object = resources.getXObject(name);
                if (!(object instanceof PDImageXObject)) {
                    continue;
                }
                BufferedImage image = ((PDImageXObject) object).getImage();
                if (image == null) {
                    continue;
                }
                images.add(new ExtractedImage(encodePng(image), "png", firstIndex + images.size(), pageNumber,
                    image.getWidth(), image.getHeight(), null));
            } catch (IOException e) {
                LOG.warn("Could not extract image {} on page {}: {}", name.getName(), pageNumber, e.getMessage());
            }
        }
        return images;
    }

    static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    /** Accumulates the glyph area of the current page range. */
    private static final class CoverageStripper extends PDFTextStripper {
        private double glyphArea;

        CoverageStripper() throws IOException {
            setSortByPosition(true);
        }

        void resetCoverage() {
            glyphArea = 0.0;
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            for (TextPosition position : textPositions) {
                if (!position.getUnicode().isBlank()) {
                    glyphArea += Math.abs(position.getWidthDirAdj() * position.getHeightDir());
                }
            }
            super.writeString(text, textPositions);
        }

        double coverage(PDPage page) {
            PDRectangle box = page.getCropBox();
            double area = (double) box.getWidth() * box.getHeight();
            if (area <= 0.0) {
                return 0.0;
            }
            return Math.min(1.0, glyphArea / area);
        }
    }
}
