package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PageContent;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Raster images. The text comes from OCR; this extractor only reports the image itself as one
 * visual page, with dimensions when {@link ImageIO} can read the header.
 */
public final class ImageExtractor implements DocumentExtractor, PageRenderer {
    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Metadata.Builder metadata = Metadata.builder()
            .pageCount(1)
            .additional("format", mimeType.substring(mimeType.indexOf('/') + 1));
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers != null && readers.hasNext()) {
                ImageReader reader = readers.next();
                try {
                    reader.setInput(input);
                    metadata.additional("width", reader.getWidth(0))
                        .additional("height", reader.getHeight(0));
                } finally {
                    reader.dispose();
                }
            }
        } catch (IOException e) {
            throw new QuarryException.ImageProcessing("Failed to read image header: " + e.getMessage(), e);
        }
        return ExtractionResult.builder(mimeType)
            .content("")
            .metadata(metadata.build())
            .addPage(new PageContent(1, "", true, 0.0))
            .build();
    }

    @Override
    public byte[] renderPage(byte[] data, int pageNumber, int dpi, ExtractionConfig config) {
        return data.clone();
    }
}
