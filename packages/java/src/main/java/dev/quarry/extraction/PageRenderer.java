package dev.quarry.extraction;

import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;

/**
 * Extractors that can rasterize a page for OCR.
 */
public interface PageRenderer {
    /**
     * Render one page as an encoded image.
     *
     * @param data document bytes
     * @param pageNumber 1-indexed page number
     * @param dpi rendering resolution
     * @param config effective configuration (passwords and similar)
     * @return PNG bytes
     * @throws QuarryException if the page cannot be rendered
     */
    byte[] renderPage(byte[] data, int pageNumber, int dpi, ExtractionConfig config) throws QuarryException;
}
