package dev.quarry.extraction;

import dev.quarry.PageContent;
import dev.quarry.config.PageConfig;
import java.util.List;

/**
 * Joins per-page text into document content, inserting page markers when configured.
 */
public final class PageAssembler {
    private PageAssembler() {
    }

    /**
     * Assemble document content from pages.
     *
     * @param pages pages in order
     * @param config page settings, may be null
     * @return document content
     */
    public static String assemble(List<PageContent> pages, PageConfig config) {
        boolean markers = config != null && config.isInsertPageMarkers();
        StringBuilder out = new StringBuilder();
        for (PageContent page : pages) {
            String text = page.content().strip();
            if (markers) {
                out.append(config.markerFor(page.pageNumber()));
                out.append(text);
            } else if (!text.isEmpty()) {
                if (out.length() > 0) {
                    out.append("\n\n");
                }
                out.append(text);
            }
        }
        return markers ? out.toString().stripTrailing() : out.toString();
    }
}
