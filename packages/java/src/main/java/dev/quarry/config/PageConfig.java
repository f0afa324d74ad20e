package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-page output for paginated formats (PDF, PPTX, ODP).
 *
 * <p>Extractors always split paginated documents into pages because OCR and chunking need them.
 * This config only decides what reaches the caller: the {@code pages} list, and markers written
 * into {@code content} ahead of each page's text.</p>
 */
public final class PageConfig {
    public static final String PAGE_NUMBER_PLACEHOLDER = "{page_num}";
    private static final String DEFAULT_MARKER_FORMAT = "\n\n<!-- PAGE " + PAGE_NUMBER_PLACEHOLDER + " -->\n\n";

    private final boolean extractPages;
    private final boolean insertPageMarkers;
    private final String markerFormat;

    private PageConfig(Builder builder) {
        this.extractPages = builder.extractPages;
        this.insertPageMarkers = builder.insertPageMarkers;
        this.markerFormat = builder.markerFormat == null ? DEFAULT_MARKER_FORMAT : builder.markerFormat;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Keep the {@code pages} list on the result. */
    public boolean isExtractPages() {
        return extractPages;
    }

    public boolean isInsertPageMarkers() {
        return insertPageMarkers;
    }

    public String getMarkerFormat() {
        return markerFormat;
    }

    /**
     * The marker written before page {@code pageNumber}.
     */
    public String markerFor(int pageNumber) {
        return markerFormat.replace(PAGE_NUMBER_PLACEHOLDER, String.valueOf(pageNumber));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("extract_pages", extractPages);
        map.put("insert_page_markers", insertPageMarkers);
        map.put("marker_format", markerFormat);
        return map;
    }

    static PageConfig fromMap(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        Builder builder = builder()
            .extractPages(ConfigValues.asBoolean(map.get("extract_pages"), false))
            .insertPageMarkers(ConfigValues.asBoolean(map.get("insert_page_markers"), false));
        String format = ConfigValues.asString(map.get("marker_format"));
        if (format != null) {
            builder.markerFormat(format);
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PageConfig)) {
            return false;
        }
        PageConfig that = (PageConfig) obj;
        return extractPages == that.extractPages
            && insertPageMarkers == that.insertPageMarkers
            && markerFormat.equals(that.markerFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(extractPages, insertPageMarkers, markerFormat);
    }

    @Override
    public String toString() {
        return "PageConfig[extract_pages=" + extractPages
            + ", insert_page_markers=" + insertPageMarkers + "]";
    }

    public static final class Builder {
        private boolean extractPages;
        private boolean insertPageMarkers;
        private String markerFormat;

        private Builder() {
        }

        public Builder extractPages(boolean extractPages) {
            this.extractPages = extractPages;
            return this;
        }

        public Builder insertPageMarkers(boolean insertPageMarkers) {
            this.insertPageMarkers = insertPageMarkers;
            return this;
        }

        /**
         * Marker template. {@value PageConfig#PAGE_NUMBER_PLACEHOLDER} is replaced by the 1-based page
         * number; null restores the HTML-comment default.
         */
        public Builder markerFormat(String markerFormat) {
            this.markerFormat = markerFormat;
            return this;
        }

        public PageConfig build() {
            return new PageConfig(this);
        }
    }
}
