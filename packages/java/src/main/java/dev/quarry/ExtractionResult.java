package dev.quarry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a document extraction operation.
 *
 * <p>Includes extracted content, tables, metadata, detected languages, text chunks, images,
 * per-page content, keywords, the quality score and the warnings recorded by stages that
 * degraded instead of failing. Collections are never null; a feature that was not requested
 * leaves its collection empty.</p>
 */
public final class ExtractionResult {
    private final String content;
    private final String mimeType;
    private final Metadata metadata;
    private final List<Table> tables;
    private final List<Chunk> chunks;
    private final List<ExtractedImage> images;
    private final List<PageContent> pages;
    private final List<String> detectedLanguages;
    private final List<ExtractedKeyword> keywords;
    private final Double qualityScore;
    private final List<ProcessingWarning> processingWarnings;

    private ExtractionResult(Builder builder) {
        this.content = builder.content != null ? builder.content : "";
        this.mimeType = Objects.requireNonNull(builder.mimeType, "mimeType must not be null");
        this.metadata = builder.metadata != null ? builder.metadata : Metadata.empty();
        this.tables = freeze(builder.tables);
        this.chunks = freeze(builder.chunks);
        this.images = freeze(builder.images);
        this.pages = freeze(builder.pages);
        this.detectedLanguages = freeze(builder.detectedLanguages);
        this.keywords = freeze(builder.keywords);
        if (builder.qualityScore != null
            && (builder.qualityScore.isNaN() || builder.qualityScore < 0.0 || builder.qualityScore > 1.0)) {
            throw new IllegalArgumentException("qualityScore must be within [0, 1]: " + builder.qualityScore);
        }
        this.qualityScore = builder.qualityScore;
        this.processingWarnings = freeze(builder.processingWarnings);
    }

    public static Builder builder(String mimeType) {
        return new Builder().mimeType(mimeType);
    }

    /**
     * Empty result for a failed batch item, carrying the failure under {@code error}.
     *
     * @param mimeType declared or detected type, may be null
     * @param error failure details
     * @return placeholder result
     */
    public static ExtractionResult failed(String mimeType, ErrorDetails error) {
        Metadata metadata = Metadata.builder()
            .additional("error", error.toMap())
            .build();
        return builder(mimeType != null ? mimeType : "application/octet-stream")
            .metadata(metadata)
            .build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.content = content;
        builder.mimeType = mimeType;
        builder.metadata = metadata;
        builder.tables = new ArrayList<>(tables);
        builder.chunks = new ArrayList<>(chunks);
        builder.images = new ArrayList<>(images);
        builder.pages = new ArrayList<>(pages);
        builder.detectedLanguages = new ArrayList<>(detectedLanguages);
        builder.keywords = new ArrayList<>(keywords);
        builder.qualityScore = qualityScore;
        builder.processingWarnings = new ArrayList<>(processingWarnings);
        return builder;
    }

    public ExtractionResult withContent(String newContent) {
        return toBuilder().content(newContent).build();
    }

    public ExtractionResult withMetadata(Metadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }

    public ExtractionResult withWarning(String source, String message) {
        return toBuilder().addWarning(new ProcessingWarning(source, message)).build();
    }

    public String getContent() {
        return content;
    }

    public String getMimeType() {
        return mimeType;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<Table> getTables() {
        return tables;
    }

    public List<Chunk> getChunks() {
        return chunks;
    }

    public List<ExtractedImage> getImages() {
        return images;
    }

    public List<PageContent> getPages() {
        return pages;
    }

    public List<String> getDetectedLanguages() {
        return detectedLanguages;
    }

    public List<ExtractedKeyword> getKeywords() {
        return keywords;
    }

    /**
     * Heuristic quality score in [0, 1].
     *
     * @return score, or empty when quality processing was disabled
     */
    public Optional<Double> getQualityScore() {
        return Optional.ofNullable(qualityScore);
    }

    public List<ProcessingWarning> getProcessingWarnings() {
        return processingWarnings;
    }

    /**
     * Get the total chunk count from the result.
     *
     * @return the chunk count, or 0 if chunking was not requested
     */
    public int getChunkCount() {
        return chunks.size();
    }

    /**
     * Get the page count reported by the extractor.
     *
     * @return page count from metadata, else the number of extracted pages
     */
    public int getPageCount() {
        return metadata.getPageCount().orElse(pages.size());
    }

    /**
     * Get the detected primary language code.
     *
     * <p>Returns {@code metadata.language} when set, else the first detected language.</p>
     *
     * @return the detected language code (e.g., "en", "de"), or empty if not detected
     */
    public Optional<String> getDetectedLanguage() {
        Optional<String> language = metadata.getLanguage();
        if (language.isPresent()) {
            return language;
        }
        if (!detectedLanguages.isEmpty()) {
            return Optional.of(detectedLanguages.get(0));
        }
        return Optional.empty();
    }

    /**
     * Serialize this result to its snake_case JSON form.
     *
     * @return JSON text
     * @throws QuarryException if serialization fails
     */
    public String toJson() throws QuarryException {
        return ResultParser.toJson(this);
    }

    /**
     * Parse a result produced by {@link #toJson()}.
     *
     * @param json JSON text
     * @return the parsed result
     * @throws QuarryException if the JSON is malformed
     */
    public static ExtractionResult fromJson(String json) throws QuarryException {
        return ResultParser.fromJson(json);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtractionResult)) {
            return false;
        }
        ExtractionResult other = (ExtractionResult) o;
        return content.equals(other.content)
            && mimeType.equals(other.mimeType)
            && metadata.equals(other.metadata)
            && tables.equals(other.tables)
            && chunks.equals(other.chunks)
            && pages.equals(other.pages)
            && detectedLanguages.equals(other.detectedLanguages)
            && keywords.equals(other.keywords)
            && Objects.equals(qualityScore, other.qualityScore)
            && processingWarnings.equals(other.processingWarnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, mimeType, metadata, tables, chunks, pages, detectedLanguages, keywords,
            qualityScore, processingWarnings);
    }

    @Override
    public String toString() {
        return "ExtractionResult{"
            + "contentLength=" + content.length()
            + ", mimeType='" + mimeType + '\''
            + ", tables=" + tables.size()
            + ", chunks=" + chunks.size()
            + ", images=" + images.size()
            + ", pages=" + pages.size()
            + ", detectedLanguages=" + detectedLanguages
            + ", qualityScore=" + qualityScore
            + ", warnings=" + processingWarnings.size()
            + '}';
    }

    private static <T> List<T> freeze(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Builder for {@link ExtractionResult}.
     */
    public static final class Builder {
        private String content = "";
        private String mimeType;
        private Metadata metadata = Metadata.empty();
        private List<Table> tables = new ArrayList<>();
        private List<Chunk> chunks = new ArrayList<>();
        private List<ExtractedImage> images = new ArrayList<>();
        private List<PageContent> pages = new ArrayList<>();
        private List<String> detectedLanguages = new ArrayList<>();
        private List<ExtractedKeyword> keywords = new ArrayList<>();
        private Double qualityScore;
        private List<ProcessingWarning> processingWarnings = new ArrayList<>();

        private Builder() {
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder tables(List<Table> tables) {
            this.tables = copy(tables);
            return this;
        }

        public Builder chunks(List<Chunk> chunks) {
            this.chunks = copy(chunks);
            return this;
        }

        public Builder images(List<ExtractedImage> images) {
            this.images = copy(images);
            return this;
        }

        public Builder pages(List<PageContent> pages) {
            this.pages = copy(pages);
            return this;
        }

        public Builder detectedLanguages(List<String> detectedLanguages) {
            this.detectedLanguages = copy(detectedLanguages);
            return this;
        }

        public Builder keywords(List<ExtractedKeyword> keywords) {
            this.keywords = copy(keywords);
            return this;
        }

        public Builder qualityScore(Double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder processingWarnings(List<ProcessingWarning> warnings) {
            this.processingWarnings = copy(warnings);
            return this;
        }

        public Builder addWarning(ProcessingWarning warning) {
            this.processingWarnings.add(Objects.requireNonNull(warning, "warning must not be null"));
            return this;
        }

        public Builder addTable(Table table) {
            this.tables.add(Objects.requireNonNull(table, "table must not be null"));
            return this;
        }

        public Builder addImage(ExtractedImage image) {
            this.images.add(Objects.requireNonNull(image, "image must not be null"));
            return this;
        }

        public Builder addPage(PageContent page) {
            this.pages.add(Objects.requireNonNull(page, "page must not be null"));
            return this;
        }

        public ExtractionResult build() {
            return new ExtractionResult(this);
        }

        private static <T> List<T> copy(List<T> values) {
            return values != null ? new ArrayList<>(values) : new ArrayList<>();
        }
    }
}
