package dev.quarry;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.quarry.batch.BatchOrchestrator;
import dev.quarry.batch.DeferredExtraction;
import dev.quarry.cache.CacheKey;
import dev.quarry.cache.CacheKeys;
import dev.quarry.cache.CacheSettings;
import dev.quarry.cache.CacheStats;
import dev.quarry.cache.ExtractionCache;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.config.PageConfig;
import dev.quarry.extraction.ExtractorRegistry;
import dev.quarry.extraction.SizingGuard;
import dev.quarry.mime.Classification;
import dev.quarry.mime.MimeDetector;
import dev.quarry.ocr.OcrOrchestrator;
import dev.quarry.pipeline.EmbeddingEngine;
import dev.quarry.pipeline.EmbeddingEngines;
import dev.quarry.pipeline.LangChain4jEmbeddingEngine;
import dev.quarry.pipeline.Pipeline;
import dev.quarry.plugins.PluginRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An extraction engine with its own plugin registry, cache and worker pool.
 *
 * <p>One extraction runs: classify, resolve the extractor, extract, OCR, post-process. Results are
 * cached by content identity plus effective configuration unless {@code use_cache} is off.</p>
 *
 * <pre>{@code
 * try (QuarryEngine engine = QuarryEngine.builder().cache(CacheSettings.onDisk(dir)).build()) {
 *     ExtractionResult result = engine.extractFile(Path.of("report.pdf"), null);
 * }
 * }</pre>
 */
public final class QuarryEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QuarryEngine.class);

    private final PluginRegistry plugins;
    private final boolean ownsPlugins;
    private final EmbeddingEngines embeddings;
    private final ExtractorRegistry extractors;
    private final OcrOrchestrator ocr;
    private final Pipeline pipeline;
    private final ExtractionCache cache;
    private final CacheKeys cacheKeys;
    private final BatchOrchestrator batch;

    private QuarryEngine(Builder builder) {
        this.ownsPlugins = builder.plugins == null;
        this.plugins = ownsPlugins ? new PluginRegistry() : builder.plugins;
        this.embeddings = builder.embeddings;
        this.extractors = new ExtractorRegistry(plugins, builder.sizingGuard);
        this.ocr = new OcrOrchestrator(plugins);
        this.pipeline = new Pipeline(plugins, embeddings);
        this.cache = new ExtractionCache(builder.cacheSettings);
        this.cacheKeys = new CacheKeys(QuarryVersion.get());
        this.batch = new BatchOrchestrator(builder.poolSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QuarryEngine create() {
        return builder().build();
    }

    public PluginRegistry plugins() {
        return plugins;
    }

    public EmbeddingEngines embeddings() {
        return embeddings;
    }

    public ExtractorRegistry extractors() {
        return extractors;
    }

    public OcrOrchestrator ocr() {
        return ocr;
    }

    /**
     * Extract a file.
     *
     * @param path document path
     * @param config configuration, or null for defaults
     * @return the extraction result
     * @throws IOException if the file is missing, not a regular file or not readable
     * @throws QuarryException if extraction fails
     */
    public ExtractionResult extractFile(Path path, ExtractionConfig config) throws IOException, QuarryException {
        Objects.requireNonNull(path, "path must not be null");
        try {
            validateFile(path);
        } catch (IOException e) {
            ErrorUtils.recordError(new QuarryException.Io(e.getMessage(), e).toErrorDetails());
            throw e;
        }
        return FaultGuard.call("extract_file", () -> extractReadableFile(path, effective(config)));
    }

    /**
     * Extract in-memory bytes.
     *
     * @param data document bytes
     * @param mimeType declared MIME type, checked against the content; may be null
     * @param config configuration, or null for defaults
     * @return the extraction result
     * @throws QuarryException if extraction fails
     */
    public ExtractionResult extractBytes(byte[] data, String mimeType, ExtractionConfig config)
        throws QuarryException {
        return FaultGuard.call("extract_bytes", () -> {
            Objects.requireNonNull(data, "data must not be null");
            if (data.length == 0) {
                throw new ValidationException("data cannot be empty");
            }
            ExtractionConfig effective = effective(config);
            if (!effective.isUseCache()) {
                return process(data, null, mimeType, effective);
            }
            Classification classification = MimeDetector.classify(data, null, mimeType);
            CacheKey key = keyOrNull(() -> cacheKeys.forBytes(data, classification.mimeType(), effective));
            if (key == null) {
                return process(data, null, mimeType, effective);
            }
            return cache.getOrCompute(key, () -> process(data, null, mimeType, effective));
        });
    }

    /**
     * Extract files on the worker pool.
     *
     * @param paths inputs
     * @param config configuration shared by every item, or null for defaults
     * @return one result per path, in input order
     * @throws QuarryException if the calling thread is interrupted
     */
    public List<BatchItemResult> batchExtractFiles(List<Path> paths, ExtractionConfig config)
        throws QuarryException {
        Objects.requireNonNull(paths, "paths must not be null");
        ExtractionConfig effective = effective(config);
        List<BatchOrchestrator.BatchItem> items = new ArrayList<>(paths.size());
        for (Path path : paths) {
            items.add(new BatchOrchestrator.BatchItem(String.valueOf(path), () -> extractFileTask(path, effective)));
        }
        return batch.extractAll(items, effective.getMaxConcurrentExtractions());
    }

    /**
     * Extract byte inputs on the worker pool.
     *
     * @param inputs inputs with declared MIME types
     * @param config configuration shared by every item, or null for defaults
     * @return one result per input, in input order, labelled {@code bytes[i]}
     * @throws QuarryException if the calling thread is interrupted
     */
    public List<BatchItemResult> batchExtractBytes(List<BytesWithMime> inputs, ExtractionConfig config)
        throws QuarryException {
        Objects.requireNonNull(inputs, "inputs must not be null");
        ExtractionConfig effective = effective(config);
        List<BatchOrchestrator.BatchItem> items = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            BytesWithMime input = inputs.get(i);
            items.add(new BatchOrchestrator.BatchItem("bytes[" + i + "]",
                () -> extractBytes(input.data(), input.mimeType(), effective)));
        }
        return batch.extractAll(items, effective.getMaxConcurrentExtractions());
    }

    public DeferredExtraction<ExtractionResult> extractFileDeferred(Path path, ExtractionConfig config) {
        return batch.defer("extract_file", () -> extractFileTask(path, effective(config)));
    }

    public DeferredExtraction<ExtractionResult> extractBytesDeferred(
        byte[] data,
        String mimeType,
        ExtractionConfig config
    ) {
        return batch.defer("extract_bytes", () -> extractBytes(data, mimeType, config));
    }

    public DeferredExtraction<List<BatchItemResult>> batchExtractFilesDeferred(
        List<Path> paths,
        ExtractionConfig config
    ) {
        return batch.defer("batch_extract_files", () -> batchExtractFiles(paths, config));
    }

    /**
     * Extract a file on the worker pool.
     *
     * @param path document path
     * @param config configuration, or null for defaults
     * @return a future completed exceptionally with the {@link QuarryException} on failure
     */
    public CompletableFuture<ExtractionResult> extractFileAsync(Path path, ExtractionConfig config) {
        return batch.submit("extract_file", () -> extractFileTask(path, effective(config)));
    }

    public CompletableFuture<ExtractionResult> extractBytesAsync(
            byte[] data, String mimeType, ExtractionConfig config) {
        return batch.submit("extract_bytes", () -> extractBytes(data, mimeType, config));
    }

    public CompletableFuture<List<BatchItemResult>> batchExtractFilesAsync(List<Path> paths, ExtractionConfig config) {
        return batch.submit("batch_extract_files", () -> batchExtractFiles(paths, config));
    }

    public void clearCache() throws QuarryException {
        FaultGuard.run("clear_cache", cache::clear);
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * Shuts the worker pool down and, when this engine created its registry, clears it.
     */
    @Override
    public void close() {
        batch.close();
        if (ownsPlugins) {
            List<QuarryException> failures = plugins.clearAll();
            if (!failures.isEmpty()) {
                LOG.warn("{} plugin(s) failed to shut down", failures.size());
            }
        }
    }

    private ExtractionResult extractFileTask(Path path, ExtractionConfig config) throws QuarryException {
        return FaultGuard.call("extract_file", () -> {
            Objects.requireNonNull(path, "path must not be null");
            validateFile(path);
            return extractReadableFile(path, config);
        });
    }

    private ExtractionResult extractReadableFile(Path path, ExtractionConfig config)
        throws IOException, QuarryException {
        byte[] data = Files.readAllBytes(path);
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        if (!config.isUseCache()) {
            return process(data, name, null, config);
        }
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        long modified = attrs.lastModifiedTime().toMillis();
        CacheKey key = keyOrNull(() -> cacheKeys.forFile(path, attrs.size(), modified, config));
        if (key == null) {
            return process(data, name, null, config);
        }
        return cache.getOrCompute(key, () -> process(data, name, null, config));
    }

    private ExtractionResult process(byte[] data, String pathHint, String declaredMime, ExtractionConfig config)
        throws QuarryException {
        Classification classification = MimeDetector.classify(data, pathHint, declaredMime);
        String mimeType = classification.mimeType();
        ExtractorRegistry.Resolved extractor = extractors.resolve(mimeType);
        LOG.debug("Extracting {} with {}", mimeType, extractor.name());

        ExtractionResult raw = extractor.extract(data, mimeType, config);
        if (!classification.warnings().isEmpty()) {
            ExtractionResult.Builder withWarnings = raw.toBuilder();
            classification.warnings().forEach(withWarnings::addWarning);
            raw = withWarnings.build();
        }

        OcrOrchestrator.Outcome outcome = ocr.process(raw, data, extractor.pageRenderer().orElse(null), config);
        ExtractionResult result = pipeline.run(
            outcome.result(), config, extractor.markdownRendering().orElse(null), data);

        PageConfig pages = config.getPages();
        if ((pages == null || !pages.isExtractPages()) && !result.getPages().isEmpty()) {
            result = result.toBuilder().pages(List.of()).build();
        }
        return result;
    }

    private CacheKey keyOrNull(KeySource source) {
        try {
            return source.get();
        } catch (QuarryException e) {
            LOG.warn("Cache key derivation failed, extracting without cache: {}", e.getMessage());
            return null;
        }
    }

    private static ExtractionConfig effective(ExtractionConfig config) {
        return config != null ? config : ExtractionConfig.defaults();
    }

    static void validateFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File not readable: " + path);
        }
    }

    @FunctionalInterface
    private interface KeySource {
        CacheKey get() throws QuarryException;
    }

    /**
     * Builder for {@link QuarryEngine}.
     */
    public static final class Builder {
        private PluginRegistry plugins;
        private final EmbeddingEngines embeddings = new EmbeddingEngines();
        private CacheSettings cacheSettings = CacheSettings.memoryOnly();
        private SizingGuard sizingGuard = SizingGuard.defaults();
        private int poolSize = BatchOrchestrator.defaultPoolSize();

        private Builder() {
        }

        /**
         * Share an existing registry. The engine will not clear it on close.
         *
         * @param plugins registry to use
         * @return this builder
         */
        public Builder plugins(PluginRegistry plugins) {
            this.plugins = Objects.requireNonNull(plugins, "plugins must not be null");
            return this;
        }

        public Builder cache(CacheSettings cacheSettings) {
            this.cacheSettings = Objects.requireNonNull(cacheSettings, "cacheSettings must not be null");
            return this;
        }

        public Builder sizingGuard(SizingGuard sizingGuard) {
            this.sizingGuard = Objects.requireNonNull(sizingGuard, "sizingGuard must not be null");
            return this;
        }

        public Builder poolSize(int poolSize) {
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be positive, got " + poolSize);
            }
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Register an embedding engine, addressable by {@code embedding.model} or by a preset name.
         *
         * @param name model or preset name
         * @param engine the engine
         * @return this builder
         */
        public Builder embeddingEngine(String name, EmbeddingEngine engine) {
            embeddings.register(name, engine);
            return this;
        }

        /**
         * Register a LangChain4j model under {@code name}.
         *
         * @param name model name referenced by {@code embedding.model}
         * @param model the model
         * @param dimensions vector size the model produces
         * @return this builder
         */
        public Builder embeddingModel(String name, EmbeddingModel model, int dimensions) {
            embeddings.register(name, new LangChain4jEmbeddingEngine(name, model, dimensions));
            return this;
        }

        public QuarryEngine build() {
            return new QuarryEngine(this);
        }
    }
}
