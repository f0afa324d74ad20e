package dev.quarry;

import dev.quarry.batch.DeferredExtraction;
import dev.quarry.cache.CacheStats;
import dev.quarry.config.EmbeddingPreset;
import dev.quarry.config.EmbeddingPresets;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeDetector;
import dev.quarry.mime.MimeTypes;
import dev.quarry.plugins.PluginNamespace;
import dev.quarry.plugins.PluginRegistration;
import dev.quarry.plugins.PluginRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * High-level Java API for the Quarry document intelligence engine.
 *
 * <p>Quarry extracts text, tables, metadata and images from PDFs, Office and OpenDocument files,
 * HTML, Markdown, spreadsheets, images and more, then runs OCR, chunking, embeddings and other
 * post-processing over the result.</p>
 *
 * <h2>Basic Usage</h2>
 * <pre>{@code
 * ExtractionResult result = Quarry.extractFile("document.pdf");
 * System.out.println(result.getContent());
 * System.out.println("Type: " + result.getMimeType());
 * }</pre>
 *
 * <h2>Error Handling</h2>
 * <pre>{@code
 * try {
 *     ExtractionResult result = Quarry.extractFile("document.pdf");
 * } catch (QuarryException e) {
 *     System.err.println(e.getErrorCode().wireName() + ": " + e.getMessage());
 * } catch (IOException e) {
 *     System.err.println("File not found: " + e.getMessage());
 * }
 * }</pre>
 *
 * <p>All static methods delegate to a lazily created default {@link QuarryEngine} that shares one
 * process-wide {@link PluginRegistry}. Applications that need isolation build their own engine.</p>
 */
public final class Quarry {
    private static final PluginRegistry REGISTRY = new PluginRegistry();
    private static final Object ENGINE_LOCK = new Object();
    private static volatile QuarryEngine engine;

    private Quarry() {
    }

    /**
     * The default engine, created on first use.
     *
     * @return the shared engine
     */
    public static QuarryEngine engine() {
        QuarryEngine current = engine;
        if (current == null) {
            synchronized (ENGINE_LOCK) {
                current = engine;
                if (current == null) {
                    current = QuarryEngine.builder().plugins(REGISTRY).build();
                    engine = current;
                }
            }
        }
        return current;
    }

    /**
     * Closes the default engine, clears the process-wide registry and starts over. Intended for tests.
     */
    public static void resetEngine() {
        synchronized (ENGINE_LOCK) {
            if (engine != null) {
                engine.close();
                engine = null;
            }
            REGISTRY.clearAll();
        }
    }

    public static ExtractionResult extractFile(String path) throws IOException, QuarryException {
        return extractFile(Path.of(path), null);
    }

    public static ExtractionResult extractFile(Path path) throws IOException, QuarryException {
        return extractFile(path, null);
    }

    public static ExtractionResult extractFile(String path, ExtractionConfig config)
        throws IOException, QuarryException {
        return extractFile(Path.of(path), config);
    }

    public static ExtractionResult extractFile(Path path, ExtractionConfig config)
        throws IOException, QuarryException {
        return engine().extractFile(path, config);
    }

    public static ExtractionResult extractBytes(byte[] data, String mimeType, ExtractionConfig config)
        throws QuarryException {
        return engine().extractBytes(data, mimeType, config);
    }

    /**
     * Extract files concurrently. A failed item becomes an empty result whose metadata carries the
     * failure under {@code error}.
     *
     * @param paths file paths
     * @param config configuration, or null for defaults
     * @return one result per path, in input order
     * @throws QuarryException if the calling thread is interrupted
     */
    public static List<ExtractionResult> batchExtractFiles(List<String> paths, ExtractionConfig config)
        throws QuarryException {
        return flatten(batchExtractFilesDetailed(paths, config));
    }

    /**
     * Extract byte inputs concurrently. A failed item becomes an empty result whose metadata carries
     * the failure under {@code error}.
     *
     * @param items inputs with declared MIME types
     * @param config configuration, or null for defaults
     * @return one result per input, in input order
     * @throws QuarryException if the calling thread is interrupted
     */
    public static List<ExtractionResult> batchExtractBytes(List<BytesWithMime> items, ExtractionConfig config)
        throws QuarryException {
        return flatten(batchExtractBytesDetailed(items, config));
    }

    public static List<BatchItemResult> batchExtractFilesDetailed(List<String> paths, ExtractionConfig config)
        throws QuarryException {
        Objects.requireNonNull(paths, "paths must not be null");
        if (paths.isEmpty()) {
            return Collections.emptyList();
        }
        return engine().batchExtractFiles(toPaths(paths), config);
    }

    public static List<BatchItemResult> batchExtractBytesDetailed(List<BytesWithMime> items, ExtractionConfig config)
        throws QuarryException {
        Objects.requireNonNull(items, "items must not be null");
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        return engine().batchExtractBytes(items, config);
    }

    public static CompletableFuture<ExtractionResult> extractFileAsync(Path path, ExtractionConfig config) {
        return engine().extractFileAsync(path, config);
    }

    public static CompletableFuture<ExtractionResult> extractBytesAsync(
        byte[] data,
        String mimeType,
        ExtractionConfig config
    ) {
        return engine().extractBytesAsync(data, mimeType, config);
    }

    public static CompletableFuture<List<ExtractionResult>> batchExtractFilesAsync(
        List<String> paths,
        ExtractionConfig config
    ) {
        Objects.requireNonNull(paths, "paths must not be null");
        return engine().batchExtractFilesAsync(toPaths(paths), config).thenApply(Quarry::flatten);
    }

    public static DeferredExtraction<ExtractionResult> extractFileDeferred(Path path, ExtractionConfig config) {
        return engine().extractFileDeferred(path, config);
    }

    public static DeferredExtraction<ExtractionResult> extractBytesDeferred(
        byte[] data,
        String mimeType,
        ExtractionConfig config
    ) {
        return engine().extractBytesDeferred(data, mimeType, config);
    }

    public static DeferredExtraction<List<BatchItemResult>> batchExtractFilesDeferred(
        List<String> paths,
        ExtractionConfig config
    ) {
        Objects.requireNonNull(paths, "paths must not be null");
        return engine().batchExtractFilesDeferred(toPaths(paths), config);
    }

    public static ExtractionConfig loadExtractionConfigFromFile(Path path) throws QuarryException {
        Objects.requireNonNull(path, "path must not be null");
        try {
            QuarryEngine.validateFile(path);
        } catch (IOException e) {
            throw new ValidationException("Invalid configuration file path: " + e.getMessage(), e);
        }
        return FaultGuard.call("load_config", () -> ExtractionConfig.fromFile(path));
    }

    /**
     * Look for {@code quarry.toml}, {@code quarry.yaml}, {@code quarry.yml} or {@code quarry.json}
     * in the working directory and its parents.
     *
     * @return the discovered configuration, or null if there is none
     * @throws QuarryException if a discovered file is malformed
     */
    public static ExtractionConfig discoverExtractionConfig() throws QuarryException {
        return FaultGuard.call("discover_config", ExtractionConfig::discover);
    }

    public static String detectMimeType(byte[] data) throws QuarryException {
        Objects.requireNonNull(data, "data must not be null");
        return FaultGuard.call("detect_mime_type", () -> MimeDetector.detect(data));
    }

    public static String detectMimeType(String path) throws QuarryException {
        return detectMimeType(path, true);
    }

    /**
     * Detect the MIME type of a file from its extension, sniffing the content when the extension
     * is unknown and the file exists.
     *
     * @param path file path
     * @param checkExists fail with an {@code IO} error if the file does not exist
     * @return canonical MIME type
     * @throws QuarryException if the file is missing or its type cannot be determined
     */
    public static String detectMimeType(String path, boolean checkExists) throws QuarryException {
        Objects.requireNonNull(path, "path must not be null");
        return FaultGuard.call("detect_mime_type", () -> {
            Path file = Path.of(path);
            boolean exists = Files.isRegularFile(file);
            if (checkExists && !exists) {
                throw new QuarryException.Io("File not found: " + path);
            }
            Optional<String> fromExtension = MimeTypes.fromPath(path);
            if (fromExtension.isPresent() || !exists) {
                return MimeDetector.detectFromPath(path);
            }
            try (InputStream in = Files.newInputStream(file)) {
                return MimeDetector.classify(in.readNBytes(MimeDetector.SNIFF_LENGTH), path, null).mimeType();
            }
        });
    }

    public static String detectMimeTypeFromPath(String path) throws QuarryException {
        Objects.requireNonNull(path, "path must not be null");
        return FaultGuard.call("detect_mime_type", () -> MimeDetector.detectFromPath(path));
    }

    /**
     * Canonicalize and check a MIME type against the built-in extractors and every registered
     * document extractor.
     *
     * @param mimeType MIME type
     * @return canonical form
     * @throws QuarryException {@code UnsupportedFormat} if nothing handles it
     */
    public static String validateMimeType(String mimeType) throws QuarryException {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Set<String> registered = new LinkedHashSet<>();
        for (PluginRegistration<DocumentExtractor> registration : REGISTRY.documentExtractors().snapshot()) {
            registered.addAll(registration.mimeTypes());
        }
        return FaultGuard.call("validate_mime_type", () -> MimeTypes.validate(mimeType, registered));
    }

    public static List<String> getExtensionsForMime(String mimeType) throws QuarryException {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        return FaultGuard.call("get_extensions_for_mime", () -> MimeTypes.getExtensionsForMime(mimeType));
    }

    public static List<String> listEmbeddingPresets() {
        return EmbeddingPresets.names();
    }

    public static Optional<EmbeddingPreset> getEmbeddingPreset(String name) throws QuarryException {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new ValidationException("Preset name must not be blank");
        }
        return EmbeddingPresets.get(name);
    }

    /**
     * Register a post-processor using its default priority and stage.
     *
     * @param name unique processor name
     * @param processor processor implementation
     * @throws QuarryException if the name is blank or {@code initialize()} fails
     */
    public static void registerPostProcessor(String name, PostProcessor processor) throws QuarryException {
        Objects.requireNonNull(processor, "processor must not be null");
        registerPostProcessor(name, processor, processor.priority(), processor.processingStage());
    }

    /**
     * Register a post-processor with explicit priority and stage. Re-registering a name replaces
     * the earlier processor and logs a warning.
     *
     * @param name unique processor name
     * @param processor processor implementation
     * @param priority order within the stage (higher runs first)
     * @param stage processing stage, null for the processor's own
     * @throws QuarryException if the name is blank or {@code initialize()} fails
     */
    public static void registerPostProcessor(
        String name,
        PostProcessor processor,
        int priority,
        ProcessingStage stage
    ) throws QuarryException {
        Objects.requireNonNull(processor, "processor must not be null");
        ProcessingStage effectiveStage = stage == null ? processor.processingStage() : stage;
        REGISTRY.postProcessors().register(name, processor, priority, effectiveStage, null);
    }

    public static void unregisterPostProcessor(String name) throws QuarryException {
        REGISTRY.postProcessors().unregister(name);
    }

    public static List<String> listPostProcessors() {
        return REGISTRY.postProcessors().list();
    }

    public static void clearPostProcessors() throws QuarryException {
        clear(REGISTRY.postProcessors());
    }

    public static void registerValidator(String name, Validator validator) throws QuarryException {
        registerValidator(name, validator, 0);
    }

    public static void registerValidator(String name, Validator validator, int priority) throws QuarryException {
        REGISTRY.validators().register(name, validator, priority);
    }

    /**
     * Unregister a validator.
     *
     * @param name validator name
     * @throws QuarryException {@code Plugin} listing the registered validators if {@code name} is unknown
     */
    public static void unregisterValidator(String name) throws QuarryException {
        REGISTRY.validators().unregister(name);
    }

    public static List<String> listValidators() {
        return REGISTRY.validators().list();
    }

    public static void clearValidators() throws QuarryException {
        clear(REGISTRY.validators());
    }

    public static void registerOcrBackend(String name, OcrBackend backend) throws QuarryException {
        registerOcrBackend(name, backend, 0);
    }

    public static void registerOcrBackend(String name, OcrBackend backend, int priority) throws QuarryException {
        REGISTRY.ocrBackends().register(name, backend, priority);
    }

    public static void unregisterOcrBackend(String name) throws QuarryException {
        REGISTRY.ocrBackends().unregister(name);
    }

    public static List<String> listOcrBackends() {
        return REGISTRY.ocrBackends().list();
    }

    public static void clearOcrBackends() throws QuarryException {
        clear(REGISTRY.ocrBackends());
    }

    /**
     * Register a document extractor for the given MIME types. It takes precedence over the built-in
     * extractor for those types; among plugins, higher priority wins.
     *
     * @param name unique extractor name
     * @param extractor extractor implementation
     * @param priority precedence among plugin extractors
     * @param mimeTypes handled MIME types
     * @throws QuarryException if the name is blank, no MIME type is given or {@code initialize()} fails
     */
    public static void registerDocumentExtractor(
        String name,
        DocumentExtractor extractor,
        int priority,
        String... mimeTypes
    ) throws QuarryException {
        if (mimeTypes == null || mimeTypes.length == 0) {
            throw new ValidationException("Document extractor '" + name + "' must declare at least one MIME type");
        }
        List<String> canonical = new ArrayList<>(mimeTypes.length);
        for (String mimeType : mimeTypes) {
            String normalized = MimeTypes.canonicalize(mimeType);
            if (normalized == null) {
                throw new ValidationException("Document extractor '" + name + "' declares a blank MIME type");
            }
            canonical.add(normalized);
        }
        REGISTRY.documentExtractors().register(name, extractor, priority, null, canonical);
    }

    public static void unregisterDocumentExtractor(String name) throws QuarryException {
        REGISTRY.documentExtractors().unregister(name);
    }

    public static List<String> listDocumentExtractors() {
        return REGISTRY.documentExtractors().list();
    }

    public static void clearDocumentExtractors() throws QuarryException {
        clear(REGISTRY.documentExtractors());
    }

    public static void clearCache() throws QuarryException {
        engine().clearCache();
    }

    public static CacheStats getCacheStats() {
        return engine().getCacheStats();
    }

    /**
     * The most recent unrecoverable fault captured by any entry point, on any thread.
     *
     * @return captured fault details
     */
    public static Optional<ErrorDetails> getLastFault() {
        return ErrorUtils.getLastFault();
    }

    /**
     * The last error recorded by an entry point on the calling thread.
     *
     * @return error details
     */
    public static Optional<ErrorDetails> getErrorDetails() {
        return ErrorUtils.getErrorDetails();
    }

    public static ErrorCode classifyError(String message) {
        return ErrorUtils.classifyError(message);
    }

    public static String getVersion() {
        return QuarryVersion.get();
    }

    private static void clear(PluginNamespace<?> namespace) throws QuarryException {
        List<QuarryException> failures = namespace.clear();
        if (failures.isEmpty()) {
            return;
        }
        QuarryException first = failures.get(0);
        QuarryException summary = new QuarryException.Plugin(
            first instanceof QuarryException.Plugin ? ((QuarryException.Plugin) first).getPluginName() : null,
            failures.size() + " " + namespace.kind().pluralName() + " failed to shut down: " + first.getMessage(),
            first);
        for (int i = 1; i < failures.size(); i++) {
            summary.addSuppressed(failures.get(i));
        }
        throw summary;
    }

    private static List<Path> toPaths(List<String> paths) {
        List<Path> out = new ArrayList<>(paths.size());
        for (String path : paths) {
            out.add(Path.of(Objects.requireNonNull(path, "paths must not contain null")));
        }
        return out;
    }

    private static List<ExtractionResult> flatten(List<BatchItemResult> items) {
        List<ExtractionResult> results = new ArrayList<>(items.size());
        for (BatchItemResult item : items) {
            results.add(item.getResult().orElseGet(() ->
                ExtractionResult.failed(MimeTypes.OCTET_STREAM, item.getError().orElseThrow())));
        }
        return results;
    }
}
