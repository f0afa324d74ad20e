package dev.quarry.pipeline;

import dev.quarry.Chunk;
import dev.quarry.ExtractedKeyword;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.PostProcessor;
import dev.quarry.ProcessingStage;
import dev.quarry.ProcessingWarning;
import dev.quarry.QuarryException;
import dev.quarry.Validator;
import dev.quarry.config.ChunkingConfig;
import dev.quarry.config.EmbeddingConfig;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.config.LanguageDetectionConfig;
import dev.quarry.config.PostProcessorConfig;
import dev.quarry.config.TokenReductionConfig;
import dev.quarry.extraction.MarkdownRendering;
import dev.quarry.plugins.PluginInvoker;
import dev.quarry.plugins.PluginKind;
import dev.quarry.plugins.PluginRegistration;
import dev.quarry.plugins.PluginRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Post-processing of a raw extraction, in fixed order:
 *
 * <ol>
 *   <li>output format</li>
 *   <li>{@code EARLY} post-processors</li>
 *   <li>quality scoring</li>
 *   <li>language detection</li>
 *   <li>{@code MIDDLE} post-processors</li>
 *   <li>keyword extraction</li>
 *   <li>chunking and embedding</li>
 *   <li>token reduction</li>
 *   <li>{@code LATE} post-processors</li>
 *   <li>validators</li>
 * </ol>
 *
 * <p>The registry is a dependency of the pipeline; the pipeline never reaches for a global one.</p>
 */
public final class Pipeline {
    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    public static final String QUALITY = "quality";
    public static final String LANGUAGE_DETECTION = "language_detection";
    public static final String KEYWORDS = "keywords";
    public static final String CHUNKING = "chunking";
    public static final String TOKEN_REDUCTION = "token_reduction";

    private final PluginRegistry plugins;
    private final EmbeddingEngines embeddings;
    private final OutputFormatter formatter = new OutputFormatter();
    private final QualityScorer quality = new QualityScorer();
    private final LanguageDetector languages = new LanguageDetector();
    private final KeywordExtractor keywords = new KeywordExtractor();
    private final Chunker chunker = new Chunker();
    private final TokenReducer reducer = new TokenReducer();

    public Pipeline(PluginRegistry plugins, EmbeddingEngines embeddings) {
        this.plugins = Objects.requireNonNull(plugins, "plugins must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
    }

    /**
     * Run every stage.
     *
     * @param raw extraction after OCR
     * @param config effective configuration
     * @param rendering the extractor's markdown rendering, or null
     * @param data document bytes, used only by {@code rendering}
     * @return processed result
     * @throws QuarryException if a validator rejects the result, a fatal post-processor fails or
     *     the configuration is inconsistent
     */
    public ExtractionResult run(ExtractionResult raw, ExtractionConfig config, MarkdownRendering rendering,
        byte[] data) throws QuarryException {
        PostProcessorConfig toggles = config.getEffectivePostprocessor();
        List<PluginRegistration<PostProcessor>> processors = plugins.postProcessors().snapshot();

        ExtractionResult result = formatter.format(raw, config.getOutputFormat(), rendering, data);
        LOG.debug("Formatted {} as {}", result.getMimeType(), config.getOutputFormat());

        result = runProcessors(result, ProcessingStage.EARLY, processors, toggles);

        if (config.isEnableQualityProcessing() && toggles.allowsBuiltIn(QUALITY)) {
            double score = quality.score(result);
            result = result.toBuilder().qualityScore(score).build();
            LOG.debug("Quality score {}", score);
        }

        LanguageDetectionConfig detection = config.getLanguageDetection();
        if (detection != null && detection.isEnabled() && toggles.allowsBuiltIn(LANGUAGE_DETECTION)) {
            result = detectLanguages(result, detection);
        }

        result = runProcessors(result, ProcessingStage.MIDDLE, processors, toggles);

        String language = result.getMetadata().getLanguage().orElse(null);
        if (config.getKeywords() != null && toggles.allowsBuiltIn(KEYWORDS)) {
            List<ExtractedKeyword> found = keywords.extract(result.getContent(), config.getKeywords(), language);
            result = result.toBuilder().keywords(found).build();
            LOG.debug("Extracted {} keywords", found.size());
        }

        TokenReductionConfig reduction = config.getTokenReduction();
        boolean reduce = reduction != null && reduction.isEnabled() && toggles.allowsBuiltIn(TOKEN_REDUCTION);
        // Reduction is idempotent, so chunking the reduced text keeps chunk offsets valid for the final content.
        String reduced = reduce ? reducer.reduce(result.getContent(), reduction, language) : null;

        ChunkingConfig chunking = config.getChunking();
        if (chunking != null && chunking.isEnabled() && toggles.allowsBuiltIn(CHUNKING)) {
            result = chunk(result, reduced != null ? reduced : result.getContent(), chunking);
        }

        if (reduced != null) {
            result = result.toBuilder()
                .content(reduced)
                .metadata(result.getMetadata().withAdditional("token_reduction", reduction.getMode().wireName()))
                .build();
            LOG.debug("Token reduction '{}' applied", reduction.getMode().wireName());
        }

        result = runProcessors(result, ProcessingStage.LATE, processors, toggles);
        validate(result);
        return result;
    }

    private ExtractionResult detectLanguages(ExtractionResult result, LanguageDetectionConfig detection) {
        List<LanguageDetector.Detection> found = languages.detect(
            result.getContent(), detection.getMinConfidence(), detection.isDetectMultiple());
        if (found.isEmpty()) {
            LOG.debug("No language above confidence {}", detection.getMinConfidence());
            return result;
        }
        List<String> codes = new ArrayList<>(found.size());
        for (LanguageDetector.Detection d : found) {
            codes.add(d.language());
        }
        LOG.debug("Detected languages {}", codes);
        return result.toBuilder()
            .detectedLanguages(codes)
            .metadata(result.getMetadata().withLanguage(codes.get(0)))
            .build();
    }

    private ExtractionResult chunk(ExtractionResult result, String text, ChunkingConfig chunking)
        throws QuarryException {
        List<Chunk> chunks = chunker.chunk(text, chunking, result.getPages());
        ExtractionResult.Builder builder = result.toBuilder();
        Metadata metadata = result.getMetadata().withAdditional("chunk_count", chunks.size());
        EmbeddingConfig embedding = chunking.getEmbedding();
        if (embedding != null && !chunks.isEmpty()) {
            try {
                chunks = embed(chunks, embedding, chunking.getPreset());
            } catch (QuarryException e) {
                LOG.warn("Embedding failed, keeping chunks without vectors: {}", e.getMessage());
                builder.addWarning(new ProcessingWarning("embedding", e.getMessage()));
                metadata = metadata.withAdditional("embedding_error", e.getMessage());
            }
        }
        LOG.debug("Produced {} chunks", chunks.size());
        return builder.chunks(chunks).metadata(metadata).build();
    }

    private List<Chunk> embed(List<Chunk> chunks, EmbeddingConfig config, String chunkingPreset)
        throws QuarryException {
        EmbeddingEngine engine = embeddings.resolve(config, chunkingPreset);
        List<Chunk> out = new ArrayList<>(chunks.size());
        for (int from = 0; from < chunks.size(); from += config.getBatchSize()) {
            List<Chunk> batch = chunks.subList(from, Math.min(chunks.size(), from + config.getBatchSize()));
            List<String> texts = new ArrayList<>(batch.size());
            for (Chunk chunk : batch) {
                texts.add(chunk.content());
            }
            List<float[]> vectors;
            try {
                vectors = engine.embed(texts);
            } catch (RuntimeException e) {
                throw new QuarryException.Plugin(engine.getClass().getSimpleName(),
                    "Embedding engine failed: " + e.getMessage(), e);
            }
            if (vectors == null || vectors.size() != batch.size()) {
                throw new QuarryException.Plugin(engine.getClass().getSimpleName(),
                    "Embedding engine returned " + (vectors == null ? "nothing" : vectors.size() + " vectors")
                        + " for " + batch.size() + " chunks");
            }
            for (int i = 0; i < batch.size(); i++) {
                float[] vector = vectors.get(i);
                out.add(batch.get(i).withEmbedding(config.isNormalize() ? l2Normalize(vector) : vector));
            }
        }
        return out;
    }

    static float[] l2Normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        if (sum == 0.0) {
            return vector.clone();
        }
        double norm = Math.sqrt(sum);
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }

    private ExtractionResult runProcessors(
        ExtractionResult result,
        ProcessingStage stage,
        List<PluginRegistration<PostProcessor>> processors,
        PostProcessorConfig toggles
    ) throws QuarryException {
        ExtractionResult current = result;
        for (PluginRegistration<PostProcessor> registration : processors) {
            PostProcessor processor = registration.plugin();
            ProcessingStage declared = registration.stage() != null
                ? registration.stage()
                : processor.processingStage();
            if (declared != stage || !toggles.allows(registration.name())) {
                continue;
            }
            String name = registration.name();
            ExtractionResult input = current;
            try {
                ExtractionResult output = PluginInvoker.invoke(PluginKind.POST_PROCESSOR, name,
                    () -> processor.process(input));
                if (output == null) {
                    throw new QuarryException.Plugin(name, "Post-processor '" + name + "' returned no result");
                }
                current = output;
                LOG.debug("Post-processor '{}' ({}) done", name, stage.wireName());
            } catch (QuarryException e) {
                if (processor.fatal() && (e instanceof QuarryException.Io || e instanceof QuarryException.Plugin)) {
                    throw e;
                }
                LOG.warn("Post-processor '{}' failed, continuing: {}", name, e.getMessage());
                current = input.toBuilder()
                    .metadata(input.getMetadata().withAdditional("processing_error_" + name, e.getMessage()))
                    .addWarning(new ProcessingWarning("postprocessor", name + ": " + e.getMessage()))
                    .build();
            }
        }
        return current;
    }

    private void validate(ExtractionResult result) throws QuarryException {
        for (PluginRegistration<Validator> registration : plugins.validators().snapshot()) {
            Validator validator = registration.plugin();
            PluginInvoker.invoke(PluginKind.VALIDATOR, registration.name(), () -> {
                validator.validate(result);
                return null;
            });
        }
    }
}
