package dev.quarry.ocr;

import dev.quarry.ExtractedImage;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.OcrBackend;
import dev.quarry.OcrResult;
import dev.quarry.PageContent;
import dev.quarry.ProcessingWarning;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.config.ImageExtractionConfig;
import dev.quarry.config.OcrConfig;
import dev.quarry.extraction.PageAssembler;
import dev.quarry.extraction.PageRenderer;
import dev.quarry.mime.MimeTypes;
import dev.quarry.plugins.PluginInvoker;
import dev.quarry.plugins.PluginKind;
import dev.quarry.plugins.PluginRegistration;
import dev.quarry.plugins.PluginRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides per page whether OCR is needed and runs it through a backend.
 *
 * <p>Backends are looked up in the plugin registry first, then among the built-ins, of which
 * there is one: {@value #NOOP_BACKEND}, returning empty text.</p>
 *
 * <p>Failures are absorbed into a degraded result unless OCR was forced or the document is an
 * image with no other text; then they are terminal for the document.</p>
 */
public final class OcrOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(OcrOrchestrator.class);

    public static final String NOOP_BACKEND = "noop";

    private static final OcrBackend NOOP = (imageBytes, language) -> OcrResult.ofText("");
    private static final Map<String, OcrBackend> BUILT_INS = Map.of(NOOP_BACKEND, NOOP);

    private final PluginRegistry plugins;

    public OcrOrchestrator(PluginRegistry plugins) {
        this.plugins = Objects.requireNonNull(plugins, "plugins must not be null");
    }

    /**
     * Decide whether a page needs OCR.
     *
     * @param page extracted page
     * @param config effective configuration
     * @param imageInput whether the document itself is an image
     * @return {@code NotNeeded} or {@code Required(reason)}
     */
    public OcrState decide(PageContent page, ExtractionConfig config, boolean imageInput) {
        if (config.isForceOcr()) {
            return OcrState.required(OcrReason.FORCED);
        }
        if (imageInput) {
            return OcrState.required(OcrReason.IMAGE_INPUT);
        }
        if (!page.hasVisualContent()) {
            return OcrState.notNeeded();
        }
        OcrConfig ocr = config.getEffectiveOcr();
        if (nonWhitespace(page.content()) < ocr.getMinTextChars()) {
            return OcrState.required(OcrReason.NO_TEXT_WITH_VISUAL_CONTENT);
        }
        if (ocr.getCoverageThreshold() > 0.0 && page.textCoverage() < ocr.getCoverageThreshold()) {
            return OcrState.required(OcrReason.LOW_TEXT_COVERAGE);
        }
        return OcrState.notNeeded();
    }

    public OcrState decide(PageContent page, ExtractionConfig config) {
        return decide(page, config, false);
    }

    /**
     * Recognize text in one image.
     *
     * @param imageBytes encoded image
     * @param language backend language code, may combine several with {@code +}
     * @param backendName backend to use
     * @return OCR result
     * @throws QuarryException {@code MissingDependency} for an unknown backend, {@code Ocr} for an
     *     unsupported language, or whatever the backend fails with
     */
    public OcrResult run(byte[] imageBytes, String language, String backendName) throws QuarryException {
        String name = backendName != null ? backendName.trim() : OcrConfig.DEFAULT_BACKEND;
        OcrBackend backend = backend(name).orElseThrow(() -> new QuarryException.MissingDependency(name,
            "OCR backend '" + name + "' is not available. Registered OCR backends: "
                + plugins.ocrBackends().list() + ", built-in: " + BUILT_INS.keySet()));
        List<String> supported = PluginInvoker.invoke(PluginKind.OCR_BACKEND, name, backend::supportedLanguages);
        if (supported != null && !supported.isEmpty() && language != null) {
            for (String requested : language.split("\\+")) {
                if (!supported.contains(requested.trim().toLowerCase(Locale.ROOT))
                    && !supported.contains(requested.trim())) {
                    throw new QuarryException.Ocr("OCR backend '" + name + "' does not support language '"
                        + requested.trim() + "'. Supported: " + supported);
                }
            }
        }
        OcrResult result = PluginInvoker.invoke(PluginKind.OCR_BACKEND, name,
            () -> backend.processImage(imageBytes, language));
        if (result == null) {
            throw new QuarryException.Ocr("OCR backend '" + name + "' returned no result");
        }
        return result;
    }

    public Optional<OcrBackend> backend(String name) {
        Optional<PluginRegistration<OcrBackend>> registered = plugins.ocrBackends().get(name);
        if (registered.isPresent()) {
            return Optional.of(registered.get().plugin());
        }
        return Optional.ofNullable(BUILT_INS.get(name));
    }

    /**
     * Run OCR over the pages of a raw extraction where needed.
     *
     * <p>Only documents whose extractor can render pages take part; for everything else every
     * page is {@code NotNeeded}.</p>
     *
     * @param raw raw extraction; paginated extractors always fill {@code pages}
     * @param data document bytes, handed to the renderer
     * @param renderer page renderer of the extractor, or null
     * @param config effective configuration
     * @return updated result and the recorded transitions
     * @throws QuarryException when a failure is terminal for the document
     */
    public Outcome process(ExtractionResult raw, byte[] data, PageRenderer renderer, ExtractionConfig config)
        throws QuarryException {
        OcrRun run = new OcrRun();
        OcrConfig ocr = config.getEffectiveOcr();
        if (!ocr.isEnabled() || renderer == null) {
            return new Outcome(raw, run);
        }
        boolean imageInput = isImage(raw.getMimeType());
        ImageExtractionConfig images = config.getImageExtraction() != null
            ? config.getImageExtraction() : ImageExtractionConfig.builder().build();
        ImagePreprocessor preprocessor = new ImagePreprocessor(config.getImagePreprocessing(), images);
        int dpi = images.getTargetDpi();

        List<PageContent> pages = new ArrayList<>(raw.getPages());
        List<ProcessingWarning> warnings = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();
        Double rotation = null;
        boolean changed = false;
        boolean degraded = false;
        int recognized = 0;

        for (int i = 0; i < pages.size(); i++) {
            PageContent page = pages.get(i);
            OcrState decision = decide(page, config, imageInput);
            run.record(page.pageNumber(), decision);
            if (!decision.isRequired()) {
                continue;
            }
            OcrReason reason = ((OcrState.Required) decision).reason();
            run.record(page.pageNumber(), OcrState.running());
            try {
                byte[] rendered = renderer.renderPage(data, page.pageNumber(), dpi, config);
                byte[] prepared = preprocessor.process(rendered, imageInput ? null : dpi);
                OcrResult result = run(prepared, ocr.getLanguage(), ocr.getBackend());
                run.record(page.pageNumber(), OcrState.succeeded(result));
                recognized++;
                result.meanConfidence().ifPresent(confidences::add);
                if (rotation == null) {
                    rotation = result.rotation();
                }
                String merged = merge(page.content(), result.text(), reason);
                if (!merged.equals(page.content())) {
                    pages.set(i, page.withContent(merged));
                    changed = true;
                }
            } catch (QuarryException e) {
                run.record(page.pageNumber(), OcrState.failed(e));
                if (config.isForceOcr() || (imageInput && page.content().isBlank())) {
                    throw terminal(page.pageNumber(), e);
                }
                LOG.warn("OCR failed on page {} of {}, keeping extracted text: {}", page.pageNumber(),
                    raw.getMimeType(), e.getMessage());
                warnings.add(new ProcessingWarning("ocr", "OCR failed on page " + page.pageNumber() + " ("
                    + reason + "): " + e.getMessage()));
                degraded = true;
            }
        }

        List<ExtractedImage> extractedImages = raw.getImages();
        if (images.isOcrImages() && !extractedImages.isEmpty()) {
            extractedImages = recognizeImages(extractedImages, preprocessor, ocr, warnings);
        }

        if (!run.anyRequired() && extractedImages == raw.getImages()) {
            return new Outcome(raw, run);
        }
        ExtractionResult.Builder builder = raw.toBuilder().pages(pages).images(extractedImages);
        if (changed) {
            builder.content(PageAssembler.assemble(pages, config.getPages()));
        }
        for (ProcessingWarning warning : warnings) {
            builder.addWarning(warning);
        }
        Metadata.Builder metadata = raw.getMetadata().toBuilder()
            .additional("ocr_backend", ocr.getBackend())
            .additional("ocr_pages", recognized);
        if (!confidences.isEmpty()) {
            double sum = 0;
            for (double confidence : confidences) {
                sum += confidence;
            }
            metadata.additional("ocr_confidence", sum / confidences.size());
        }
        if (rotation != null) {
            metadata.additional("ocr_rotation", rotation);
        }
        if (degraded) {
            metadata.additional("ocr_degraded", true);
        }
        return new Outcome(builder.metadata(metadata.build()).build(), run);
    }

    private List<ExtractedImage> recognizeImages(
        List<ExtractedImage> images,
        ImagePreprocessor preprocessor,
        OcrConfig ocr,
        List<ProcessingWarning> warnings
    ) {
        List<ExtractedImage> out = new ArrayList<>(images.size());
        for (ExtractedImage image : images) {
            try {
                byte[] prepared = preprocessor.process(image.getData(), null);
                out.add(image.withOcrText(run(prepared, ocr.getLanguage(), ocr.getBackend()).text()));
            } catch (QuarryException e) {
                LOG.warn("OCR failed on extracted image {}: {}", image.getImageIndex(), e.getMessage());
                warnings.add(new ProcessingWarning("ocr",
                    "OCR failed on image " + image.getImageIndex() + ": " + e.getMessage()));
                out.add(image);
            }
        }
        return out;
    }

    private static QuarryException terminal(int pageNumber, QuarryException e) {
        if (e instanceof QuarryException.Ocr || e instanceof QuarryException.MissingDependency) {
            return e;
        }
        return new QuarryException.Ocr("OCR failed on page " + pageNumber + ": " + e.getMessage(), e);
    }

    static String merge(String extracted, String recognized, OcrReason reason) {
        String ocrText = recognized.strip();
        if (ocrText.isEmpty()) {
            return extracted;
        }
        String existing = extracted.strip();
        if (existing.isEmpty() || reason == OcrReason.FORCED || reason == OcrReason.IMAGE_INPUT
            || reason == OcrReason.NO_TEXT_WITH_VISUAL_CONTENT) {
            return ocrText;
        }
        return existing + "\n\n" + ocrText;
    }

    static boolean isImage(String mimeType) {
        return mimeType != null && mimeType.startsWith("image/") && !MimeTypes.SVG.equals(mimeType);
    }

    private static int nonWhitespace(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    /** Result of {@link #process}. */
    public static final class Outcome {
        private final ExtractionResult result;
        private final OcrRun run;

        Outcome(ExtractionResult result, OcrRun run) {
            this.result = result;
            this.run = run;
        }

        public ExtractionResult result() {
            return result;
        }

        public OcrRun run() {
            return run;
        }
    }
}
