package dev.quarry.plugins;

import dev.quarry.DocumentExtractor;
import dev.quarry.OcrBackend;
import dev.quarry.PostProcessor;
import dev.quarry.QuarryException;
import dev.quarry.Validator;
import java.util.ArrayList;
import java.util.List;

/**
 * Plugin registry with one namespace per plugin kind.
 *
 * <p>An engine owns one registry; the static {@code Quarry} facade owns the process-wide one.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Each namespace is guarded by its own read/write lock, so lookups from concurrent
 * extractions never block each other.</p>
 */
public final class PluginRegistry {
    private final PluginNamespace<Validator> validators = new PluginNamespace<>(PluginKind.VALIDATOR);
    private final PluginNamespace<PostProcessor> postProcessors = new PluginNamespace<>(PluginKind.POST_PROCESSOR);
    private final PluginNamespace<OcrBackend> ocrBackends = new PluginNamespace<>(PluginKind.OCR_BACKEND);
    private final PluginNamespace<DocumentExtractor> documentExtractors =
        new PluginNamespace<>(PluginKind.DOCUMENT_EXTRACTOR);

    public PluginNamespace<Validator> validators() {
        return validators;
    }

    public PluginNamespace<PostProcessor> postProcessors() {
        return postProcessors;
    }

    public PluginNamespace<OcrBackend> ocrBackends() {
        return ocrBackends;
    }

    public PluginNamespace<DocumentExtractor> documentExtractors() {
        return documentExtractors;
    }

    /**
     * Clear all four namespaces.
     *
     * @return shutdown failures across all namespaces
     */
    public List<QuarryException> clearAll() {
        List<QuarryException> failures = new ArrayList<>();
        failures.addAll(postProcessors.clear());
        failures.addAll(validators.clear());
        failures.addAll(ocrBackends.clear());
        failures.addAll(documentExtractors.clear());
        return failures;
    }
}
