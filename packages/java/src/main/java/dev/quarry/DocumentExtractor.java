package dev.quarry;

import dev.quarry.config.ExtractionConfig;

/**
 * Capability that turns raw document bytes into an extraction result.
 *
 * <p>Registered extractors override the built-in extractor for the MIME types they are
 * registered with. The returned result is the raw extraction; OCR and the post-processing
 * pipeline run on it afterwards.</p>
 *
 * <pre>{@code
 * Quarry.registerDocumentExtractor("notes", (data, mime, config) ->
 *     ExtractionResult.builder(mime).content(new String(data, UTF_8)).build(),
 *     100, "text/x-notes");
 * }</pre>
 */
@FunctionalInterface
public interface DocumentExtractor extends PluginLifecycle {
    /**
     * Extract text and structure from a document.
     *
     * @param data document bytes
     * @param mimeType canonical MIME type the document was classified as
     * @param config effective configuration
     * @return raw extraction
     * @throws QuarryException if the document cannot be extracted
     */
    ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException;
}
