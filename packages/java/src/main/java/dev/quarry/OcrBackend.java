package dev.quarry;

import java.util.Collections;
import java.util.List;

/**
 * Interface for OCR backend implementations.
 *
 * <p>OCR backends recognize text in page renderings and image inputs. They are looked up by
 * name, registered backends first, then the built-in {@code noop} backend.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OcrBackend engine = (imageBytes, language) -> OcrResult.ofText(myEngine.recognize(imageBytes, language));
 *
 * Quarry.registerOcrBackend("tesseract", engine);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe as they may be called concurrently
 * from multiple threads during batch extraction operations.</p>
 *
 * <h2>Error Handling</h2>
 * <p>If OCR fails, throw a {@link QuarryException}. Unless OCR was forced the extraction
 * continues with a degraded result.</p>
 */
@FunctionalInterface
public interface OcrBackend extends PluginLifecycle {
    /**
     * Recognize text in an image.
     *
     * @param imageBytes encoded image (PNG after preprocessing)
     * @param language language code from the OCR configuration
     * @return recognized text with optional element geometry
     * @throws QuarryException if recognition fails
     */
    OcrResult processImage(byte[] imageBytes, String language) throws QuarryException;

    /**
     * Languages supported by the backend.
     *
     * @return language codes (empty means all languages)
     */
    default List<String> supportedLanguages() {
        return Collections.emptyList();
    }
}
