package dev.quarry.e2e;

import static org.junit.jupiter.api.Assertions.*;

import dev.quarry.ExtractionResult;
import dev.quarry.OcrResult;
import dev.quarry.Quarry;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * E2E tests for plugin, configuration and utility APIs.
 */
@DisplayName("Plugin API Tests")
class PluginAPIsTest {

    @AfterEach
    void resetEngine() {
        Quarry.resetEngine();
    }

    @Test
    @DisplayName("Load configuration from a TOML file")
    void configFromFile(@TempDir Path tempDir) throws IOException, QuarryException {
        Path configPath = tempDir.resolve("test_config.toml");
        Files.writeString(configPath, """
[chunking]
max_chars = 100
max_overlap = 20

[language_detection]
enabled = false
""");

        ExtractionConfig config = Quarry.loadExtractionConfigFromFile(configPath);
        assertNotNull(config.getChunking());
        assertEquals(100, config.getChunking().getMaxChars());
        assertEquals(20, config.getChunking().getMaxOverlap());
        assertNotNull(config.getLanguageDetection());
        assertFalse(config.getLanguageDetection().isEnabled());
    }

    @Test
    @DisplayName("Load configuration from a YAML file")
    void configFromYamlFile(@TempDir Path tempDir) throws IOException, QuarryException {
        Path configPath = tempDir.resolve("quarry.yaml");
        Files.writeString(configPath, "use_cache: false\nchunking:\n  max_chars: 250\n");

        ExtractionConfig config = Quarry.loadExtractionConfigFromFile(configPath);
        assertFalse(config.isUseCache());
        assertEquals(250, config.getChunking().getMaxChars());
    }

    @Test
    @DisplayName("Reject a configuration file that does not exist")
    void configFromMissingFile(@TempDir Path tempDir) {
        assertThrows(QuarryException.class,
            () -> Quarry.loadExtractionConfigFromFile(tempDir.resolve("absent.toml")));
    }

    @Test
    @DisplayName("Registered extractor handles its MIME type end to end")
    void extractorsRegisterAndExtract() throws QuarryException {
        Quarry.registerDocumentExtractor("ledger",
            (data, mime, config) -> ExtractionResult.builder(mime)
                .content("ledger:" + new String(data, StandardCharsets.UTF_8).trim())
                .build(),
            10, "text/x-ledger");

        ExtractionResult result = Quarry.extractBytes(
            "2024 balance".getBytes(StandardCharsets.UTF_8), "text/x-ledger", null);

        assertEquals("ledger:2024 balance", result.getContent());
        assertEquals(List.of("ledger"), Quarry.listDocumentExtractors());
    }

    @Test
    @DisplayName("Clear all document extractors and verify list is empty")
    void extractorsClear() throws QuarryException {
        Quarry.clearDocumentExtractors();
        List<String> result = Quarry.listDocumentExtractors();
        assertEquals(0, result.size());
    }

    @Test
    @DisplayName("Unregister nonexistent document extractor fails with the registered names")
    void extractorsUnregister() {
        QuarryException error = assertThrows(QuarryException.Plugin.class,
            () -> Quarry.unregisterDocumentExtractor("nonexistent-extractor-xyz"));
        assertTrue(error.getMessage().contains("nonexistent-extractor-xyz"));
    }

    @Test
    @DisplayName("Detect MIME type from file bytes")
    void mimeDetectBytes() throws QuarryException {
        byte[] testBytes = "%PDF-1.4\n".getBytes(StandardCharsets.US_ASCII);
        String result = Quarry.detectMimeType(testBytes);
        assertEquals("application/pdf", result);
    }

    @Test
    @DisplayName("Detect MIME type from file path")
    void mimeDetectPath(@TempDir Path tempDir) throws IOException, QuarryException {
        Path testFile = tempDir.resolve("test.txt");
        Files.writeString(testFile, "Hello, world!");

        String result = Quarry.detectMimeTypeFromPath(testFile.toString());
        assertEquals("text/plain", result);
    }

    @Test
    @DisplayName("Get file extensions for a MIME type")
    void mimeGetExtensions() throws QuarryException {
        List<String> result = Quarry.getExtensionsForMime("application/pdf");
        assertNotNull(result);
        assertTrue(result.contains("pdf"));
    }

    @Test
    @DisplayName("Register, list and clear OCR backends")
    void ocrBackendsLifecycle() throws IOException, QuarryException {
        Quarry.registerOcrBackend("tesseract", (image, language) -> OcrResult.ofText("HELLO WORLD"));
        assertEquals(List.of("tesseract"), Quarry.listOcrBackends());

        ExtractionResult result = Quarry.extractBytes(
            Files.readAllBytes(E2EHelpers.resolveDocument("images/sample.png")), null, null);
        assertEquals("HELLO WORLD", result.getContent());

        Quarry.clearOcrBackends();
        assertEquals(0, Quarry.listOcrBackends().size());
    }

    @Test
    @DisplayName("Clear all post-processors and verify list is empty")
    void postProcessorsClear() throws QuarryException {
        Quarry.registerPostProcessor("noop", result -> result);
        Quarry.clearPostProcessors();
        assertEquals(0, Quarry.listPostProcessors().size());
    }

    @Test
    @DisplayName("Clear all validators and verify list is empty")
    void validatorsClear() throws QuarryException {
        Quarry.registerValidator("accept", result -> { });
        Quarry.clearValidators();
        assertEquals(0, Quarry.listValidators().size());
    }
}
