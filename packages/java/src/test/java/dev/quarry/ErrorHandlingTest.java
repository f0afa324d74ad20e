package dev.quarry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Error handling tests for Quarry.
 *
 * Tests cover file errors, the fault guard, message classification, error code metadata
 * and the error details wire shape.
 */
class ErrorHandlingTest {

    @BeforeEach
    void releaseFaults() {
        ErrorUtils.releaseLastFault();
    }

    // ==================== File Errors ====================

    @Test
    void testExtractNonexistentFile() {
        Path nonexistent = Path.of("/nonexistent/path/to/file.txt");

        IOException error = assertThrows(IOException.class, () -> {
            Quarry.extractFile(nonexistent);
        }, "Should throw IOException for nonexistent file");
        assertTrue(error.getMessage().contains("File not found"));
    }

    @Test
    void testExtractFromNullPath() {
        assertThrows(NullPointerException.class, () -> {
            Quarry.extractFile((Path) null);
        }, "Should throw NullPointerException for null path");
    }

    @Test
    void testExtractFromDirectory(@TempDir Path tempDir) {
        IOException error = assertThrows(IOException.class, () -> {
            Quarry.extractFile(tempDir);
        }, "Should throw IOException when trying to extract from directory");
        assertTrue(error.getMessage().contains("Not a regular file"));
    }

    @Test
    void testFailedCallRecordsThreadErrorDetails() {
        assertThrows(ValidationException.class, () -> {
            Quarry.extractBytes(new byte[0], "text/plain", null);
        });

        ErrorDetails details = Quarry.getErrorDetails().orElseThrow();
        assertEquals(ErrorCode.VALIDATION, details.getKind());
        assertEquals("data cannot be empty", details.getMessage());
        assertFalse(details.isFault());
    }

    @Test
    void testUnsupportedBytes() {
        byte[] binary = {0x00, 0x01, 0x02, (byte) 0xFF, (byte) 0xFE, 0x00, 0x10};

        QuarryException error = assertThrows(QuarryException.class, () -> {
            Quarry.extractBytes(binary, null, null);
        });
        assertEquals(ErrorCode.UNSUPPORTED_FORMAT, error.getErrorCode());
    }

    // ==================== Fault Guard ====================

    @Test
    void testTypedExceptionPassesThrough() {
        QuarryException.Parsing original = new QuarryException.Parsing("bad header");

        QuarryException converted = FaultGuard.convert("parse", original);

        assertSame(original, converted);
        assertFalse(ErrorUtils.getLastFault().isPresent());
    }

    @Test
    void testIoExceptionBecomesIoError() {
        QuarryException converted = FaultGuard.convert("read", new IOException("disk unplugged"));

        assertInstanceOf(QuarryException.Io.class, converted);
        assertEquals("disk unplugged", converted.getMessage());

        QuarryException unchecked = FaultGuard.convert("read",
            new UncheckedIOException(new IOException("stream closed")));
        assertInstanceOf(QuarryException.Io.class, unchecked);
    }

    @Test
    void testIllegalArgumentBecomesValidationError() {
        QuarryException converted = FaultGuard.convert("configure", new IllegalArgumentException("negative size"));

        assertInstanceOf(ValidationException.class, converted);
        assertEquals(ErrorCode.VALIDATION, converted.getErrorCode());
    }

    @Test
    void testCompletionWrapperIsUnwrapped() {
        QuarryException converted = FaultGuard.convert("async",
            new CompletionException(new QuarryException.Ocr("backend crashed")));

        assertInstanceOf(QuarryException.Ocr.class, converted);
    }

    @Test
    void testRuntimeFaultIsCaptured() {
        QuarryException error = assertThrows(QuarryException.class, () -> {
            FaultGuard.call("explode", () -> {
                throw new IllegalStateException("boom");
            });
        });

        ErrorDetails details = error.toErrorDetails();
        assertTrue(details.isFault());
        assertEquals("IllegalStateException during explode: boom", details.getMessage());
        assertEquals("explode", details.getContext().get("operation"));
        assertEquals(IllegalStateException.class.getName(), details.getContext().get("exception"));
        assertNotNull(details.getSource());
        assertTrue(details.getTrace().contains("IllegalStateException"));

        assertEquals(details, Quarry.getLastFault().orElseThrow());
        assertEquals(details, ErrorUtils.releaseLastFault().orElseThrow());
        assertFalse(ErrorUtils.getLastFault().isPresent());
    }

    @Test
    void testStackOverflowIsCaptured() {
        QuarryException error = assertThrows(QuarryException.class, () -> {
            FaultGuard.run("recurse", () -> {
                throw new StackOverflowError();
            });
        });

        assertTrue(error.toErrorDetails().isFault());
        assertTrue(error.getMessage().startsWith("StackOverflowError during recurse"));
    }

    @Test
    void testFaultKindIsClassifiedFromMessage() {
        QuarryException error = FaultGuard.convert("load", new IllegalStateException("cache directory vanished"));

        assertInstanceOf(QuarryException.Cache.class, error);
        assertTrue(error.toErrorDetails().isFault());
    }

    // ==================== Classification ====================

    @Test
    void testClassifyError() {
        assertEquals(ErrorCode.VALIDATION, Quarry.classifyError("Invalid argument: max_chars"));
        assertEquals(ErrorCode.UNSUPPORTED_FORMAT, Quarry.classifyError("Unsupported MIME type: x/y"));
        assertEquals(ErrorCode.PARSING, Quarry.classifyError("Failed to parse document"));
        assertEquals(ErrorCode.OCR, Quarry.classifyError("OCR engine returned nothing"));
        assertEquals(ErrorCode.MISSING_DEPENDENCY, Quarry.classifyError("onnxruntime is not installed"));
        assertEquals(ErrorCode.CACHE, Quarry.classifyError("cache write failed"));
        assertEquals(ErrorCode.PLUGIN, Quarry.classifyError("post processor crashed"));
        assertEquals(ErrorCode.IO, Quarry.classifyError("No such file or directory"));
        assertEquals(ErrorCode.INTERNAL, Quarry.classifyError("something odd"));
        assertEquals(ErrorCode.INTERNAL, Quarry.classifyError(""));
    }

    @Test
    void testClassifyIsCaseInsensitiveAndOrdered() {
        assertEquals(ErrorCode.UNSUPPORTED_FORMAT, Quarry.classifyError("UNSUPPORTED format, cannot PARSE"));
    }

    @Test
    void testClassifyNullMessage() {
        assertThrows(NullPointerException.class, () -> Quarry.classifyError(null));
    }

    // ==================== Error Codes ====================

    @Test
    void testErrorCodeNames() {
        assertEquals("validation", ErrorUtils.getErrorCodeName(0));
        assertEquals("missing_dependency", ErrorUtils.getErrorCodeName(3));
        assertEquals("image_processing", ErrorUtils.getErrorCodeName(9));
        assertEquals("unknown", ErrorUtils.getErrorCodeName(42));
    }

    @Test
    void testErrorCodeDescriptions() {
        assertEquals(ErrorCode.IO.getDescription(), ErrorUtils.getErrorCodeDescription(4));
        assertEquals("Unknown error", ErrorUtils.getErrorCodeDescription(-1));
    }

    @Test
    void testErrorCodeLookup() {
        assertEquals(ErrorCode.PLUGIN, ErrorCode.fromCode(5));
        assertEquals(ErrorCode.INTERNAL, ErrorCode.fromCode(99));
        assertEquals(ErrorCode.MISSING_DEPENDENCY, ErrorCode.fromName("missing-dependency"));
        assertEquals(ErrorCode.INTERNAL, ErrorCode.fromName(null));
    }

    // ==================== Error Details ====================

    @Test
    void testErrorDetailsJsonRoundTrip() throws QuarryException {
        ErrorDetails details = ErrorDetails.builder(ErrorCode.PLUGIN)
            .message("PostProcessor 'tagger' failed: timeout")
            .pluginName("tagger")
            .contextValue("attempt", 2)
            .build();

        String json = details.toJson();

        assertTrue(json.contains("\"code\":5"));
        assertTrue(json.contains("\"name\":\"plugin\""));
        assertTrue(json.contains("\"plugin_name\":\"tagger\""));
        assertEquals(details, ErrorDetails.fromJson(json));
    }

    @Test
    void testErrorDetailsFromMalformedJson() {
        assertThrows(QuarryException.Parsing.class, () -> ErrorDetails.fromJson("{\"code\":"));
        assertThrows(ValidationException.class, () -> ErrorDetails.fromJson("  "));
    }

    @Test
    void testExceptionRebuiltFromDetails() {
        ErrorDetails plugin = ErrorDetails.builder(ErrorCode.PLUGIN)
            .message("Validator 'strict' failed: rejected")
            .pluginName("strict")
            .build();
        ErrorDetails dependency = ErrorDetails.builder(ErrorCode.MISSING_DEPENDENCY)
            .message("tesseract is not installed")
            .dependency("tesseract")
            .build();

        QuarryException rebuiltPlugin = QuarryException.fromDetails(plugin);
        QuarryException rebuiltDependency = QuarryException.fromDetails(dependency);

        assertEquals("strict", assertInstanceOf(QuarryException.Plugin.class, rebuiltPlugin).getPluginName());
        assertEquals("tesseract",
            assertInstanceOf(QuarryException.MissingDependency.class, rebuiltDependency).getDependency());
        assertSame(plugin, rebuiltPlugin.toErrorDetails());
    }

    @Test
    void testToErrorDetailsForForeignThrowable() {
        ErrorDetails details = ErrorUtils.toErrorDetails(new RuntimeException("malformed header"));

        assertEquals(ErrorCode.PARSING, details.getKind());
        assertEquals("malformed header", details.getMessage());
    }

    // ==================== Result Wire Shape ====================

    @Test
    void testExtractionResultJsonRoundTrip() throws QuarryException {
        ExtractionResult result = Quarry.extractBytes(
            "round trip text".getBytes(StandardCharsets.UTF_8), "text/plain", null);

        ExtractionResult parsed = ExtractionResult.fromJson(result.toJson());

        assertEquals(result.getContent(), parsed.getContent());
        assertEquals(result.getMimeType(), parsed.getMimeType());
        Quarry.resetEngine();
    }
}
