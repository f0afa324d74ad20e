package dev.quarry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.quarry.batch.DeferredExtraction;
import dev.quarry.cache.CacheSettings;
import dev.quarry.config.ChunkingConfig;
import dev.quarry.config.EmbeddingConfig;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.config.OcrConfig;
import dev.quarry.config.PageConfig;
import dev.quarry.mime.MimeTypes;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class QuarryEngineTest {
    private static final byte[] HELLO = "hello world".getBytes(StandardCharsets.UTF_8);

    private QuarryEngine engine;

    @BeforeEach
    void setUp() {
        engine = QuarryEngine.builder().poolSize(2).build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Nested
    @DisplayName("Single documents")
    final class Single {

        @Test
        void shouldExtractPlainBytes() throws Exception {
            ExtractionResult result = engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);

            assertThat(result.getContent()).isEqualTo("hello world");
            assertThat(result.getMimeType()).isEqualTo(MimeTypes.PLAIN_TEXT);
            assertThat(result.getQualityScore()).isPresent();
        }

        @Test
        void shouldExtractFileByContent(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("report.docx");
            Files.write(file, TestDocuments.docx("Title", "First paragraph", "Second paragraph"));

            ExtractionResult result = engine.extractFile(file, null);

            assertThat(result.getMimeType()).isEqualTo(MimeTypes.DOCX);
            assertThat(result.getContent()).contains("First paragraph").contains("Second paragraph");
        }

        @Test
        void shouldRejectEmptyBytes() {
            assertThatThrownBy(() -> engine.extractBytes(new byte[0], MimeTypes.PLAIN_TEXT, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
        }

        @Test
        void shouldFailMissingFileWithIoException(@TempDir Path dir) {
            assertThatThrownBy(() -> engine.extractFile(dir.resolve("missing.pdf"), null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("File not found");
            assertThat(ErrorUtils.getErrorDetails())
                .hasValueSatisfying(d -> assertThat(d.getKind()).isEqualTo(ErrorCode.IO));
        }

        @Test
        void shouldWarnWhenDeclaredTypeDisagrees() throws Exception {
            byte[] pdf = TestDocuments.pdf("declared wrongly");

            ExtractionResult result = engine.extractBytes(pdf, MimeTypes.DOCX, null);

            assertThat(result.getMimeType()).isEqualTo(MimeTypes.PDF);
            assertThat(result.getProcessingWarnings()).extracting(ProcessingWarning::source).contains("mime");
        }

        @Test
        void shouldDropPagesUnlessRequested() throws Exception {
            byte[] pdf = TestDocuments.pdf(List.of(List.of("alpha"), List.of("beta")));

            ExtractionResult plain = engine.extractBytes(pdf, null, null);
            ExtractionResult paged = engine.extractBytes(pdf, null, ExtractionConfig.builder()
                .pages(PageConfig.builder().extractPages(true).build())
                .build());

            assertThat(plain.getPages()).isEmpty();
            assertThat(paged.getPages()).extracting(PageContent::pageNumber).containsExactly(1, 2);
        }
    }

    @Nested
    @DisplayName("Cache")
    final class Caching {

        @Test
        void shouldServeRepeatedExtractionFromCache() throws Exception {
            ExtractionResult first = engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);
            ExtractionResult second = engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);

            assertThat(second).isSameAs(first);
            assertThat(engine.getCacheStats().hits()).isEqualTo(1);
            assertThat(engine.getCacheStats().misses()).isEqualTo(1);
        }

        @Test
        void shouldBypassCacheWhenDisabled() throws Exception {
            ExtractionConfig uncached = ExtractionConfig.builder().useCache(false).build();

            engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, uncached);
            engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, uncached);

            assertThat(engine.getCacheStats().hits()).isZero();
            assertThat(engine.getCacheStats().misses()).isZero();
        }

        @Test
        void shouldPersistAcrossEngines(@TempDir Path dir) throws Exception {
            try (QuarryEngine first = QuarryEngine.builder().cache(CacheSettings.onDisk(dir)).build()) {
                first.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);
            }
            try (QuarryEngine second = QuarryEngine.builder().cache(CacheSettings.onDisk(dir)).build()) {
                ExtractionResult result = second.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);

                assertThat(result.getContent()).isEqualTo("hello world");
                assertThat(second.getCacheStats().hits()).isEqualTo(1);
                assertThat(second.getCacheStats().misses()).isZero();
            }
        }

        @Test
        void shouldKeyOnConfiguration() throws Exception {
            engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, null);
            engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT, ExtractionConfig.builder().forceOcr(true).build());

            assertThat(engine.getCacheStats().misses()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Batches")
    final class Batches {

        @Test
        void shouldKeepOrderAndIsolateFailures(@TempDir Path dir) throws Exception {
            Path valid = dir.resolve("valid.pdf");
            Path missing = dir.resolve("missing.pdf");
            Path valid2 = dir.resolve("valid2.docx");
            Files.write(valid, TestDocuments.pdf("first document"));
            Files.write(valid2, TestDocuments.docx("Second", "second document"));

            List<BatchItemResult> results = engine.batchExtractFiles(List.of(valid, missing, valid2), null);

            assertThat(results).hasSize(3);
            assertThat(results).extracting(BatchItemResult::isSuccess).containsExactly(true, false, true);
            assertThat(results.get(0).getOrThrow().getContent()).contains("first document");
            assertThat(results.get(1).getError()).hasValueSatisfying(e -> {
                assertThat(e.getKind()).isEqualTo(ErrorCode.IO);
                assertThat(e.getMessage()).contains("missing.pdf");
            });
            assertThat(results.get(2).getOrThrow().getContent()).contains("second document");
        }

        @Test
        void shouldLabelByteItems() throws Exception {
            List<BatchItemResult> results = engine.batchExtractBytes(List.of(
                new BytesWithMime(HELLO, MimeTypes.PLAIN_TEXT),
                new BytesWithMime("# Heading".getBytes(StandardCharsets.UTF_8), MimeTypes.MARKDOWN)), null);

            assertThat(results).extracting(BatchItemResult::getSource).containsExactly("bytes[0]", "bytes[1]");
            assertThat(results).allMatch(BatchItemResult::isSuccess);
        }

        @Test
        void shouldPollDeferredExtraction() throws Exception {
            DeferredExtraction<ExtractionResult> handle =
                engine.extractBytesDeferred(HELLO, MimeTypes.PLAIN_TEXT, null);

            assertThat(handle.getResult().getContent()).isEqualTo("hello world");
            assertThat(handle.isReady()).isTrue();
        }

        @Test
        void shouldCompleteAsyncFailureWithTypedError(@TempDir Path dir) {
            CompletableFuture<ExtractionResult> future = engine.extractFileAsync(dir.resolve("gone.txt"), null);

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(QuarryException.Io.class);
        }
    }

    @Nested
    @DisplayName("Plugins")
    final class Plugins {

        @Test
        void shouldPreferPluginExtractorForItsMimeType() throws Exception {
            engine.plugins().documentExtractors().register("shout",
                (data, mime, config) -> ExtractionResult.builder(mime)
                    .content(new String(data, StandardCharsets.UTF_8).toUpperCase(Locale.ROOT))
                    .build(),
                10, null, List.of(MimeTypes.PLAIN_TEXT));

            ExtractionResult result = engine.extractBytes(HELLO, MimeTypes.PLAIN_TEXT,
                ExtractionConfig.builder().useCache(false).build());

            assertThat(result.getContent()).isEqualTo("HELLO WORLD");
        }

        @Test
        void shouldOcrImageInputWithRegisteredBackend() throws Exception {
            engine.plugins().ocrBackends().register("tesseract",
                (image, language) -> OcrResult.ofText("scanned words"), 0);

            ExtractionResult result = engine.extractBytes(TestDocuments.png(40, 20), null, null);

            assertThat(result.getMimeType()).isEqualTo(MimeTypes.PNG);
            assertThat(result.getContent()).isEqualTo("scanned words");
        }

        @Test
        void shouldKeepTextAndLowerQualityWhenOptionalOcrFails() throws Exception {
            engine.plugins().ocrBackends().register("broken", (image, language) -> {
                throw new QuarryException.Ocr("recognizer unavailable");
            }, 0);
            byte[] pdf = TestDocuments.captionedImagePdf("Figure 3 shows quarterly revenue by region");
            OcrConfig.Builder ocr = OcrConfig.builder().backend("broken").coverageThreshold(0.99);

            ExtractionResult baseline = engine.extractBytes(pdf, MimeTypes.PDF, ExtractionConfig.builder()
                .useCache(false).ocr(ocr.enabled(false).build()).build());
            ExtractionResult degraded = engine.extractBytes(pdf, MimeTypes.PDF, ExtractionConfig.builder()
                .useCache(false).ocr(ocr.enabled(true).build()).build());

            assertThat(degraded.getContent()).contains("quarterly revenue");
            assertThat(degraded.getMetadata().get("ocr_degraded")).contains(true);
            assertThat(degraded.getProcessingWarnings()).anySatisfy(warning -> {
                assertThat(warning.source()).isEqualTo("ocr");
                assertThat(warning.message()).contains("recognizer unavailable");
            });
            assertThat(baseline.getProcessingWarnings()).noneMatch(warning -> "ocr".equals(warning.source()));
            assertThat(degraded.getQualityScore()).isPresent();
            assertThat(degraded.getQualityScore().get()).isLessThan(baseline.getQualityScore().get());
        }

        @Test
        void shouldEmbedChunksWithLangChain4jModel() throws Exception {
            List<Integer> batchSizes = new ArrayList<>();
            EmbeddingModel model = new EmbeddingModel() {
                @Override
                public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
                    batchSizes.add(segments.size());
                    List<Embedding> embeddings = new ArrayList<>();
                    for (TextSegment segment : segments) {
                        embeddings.add(Embedding.from(new float[] {segment.text().length(), 0f, 0f}));
                    }
                    return Response.from(embeddings);
                }
            };
            try (QuarryEngine withModel = QuarryEngine.builder().embeddingModel("mini", model, 3).build()) {
                ExtractionConfig config = ExtractionConfig.builder()
                    .chunking(ChunkingConfig.builder().maxChars(20).maxOverlap(0)
                        .embedding(EmbeddingConfig.builder().model("mini").build())
                        .build())
                    .build();

                ExtractionResult result = withModel.extractBytes(
                    "one two three four five six seven eight nine ten".getBytes(StandardCharsets.UTF_8),
                    MimeTypes.PLAIN_TEXT, config);

                assertThat(result.getChunks()).hasSizeGreaterThan(1);
                assertThat(result.getChunks()).allSatisfy(chunk ->
                    assertThat(chunk.embedding()).containsExactly(1f, 0f, 0f));
                assertThat(batchSizes).containsExactly(result.getChunks().size());
            }
        }
    }
}
