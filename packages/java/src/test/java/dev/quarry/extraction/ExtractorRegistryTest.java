package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import dev.quarry.plugins.PluginRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExtractorRegistry")
final class ExtractorRegistryTest {
    private PluginRegistry plugins;
    private ExtractorRegistry registry;

    @BeforeEach
    void setUp() {
        plugins = new PluginRegistry();
        registry = new ExtractorRegistry(plugins);
    }

    @Nested
    @DisplayName("built-in extractors")
    final class BuiltInTest {

        @Test
        void shouldResolveEveryBuiltInFamily() throws QuarryException {
            assertThat(registry.resolve(MimeTypes.PDF).extractor()).isInstanceOf(PdfExtractor.class);
            assertThat(registry.resolve(MimeTypes.DOCX).extractor()).isInstanceOf(DocxExtractor.class);
            assertThat(registry.resolve(MimeTypes.XLSM).extractor()).isInstanceOf(XlsxExtractor.class);
            assertThat(registry.resolve(MimeTypes.ODS).extractor()).isInstanceOf(OdfExtractor.class);
            assertThat(registry.resolve(MimeTypes.TSV).extractor()).isInstanceOf(CsvExtractor.class);
            assertThat(registry.resolve(MimeTypes.SVG).extractor()).isInstanceOf(XmlExtractor.class);
            assertThat(registry.resolve("image/x-portable-anymap").extractor()).isInstanceOf(ImageExtractor.class);
        }

        @Test
        void shouldResolveLegacyMailBookAndArchiveFormats() throws QuarryException {
            assertThat(registry.resolve(MimeTypes.DOC).extractor()).isInstanceOf(OleExtractor.class);
            assertThat(registry.resolve("application/vnd.ms-excel").extractor()).isInstanceOf(OleExtractor.class);
            assertThat(registry.resolve(MimeTypes.OLE_STORAGE).extractor()).isInstanceOf(OleExtractor.class);
            assertThat(registry.resolve(MimeTypes.EML).extractor()).isInstanceOf(EmailExtractor.class);
            assertThat(registry.resolve(MimeTypes.MSG).extractor()).isInstanceOf(EmailExtractor.class);
            assertThat(registry.resolve(MimeTypes.EPUB).extractor()).isInstanceOf(EpubExtractor.class);
            assertThat(registry.resolve(MimeTypes.IPYNB).extractor()).isInstanceOf(JupyterExtractor.class);
            assertThat(registry.resolve(MimeTypes.LATEX).extractor()).isInstanceOf(LatexExtractor.class);
            for (String archive : List.of(MimeTypes.ZIP, MimeTypes.TAR, MimeTypes.GZIP, MimeTypes.SEVEN_Z)) {
                assertThat(registry.resolve(archive).extractor()).isInstanceOf(ArchiveExtractor.class);
            }
            assertThat(registry.supportedMimeTypes()).containsAll(MimeTypes.builtInTypes());
        }

        @Test
        void shouldCanonicalizeBeforeLookup() throws QuarryException {
            ExtractorRegistry.Resolved resolved = registry.resolve("Application/X-PDF");

            assertThat(resolved.extractor()).isInstanceOf(PdfExtractor.class);
            assertThat(resolved.isPlugin()).isFalse();
        }

        @Test
        void shouldExposeRenderingCapabilities() throws QuarryException {
            assertThat(registry.resolve(MimeTypes.PDF).pageRenderer()).isPresent();
            assertThat(registry.resolve(MimeTypes.PNG).pageRenderer()).isPresent();
            assertThat(registry.resolve(MimeTypes.CSV).pageRenderer()).isEmpty();
            assertThat(registry.resolve(MimeTypes.HTML).markdownRendering()).isPresent();
        }

        @Test
        void shouldRejectUnsupportedType() {
            assertThatThrownBy(() -> registry.resolve("application/x-unheard-of"))
                .isInstanceOf(QuarryException.UnsupportedFormat.class)
                .hasMessageContaining("application/x-unheard-of");
        }

        @Test
        void shouldRejectBlankType() {
            assertThatThrownBy(() -> registry.resolve("  "))
                .isInstanceOf(QuarryException.UnsupportedFormat.class);
        }
    }

    @Nested
    @DisplayName("plugin extractors")
    final class PluginTest {

        @Test
        void shouldTakePrecedenceOverBuiltIn() throws QuarryException {
            DocumentExtractor custom = (data, mime, config) -> ExtractionResult.builder(mime).content("custom").build();
            plugins.documentExtractors().register("custom-pdf", custom, 10, null, Set.of(MimeTypes.PDF));

            ExtractorRegistry.Resolved resolved = registry.resolve(MimeTypes.PDF);

            assertThat(resolved.isPlugin()).isTrue();
            assertThat(resolved.name()).isEqualTo("custom-pdf");
            assertThat(resolved.extract(new byte[] {1}, MimeTypes.PDF, ExtractionConfig.defaults()).getContent())
                .isEqualTo("custom");
        }

        @Test
        void shouldPreferHigherPriorityPlugin() throws QuarryException {
            plugins.documentExtractors().register("low",
                (data, mime, config) -> ExtractionResult.builder(mime).content("low").build(), 1, null,
                Set.of("text/x-notes"));
            plugins.documentExtractors().register("high",
                (data, mime, config) -> ExtractionResult.builder(mime).content("high").build(), 50, null,
                Set.of("text/x-notes"));

            assertThat(registry.resolve("text/x-notes").name()).isEqualTo("high");
            assertThat(registry.supportedMimeTypes()).contains("text/x-notes", MimeTypes.PDF);
        }

        @Test
        void shouldWrapUntypedPluginFailure() throws QuarryException {
            plugins.documentExtractors().register("broken", (data, mime, config) -> {
                throw new IllegalStateException("boom");
            }, 0, null, List.of("text/x-broken"));

            ExtractorRegistry.Resolved resolved = registry.resolve("text/x-broken");

            assertThatThrownBy(() -> resolved.extract("x".getBytes(StandardCharsets.UTF_8), "text/x-broken",
                ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Plugin.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("boom");
        }

        @Test
        void shouldRejectNullResult() throws QuarryException {
            plugins.documentExtractors().register("silent", (data, mime, config) -> null, 0, null,
                List.of("text/x-silent"));

            assertThatThrownBy(() -> registry.resolve("text/x-silent")
                .extract(new byte[] {1}, "text/x-silent", ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Plugin.class)
                .hasMessageContaining("returned no result");
        }

        @Test
        void shouldFallBackAfterUnregister() throws QuarryException {
            plugins.documentExtractors().register("custom-csv",
                (data, mime, config) -> ExtractionResult.builder(mime).build(), 0, null, Set.of(MimeTypes.CSV));
            plugins.documentExtractors().unregister("custom-csv");

            assertThat(registry.resolve(MimeTypes.CSV).extractor()).isInstanceOf(CsvExtractor.class);
        }
    }
}
