package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeDetector;
import dev.quarry.mime.MimeTypes;
import dev.quarry.plugins.PluginRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ArchiveExtractor")
final class ArchiveExtractorTest {
    private ExtractorRegistry registry;
    private ArchiveExtractor extractor;

    @BeforeEach
    void setUp() {
        registry = new ExtractorRegistry(new PluginRegistry());
        extractor = new ArchiveExtractor(registry);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static Map<String, byte[]> entries(Object... pathsAndContents) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            Object value = pathsAndContents[i + 1];
            entries.put((String) pathsAndContents[i], value instanceof byte[] ? (byte[]) value : utf8((String) value));
        }
        return entries;
    }

    private static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    private static byte[] tar(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
                tarEntry.setSize(entry.getValue().length);
                tar.putArchiveEntry(tarEntry);
                tar.write(entry.getValue());
                tar.closeArchiveEntry();
            }
        }
        return out.toByteArray();
    }

    private static byte[] gzip(byte[] payload) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(payload);
        }
        return out.toByteArray();
    }

    private static byte[] sevenZ(Map<String, byte[]> entries) throws IOException {
        SeekableInMemoryByteChannel channel = new SeekableInMemoryByteChannel();
        try (SevenZOutputFile file = new SevenZOutputFile(channel)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                SevenZArchiveEntry sevenZEntry = new SevenZArchiveEntry();
                sevenZEntry.setName(entry.getKey());
                file.putArchiveEntry(sevenZEntry);
                file.write(entry.getValue());
                file.closeArchiveEntry();
            }
            file.finish();
            return Arrays.copyOf(channel.array(), (int) channel.size());
        }
    }

    private ExtractionResult extract(byte[] data, String mimeType) throws QuarryException {
        return extractor.extract(data, mimeType, ExtractionConfig.defaults());
    }

    @Nested
    @DisplayName("formats")
    final class FormatTest {

        @Test
        void shouldExtractEveryZipEntryUnderItsPath() throws Exception {
            byte[] archive = zip(entries(
                "docs/", new byte[0],
                "docs/readme.txt", "Install with care.",
                "data/prices.csv", "item,price\napple,3\n"));

            ExtractionResult result = extract(archive, MimeTypes.ZIP);

            assertThat(result.getContent())
                .contains("## docs/readme.txt\n\nInstall with care.")
                .contains("## data/prices.csv");
            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells()).contains(List.of("apple", "3")));
            assertThat(result.getMetadata().get("format")).contains("zip");
            assertThat(result.getMetadata().get("file_count")).contains(2);
            assertThat(result.getMetadata().get("file_list")).hasValueSatisfying(list ->
                assertThat((List<?>) list).hasSize(3));
        }

        @Test
        void shouldExtractTarEntries() throws Exception {
            byte[] archive = tar(entries("notes.md", "# Plan\n\nShip it."));

            assertThat(MimeDetector.detect(archive)).isEqualTo(MimeTypes.TAR);
            ExtractionResult result = extract(archive, MimeTypes.TAR);

            assertThat(result.getContent()).contains("## notes.md").contains("Ship it.");
            assertThat(result.getMetadata().get("format")).contains("tar");
        }

        @Test
        void shouldOpenTarInsideGzip() throws Exception {
            byte[] archive = gzip(tar(entries("a.txt", "alpha", "b.txt", "beta")));

            ExtractionResult result = extract(archive, MimeTypes.GZIP);

            assertThat(result.getContent()).contains("## a.txt\n\nalpha").contains("## b.txt\n\nbeta");
            assertThat(result.getMetadata().get("file_count")).contains(2);
            assertThat(result.getMetadata().get("total_size")).contains(9L);
        }

        @Test
        void shouldTreatPlainGzipAsSingleEntry() throws Exception {
            ExtractionResult result = extract(gzip(utf8("compressed words")), MimeTypes.GZIP);

            assertThat(result.getContent()).isEqualTo("## content\n\ncompressed words");
            assertThat(result.getMetadata().get("format")).contains("gzip");
        }

        @Test
        void shouldExtractSevenZipEntries() throws Exception {
            byte[] archive = sevenZ(entries("report.txt", "seven zip body"));

            assertThat(MimeDetector.detect(archive)).isEqualTo(MimeTypes.SEVEN_Z);
            ExtractionResult result = extract(archive, MimeTypes.SEVEN_Z);

            assertThat(result.getContent()).contains("## report.txt\n\nseven zip body");
            assertThat(result.getMetadata().get("format")).contains("7z");
        }
    }

    @Nested
    @DisplayName("nesting")
    final class NestingTest {

        @Test
        void shouldRecurseIntoNestedArchives() throws Exception {
            byte[] inner = tar(entries("deep.txt", "found it"));
            byte[] outer = zip(entries("top.txt", "surface", "inner.tar", inner));

            ExtractionResult result = extract(outer, MimeTypes.ZIP);

            assertThat(result.getContent())
                .contains("## top.txt\n\nsurface")
                .contains("## inner.tar/deep.txt\n\nfound it");
            assertThat(result.getMetadata().get("file_count")).contains(3);
        }

        @Test
        void shouldStopOpeningArchivesBeyondMaximumDepth() throws Exception {
            byte[] nested = zip(entries("bottom.txt", "too deep"));
            for (int level = ArchiveExtractor.MAX_DEPTH + 1; level >= 1; level--) {
                nested = zip(entries("level" + level + ".zip", nested));
            }

            ExtractionResult result = extract(nested, MimeTypes.ZIP);

            assertThat(result.getContent()).doesNotContain("too deep");
            assertThat(result.getProcessingWarnings()).singleElement().satisfies(warning -> {
                assertThat(warning.source()).isEqualTo("archive");
                assertThat(warning.message())
                    .startsWith("level1.zip/level2.zip/level3.zip/level4.zip: ")
                    .contains("deeper than");
            });
        }
    }

    @Nested
    @DisplayName("entry failures")
    final class EntryFailureTest {

        @Test
        void shouldWarnAndContinueWhenAnEntryFails() throws Exception {
            byte[] archive = zip(entries("broken.json", "{not json", "good.txt", "still here"));

            ExtractionResult result = extract(archive, MimeTypes.ZIP);

            assertThat(result.getContent()).contains("## good.txt\n\nstill here").doesNotContain("broken.json");
            assertThat(result.getProcessingWarnings()).singleElement().satisfies(warning -> {
                assertThat(warning.source()).isEqualTo("archive");
                assertThat(warning.message()).startsWith("broken.json: ");
            });
        }

        @Test
        void shouldSkipUnrecognizedBinaryEntries() throws Exception {
            byte[] archive = zip(entries("blob.bin", new byte[] {0, 1, 2, (byte) 0xFF}, "ok.txt", "fine"));

            ExtractionResult result = extract(archive, MimeTypes.ZIP);

            assertThat(result.getContent()).isEqualTo("## ok.txt\n\nfine");
            assertThat(result.getProcessingWarnings()).isEmpty();
            assertThat(result.getMetadata().get("file_count")).contains(2);
        }

        @Test
        void shouldReportCorruptArchiveAsParsingError() {
            byte[] garbage = utf8("7z but not really");

            assertThatThrownBy(() -> extract(garbage, MimeTypes.SEVEN_Z))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("7z");
        }
    }

    @Nested
    @DisplayName("limits")
    final class LimitTest {

        @Test
        void shouldRejectTooManyEntries() throws Exception {
            ArchiveExtractor limited = new ArchiveExtractor(registry, 2, 1024, 4096);
            byte[] archive = zip(entries("a.txt", "a", "b.txt", "b", "c.txt", "c"));

            assertThatThrownBy(() -> limited.extract(archive, MimeTypes.ZIP, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("more than 2 entries");
        }

        @Test
        void shouldRejectOversizedEntry() throws Exception {
            ArchiveExtractor limited = new ArchiveExtractor(registry, 10, 16, 4096);
            byte[] archive = zip(entries("big.txt", "x".repeat(64)));

            assertThatThrownBy(() -> limited.extract(archive, MimeTypes.ZIP, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("big.txt")
                .hasMessageContaining("16 bytes");
        }

        @Test
        void shouldShareTheTotalBudgetWithNestedArchives() throws Exception {
            ArchiveExtractor limited = new ArchiveExtractor(registry, 10, 1024, 100);
            byte[] inner = zip(entries("inner.txt", "y".repeat(60)));
            byte[] outer = zip(entries("outer.txt", "x".repeat(30), "nested.zip", inner));

            assertThatThrownBy(() -> limited.extract(outer, MimeTypes.ZIP, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("in total");
        }
    }
}
