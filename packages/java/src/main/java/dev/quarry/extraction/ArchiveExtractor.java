package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.ProcessingWarning;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeDetector;
import dev.quarry.mime.MimeTypes;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZIP, TAR, gzip and 7z archives through Commons Compress.
 *
 * <p>Every file entry is classified by its bytes and name and extracted with whatever extractor
 * the registry holds for it; the text lands under a {@code ## path} heading. Archives inside
 * archives are opened up to {@link #MAX_DEPTH} levels. Entry count and inflated size are capped
 * per entry and across the whole nesting, and exceeding a cap fails the extraction. An entry that
 * cannot be extracted only adds a warning.</p>
 */
public final class ArchiveExtractor implements DocumentExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    public static final int MAX_DEPTH = 3;
    public static final int MAX_ENTRIES = 10_000;
    public static final long MAX_ENTRY_BYTES = 512L * 1024 * 1024;
    public static final long MAX_TOTAL_BYTES = 1024L * 1024 * 1024;

    private static final Set<String> ARCHIVE_TYPES =
        Set.of(MimeTypes.ZIP, MimeTypes.TAR, MimeTypes.GZIP, MimeTypes.SEVEN_Z);

    private final ExtractorRegistry registry;
    private final int maxEntries;
    private final long maxEntryBytes;
    private final long maxTotalBytes;

    public ArchiveExtractor(ExtractorRegistry registry) {
        this(registry, MAX_ENTRIES, MAX_ENTRY_BYTES, MAX_TOTAL_BYTES);
    }

    ArchiveExtractor(ExtractorRegistry registry, int maxEntries, long maxEntryBytes, long maxTotalBytes) {
        this.registry = registry;
        this.maxEntries = maxEntries;
        this.maxEntryBytes = maxEntryBytes;
        this.maxTotalBytes = maxTotalBytes;
    }

    static boolean isArchive(String mimeType) {
        return ARCHIVE_TYPES.contains(mimeType);
    }

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Walk walk = new Walk(mimeType, config);
        walk.open(data, mimeType, "", 0);

        Metadata metadata = Metadata.builder()
            .additional("format", formatName(mimeType))
            .additional("file_count", walk.fileCount)
            .additional("total_size", walk.fileBytes)
            .additional("file_list", walk.fileList)
            .build();
        return walk.result
            .content(Texts.tidy(walk.content.toString()))
            .metadata(metadata)
            .build();
    }

    static String formatName(String mimeType) {
        if (MimeTypes.TAR.equals(mimeType)) {
            return "tar";
        }
        if (MimeTypes.GZIP.equals(mimeType)) {
            return "gzip";
        }
        if (MimeTypes.SEVEN_Z.equals(mimeType)) {
            return "7z";
        }
        return "zip";
    }

    /** Reads the current entry into {@code buffer}, like {@link InputStream#read(byte[], int, int)}. */
    @FunctionalInterface
    private interface EntrySource {
        int read(byte[] buffer, int offset, int length) throws IOException;
    }

    /** State shared by one top-level archive and everything nested inside it. */
    private final class Walk {
        final ExtractionConfig config;
        final ExtractionResult.Builder result;
        final StringBuilder content = new StringBuilder();
        final List<Map<String, Object>> fileList = new ArrayList<>();
        int entries;
        int fileCount;
        long fileBytes;
        long totalBytes;

        Walk(String mimeType, ExtractionConfig config) {
            this.config = config;
            this.result = ExtractionResult.builder(mimeType);
        }

        void open(byte[] data, String mimeType, String prefix, int depth) throws QuarryException {
            try {
                if (MimeTypes.SEVEN_Z.equals(mimeType)) {
                    sevenZ(data, prefix, depth);
                } else if (MimeTypes.GZIP.equals(mimeType)) {
                    gzip(data, prefix, depth);
                } else if (MimeTypes.TAR.equals(mimeType)) {
                    stream(new TarArchiveInputStream(new ByteArrayInputStream(data)), prefix, depth);
                } else {
                    stream(new ZipArchiveInputStream(new ByteArrayInputStream(data), "UTF-8", true, true),
                        prefix, depth);
                }
            } catch (IOException e) {
                throw new QuarryException.Parsing(
                    "Failed to read " + formatName(mimeType) + " archive: " + e.getMessage(), e);
            }
        }

        private void stream(ArchiveInputStream<?> in, String prefix, int depth) throws IOException, QuarryException {
            try (in) {
                ArchiveEntry entry;
                while ((entry = in.getNextEntry()) != null) {
                    if (!in.canReadEntryData(entry)) {
                        warn(prefix + entry.getName(), "entry uses an unsupported compression method or encryption");
                        continue;
                    }
                    visit(prefix + entry.getName(), entry.isDirectory(), in::read, depth);
                }
            }
        }

        private void sevenZ(byte[] data, String prefix, int depth) throws IOException, QuarryException {
            try (SevenZFile file = SevenZFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(data))
                .get()) {
                SevenZArchiveEntry entry;
                while ((entry = file.getNextEntry()) != null) {
                    boolean directory = entry.isDirectory() || !entry.hasStream();
                    visit(prefix + entry.getName(), directory, file::read, depth);
                }
            }
        }

        private void gzip(byte[] data, String prefix, int depth) throws IOException, QuarryException {
            try (GzipCompressorInputStream in = new GzipCompressorInputStream(new ByteArrayInputStream(data))) {
                String name = in.getMetaData().getFileName();
                byte[] payload = readCapped(prefix + (name != null ? name : "content"), in::read);
                if (MimeDetector.isTar(payload)) {
                    stream(new TarArchiveInputStream(new ByteArrayInputStream(payload)), prefix, depth);
                    return;
                }
                String path = prefix + (name != null && !name.isBlank() ? name : "content");
                fileCount++;
                fileBytes += payload.length;
                fileList.add(entryInfo(path, payload.length, false));
                extractEntry(path, payload, depth);
            }
        }

        private void visit(String path, boolean directory, EntrySource source, int depth)
            throws IOException, QuarryException {
            if (++entries > maxEntries) {
                throw new QuarryException.Parsing("Archive holds more than " + maxEntries + " entries");
            }
            if (directory) {
                fileList.add(entryInfo(path, 0, true));
                return;
            }
            byte[] bytes = readCapped(path, source);
            fileCount++;
            fileBytes += bytes.length;
            fileList.add(entryInfo(path, bytes.length, false));
            extractEntry(path, bytes, depth);
        }

        private byte[] readCapped(String path, EntrySource source) throws IOException, QuarryException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            long entryBytes = 0;
            int n;
            while ((n = source.read(buffer, 0, buffer.length)) != -1) {
                entryBytes += n;
                totalBytes += n;
                if (entryBytes > maxEntryBytes) {
                    throw new QuarryException.Parsing(
                        "Archive entry " + path + " inflates beyond " + maxEntryBytes + " bytes");
                }
                if (totalBytes > maxTotalBytes) {
                    throw new QuarryException.Parsing(
                        "Archive inflates beyond " + maxTotalBytes + " bytes in total (stopped at " + path + ")");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }

        private void extractEntry(String path, byte[] bytes, int depth) throws QuarryException {
            if (bytes.length == 0) {
                return;
            }
            String mimeType;
            try {
                mimeType = MimeDetector.classify(bytes, path, null).mimeType();
            } catch (QuarryException.UnsupportedFormat e) {
                LOG.debug("Skipping archive entry {}: {}", path, e.getMessage());
                return;
            }
            if (isArchive(mimeType)) {
                if (depth + 1 > MAX_DEPTH) {
                    warn(path, "nested archive deeper than " + MAX_DEPTH + " levels was not opened");
                    return;
                }
                open(bytes, mimeType, path + "/", depth + 1);
                return;
            }
            try {
                ExtractionResult entry = registry.resolve(mimeType).extract(bytes, mimeType, config);
                String text = entry.getContent().strip();
                if (!text.isEmpty()) {
                    content.append("## ").append(path).append("\n\n").append(text).append("\n\n");
                }
                for (Table table : entry.getTables()) {
                    result.addTable(table);
                }
                for (ProcessingWarning warning : entry.getProcessingWarnings()) {
                    result.addWarning(new ProcessingWarning(warning.source(), path + ": " + warning.message()));
                }
            } catch (QuarryException e) {
                warn(path, e.getMessage());
            }
        }

        private void warn(String path, String message) {
            LOG.warn("Archive entry {} skipped: {}", path, message);
            result.addWarning(new ProcessingWarning("archive", path + ": " + message));
        }
    }

    private static Map<String, Object> entryInfo(String path, long size, boolean directory) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("path", path);
        info.put("size", size);
        info.put("is_dir", directory);
        return info;
    }
}
