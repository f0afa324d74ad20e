package dev.quarry.cache;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * On-disk tier: one JSON file per entry at {@code <root>/<first two hex chars>/<key>.json}.
 *
 * <p>Files are written to a temporary sibling and moved into place, so readers never see a partial
 * entry. A file that fails to parse is deleted and reported.</p>
 */
final class DiskCacheStore {
    private static final Logger LOG = LoggerFactory.getLogger(DiskCacheStore.class);
    private static final String SUFFIX = ".json";

    private final Path root;
    private final int maxEntries;
    private final Duration maxAge;

    DiskCacheStore(Path root, int maxEntries, Duration maxAge) {
        this.root = root;
        this.maxEntries = maxEntries;
        this.maxAge = maxAge;
    }

    Path root() {
        return root;
    }

    Path pathOf(CacheKey key) {
        return root.resolve(key.shard()).resolve(key.hex() + SUFFIX);
    }

    Optional<ExtractionResult> read(CacheKey key) throws QuarryException.Cache {
        Path file = pathOf(key);
        String json;
        try {
            if (isExpired(Files.getLastModifiedTime(file))) {
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new QuarryException.Cache("Failed to read cache entry " + file + ": " + e.getMessage(), e);
        }
        try {
            return Optional.of(ExtractionResult.fromJson(json));
        } catch (QuarryException e) {
            deleteCorrupt(file);
            throw new QuarryException.Cache("Corrupt cache entry " + file + ": " + e.getMessage(), e);
        }
    }

    void write(CacheKey key, ExtractionResult result) throws QuarryException.Cache {
        Path file = pathOf(key);
        Path tmp = null;
        try {
            String json = result.toJson();
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), key.hex(), ".tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException | QuarryException e) {
            throw new QuarryException.Cache("Failed to write cache entry " + file + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                deleteCorrupt(tmp);
            }
        }
        prune();
    }

    /**
     * Drops expired entries, then the oldest ones beyond the entry bound.
     */
    void prune() throws QuarryException.Cache {
        List<Entry> entries = entries();
        List<Entry> live = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            if (isExpired(entry.modified())) {
                delete(entry.path());
            } else {
                live.add(entry);
            }
        }
        if (live.size() <= maxEntries) {
            return;
        }
        live.sort(Comparator.comparing(Entry::modified));
        int excess = live.size() - maxEntries;
        for (int i = 0; i < excess; i++) {
            delete(live.get(i).path());
        }
        LOG.debug("Pruned {} cache entries beyond the bound of {}", excess, maxEntries);
    }

    void clear() throws QuarryException.Cache {
        for (Entry entry : entries()) {
            delete(entry.path());
        }
    }

    int entryCount() throws QuarryException.Cache {
        return entries().size();
    }

    long totalBytes() throws QuarryException.Cache {
        long total = 0;
        for (Entry entry : entries()) {
            total += entry.size();
        }
        return total;
    }

    private boolean isExpired(FileTime modified) {
        return modified.toInstant().plus(maxAge).isBefore(Instant.now());
    }

    private List<Entry> entries() throws QuarryException.Cache {
        List<Entry> entries = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return entries;
        }
        try (DirectoryStream<Path> shards = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path shard : shards) {
                try (Stream<Path> files = Files.list(shard)) {
                    for (Path file : (Iterable<Path>) files::iterator) {
                        if (!file.getFileName().toString().endsWith(SUFFIX)) {
                            continue;
                        }
                        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                        entries.add(new Entry(file, attrs.lastModifiedTime(), attrs.size()));
                    }
                }
            }
        } catch (NoSuchFileException e) {
            LOG.debug("Cache entry vanished while listing: {}", e.getFile());
        } catch (IOException e) {
            throw new QuarryException.Cache("Failed to list cache directory " + root + ": " + e.getMessage(), e);
        }
        return entries;
    }

    private static void delete(Path file) throws QuarryException.Cache {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new QuarryException.Cache("Failed to delete cache entry " + file + ": " + e.getMessage(), e);
        }
    }

    private static void deleteCorrupt(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete cache file {}: {}", file, e.getMessage());
        }
    }

    private record Entry(Path path, FileTime modified, long size) {
    }
}
