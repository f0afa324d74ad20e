package dev.quarry.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Derives {@link CacheKey}s.
 *
 * <p>A key covers the content identity, the canonical JSON of the full effective configuration
 * (keys sorted at every depth) and the library version, so the same file under different settings
 * maps to different entries and an upgrade never serves stale results.</p>
 */
public final class CacheKeys {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String version;

    public CacheKeys(String version) {
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Key for in-memory bytes.
     *
     * @param data document bytes
     * @param mimeType canonical MIME type
     * @param config effective configuration
     * @return the key
     * @throws QuarryException if the configuration cannot be serialized
     */
    public CacheKey forBytes(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        MessageDigest content = sha256();
        content.update(data);
        String identity = "bytes:" + HexFormat.of().formatHex(content.digest()) + ':' + mimeType;
        return derive(identity, config);
    }

    /**
     * Key for a file, identified by its absolute path, size and modification time.
     *
     * @param path document path
     * @param size file size in bytes
     * @param modifiedMillis last modification time in epoch milliseconds
     * @param config effective configuration
     * @return the key
     * @throws QuarryException if the configuration cannot be serialized
     */
    public CacheKey forFile(Path path, long size, long modifiedMillis, ExtractionConfig config)
        throws QuarryException {
        String identity = "file:" + path.toAbsolutePath().normalize() + ':' + size + ':' + modifiedMillis;
        return derive(identity, config);
    }

    static String canonicalJson(ExtractionConfig config) throws QuarryException {
        Map<String, Object> map = (config != null ? config : ExtractionConfig.builder().build()).toMap();
        try {
            return CANONICAL.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new QuarryException.Cache("Failed to serialize configuration for cache key", e);
        }
    }

    private CacheKey derive(String identity, ExtractionConfig config) throws QuarryException {
        MessageDigest digest = sha256();
        digest.update(identity.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(canonicalJson(config).getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(version.getBytes(StandardCharsets.UTF_8));
        return new CacheKey(HexFormat.of().formatHex(digest.digest()));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
