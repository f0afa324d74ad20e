package dev.quarry;

import java.util.Objects;

/**
 * Raw document bytes with a declared MIME type, used for batch extraction.
 *
 * <p>The declared type is advisory; the classifier cross-checks it against the content.</p>
 *
 * @param data document bytes
 * @param mimeType declared MIME type, may be null to rely on detection
 */
public record BytesWithMime(byte[] data, String mimeType) {
    public BytesWithMime {
        Objects.requireNonNull(data, "data must not be null");
    }
}
