package dev.quarry.mime;

import dev.quarry.ProcessingWarning;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link MimeDetector#classify}.
 *
 * @param mimeType canonical media type used for dispatch
 * @param sniffedType type recognized from content, null if the bytes were inconclusive
 * @param warnings disagreements between content, extension and declared type
 */
public record Classification(String mimeType, String sniffedType, List<ProcessingWarning> warnings) {
    public Classification {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
