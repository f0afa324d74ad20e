package dev.quarry;

import java.util.Locale;

/**
 * Processing stage for post-processors.
 *
 * <p>Controls when a post-processor is applied relative to the built-in stages.</p>
 */
public enum ProcessingStage {
    /**
     * Runs before quality scoring and language detection.
     */
    EARLY("early"),

    /**
     * Runs after language detection, before keywords and chunking (default).
     */
    MIDDLE("middle"),

    /**
     * Runs after token reduction, right before validators.
     */
    LATE("late");

    private final String wireName;

    ProcessingStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ProcessingStage fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ProcessingStage stage : values()) {
            if (stage.wireName.equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown processing stage: " + value);
    }
}
