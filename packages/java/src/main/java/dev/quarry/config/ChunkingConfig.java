package dev.quarry.config;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chunking configuration for splitting extracted text.
 *
 * <p>A {@code preset} supplies {@code max_chars} and {@code max_overlap} unless they are set
 * explicitly.</p>
 */
public final class ChunkingConfig {
    public static final String BOUNDARY_CHARACTERS = "characters";
    public static final String BOUNDARY_SENTENCES = "sentences";
    public static final String BOUNDARY_PARAGRAPHS = "paragraphs";

    private static final List<String> VALID_BOUNDARIES =
        Arrays.asList(BOUNDARY_CHARACTERS, BOUNDARY_SENTENCES, BOUNDARY_PARAGRAPHS);

    private final int maxChars;
    private final int maxOverlap;
    private final String boundary;
    private final String preset;
    private final EmbeddingConfig embedding;
    private final boolean enabled;

    private ChunkingConfig(Builder builder) {
        EmbeddingPreset presetValues = builder.preset != null
            ? EmbeddingPresets.get(builder.preset).orElse(null)
            : null;
        this.maxChars = builder.maxChars != null ? builder.maxChars
            : presetValues != null ? presetValues.chunkSize() : 1000;
        this.maxOverlap = builder.maxOverlap != null ? builder.maxOverlap
            : presetValues != null ? presetValues.overlap() : 200;
        this.boundary = builder.boundary;
        this.preset = builder.preset;
        this.embedding = builder.embedding;
        this.enabled = builder.enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxChars() {
        return maxChars;
    }

    public int getMaxOverlap() {
        return maxOverlap;
    }

    /**
     * Boundary policy: {@code characters}, {@code sentences} or {@code paragraphs}.
     *
     * @return boundary policy name
     */
    public String getBoundary() {
        return boundary;
    }

    public String getPreset() {
        return preset;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("enabled", enabled);
        map.put("max_chars", maxChars);
        map.put("max_overlap", maxOverlap);
        map.put("boundary", boundary);
        if (preset != null) {
            map.put("preset", preset);
        }
        if (embedding != null) {
            map.put("embedding", embedding.toMap());
        }
        return map;
    }

    static ChunkingConfig fromMap(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        Builder builder = builder();
        if (map.containsKey("enabled")) {
            builder.enabled(ConfigValues.asBoolean(map.get("enabled"), true));
        }
        Integer chars = ConfigValues.asInteger(map.get("max_chars"));
        if (chars != null) {
            builder.maxChars(chars);
        }
        Integer overlap = ConfigValues.asInteger(map.get("max_overlap"));
        if (overlap != null) {
            builder.maxOverlap(overlap);
        }
        String boundaryValue = ConfigValues.asString(map.get("boundary"));
        if (boundaryValue != null) {
            builder.boundary(boundaryValue);
        }
        String presetValue = ConfigValues.asString(map.get("preset"));
        if (presetValue != null) {
            builder.preset(presetValue);
        }
        Map<String, Object> embeddingMap = ConfigValues.asMap(map.get("embedding"));
        if (embeddingMap != null) {
            builder.embedding(EmbeddingConfig.fromMap(embeddingMap));
        } else if (ConfigValues.asString(map.get("embedding")) != null) {
            builder.embedding(EmbeddingConfig.builder().preset(ConfigValues.asString(map.get("embedding"))).build());
        }
        return builder.build();
    }

    public static final class Builder {
        private Integer maxChars;
        private Integer maxOverlap;
        private String boundary = BOUNDARY_CHARACTERS;
        private String preset;
        private EmbeddingConfig embedding;
        private boolean enabled = true;

        private Builder() { }

        public Builder maxChars(int maxChars) {
            if (maxChars < 1) {
                throw new IllegalArgumentException("max_chars must be positive");
            }
            this.maxChars = maxChars;
            return this;
        }

        public Builder maxOverlap(int maxOverlap) {
            if (maxOverlap < 0) {
                throw new IllegalArgumentException("max_overlap must be non-negative");
            }
            this.maxOverlap = maxOverlap;
            return this;
        }

        public Builder boundary(String boundary) {
            String normalized = boundary == null ? "" : boundary.trim().toLowerCase(Locale.ROOT);
            if (!VALID_BOUNDARIES.contains(normalized)) {
                throw new IllegalArgumentException(
                    "boundary must be one of: " + String.join(", ", VALID_BOUNDARIES));
            }
            this.boundary = normalized;
            return this;
        }

        public Builder preset(String preset) {
            if (preset != null && EmbeddingPresets.get(preset).isEmpty()) {
                throw new IllegalArgumentException("Unknown embedding preset: " + preset
                    + ". Available presets: " + EmbeddingPresets.names());
            }
            this.preset = preset;
            return this;
        }

        public Builder embedding(EmbeddingConfig embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ChunkingConfig build() {
            return new ChunkingConfig(this);
        }
    }
}
