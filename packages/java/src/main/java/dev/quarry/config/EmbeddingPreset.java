package dev.quarry.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named embedding setup: vector size plus the chunk window it was tuned for.
 *
 * @param name preset name
 * @param dimensions vector dimensions
 * @param chunkSize recommended maximum characters per chunk
 * @param overlap recommended chunk overlap in characters
 * @param modelName model the preset stands for
 * @param description short human description
 */
public record EmbeddingPreset(
    @JsonProperty("name") String name,
    @JsonProperty("dimensions") int dimensions,
    @JsonProperty("chunk_size") int chunkSize,
    @JsonProperty("overlap") int overlap,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("description") String description
) {
}
