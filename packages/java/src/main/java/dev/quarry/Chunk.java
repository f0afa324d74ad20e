package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Objects;

/**
 * A window of the result content, optionally with an embedding vector.
 *
 * @param content chunk text
 * @param embedding embedding vector, null when embeddings were not requested or failed
 * @param metadata offsets and statistics
 */
public record Chunk(
    @JsonProperty("content") String content,
    @JsonProperty("embedding") @JsonInclude(JsonInclude.Include.NON_NULL) float[] embedding,
    @JsonProperty("metadata") ChunkMetadata metadata
) {
    @JsonCreator
    public Chunk {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        embedding = embedding != null ? embedding.clone() : null;
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public Chunk withEmbedding(float[] vector) {
        return new Chunk(content, vector, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk)) {
            return false;
        }
        Chunk other = (Chunk) o;
        return content.equals(other.content)
            && Arrays.equals(embedding, other.embedding)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(content, metadata) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Chunk{"
            + "chars=" + content.length()
            + ", index=" + metadata.chunkIndex()
            + ", embedding=" + (embedding != null ? embedding.length + "d" : "none")
            + '}';
    }
}
