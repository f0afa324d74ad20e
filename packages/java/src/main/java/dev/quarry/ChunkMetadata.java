package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata describing where a chunk appears within the original document.
 *
 * <p>Byte offsets are UTF-8 positions into the result content, character offsets are Java
 * {@code String} indices. Page numbers are present when the document was paginated.</p>
 *
 * @param byteStart inclusive UTF-8 start offset
 * @param byteEnd exclusive UTF-8 end offset
 * @param charStart inclusive character start offset
 * @param charEnd exclusive character end offset
 * @param tokenCount whitespace token count
 * @param chunkIndex zero-based index
 * @param totalChunks number of chunks in the document
 * @param firstPage first page the chunk touches, null if unknown
 * @param lastPage last page the chunk touches, null if unknown
 */
public record ChunkMetadata(
    @JsonProperty("byte_start") long byteStart,
    @JsonProperty("byte_end") long byteEnd,
    @JsonProperty("char_start") int charStart,
    @JsonProperty("char_end") int charEnd,
    @JsonProperty("token_count") int tokenCount,
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("first_page") Integer firstPage,
    @JsonProperty("last_page") Integer lastPage
) {
    @JsonCreator
    public ChunkMetadata {
        if (byteStart < 0 || byteEnd < byteStart) {
            throw new IllegalArgumentException("Invalid chunk byte range: " + byteStart + "-" + byteEnd);
        }
        if (charStart < 0 || charEnd < charStart) {
            throw new IllegalArgumentException("Invalid chunk char range: " + charStart + "-" + charEnd);
        }
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be non-negative");
        }
        if (totalChunks < 1 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException("totalChunks must be positive and greater than chunkIndex");
        }
        if (firstPage != null && lastPage != null && lastPage < firstPage) {
            throw new IllegalArgumentException("lastPage must be >= firstPage");
        }
    }
}
