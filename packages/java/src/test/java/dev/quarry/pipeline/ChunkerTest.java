package dev.quarry.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.Chunk;
import dev.quarry.PageContent;
import dev.quarry.ValidationException;
import dev.quarry.config.ChunkingConfig;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

final class ChunkerTest {
    private final Chunker chunker = new Chunker();

    private static ChunkingConfig config(int maxChars, int overlap, String boundary) {
        return ChunkingConfig.builder().maxChars(maxChars).maxOverlap(overlap).boundary(boundary).build();
    }

    private static List<String> texts(List<Chunk> chunks) {
        return chunks.stream().map(Chunk::content).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Character windows")
    final class Characters {

        @Test
        void shouldShareOverlapBetweenWindows() throws Exception {
            List<Chunk> chunks = chunker.chunk("abcdefghij", config(4, 1, "characters"), List.of());

            assertThat(texts(chunks)).containsExactly("abcd", "defg", "ghij");
            assertThat(chunks.get(1).metadata().charStart()).isEqualTo(3);
            assertThat(chunks.get(2).metadata().chunkIndex()).isEqualTo(2);
            assertThat(chunks).allSatisfy(c -> assertThat(c.metadata().totalChunks()).isEqualTo(3));
        }

        @Test
        void shouldCountUtf8Bytes() throws Exception {
            List<Chunk> chunks = chunker.chunk("caf\u00e9 bar", config(4, 0, "characters"), List.of());

            assertThat(texts(chunks)).containsExactly("caf\u00e9", "bar");
            assertThat(chunks.get(0).metadata().byteEnd()).isEqualTo(5);
            assertThat(chunks.get(1).metadata().byteStart()).isEqualTo(6);
            assertThat(chunks.get(1).metadata().byteEnd()).isEqualTo(9);
        }

        @Test
        void shouldAttachPageNumbers() throws Exception {
            List<PageContent> pages = List.of(
                new PageContent(1, "alpha text", false, 1.0),
                new PageContent(2, "beta text", false, 1.0));

            List<Chunk> chunks = chunker.chunk("alpha text\n\nbeta text", config(12, 0, "characters"), pages);

            assertThat(texts(chunks)).containsExactly("alpha text", "beta text");
            assertThat(chunks.get(0).metadata().firstPage()).isEqualTo(1);
            assertThat(chunks.get(1).metadata().firstPage()).isEqualTo(2);
            assertThat(chunks.get(1).metadata().lastPage()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Unit packing")
    final class Units {

        @Test
        void shouldNeverSplitSentences() throws Exception {
            String content = "First sentence here. Second one is longer than that. Third.";

            List<Chunk> chunks = chunker.chunk(content, config(40, 0, "sentences"), List.of());

            assertThat(texts(chunks)).containsExactly("First sentence here.",
                "Second one is longer than that. Third.");
            assertThat(chunks.get(1).metadata().tokenCount()).isEqualTo(7);
        }

        @Test
        void shouldKeepOversizedSentenceWhole() throws Exception {
            String content = "Short. This sentence is far longer than the limit allows. End.";

            List<Chunk> chunks = chunker.chunk(content, config(20, 0, "sentences"), List.of());

            assertThat(texts(chunks)).contains("This sentence is far longer than the limit allows.");
            assertThat(chunks).allSatisfy(c -> assertThat(c.content()).endsWith("."));
        }

        @Test
        void shouldPackParagraphs() throws Exception {
            String content = "Para one line.\n\nPara two.\n\nPara three.";

            List<Chunk> chunks = chunker.chunk(content, config(30, 0, "paragraphs"), List.of());

            assertThat(texts(chunks)).containsExactly("Para one line.\n\nPara two.", "Para three.");
        }
    }

    @Test
    void shouldReturnNothingForBlankContent() throws Exception {
        assertThat(chunker.chunk("  \n ", config(10, 0, "characters"), List.of())).isEmpty();
    }

    @Test
    void shouldRejectOverlapNotBelowMax() {
        assertThatThrownBy(() -> chunker.chunk("text", config(10, 10, "characters"), List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("max_overlap");
    }
}
