package dev.quarry.pipeline;

import dev.quarry.Chunk;
import dev.quarry.ChunkMetadata;
import dev.quarry.PageContent;
import dev.quarry.ValidationException;
import dev.quarry.config.ChunkingConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits content into chunks.
 *
 * <ul>
 *   <li>{@code characters}: fixed windows of {@code max_chars} with {@code max_overlap} shared
 *   characters.</li>
 *   <li>{@code sentences} and {@code paragraphs}: whole units packed up to {@code max_chars}; a
 *   unit longer than that becomes its own chunk. Overlap is carried as whole trailing units.</li>
 * </ul>
 */
public final class Chunker {

    /**
     * Chunk content.
     *
     * @param content final content
     * @param config chunking settings
     * @param pages pages of the result, used to fill page numbers; may be empty
     * @return chunks in order, empty for blank content
     * @throws ValidationException if {@code max_overlap >= max_chars}
     */
    public List<Chunk> chunk(String content, ChunkingConfig config, List<PageContent> pages)
        throws ValidationException {
        int maxChars = config.getMaxChars();
        int overlap = config.getMaxOverlap();
        if (overlap >= maxChars) {
            throw new ValidationException("max_overlap (" + overlap + ") must be less than max_chars ("
                + maxChars + ")");
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<int[]> spans;
        switch (config.getBoundary()) {
            case ChunkingConfig.BOUNDARY_SENTENCES:
                spans = pack(sentences(content), maxChars, overlap);
                break;
            case ChunkingConfig.BOUNDARY_PARAGRAPHS:
                spans = pack(paragraphs(content), maxChars, overlap);
                break;
            default:
                spans = windows(content, maxChars, overlap);
                break;
        }
        List<int[]> pageRanges = pageRanges(content, pages);
        List<Chunk> chunks = new ArrayList<>(spans.size());
        long bytePosition = 0;
        int charPosition = 0;
        for (int i = 0; i < spans.size(); i++) {
            int start = spans.get(i)[0];
            int end = spans.get(i)[1];
            bytePosition = start >= charPosition
                ? bytePosition + utf8Length(content, charPosition, start)
                : bytePosition - utf8Length(content, start, charPosition);
            charPosition = start;
            long byteEnd = bytePosition + utf8Length(content, start, end);
            String text = content.substring(start, end);
            ChunkMetadata metadata = new ChunkMetadata(bytePosition, byteEnd, start, end, countTokens(text), i,
                spans.size(), pageAt(pageRanges, start), pageAt(pageRanges, Math.max(start, end - 1)));
            chunks.add(new Chunk(text, null, metadata));
        }
        return chunks;
    }

    static List<int[]> windows(String content, int maxChars, int overlap) {
        List<int[]> spans = new ArrayList<>();
        int length = content.length();
        int start = skipWhitespace(content, 0);
        while (start < length) {
            int end = Math.min(length, start + maxChars);
            if (end < length && Character.isHighSurrogate(content.charAt(end - 1))) {
                end--;
            }
            int trimmedEnd = end;
            while (trimmedEnd > start && Character.isWhitespace(content.charAt(trimmedEnd - 1))) {
                trimmedEnd--;
            }
            if (trimmedEnd > start) {
                spans.add(new int[] {start, trimmedEnd});
            }
            if (end >= length) {
                break;
            }
            int next = end - overlap;
            if (next < length && next > 0 && Character.isLowSurrogate(content.charAt(next))) {
                next--;
            }
            start = skipWhitespace(content, Math.max(next, start + 1));
        }
        return spans;
    }

    static List<int[]> pack(List<int[]> units, int maxChars, int overlap) {
        List<int[]> spans = new ArrayList<>();
        int i = 0;
        while (i < units.size()) {
            int start = units.get(i)[0];
            int j = i + 1;
            while (j < units.size() && units.get(j)[1] - start <= maxChars) {
                j++;
            }
            int end = units.get(j - 1)[1];
            spans.add(new int[] {start, end});
            if (j >= units.size()) {
                break;
            }
            int k = j;
            while (k - 1 > i && end - units.get(k - 1)[0] <= overlap) {
                k--;
            }
            i = k;
        }
        return spans;
    }

    /** Sentence spans: text up to terminal punctuation followed by whitespace, or a blank line. */
    static List<int[]> sentences(String content) {
        List<int[]> units = new ArrayList<>();
        int length = content.length();
        int start = skipWhitespace(content, 0);
        int i = start;
        while (i < length) {
            char c = content.charAt(i);
            boolean boundary = false;
            int end = i + 1;
            if (c == '.' || c == '!' || c == '?') {
                while (end < length && isClosing(content.charAt(end))) {
                    end++;
                }
                boundary = end >= length || Character.isWhitespace(content.charAt(end));
            } else if (c == '\n' && i + 1 < length && blankLineFollows(content, i + 1)) {
                boundary = true;
                end = i;
            }
            if (boundary) {
                addTrimmed(units, content, start, end);
                start = skipWhitespace(content, Math.max(end, i + 1));
                i = start;
            } else {
                i++;
            }
        }
        addTrimmed(units, content, start, length);
        return units;
    }

    static List<int[]> paragraphs(String content) {
        List<int[]> units = new ArrayList<>();
        int length = content.length();
        int start = skipWhitespace(content, 0);
        int i = start;
        while (i < length) {
            if (content.charAt(i) == '\n' && i + 1 < length && blankLineFollows(content, i + 1)) {
                addTrimmed(units, content, start, i);
                start = skipWhitespace(content, i + 1);
                i = start;
            } else {
                i++;
            }
        }
        addTrimmed(units, content, start, length);
        return units;
    }

    static int countTokens(String text) {
        int count = 0;
        boolean inToken = false;
        for (int i = 0; i < text.length(); i++) {
            boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inToken) {
                count++;
            }
            inToken = !whitespace;
        }
        return count;
    }

    static long utf8Length(String text, int from, int to) {
        long bytes = 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < to && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    /** Character ranges of each page's text inside the content, located in order. */
    private static List<int[]> pageRanges(String content, List<PageContent> pages) {
        List<int[]> ranges = new ArrayList<>();
        int cursor = 0;
        for (PageContent page : pages) {
            String text = page.content().strip();
            if (text.isEmpty()) {
                continue;
            }
            int at = content.indexOf(text, cursor);
            if (at < 0) {
                continue;
            }
            ranges.add(new int[] {at, at + text.length(), page.pageNumber()});
            cursor = at + text.length();
        }
        return ranges;
    }

    private static Integer pageAt(List<int[]> ranges, int position) {
        Integer last = null;
        for (int[] range : ranges) {
            if (position < range[0]) {
                return last != null ? last : range[2];
            }
            last = range[2];
            if (position < range[1]) {
                return range[2];
            }
        }
        return last;
    }

    private static boolean blankLineFollows(String content, int from) {
        for (int i = from; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isClosing(char c) {
        return c == '"' || c == '\'' || c == ')' || c == ']' || c == '\u201D' || c == '\u2019'
            || c == '.' || c == '!' || c == '?';
    }

    private static void addTrimmed(List<int[]> units, String content, int start, int end) {
        int s = start;
        int e = Math.min(end, content.length());
        while (s < e && Character.isWhitespace(content.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(content.charAt(e - 1))) {
            e--;
        }
        if (e > s) {
            units.add(new int[] {s, e});
        }
    }

    private static int skipWhitespace(String content, int from) {
        int i = from;
        while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
            i++;
        }
        return i;
    }
}
