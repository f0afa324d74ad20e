package dev.quarry.pipeline;

import dev.quarry.config.TokenReductionConfig;
import dev.quarry.config.TokenReductionConfig.Mode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shrinks content by severity mode. Each mode includes the rules of the milder ones:
 *
 * <ul>
 *   <li>{@code light}: collapse whitespace runs and repeated blank lines</li>
 *   <li>{@code moderate}: drop stop words</li>
 *   <li>{@code aggressive}: drop punctuation-only tokens, drop a sentence equal to the one before it</li>
 *   <li>{@code maximum}: drop non-numeric words of at most two characters</li>
 * </ul>
 *
 * <p>Every rule's output is a fixed point of the whole rule set, so reducing twice equals
 * reducing once.</p>
 */
public final class TokenReducer {
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");

    /**
     * Reduce content.
     *
     * @param content text
     * @param config mode and word preservation
     * @param language stop-word language, null for English
     * @return reduced text
     */
    public String reduce(String content, TokenReductionConfig config, String language) {
        Mode mode = config.getMode();
        if (mode == Mode.OFF || content == null || content.isEmpty()) {
            return content;
        }
        String text = content;
        if (mode.includes(Mode.MODERATE)) {
            text = filterTokens(text, mode, config.isPreserveImportantWords(), StopWords.forLanguage(language));
        }
        if (mode.includes(Mode.AGGRESSIVE)) {
            text = dropRepeatedSentences(normalizeWhitespace(text));
        }
        return normalizeWhitespace(text);
    }

    static String normalizeWhitespace(String text) {
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder out = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            out.append(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").strip()).append('\n');
        }
        return BLANK_LINES.matcher(out.toString()).replaceAll("\n\n").strip();
    }

    private static String filterTokens(String text, Mode mode, boolean preserve, Set<String> stopWords) {
        StringBuilder out = new StringBuilder(text.length());
        String[] lines = text.split("\n", -1);
        for (int l = 0; l < lines.length; l++) {
            if (l > 0) {
                out.append('\n');
            }
            boolean first = true;
            for (String token : HORIZONTAL_SPACE.split(lines[l].strip())) {
                if (token.isEmpty() || drop(token, mode, preserve, stopWords)) {
                    continue;
                }
                if (!first) {
                    out.append(' ');
                }
                out.append(token);
                first = false;
            }
        }
        return out.toString();
    }

    private static boolean drop(String token, Mode mode, boolean preserve, Set<String> stopWords) {
        String core = core(token);
        if (core.isEmpty()) {
            return mode.includes(Mode.AGGRESSIVE);
        }
        if (preserve && (Character.isUpperCase(core.charAt(0)) || isNumeric(core))) {
            return false;
        }
        if (stopWords.contains(core.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return mode == Mode.MAXIMUM && core.length() <= 2 && !isNumeric(core);
    }

    private static String dropRepeatedSentences(String text) {
        StringBuilder out = new StringBuilder(text.length());
        String[] lines = text.split("\n", -1);
        String previous = null;
        for (int l = 0; l < lines.length; l++) {
            if (l > 0) {
                out.append('\n');
            }
            if (lines[l].isEmpty()) {
                continue;
            }
            List<String> kept = new ArrayList<>();
            for (String sentence : SENTENCE_SPLIT.split(lines[l])) {
                String normalized = sentence.toLowerCase(Locale.ROOT);
                if (!normalized.equals(previous)) {
                    kept.add(sentence);
                }
                previous = normalized;
            }
            out.append(String.join(" ", kept));
        }
        return out.toString();
    }

    /** The token without leading and trailing characters that are neither letters nor digits. */
    private static String core(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && !Character.isLetterOrDigit(token.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isNumeric(String core) {
        boolean digit = false;
        for (int i = 0; i < core.length(); i++) {
            char c = core.charAt(i);
            if (Character.isDigit(c)) {
                digit = true;
            } else if (c != '.' && c != ',' && c != '-' && c != '%') {
                return false;
            }
        }
        return digit;
    }
}
