package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Rich Text Format. Control words are interpreted only as far as text recovery needs:
 * paragraph and tab breaks, hex and Unicode escapes, and the {@code \info} group for metadata.
 * Font, color, style and picture destinations are skipped.
 */
public final class RtfExtractor implements DocumentExtractor {
    private static final Charset ANSI = Charset.forName("windows-1252");
    private static final int MAX_DEPTH = 512;
    private static final Set<String> SKIPPED_DESTINATIONS = Set.of(
        "fonttbl", "colortbl", "stylesheet", "pict", "object", "header", "footer", "headerl", "headerr",
        "footerl", "footerr", "listtable", "listoverridetable", "rsidtbl", "generator", "xmlnstbl",
        "themedata", "colorschememapping", "latentstyles", "datastore", "fldinst");
    private static final Set<String> INFO_FIELDS = Set.of("title", "subject", "author", "keywords", "operator");

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        String source = new String(data, StandardCharsets.ISO_8859_1);
        if (!source.startsWith("{\\rtf")) {
            throw new QuarryException.Parsing("Not an RTF document: missing {\\rtf header");
        }
        Parser parser = new Parser(source);
        parser.parse();
        String text = Texts.tidy(parser.text.toString());

        Metadata.Builder metadata = Metadata.builder()
            .title(parser.info.title)
            .subject(parser.info.subject)
            .modifiedBy(parser.info.operator)
            .additional("word_count", Texts.countWords(text));
        if (parser.info.author != null && !parser.info.author.isBlank()) {
            metadata.authors(List.of(parser.info.author.trim())).createdBy(parser.info.author.trim());
        }
        if (parser.info.keywords != null) {
            metadata.keywords(CoreProperties.splitKeywords(parser.info.keywords));
        }
        return ExtractionResult.builder(mimeType)
            .content(text)
            .metadata(metadata.build())
            .build();
    }

    private static final class Info {
        private String title;
        private String subject;
        private String author;
        private String keywords;
        private String operator;

        void set(String field, String value) {
            String trimmed = value.trim();
            switch (field) {
                case "title":
                    title = trimmed;
                    break;
                case "subject":
                    subject = trimmed;
                    break;
                case "author":
                    author = trimmed;
                    break;
                case "keywords":
                    keywords = trimmed;
                    break;
                case "operator":
                    operator = trimmed;
                    break;
                default:
                    break;
            }
        }
    }

    private static final class Group {
        private final boolean skip;
        private final String infoField;
        private final int unicodeSkip;

        Group(boolean skip, String infoField, int unicodeSkip) {
            this.skip = skip;
            this.infoField = infoField;
            this.unicodeSkip = unicodeSkip;
        }
    }

    private static final class Parser {
        private final String source;
        private final StringBuilder text = new StringBuilder();
        private final Info info = new Info();
        private final Deque<Group> groups = new ArrayDeque<>();
        private StringBuilder field;
        private int pos;
        private int pendingSkip;
        private boolean groupStart;

        Parser(String source) {
            this.source = source;
        }

        void parse() throws QuarryException {
            Group current = new Group(false, null, 1);
            while (pos < source.length()) {
                char c = source.charAt(pos++);
                switch (c) {
                    case '{':
                        if (groups.size() >= MAX_DEPTH) {
                            throw new QuarryException.Parsing("RTF groups nested deeper than " + MAX_DEPTH);
                        }
                        groups.push(current);
                        current = new Group(current.skip, current.infoField, current.unicodeSkip);
                        groupStart = true;
                        break;
                    case '}':
                        if (current.infoField != null && field != null
                            && (groups.isEmpty() || groups.peek().infoField == null)) {
                            info.set(current.infoField, field.toString());
                            field = null;
                        }
                        current = groups.isEmpty() ? current : groups.pop();
                        groupStart = false;
                        break;
                    case '\\':
                        current = controlWord(current);
                        groupStart = false;
                        break;
                    case '\r':
                    case '\n':
                        break;
                    default:
                        groupStart = false;
                        emit(current, c);
                        break;
                }
            }
        }

        private Group controlWord(Group current) {
            if (pos >= source.length()) {
                return current;
            }
            char c = source.charAt(pos);
            if (!Character.isLetter(c)) {
                pos++;
                switch (c) {
                    case '\'':
                        if (pos + 2 <= source.length()) {
                            String hex = source.substring(pos, pos + 2);
                            pos += 2;
                            try {
                                byte value = (byte) Integer.parseInt(hex, 16);
                                emit(current, new String(new byte[] {value}, ANSI).charAt(0));
                            } catch (NumberFormatException e) {
                                emit(current, '?');
                            }
                        }
                        break;
                    case '*':
                        if (groupStart) {
                            return new Group(true, null, current.unicodeSkip);
                        }
                        break;
                    case '~':
                        emit(current, '\u00a0');
                        break;
                    case '\r':
                    case '\n':
                        emit(current, '\n');
                        break;
                    default:
                        emit(current, c);
                        break;
                }
                return current;
            }
            int start = pos;
            while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
                pos++;
            }
            String word = source.substring(start, pos);
            int paramStart = pos;
            if (pos < source.length() && source.charAt(pos) == '-') {
                pos++;
            }
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
            Integer param = null;
            if (pos > paramStart && !(pos - paramStart == 1 && source.charAt(paramStart) == '-')) {
                try {
                    param = Integer.parseInt(source.substring(paramStart, pos));
                } catch (NumberFormatException e) {
                    param = 0;
                }
            }
            if (pos < source.length() && source.charAt(pos) == ' ') {
                pos++;
            }
            return apply(current, word, param);
        }

        private Group apply(Group current, String word, Integer param) {
            boolean atStart = groupStart;
            if (atStart && SKIPPED_DESTINATIONS.contains(word)) {
                return new Group(true, null, current.unicodeSkip);
            }
            if (atStart && "info".equals(word)) {
                return new Group(true, null, current.unicodeSkip);
            }
            if (atStart && INFO_FIELDS.contains(word) && current.skip && groups.size() >= 2) {
                field = new StringBuilder();
                return new Group(true, word, current.unicodeSkip);
            }
            switch (word) {
                case "par":
                case "sect":
                case "page":
                    emit(current, '\n');
                    emit(current, '\n');
                    break;
                case "line":
                case "row":
                    emit(current, '\n');
                    break;
                case "tab":
                case "cell":
                    emit(current, '\t');
                    break;
                case "emdash":
                    emit(current, '\u2014');
                    break;
                case "endash":
                    emit(current, '\u2013');
                    break;
                case "bullet":
                    emit(current, '\u2022');
                    break;
                case "lquote":
                    emit(current, '\u2018');
                    break;
                case "rquote":
                    emit(current, '\u2019');
                    break;
                case "ldblquote":
                    emit(current, '\u201C');
                    break;
                case "rdblquote":
                    emit(current, '\u201D');
                    break;
                case "uc":
                    return new Group(current.skip, current.infoField, param != null ? Math.max(param, 0) : 1);
                case "u":
                    if (param != null) {
                        int code = param < 0 ? param + 65536 : param;
                        emit(current, (char) code);
                        pendingSkip = current.unicodeSkip;
                        return current;
                    }
                    break;
                default:
                    break;
            }
            return current;
        }

        private void emit(Group group, char c) {
            if (pendingSkip > 0) {
                pendingSkip--;
                return;
            }
            if (group.infoField != null && field != null) {
                field.append(c);
            } else if (!group.skip) {
                text.append(c);
            }
        }
    }
}
