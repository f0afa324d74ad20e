package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.Table;
import dev.quarry.config.ExtractionConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * LaTeX sources, read as text without running TeX.
 *
 * <p>Title, author and date come from the preamble. In the body, sectioning commands become
 * {@code #} headings, list items become {@code - } lines and {@code tabular} environments become
 * tables. Formatting commands keep their argument; citations and references keep their key in
 * brackets; setup commands vanish with their arguments. Any other command loses only its name.</p>
 */
public final class LatexExtractor implements DocumentExtractor {
    private static final Set<String> KEEP_PROCESSED = Set.of(
        "textbf", "textit", "emph", "underline", "textsc", "mbox", "hbox", "vbox", "text", "mathrm", "mathbf",
        "mathit", "mathsf", "mathtt", "boldsymbol", "textrm", "textsf");
    private static final Set<String> KEEP_RAW = Set.of("texttt", "url", "textsuperscript", "textsubscript");
    private static final Set<String> SETUP = Set.of(
        "usepackage", "documentclass", "pagestyle", "setlength", "newcommand", "renewcommand", "def", "let",
        "input", "include", "bibliography", "bibliographystyle", "graphicspath", "geometry", "hypersetup",
        "includegraphics", "title", "author", "date", "thanks");
    private static final Set<String> CITE = Set.of("cite", "citep", "citet", "citealp", "citeauthor", "citeyear");
    private static final Set<String> REF = Set.of("ref", "eqref", "pageref", "autoref", "cref", "Cref", "nameref");
    private static final Set<String> VERBATIM = Set.of(
        "verbatim", "lstlisting", "minted", "equation", "equation*", "align", "align*", "displaymath");
    private static final String[] HEADINGS = {"chapter", "section", "subsection", "subsubsection"};

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        String source = stripComments(Texts.normalizeNewlines(Texts.decode(data)));
        int begin = source.indexOf("\\begin{document}");
        String preamble = begin >= 0 ? source.substring(0, begin) : "";
        String body = begin >= 0 ? source.substring(begin + "\\begin{document}".length()) : source;
        int end = body.indexOf("\\end{document}");
        if (end >= 0) {
            body = body.substring(0, end);
        }

        ExtractionResult.Builder result = ExtractionResult.builder(mimeType);
        Body rendered = renderBody(body);
        rendered.tables.forEach(result::addTable);

        Metadata.Builder metadata = Metadata.builder()
            .additional("section_count", rendered.sections);
        String title = argument(source, "title");
        if (title != null) {
            metadata.title(inline(title));
        }
        String author = argument(source, "author");
        if (author != null) {
            List<String> authors = new ArrayList<>();
            for (String name : author.split("\\\\and")) {
                String cleaned = inline(name);
                if (!cleaned.isEmpty()) {
                    authors.add(cleaned);
                }
            }
            if (!authors.isEmpty()) {
                metadata.authors(authors);
            }
        }
        String date = argument(source, "date");
        if (date != null && !inline(date).isEmpty()) {
            metadata.additional("date", inline(date));
        }
        String documentClass = argument(preamble, "documentclass");
        if (documentClass != null) {
            metadata.additional("documentclass", documentClass.strip());
        }
        return result
            .content(Texts.tidy(rendered.text.toString()))
            .metadata(metadata.build())
            .build();
    }

    /** Rendered body text plus what was collected along the way. */
    private static final class Body {
        final StringBuilder text = new StringBuilder();
        final List<Table> tables = new ArrayList<>();
        int sections;
    }

    private static Body renderBody(String body) {
        Body out = new Body();
        String[] lines = body.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            String environment = environmentOf(line, "\\begin{");
            if ("tabular".equals(environment) || "tabular*".equals(environment)) {
                StringBuilder raw = new StringBuilder(afterEnvironmentArguments(line));
                while (++i < lines.length && !lines[i].contains("\\end{tabular")) {
                    raw.append('\n').append(lines[i]);
                }
                if (i < lines.length) {
                    raw.append('\n').append(lines[i], 0, lines[i].indexOf("\\end{tabular"));
                }
                List<List<String>> rows = tableRows(raw.toString());
                if (!rows.isEmpty()) {
                    out.tables.add(Table.of(rows, 1));
                    for (List<String> row : rows) {
                        out.text.append(String.join("\t", row)).append('\n');
                    }
                    out.text.append('\n');
                }
                continue;
            }
            if (environment != null && VERBATIM.contains(environment)) {
                String close = "\\end{" + environment + "}";
                while (++i < lines.length && !lines[i].contains(close)) {
                    out.text.append(lines[i].stripTrailing()).append('\n');
                }
                out.text.append('\n');
                continue;
            }
            if (environment != null || environmentOf(line, "\\end{") != null) {
                continue;
            }
            if (line.isEmpty()) {
                out.text.append('\n');
                continue;
            }
            String heading = heading(line);
            if (heading != null) {
                out.sections++;
                out.text.append('\n').append(heading).append("\n\n");
                continue;
            }
            if (line.startsWith("\\item")) {
                Cursor cursor = new Cursor(line, "\\item".length());
                String label = cursor.optional();
                String item = inline(line.substring(cursor.pos));
                out.text.append("- ");
                if (label != null) {
                    out.text.append(inline(label)).append(' ');
                }
                out.text.append(item).append('\n');
                continue;
            }
            String text = inline(line);
            if (!text.isEmpty()) {
                out.text.append(text).append('\n');
            }
        }
        return out;
    }

    private static String heading(String line) {
        for (int level = 0; level < HEADINGS.length; level++) {
            String command = "\\" + HEADINGS[level];
            if (!line.startsWith(command)) {
                continue;
            }
            Cursor cursor = new Cursor(line, command.length());
            if (!cursor.atEnd() && cursor.peek() == '*') {
                cursor.pos++;
            }
            cursor.optional();
            String title = cursor.braced();
            if (title == null) {
                return null;
            }
            String marks = "#".repeat(Math.max(1, level));
            String rest = inline(line.substring(cursor.pos));
            return marks + " " + inline(title) + (rest.isEmpty() ? "" : "\n\n" + rest);
        }
        return null;
    }

    /** The environment name of a leading {@code \begin{..}} or {@code \end{..}}, else null. */
    private static String environmentOf(String line, String marker) {
        if (!line.startsWith(marker)) {
            return null;
        }
        int close = line.indexOf('}', marker.length());
        return close < 0 ? null : line.substring(marker.length(), close);
    }

    private static String afterEnvironmentArguments(String line) {
        Cursor cursor = new Cursor(line, line.indexOf('}') + 1);
        cursor.optional();
        cursor.braced();
        return line.substring(cursor.pos);
    }

    static List<List<String>> tableRows(String raw) {
        List<List<String>> rows = new ArrayList<>();
        for (String rawRow : raw.split("\\\\\\\\")) {
            String row = rawRow.replaceAll("\\\\(hline|toprule|midrule|bottomrule)", "")
                .replaceAll("\\\\cline\\{[^}]*}", "")
                .strip();
            if (row.isEmpty()) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (String cell : row.split("(?<!\\\\)&", -1)) {
                cells.add(inline(cell));
            }
            rows.add(cells);
        }
        return rows;
    }

    /** Render inline markup on one line or argument to plain text. */
    static String inline(String text) {
        StringBuilder out = new StringBuilder();
        Cursor cursor = new Cursor(text, 0);
        while (!cursor.atEnd()) {
            char c = text.charAt(cursor.pos++);
            switch (c) {
                case '\\':
                    command(cursor, out);
                    break;
                case '~':
                    out.append(' ');
                    break;
                case '{':
                case '}':
                case '$':
                    break;
                default:
                    out.append(c);
                    break;
            }
        }
        return out.toString().replaceAll("[ \\t]{2,}", " ").strip();
    }

    private static void command(Cursor cursor, StringBuilder out) {
        if (cursor.atEnd()) {
            return;
        }
        char next = cursor.peek();
        if (next == '\\') {
            cursor.pos++;
            out.append('\n');
            return;
        }
        if ("%&$#_{}".indexOf(next) >= 0) {
            cursor.pos++;
            out.append(next);
            return;
        }
        if (!Character.isLetter(next)) {
            cursor.pos++;
            if (next == ' ' || next == ',' || next == ';') {
                out.append(' ');
            }
            return;
        }
        String name = cursor.word();
        if (KEEP_PROCESSED.contains(name)) {
            append(out, cursor.braced(), true);
        } else if (KEEP_RAW.contains(name)) {
            append(out, cursor.braced(), false);
        } else if (SETUP.contains(name)) {
            cursor.skipArguments();
        } else if (CITE.contains(name)) {
            cursor.optional();
            bracketed(out, cursor.braced());
        } else if (REF.contains(name)) {
            bracketed(out, cursor.braced());
        } else if ("label".equals(name)) {
            cursor.braced();
        } else if ("href".equals(name)) {
            String url = cursor.braced();
            String label = cursor.braced();
            if (label != null) {
                out.append(inline(label));
                if (url != null) {
                    out.append(" (").append(url).append(')');
                }
            } else if (url != null) {
                out.append(url);
            }
        } else if ("footnote".equals(name) || "footnotetext".equals(name)) {
            String note = cursor.braced();
            if (note != null) {
                out.append(" (").append(inline(note)).append(')');
            }
        } else if ("font".equals(name)) {
            while (!cursor.atEnd() && cursor.peek() != '\\') {
                cursor.pos++;
            }
        }
        // Anything else: zero-argument or unknown, the name alone is dropped.
    }

    private static void append(StringBuilder out, String argument, boolean processed) {
        if (argument != null) {
            out.append(processed ? inline(argument) : argument);
        }
    }

    private static void bracketed(StringBuilder out, String key) {
        if (key != null) {
            out.append('[').append(key).append(']');
        }
    }

    /** The first braced argument of {@code \name}, allowing an optional argument before it. */
    static String argument(String source, String name) {
        String command = "\\" + name;
        int from = 0;
        while (true) {
            int at = source.indexOf(command, from);
            if (at < 0) {
                return null;
            }
            Cursor cursor = new Cursor(source, at + command.length());
            if (!cursor.atEnd() && Character.isLetter(cursor.peek())) {
                from = cursor.pos;
                continue;
            }
            cursor.optional();
            String value = cursor.braced();
            if (value != null) {
                return value;
            }
            from = cursor.pos;
        }
    }

    static String stripComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        for (String line : source.split("\n", -1)) {
            int cut = -1;
            for (int i = 0; i < line.length(); i++) {
                if (line.charAt(i) == '%' && (i == 0 || line.charAt(i - 1) != '\\')) {
                    cut = i;
                    break;
                }
            }
            out.append(cut >= 0 ? line.substring(0, cut) : line).append('\n');
        }
        return out.toString();
    }

    /** A read position inside LaTeX text. */
    private static final class Cursor {
        final String text;
        int pos;

        Cursor(String text, int pos) {
            this.text = text;
            this.pos = pos;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        String word() {
            int start = pos;
            while (!atEnd() && Character.isLetter(peek())) {
                pos++;
            }
            if (!atEnd() && peek() == '*') {
                pos++;
            }
            return text.substring(start, pos).replace("*", "");
        }

        private void skipSpaces() {
            while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
                pos++;
            }
        }

        /** A balanced {@code {..}} group, or null (position unchanged) if none follows. */
        String braced() {
            int start = pos;
            skipSpaces();
            if (atEnd() || peek() != '{') {
                pos = start;
                return null;
            }
            int depth = 0;
            int open = pos;
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '\\' && !atEnd()) {
                    pos++;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return text.substring(open + 1, pos - 1);
                }
            }
            return text.substring(open + 1);
        }

        void skipArguments() {
            while (optional() != null || braced() != null) {
                skipSpaces();
            }
        }

        /** An optional {@code [..]} argument, or null (position unchanged) if none follows. */
        String optional() {
            int start = pos;
            skipSpaces();
            if (atEnd() || peek() != '[') {
                pos = start;
                return null;
            }
            int close = text.indexOf(']', pos);
            if (close < 0) {
                pos = start;
                return null;
            }
            String value = text.substring(pos + 1, close);
            pos = close + 1;
            return value;
        }
    }
}
