package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeDetector;
import dev.quarry.mime.MimeTypes;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LatexExtractor")
final class LatexExtractorTest {
    private final LatexExtractor extractor = new LatexExtractor();

    private static final String PAPER = String.join("\n",
        "\\documentclass[11pt]{article}",
        "\\usepackage{amsmath}",
        "\\title{A Study of \\emph{Engines}}",
        "\\author{Ada Lovelace \\and Alan Turing}",
        "\\date{1843}",
        "\\begin{document}",
        "\\maketitle",
        "\\section{Introduction}",
        "This is \\textbf{bold} and \\emph{slanted} text~here.",
        "See \\cite[p.~4]{knuth84} and Figure~\\ref{fig:1}.\\label{sec:intro}",
        "Prices drop 50\\% today. % this remark is hidden",
        "Visit \\href{https://example.org}{our site}\\footnote{Open daily.}.",
        "\\subsection*{Details}",
        "\\begin{itemize}",
        "  \\item First point",
        "  \\item[Key] Second point",
        "\\end{itemize}",
        "\\begin{tabular}{|l|r|}",
        "\\hline",
        "Name & Score \\\\",
        "\\hline",
        "Ada \\& Co & 10 \\\\",
        "\\end{tabular}",
        "\\begin{equation}",
        "E = mc^2",
        "\\end{equation}",
        "\\end{document}",
        "");

    private ExtractionResult extract(String source) throws QuarryException {
        return extractor.extract(source.getBytes(StandardCharsets.UTF_8), MimeTypes.LATEX,
            ExtractionConfig.defaults());
    }

    @Nested
    @DisplayName("document structure")
    final class StructureTest {

        @Test
        void shouldTurnSectionsIntoHeadings() throws QuarryException {
            ExtractionResult result = extract(PAPER);

            assertThat(result.getContent())
                .startsWith("# Introduction\n\nThis is bold and slanted text here.")
                .contains("\n## Details\n");
            assertThat(result.getMetadata().get("section_count")).contains(2);
        }

        @Test
        void shouldRenderListItems() throws QuarryException {
            assertThat(extract(PAPER).getContent()).contains("- First point\n- Key Second point");
        }

        @Test
        void shouldCollectTabularAsTable() throws QuarryException {
            ExtractionResult result = extract(PAPER);

            assertThat(result.getTables()).singleElement()
                .satisfies(table -> assertThat(table.cells())
                    .containsExactly(List.of("Name", "Score"), List.of("Ada & Co", "10")));
            assertThat(result.getContent()).contains("Name\tScore\nAda & Co\t10");
        }

        @Test
        void shouldKeepMathEnvironmentsVerbatim() throws QuarryException {
            assertThat(extract(PAPER).getContent()).endsWith("E = mc^2");
        }

        @Test
        void shouldReadPreambleMetadata() throws QuarryException {
            ExtractionResult result = extract(PAPER);

            assertThat(result.getMetadata().getTitle()).contains("A Study of Engines");
            assertThat(result.getMetadata().getAuthors()).containsExactly("Ada Lovelace", "Alan Turing");
            assertThat(result.getMetadata().get("date")).contains("1843");
            assertThat(result.getMetadata().get("documentclass")).contains("article");
        }
    }

    @Nested
    @DisplayName("inline commands")
    final class InlineTest {

        @Test
        void shouldKeepCitationAndReferenceKeys() throws QuarryException {
            assertThat(extract(PAPER).getContent()).contains("See [knuth84] and Figure [fig:1].");
        }

        @Test
        void shouldDropCommentsButKeepEscapedPercent() throws QuarryException {
            assertThat(extract(PAPER).getContent())
                .contains("Prices drop 50% today.")
                .doesNotContain("remark");
        }

        @Test
        void shouldInlineLinksAndFootnotes() throws QuarryException {
            assertThat(extract(PAPER).getContent()).contains("Visit our site (https://example.org) (Open daily.).");
        }

        @Test
        void shouldDropUnknownCommandNamesOnly() {
            assertThat(LatexExtractor.inline("\\mystery{kept} \\vspace{2em}words \\newpage"))
                .isEqualTo("kept 2emwords");
        }

        @Test
        void shouldHandleFragmentWithoutDocumentEnvironment() throws QuarryException {
            assertThat(extract("Just \\textit{a} fragment.").getContent()).isEqualTo("Just a fragment.");
        }
    }

    @Test
    void shouldBeChosenForTexFiles() throws QuarryException {
        assertThat(MimeDetector.classify(PAPER.getBytes(StandardCharsets.UTF_8), "paper.tex", null).mimeType())
            .isEqualTo(MimeTypes.LATEX);
    }
}
