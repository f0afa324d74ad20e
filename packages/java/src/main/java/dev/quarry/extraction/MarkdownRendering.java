package dev.quarry.extraction;

import dev.quarry.QuarryException;

/**
 * Extractors that can render their source as Markdown for the {@code markdown} output format.
 */
public interface MarkdownRendering {
    /**
     * Render the document as Markdown.
     *
     * @param data document bytes
     * @param mimeType canonical MIME type
     * @return Markdown text
     * @throws QuarryException if the document cannot be parsed
     */
    String renderMarkdown(byte[] data, String mimeType) throws QuarryException;
}
