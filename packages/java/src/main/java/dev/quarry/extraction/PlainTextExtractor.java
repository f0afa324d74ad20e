package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.config.ExtractionConfig;

/**
 * Plain text and the line-oriented text formats without a dedicated parser (YAML, TOML, reST, Org).
 */
public final class PlainTextExtractor implements DocumentExtractor {
    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) {
        String content = Texts.normalizeNewlines(Texts.decode(data));
        Metadata metadata = Metadata.builder()
            .additional("line_count", Texts.countLines(content))
            .additional("word_count", Texts.countWords(content))
            .additional("character_count", content.length())
            .build();
        return ExtractionResult.builder(mimeType)
            .content(content)
            .metadata(metadata)
            .build();
    }
}
