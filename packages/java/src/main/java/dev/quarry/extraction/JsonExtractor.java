package dev.quarry.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON documents: every string leaf becomes a {@code path: value} line.
 */
public final class JsonExtractor implements DocumentExtractor {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        JsonNode root;
        try {
            root = MAPPER.readTree(Texts.decode(data));
        } catch (JsonProcessingException e) {
            throw new QuarryException.Parsing("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        StringBuilder out = new StringBuilder();
        int[] leaves = new int[1];
        if (root != null) {
            walk(root, "", out, leaves);
        }
        Metadata.Builder metadata = Metadata.builder().additional("string_leaf_count", leaves[0]);
        if (root != null && root.path("title").isTextual()) {
            metadata.title(root.path("title").asText());
        }
        return ExtractionResult.builder(mimeType)
            .content(out.toString().strip())
            .metadata(metadata.build())
            .build();
    }

    private static void walk(JsonNode node, String path, StringBuilder out, int[] leaves) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                walk(field.getValue(), path.isEmpty() ? field.getKey() : path + "." + field.getKey(), out, leaves);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                walk(node.get(i), path + "[" + i + "]", out, leaves);
            }
        } else if (node.isTextual()) {
            String value = node.asText();
            if (!value.isBlank()) {
                leaves[0]++;
                if (!path.isEmpty()) {
                    out.append(path).append(": ");
                }
                out.append(value).append('\n');
            }
        }
    }
}
