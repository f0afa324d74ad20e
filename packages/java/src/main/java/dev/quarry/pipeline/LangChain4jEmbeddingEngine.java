package dev.quarry.pipeline;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.quarry.QuarryException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adapts a LangChain4j {@link EmbeddingModel}. Failures of the model are reported as {@code Plugin}
 * errors naming it. Vectors of another size than the declared
 * dimensions are rejected.
 */
public final class LangChain4jEmbeddingEngine implements EmbeddingEngine {
    private final String name;
    private final EmbeddingModel model;
    private final int dimensions;

    public LangChain4jEmbeddingEngine(String name, EmbeddingModel model, int dimensions) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws QuarryException {
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }
        Response<List<Embedding>> response;
        try {
            response = model.embedAll(segments);
        } catch (RuntimeException e) {
            throw new QuarryException.Plugin(name,
                "Embedding model '" + name + "' failed: " + e.getMessage(), e);
        }
        List<Embedding> embeddings = response != null ? response.content() : null;
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new QuarryException.Plugin(name, "Embedding model '" + name + "' returned "
                + (embeddings == null ? "nothing" : embeddings.size() + " vectors for " + texts.size() + " inputs"));
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            float[] vector = embedding.vector();
            if (vector.length != dimensions) {
                throw new QuarryException.Plugin(name, "Embedding model '" + name + "' returned "
                    + vector.length + " dimensions, expected " + dimensions);
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
