package dev.quarry.pipeline;

import dev.quarry.QuarryException;
import java.util.List;

/**
 * Turns a batch of texts into fixed-dimension vectors.
 *
 * <p>Implementations must be thread-safe; concurrent extractions share one engine.</p>
 */
public interface EmbeddingEngine {
    /**
     * Vector size produced by {@link #embed}.
     *
     * @return dimensions
     */
    int dimensions();

    /**
     * Embed texts.
     *
     * @param texts inputs, non-empty
     * @return one vector per input, same order, not normalized
     * @throws QuarryException if the model fails
     */
    List<float[]> embed(List<String> texts) throws QuarryException;
}
