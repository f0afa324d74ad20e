package dev.quarry;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one item of a batch: either a result or the error that item failed with.
 */
public final class BatchItemResult {
    private final int index;
    private final String source;
    private final ExtractionResult result;
    private final ErrorDetails error;

    private BatchItemResult(int index, String source, ExtractionResult result, ErrorDetails error) {
        this.index = index;
        this.source = source;
        this.result = result;
        this.error = error;
    }

    public static BatchItemResult success(int index, String source, ExtractionResult result) {
        return new BatchItemResult(index, source, Objects.requireNonNull(result, "result must not be null"), null);
    }

    public static BatchItemResult failure(int index, String source, ErrorDetails error) {
        return new BatchItemResult(index, source, null, Objects.requireNonNull(error, "error must not be null"));
    }

    /**
     * Position of the item in the batch input.
     *
     * @return zero-based index
     */
    public int getIndex() {
        return index;
    }

    /**
     * Path of the input file, or a {@code bytes[i]} label for byte inputs.
     *
     * @return source label
     */
    public String getSource() {
        return source;
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<ExtractionResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<ErrorDetails> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * The result, or the item's failure rethrown as its typed exception.
     *
     * @return the extraction result
     * @throws QuarryException the item's failure
     */
    public ExtractionResult getOrThrow() throws QuarryException {
        if (result != null) {
            return result;
        }
        throw QuarryException.fromDetails(error);
    }

    @Override
    public String toString() {
        return "BatchItemResult{"
            + "index=" + index
            + ", source='" + source + '\''
            + (result != null ? ", result=" + result : ", error=" + error)
            + '}';
    }
}
