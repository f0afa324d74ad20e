package dev.quarry;

/**
 * Interface for post-processing extraction results.
 *
 * <p>PostProcessors enrich extraction results by transforming content,
 * adding metadata, or performing additional analysis. They run inside the
 * pipeline at their declared {@link ProcessingStage}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PostProcessor uppercase = result -> result.withContent(result.getContent().toUpperCase());
 *
 * Quarry.registerPostProcessor("uppercase", uppercase);
 * }</pre>
 *
 * <p>A failing post-processor does not fail the extraction: its error is recorded under
 * {@code processing_error_<name>} in the metadata. Processors that declare themselves
 * {@link #fatal() fatal} propagate IO and plugin errors instead.</p>
 */
@FunctionalInterface
public interface PostProcessor extends PluginLifecycle {
    /**
     * Process and enrich an extraction result.
     *
     * <p>The original result is not modified; a new result with the changes is returned.</p>
     *
     * @param result the extraction result to process
     * @return the processed result, never null
     * @throws QuarryException if processing fails
     */
    ExtractionResult process(ExtractionResult result) throws QuarryException;

    /**
     * Returns a composed post-processor that first applies this processor,
     * then applies the {@code after} processor.
     *
     * @param after the processor to apply after this one
     * @return a composed processor
     * @throws NullPointerException if after is null
     */
    default PostProcessor andThen(PostProcessor after) {
        if (after == null) {
            throw new NullPointerException("after processor must not be null");
        }
        PostProcessor first = this;
        return new PostProcessor() {
            @Override
            public ExtractionResult process(ExtractionResult result) throws QuarryException {
                return after.process(first.process(result));
            }

            @Override
            public ProcessingStage processingStage() {
                return first.processingStage();
            }

            @Override
            public int priority() {
                return first.priority();
            }
        };
    }

    /**
     * Defines when the processor runs in the pipeline.
     *
     * @return processing stage, defaults to {@link ProcessingStage#MIDDLE}
     */
    default ProcessingStage processingStage() {
        return ProcessingStage.MIDDLE;
    }

    /**
     * Priority within the processing stage. Higher values run first.
     *
     * @return priority value (default 0)
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether IO and plugin failures of this processor abort the extraction.
     *
     * @return true to propagate, false (default) to record and continue
     */
    default boolean fatal() {
        return false;
    }
}
