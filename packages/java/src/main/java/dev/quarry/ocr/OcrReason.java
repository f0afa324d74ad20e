package dev.quarry.ocr;

/** Why a page was sent to OCR. */
public enum OcrReason {
    /** {@code force_ocr} was set. */
    FORCED,
    /** The document is itself an image. */
    IMAGE_INPUT,
    /** A page with images or drawings yielded (almost) no text. */
    NO_TEXT_WITH_VISUAL_CONTENT,
    /** Text covers less of the page than {@code ocr.coverage_threshold}. */
    LOW_TEXT_COVERAGE
}
