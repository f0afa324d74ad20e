package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Represents an image artifact extracted from a document page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtractedImage {
    private final byte[] data;
    private final String format;
    private final int imageIndex;
    private final Integer pageNumber;
    private final Integer width;
    private final Integer height;
    private final String ocrText;

    @JsonCreator
    public ExtractedImage(
        @JsonProperty("data") byte[] data,
        @JsonProperty("format") String format,
        @JsonProperty("image_index") int imageIndex,
        @JsonProperty("page_number") Integer pageNumber,
        @JsonProperty("width") Integer width,
        @JsonProperty("height") Integer height,
        @JsonProperty("ocr_text") String ocrText
    ) {
        this.data = Objects.requireNonNull(data, "data must not be null").clone();
        this.format = Objects.requireNonNull(format, "format must not be null");
        if (imageIndex < 0) {
            throw new IllegalArgumentException("imageIndex must be non-negative");
        }
        this.imageIndex = imageIndex;
        this.pageNumber = pageNumber;
        this.width = width;
        this.height = height;
        this.ocrText = ocrText;
    }

    @JsonProperty("data")
    public byte[] getData() {
        return data.clone();
    }

    @JsonProperty("format")
    public String getFormat() {
        return format;
    }

    @JsonProperty("image_index")
    public int getImageIndex() {
        return imageIndex;
    }

    /**
     * Page the image was found on.
     *
     * @return 1-indexed page, or null for non-paginated documents
     */
    @JsonProperty("page_number")
    public Integer getPageNumber() {
        return pageNumber;
    }

    @JsonProperty("width")
    public Integer getWidth() {
        return width;
    }

    @JsonProperty("height")
    public Integer getHeight() {
        return height;
    }

    /**
     * Text recognized in this image when OCR ran on it.
     *
     * @return OCR text, or null
     */
    @JsonProperty("ocr_text")
    public String getOcrText() {
        return ocrText;
    }

    public ExtractedImage withOcrText(String text) {
        return new ExtractedImage(data, format, imageIndex, pageNumber, width, height, text);
    }

    @Override
    public String toString() {
        return "ExtractedImage{"
            + "format='" + format + '\''
            + ", index=" + imageIndex
            + ", page=" + pageNumber
            + ", size=" + data.length
            + '}';
    }
}
