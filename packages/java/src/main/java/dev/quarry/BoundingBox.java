package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Axis-aligned rectangle in image pixel coordinates.
 *
 * @param x left edge
 * @param y top edge
 * @param width width in pixels
 * @param height height in pixels
 */
public record BoundingBox(
    @JsonProperty("x") int x,
    @JsonProperty("y") int y,
    @JsonProperty("width") int width,
    @JsonProperty("height") int height
) {
    @JsonCreator
    public BoundingBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("width and height must be non-negative");
        }
    }

    public long area() {
        return (long) width * height;
    }
}
