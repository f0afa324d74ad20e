package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Image extraction configuration.
 *
 * <p>{@code target_dpi} and {@code max_image_dimension} also bound the images handed to OCR.</p>
 */
public final class ImageExtractionConfig {
  private final boolean extractImages;
  private final int targetDpi;
  private final int maxImageDimension;
  private final boolean ocrImages;

  private ImageExtractionConfig(Builder builder) {
    this.extractImages = builder.extractImages;
    this.targetDpi = builder.targetDpi;
    this.maxImageDimension = builder.maxImageDimension;
    this.ocrImages = builder.ocrImages;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isExtractImages() {
    return extractImages;
  }

  public int getTargetDpi() {
    return targetDpi;
  }

  public int getMaxImageDimension() {
    return maxImageDimension;
  }

  /**
   * Whether extracted images are themselves run through OCR.
   *
   * @return true to attach OCR text to each extracted image
   */
  public boolean isOcrImages() {
    return ocrImages;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("extract_images", extractImages);
    map.put("target_dpi", targetDpi);
    map.put("max_image_dimension", maxImageDimension);
    map.put("ocr_images", ocrImages);
    return map;
  }

  static ImageExtractionConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    if (map.containsKey("extract_images")) {
      builder.extractImages(ConfigValues.asBoolean(map.get("extract_images"), true));
    }
    Integer dpi = ConfigValues.asInteger(map.get("target_dpi"));
    if (dpi != null) {
      builder.targetDpi(dpi);
    }
    Integer dimension = ConfigValues.asInteger(map.get("max_image_dimension"));
    if (dimension != null) {
      builder.maxImageDimension(dimension);
    }
    if (map.containsKey("ocr_images")) {
      builder.ocrImages(ConfigValues.asBoolean(map.get("ocr_images"), false));
    }
    return builder.build();
  }

  public static final class Builder {
    private boolean extractImages = true;
    private int targetDpi = 300;
    private int maxImageDimension = 4096;
    private boolean ocrImages = false;

    private Builder() {
      // Use defaults
    }

    public Builder extractImages(boolean extractImages) {
      this.extractImages = extractImages;
      return this;
    }

    public Builder targetDpi(int targetDpi) {
      if (targetDpi < 36 || targetDpi > 2400) {
        throw new IllegalArgumentException("target_dpi must be within [36, 2400]");
      }
      this.targetDpi = targetDpi;
      return this;
    }

    public Builder maxImageDimension(int maxImageDimension) {
      if (maxImageDimension < 1) {
        throw new IllegalArgumentException("max_image_dimension must be positive");
      }
      this.maxImageDimension = maxImageDimension;
      return this;
    }

    public Builder ocrImages(boolean ocrImages) {
      this.ocrImages = ocrImages;
      return this;
    }

    public ImageExtractionConfig build() {
      return new ImageExtractionConfig(this);
    }
  }
}
