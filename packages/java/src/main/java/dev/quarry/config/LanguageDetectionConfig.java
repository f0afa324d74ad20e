package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for the language detection stage. Detected codes are ISO 639-1 and land in
 * {@code detected_languages}; the most confident one also becomes {@code Metadata.language}.
 */
public final class LanguageDetectionConfig {
  private final boolean enabled;
  private final double minConfidence;
  private final boolean detectMultiple;

  private LanguageDetectionConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.minConfidence = builder.minConfidence;
    this.detectMultiple = builder.detectMultiple;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Languages scoring below this are not reported. */
  public double getMinConfidence() {
    return minConfidence;
  }

  /** Report every language above the gate, most confident first, instead of only the best. */
  public boolean isDetectMultiple() {
    return detectMultiple;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    map.put("min_confidence", minConfidence);
    map.put("detect_multiple", detectMultiple);
    return map;
  }

  static LanguageDetectionConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    if (map.containsKey("enabled")) {
      builder.enabled(ConfigValues.asBoolean(map.get("enabled"), true));
    }
    Double confidence = ConfigValues.asDouble(map.get("min_confidence"));
    if (confidence != null) {
      builder.minConfidence(confidence);
    }
    if (map.containsKey("detect_multiple")) {
      builder.detectMultiple(ConfigValues.asBoolean(map.get("detect_multiple"), false));
    }
    return builder.build();
  }

  public static final class Builder {
    private boolean enabled = true;
    private double minConfidence = 0.5;
    private boolean detectMultiple = false;

    private Builder() {
      // Use defaults
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder minConfidence(double minConfidence) {
      if (minConfidence < 0.0 || minConfidence > 1.0) {
        throw new IllegalArgumentException("min_confidence must be within [0, 1]");
      }
      this.minConfidence = minConfidence;
      return this;
    }

    public Builder detectMultiple(boolean detectMultiple) {
      this.detectMultiple = detectMultiple;
      return this;
    }

    public LanguageDetectionConfig build() {
      return new LanguageDetectionConfig(this);
    }
  }
}
