package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OCR configuration options.
 *
 * <p>
 * Configures the OCR backend, the recognition language and the per-page thresholds that
 * decide whether a page is re-run through OCR.
 */
public final class OcrConfig {
  public static final String DEFAULT_BACKEND = "tesseract";
  public static final String DEFAULT_LANGUAGE = "eng";
  public static final int DEFAULT_MIN_TEXT_CHARS = 3;

  private final boolean enabled;
  private final String backend;
  private final String language;
  private final int minTextChars;
  private final double coverageThreshold;

  private OcrConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.backend = builder.backend;
    this.language = builder.language;
    this.minTextChars = builder.minTextChars;
    this.coverageThreshold = builder.coverageThreshold;
  }

  /**
   * Creates a new builder for OCR configuration.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Configuration used when the caller supplies none.
   *
   * @return default OCR configuration
   */
  public static OcrConfig defaults() {
    return builder().build();
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Gets the OCR backend name.
   *
   * @return the backend name (e.g., "tesseract")
   */
  public String getBackend() {
    return backend;
  }

  /**
   * Gets the OCR language code.
   *
   * @return the language code (e.g., "eng", "deu")
   */
  public String getLanguage() {
    return language;
  }

  /**
   * Minimum number of non-whitespace characters a page with visual content needs before OCR
   * is skipped.
   *
   * @return character threshold
   */
  public int getMinTextChars() {
    return minTextChars;
  }

  /**
   * Fraction of page area that must carry text before OCR is skipped; 0 disables the check.
   *
   * @return coverage threshold in [0, 1]
   */
  public double getCoverageThreshold() {
    return coverageThreshold;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    map.put("backend", backend);
    map.put("language", language);
    map.put("min_text_chars", minTextChars);
    map.put("coverage_threshold", coverageThreshold);
    return map;
  }

  static OcrConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    if (map.containsKey("enabled")) {
      builder.enabled(ConfigValues.asBoolean(map.get("enabled"), true));
    }
    String backendValue = ConfigValues.asString(map.get("backend"));
    if (backendValue != null) {
      builder.backend(backendValue);
    }
    String languageValue = ConfigValues.asString(map.get("language"));
    if (languageValue != null) {
      builder.language(languageValue);
    }
    Integer minChars = ConfigValues.asInteger(map.get("min_text_chars"));
    if (minChars != null) {
      builder.minTextChars(minChars);
    }
    Double coverage = ConfigValues.asDouble(map.get("coverage_threshold"));
    if (coverage != null) {
      builder.coverageThreshold(coverage);
    }
    return builder.build();
  }

  /**
   * Builder for {@link OcrConfig}.
   */
  public static final class Builder {
    private boolean enabled = true;
    private String backend = DEFAULT_BACKEND;
    private String language = DEFAULT_LANGUAGE;
    private int minTextChars = DEFAULT_MIN_TEXT_CHARS;
    private double coverageThreshold = 0.0;

    private Builder() {
      // Use defaults
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the OCR backend.
     *
     * @param backend the backend name
     * @return this builder
     */
    public Builder backend(String backend) {
      if (backend == null || backend.isBlank()) {
        throw new IllegalArgumentException("backend must not be blank");
      }
      this.backend = backend.trim();
      return this;
    }

    /**
     * Sets the OCR language.
     *
     * @param language the language code
     * @return this builder
     */
    public Builder language(String language) {
      if (language == null || language.isBlank()) {
        throw new IllegalArgumentException("language must not be blank");
      }
      this.language = language.trim();
      return this;
    }

    public Builder minTextChars(int minTextChars) {
      if (minTextChars < 0) {
        throw new IllegalArgumentException("min_text_chars must be non-negative");
      }
      this.minTextChars = minTextChars;
      return this;
    }

    public Builder coverageThreshold(double coverageThreshold) {
      if (coverageThreshold < 0.0 || coverageThreshold > 1.0) {
        throw new IllegalArgumentException("coverage_threshold must be within [0, 1]");
      }
      this.coverageThreshold = coverageThreshold;
      return this;
    }

    /**
     * Builds the OCR configuration.
     *
     * @return the built configuration
     */
    public OcrConfig build() {
      return new OcrConfig(this);
    }
  }
}
