package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * How hard the pipeline shrinks the final content before handing it back.
 */
public final class TokenReductionConfig {
  /**
   * Reduction severity. Every mode applies the rules of the milder ones as well.
   */
  public enum Mode {
    OFF,
    LIGHT,
    MODERATE,
    AGGRESSIVE,
    MAXIMUM;

    /** Lower-case name used in config files. */
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Whether this mode applies the rules introduced by {@code other}. */
    public boolean includes(Mode other) {
      return compareTo(other) >= 0;
    }

    static Mode parse(String value) {
      String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
      for (Mode mode : values()) {
        if (mode.name().equals(normalized)) {
          return mode;
        }
      }
      throw new IllegalArgumentException(
          "token_reduction.mode must be one of off, light, moderate, aggressive, maximum; got '" + value + "'");
    }
  }

  private final Mode mode;
  private final boolean preserveImportantWords;

  private TokenReductionConfig(Builder builder) {
    this.mode = builder.mode;
    this.preserveImportantWords = builder.preserveImportantWords;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Mode getMode() {
    return mode;
  }

  /** False for {@link Mode#OFF}. */
  public boolean isEnabled() {
    return mode != Mode.OFF;
  }

  /** Keep capitalized and numeric tokens even when a rule would drop them. */
  public boolean isPreserveImportantWords() {
    return preserveImportantWords;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("mode", mode.wireName());
    map.put("preserve_important_words", preserveImportantWords);
    return map;
  }

  static TokenReductionConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    String modeValue = ConfigValues.asString(map.get("mode"));
    if (modeValue != null) {
      builder.mode(modeValue);
    }
    if (map.containsKey("preserve_important_words")) {
      builder.preserveImportantWords(ConfigValues.asBoolean(map.get("preserve_important_words"), true));
    }
    return builder.build();
  }

  public static final class Builder {
    private Mode mode = Mode.OFF;
    private boolean preserveImportantWords = true;

    private Builder() {
    }

    public Builder mode(Mode mode) {
      if (mode == null) {
        throw new IllegalArgumentException("token_reduction.mode must not be null");
      }
      this.mode = mode;
      return this;
    }

    /** Accepts the config-file spelling, case-insensitively. */
    public Builder mode(String mode) {
      this.mode = Mode.parse(mode);
      return this;
    }

    public Builder preserveImportantWords(boolean preserveImportantWords) {
      this.preserveImportantWords = preserveImportantWords;
      return this;
    }

    public TokenReductionConfig build() {
      return new TokenReductionConfig(this);
    }
  }
}
