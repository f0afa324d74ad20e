package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword extraction configuration.
 *
 * <p>Two algorithms are available: {@code yake} (statistical, single document) and
 * {@code rake} (stop-word delimited phrases).</p>
 */
public final class KeywordConfig {
  public static final String YAKE = "yake";
  public static final String RAKE = "rake";

  private final String algorithm;
  private final int maxKeywords;
  private final double minScore;
  private final int[] ngramRange;
  private final String language;
  private final YakeParams yakeParams;
  private final RakeParams rakeParams;

  private KeywordConfig(Builder builder) {
    this.algorithm = builder.algorithm;
    this.maxKeywords = builder.maxKeywords;
    this.minScore = builder.minScore;
    this.ngramRange = builder.ngramRange.clone();
    this.language = builder.language;
    this.yakeParams = builder.yakeParams != null ? builder.yakeParams : YakeParams.builder().build();
    this.rakeParams = builder.rakeParams != null ? builder.rakeParams : RakeParams.builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getAlgorithm() {
    return algorithm;
  }

  public int getMaxKeywords() {
    return maxKeywords;
  }

  public double getMinScore() {
    return minScore;
  }

  public int getMinNgram() {
    return ngramRange[0];
  }

  public int getMaxNgram() {
    return ngramRange[1];
  }

  /**
   * Stop-word language override.
   *
   * @return ISO 639-1 code, or null to use the detected language
   */
  public String getLanguage() {
    return language;
  }

  public YakeParams getYakeParams() {
    return yakeParams;
  }

  public RakeParams getRakeParams() {
    return rakeParams;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("algorithm", algorithm);
    map.put("max_keywords", maxKeywords);
    map.put("min_score", minScore);
    map.put("ngram_range", List.of(ngramRange[0], ngramRange[1]));
    if (language != null) {
      map.put("language", language);
    }
    map.put("yake_params", yakeParams.toMap());
    map.put("rake_params", rakeParams.toMap());
    return map;
  }

  static KeywordConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    String algorithmValue = ConfigValues.asString(map.get("algorithm"));
    if (algorithmValue != null) {
      builder.algorithm(algorithmValue);
    }
    Integer max = ConfigValues.asInteger(map.get("max_keywords"));
    if (max != null) {
      builder.maxKeywords(max);
    }
    Double score = ConfigValues.asDouble(map.get("min_score"));
    if (score != null) {
      builder.minScore(score);
    }
    if (map.get("ngram_range") instanceof Iterable) {
      Iterable<?> iterable = (Iterable<?>) map.get("ngram_range");
      int[] range = new int[2];
      int idx = 0;
      for (Object value : iterable) {
        if (value instanceof Number && idx < 2) {
          range[idx] = ((Number) value).intValue();
          idx++;
        }
      }
      if (idx == 2) {
        builder.ngramRange(range[0], range[1]);
      }
    }
    String languageValue = ConfigValues.asString(map.get("language"));
    if (languageValue != null) {
      builder.language(languageValue);
    }
    Map<String, Object> yakeMap = ConfigValues.asMap(map.get("yake_params"));
    if (yakeMap != null) {
      builder.yakeParams(YakeParams.fromMap(yakeMap));
    }
    Map<String, Object> rakeMap = ConfigValues.asMap(map.get("rake_params"));
    if (rakeMap != null) {
      builder.rakeParams(RakeParams.fromMap(rakeMap));
    }
    return builder.build();
  }

  public static final class Builder {
    private String algorithm = YAKE;
    private int maxKeywords = 10;
    private double minScore = 0.0;
    private int[] ngramRange = {1, 3};
    private String language;
    private YakeParams yakeParams;
    private RakeParams rakeParams;

    private Builder() {
      // defaults
    }

    public Builder algorithm(String algorithm) {
      String normalized = algorithm == null ? "" : algorithm.trim().toLowerCase(Locale.ROOT);
      if (!YAKE.equals(normalized) && !RAKE.equals(normalized)) {
        throw new IllegalArgumentException("algorithm must be one of: yake, rake");
      }
      this.algorithm = normalized;
      return this;
    }

    public Builder maxKeywords(int maxKeywords) {
      if (maxKeywords < 1) {
        throw new IllegalArgumentException("max_keywords must be positive");
      }
      this.maxKeywords = maxKeywords;
      return this;
    }

    public Builder minScore(double minScore) {
      this.minScore = minScore;
      return this;
    }

    public Builder ngramRange(int min, int max) {
      if (min < 1 || max < min) {
        throw new IllegalArgumentException("ngram_range must satisfy 1 <= min <= max");
      }
      this.ngramRange = new int[]{min, max};
      return this;
    }

    public Builder language(String language) {
      this.language = language;
      return this;
    }

    public Builder yakeParams(YakeParams yakeParams) {
      this.yakeParams = yakeParams;
      return this;
    }

    public Builder rakeParams(RakeParams rakeParams) {
      this.rakeParams = rakeParams;
      return this;
    }

    public KeywordConfig build() {
      return new KeywordConfig(this);
    }
  }

  public static final class YakeParams {
    private final int windowSize;

    private YakeParams(Builder builder) {
      this.windowSize = builder.windowSize;
    }

    public int getWindowSize() {
      return windowSize;
    }

    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("window_size", windowSize);
      return map;
    }

    static YakeParams fromMap(Map<String, Object> map) {
      if (map == null) {
        return null;
      }
      Builder builder = builder();
      Integer window = ConfigValues.asInteger(map.get("window_size"));
      if (window != null) {
        builder.windowSize(window);
      }
      return builder.build();
    }

    public static Builder builder() {
      return new Builder();
    }

    public static final class Builder {
      private int windowSize = 2;

      private Builder() { }

      public Builder windowSize(int windowSize) {
        if (windowSize < 1) {
          throw new IllegalArgumentException("window_size must be positive");
        }
        this.windowSize = windowSize;
        return this;
      }

      public YakeParams build() {
        return new YakeParams(this);
      }
    }
  }

  public static final class RakeParams {
    private final int minWordLength;
    private final int maxWordsPerPhrase;

    private RakeParams(Builder builder) {
      this.minWordLength = builder.minWordLength;
      this.maxWordsPerPhrase = builder.maxWordsPerPhrase;
    }

    public int getMinWordLength() {
      return minWordLength;
    }

    public int getMaxWordsPerPhrase() {
      return maxWordsPerPhrase;
    }

    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("min_word_length", minWordLength);
      map.put("max_words_per_phrase", maxWordsPerPhrase);
      return map;
    }

    static RakeParams fromMap(Map<String, Object> map) {
      if (map == null) {
        return null;
      }
      Builder builder = builder();
      Integer minLength = ConfigValues.asInteger(map.get("min_word_length"));
      if (minLength != null) {
        builder.minWordLength(minLength);
      }
      Integer maxWords = ConfigValues.asInteger(map.get("max_words_per_phrase"));
      if (maxWords != null) {
        builder.maxWordsPerPhrase(maxWords);
      }
      return builder.build();
    }

    public static Builder builder() {
      return new Builder();
    }

    public static final class Builder {
      private int minWordLength = 1;
      private int maxWordsPerPhrase = 3;

      private Builder() { }

      public Builder minWordLength(int minWordLength) {
        this.minWordLength = minWordLength;
        return this;
      }

      public Builder maxWordsPerPhrase(int maxWordsPerPhrase) {
        if (maxWordsPerPhrase < 1) {
          throw new IllegalArgumentException("max_words_per_phrase must be positive");
        }
        this.maxWordsPerPhrase = maxWordsPerPhrase;
        return this;
      }

      public RakeParams build() {
        return new RakeParams(this);
      }
    }
  }
}
