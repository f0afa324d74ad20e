package dev.quarry.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedding generation for chunks.
 *
 * <p>Either a built-in {@code preset} or a {@code model} name registered on the engine selects
 * the encoder. A model wins when both are set.</p>
 */
public final class EmbeddingConfig {
  public static final String DEFAULT_PRESET = "balanced";

  private final String preset;
  private final String model;
  private final boolean normalize;
  private final int batchSize;

  private EmbeddingConfig(Builder builder) {
    this.preset = builder.preset;
    this.model = builder.model;
    this.normalize = builder.normalize;
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getPreset() {
    return preset;
  }

  public String getModel() {
    return model;
  }

  public boolean isNormalize() {
    return normalize;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (preset != null) {
      map.put("preset", preset);
    }
    if (model != null) {
      map.put("model", model);
    }
    map.put("normalize", normalize);
    map.put("batch_size", batchSize);
    return map;
  }

  static EmbeddingConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    String presetValue = ConfigValues.asString(map.get("preset"));
    if (presetValue != null) {
      builder.preset(presetValue);
    }
    Object modelValue = map.get("model");
    Map<String, Object> modelMap = ConfigValues.asMap(modelValue);
    if (modelMap != null) {
      // {"model": {"type": "preset", "name": "fast"}} form
      String name = ConfigValues.asString(modelMap.get("name"));
      String type = ConfigValues.asString(modelMap.get("type"));
      if ("preset".equals(type)) {
        builder.preset(name);
      } else if (name != null) {
        builder.model(name);
      }
    } else if (ConfigValues.asString(modelValue) != null) {
      builder.model(ConfigValues.asString(modelValue));
    }
    if (map.containsKey("normalize")) {
      builder.normalize(ConfigValues.asBoolean(map.get("normalize"), true));
    }
    Integer batch = ConfigValues.asInteger(map.get("batch_size"));
    if (batch != null) {
      builder.batchSize(batch);
    }
    return builder.build();
  }

  public static final class Builder {
    private String preset = DEFAULT_PRESET;
    private String model;
    private boolean normalize = true;
    private int batchSize = 32;

    private Builder() { }

    public Builder preset(String preset) {
      this.preset = preset;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder normalize(boolean normalize) {
      this.normalize = normalize;
      return this;
    }

    public Builder batchSize(int batchSize) {
      if (batchSize < 1) {
        throw new IllegalArgumentException("batch_size must be positive");
      }
      this.batchSize = batchSize;
      return this;
    }

    public EmbeddingConfig build() {
      return new EmbeddingConfig(this);
    }
  }
}
