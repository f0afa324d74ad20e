package dev.quarry.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in embedding presets.
 */
public final class EmbeddingPresets {
  private static final Map<String, EmbeddingPreset> PRESETS;

  static {
    Map<String, EmbeddingPreset> presets = new LinkedHashMap<>();
    presets.put("fast", new EmbeddingPreset("fast", 384, 512, 50,
        "all-minilm-l6-v2", "Fast embedding with small vectors for quick prototyping"));
    presets.put("balanced", new EmbeddingPreset("balanced", 768, 1024, 100,
        "bge-base-en-v1.5", "Balanced quality and speed for general retrieval"));
    presets.put("quality", new EmbeddingPreset("quality", 1024, 2000, 200,
        "bge-large-en-v1.5", "High quality with larger context windows"));
    presets.put("multilingual", new EmbeddingPreset("multilingual", 768, 1024, 100,
        "multilingual-e5-base", "Multilingual model covering 100+ languages"));
    PRESETS = Collections.unmodifiableMap(presets);
  }

  private EmbeddingPresets() {
  }

  public static List<String> names() {
    return Collections.unmodifiableList(new ArrayList<>(PRESETS.keySet()));
  }

  public static Optional<EmbeddingPreset> get(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PRESETS.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  public static List<EmbeddingPreset> all() {
    return List.copyOf(PRESETS.values());
  }
}
