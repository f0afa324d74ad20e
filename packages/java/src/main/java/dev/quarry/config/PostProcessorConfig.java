package dev.quarry.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which post-processors run.
 *
 * <p>Names refer to registered post-processors and to the built-in stages
 * ({@code quality}, {@code language_detection}, {@code keywords}, {@code chunking},
 * {@code token_reduction}). A non-empty allow list runs only the listed processors;
 * the deny list always wins.</p>
 */
public final class PostProcessorConfig {
  private final boolean enabled;
  private final Set<String> enabledProcessors;
  private final Set<String> disabledProcessors;

  private PostProcessorConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.enabledProcessors = Set.copyOf(builder.enabledProcessors);
    this.disabledProcessors = Set.copyOf(builder.disabledProcessors);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Master switch for registered post-processors. Built-in stages ignore it. */
  public boolean isEnabled() {
    return enabled;
  }

  public Set<String> getEnabledProcessors() {
    return enabledProcessors;
  }

  public Set<String> getDisabledProcessors() {
    return disabledProcessors;
  }

  /**
   * Whether a registered post-processor should run.
   *
   * @param name processor name
   * @return true if allowed by both lists and the master switch
   */
  public boolean allows(String name) {
    if (!enabled || disabledProcessors.contains(name)) {
      return false;
    }
    return enabledProcessors.isEmpty() || enabledProcessors.contains(name);
  }

  /**
   * Whether a built-in stage should run. Only the deny list applies to built-ins.
   */
  public boolean allowsBuiltIn(String stageName) {
    return !disabledProcessors.contains(stageName);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    if (!enabledProcessors.isEmpty()) {
      map.put("enabled_processors", sorted(enabledProcessors));
    }
    if (!disabledProcessors.isEmpty()) {
      map.put("disabled_processors", sorted(disabledProcessors));
    }
    return map;
  }

  private static List<String> sorted(Set<String> names) {
    List<String> list = new ArrayList<>(names);
    list.sort(null);
    return list;
  }

  static PostProcessorConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    if (map.containsKey("enabled")) {
      builder.enabled(ConfigValues.asBoolean(map.get("enabled"), true));
    }
    List<String> enabledValues = ConfigValues.asStringList(map.get("enabled_processors"));
    if (enabledValues != null) {
      builder.enabledProcessors(enabledValues);
    }
    List<String> disabledValues = ConfigValues.asStringList(map.get("disabled_processors"));
    if (disabledValues != null) {
      builder.disabledProcessors(disabledValues);
    }
    return builder.build();
  }

  public static final class Builder {
    private boolean enabled = true;
    private final Set<String> enabledProcessors = new LinkedHashSet<>();
    private final Set<String> disabledProcessors = new LinkedHashSet<>();

    private Builder() {
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder enabledProcessors(Collection<String> names) {
      enabledProcessors.clear();
      if (names != null) {
        names.forEach(this::enabledProcessor);
      }
      return this;
    }

    public Builder enabledProcessor(String name) {
      enabledProcessors.add(processorName(name));
      return this;
    }

    public Builder disabledProcessors(Collection<String> names) {
      disabledProcessors.clear();
      if (names != null) {
        names.forEach(this::disabledProcessor);
      }
      return this;
    }

    public Builder disabledProcessor(String name) {
      disabledProcessors.add(processorName(name));
      return this;
    }

    private static String processorName(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("post-processor names must not be blank");
      }
      return name.trim();
    }

    public PostProcessorConfig build() {
      return new PostProcessorConfig(this);
    }
  }
}
