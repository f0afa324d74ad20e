package dev.quarry.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.quarry.QuarryException;
import dev.quarry.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads configuration files and walks directories looking for one.
 */
final class ConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

  static final List<String> DISCOVERY_NAMES =
      List.of("quarry.toml", "quarry.yaml", "quarry.yml", "quarry.json");

  private static final ObjectMapper YAML_MAPPER = new YAMLMapper();
  private static final ObjectMapper TOML_MAPPER = new TomlMapper();

  private ConfigLoader() {
  }

  static ExtractionConfig load(Path path) throws QuarryException {
    if (path == null) {
      throw new ValidationException("Configuration path must not be null");
    }
    if (!Files.isRegularFile(path)) {
      throw new QuarryException.Io("Configuration file not found: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new QuarryException.Io("Configuration file not readable: " + path);
    }
    ObjectMapper mapper = mapperFor(path);
    Map<String, Object> raw;
    try {
      raw = mapper.readValue(path.toFile(), ExtractionConfig.CONFIG_MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed configuration file " + path + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new QuarryException.Io("Failed to read configuration file " + path, e);
    }
    try {
      return ExtractionConfig.fromMap(raw);
    } catch (ValidationException e) {
      throw new ValidationException("Invalid configuration file " + path + ": " + e.getMessage(), e);
    }
  }

  static Optional<ExtractionConfig> discover(Path start) throws QuarryException {
    Path dir = start;
    while (dir != null) {
      for (String name : DISCOVERY_NAMES) {
        Path candidate = dir.resolve(name);
        if (Files.isRegularFile(candidate)) {
          LOG.debug("Discovered configuration at {}", candidate);
          return Optional.of(load(candidate));
        }
      }
      dir = dir.getParent();
    }
    return Optional.empty();
  }

  private static ObjectMapper mapperFor(Path path) throws ValidationException {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".toml")) {
      return TOML_MAPPER;
    }
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      return YAML_MAPPER;
    }
    if (name.endsWith(".json")) {
      return ExtractionConfig.CONFIG_MAPPER;
    }
    throw new ValidationException("Unsupported configuration file extension: " + path
        + " (expected .toml, .yaml, .yml or .json)");
  }
}
