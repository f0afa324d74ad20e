package dev.quarry.pipeline;

import dev.quarry.QuarryException;
import dev.quarry.ValidationException;
import dev.quarry.config.EmbeddingConfig;
import dev.quarry.config.EmbeddingPreset;
import dev.quarry.config.EmbeddingPresets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Engines available to the chunking stage, by model name.
 *
 * <p>A configured {@code model} must have been registered. A preset resolves to an engine
 * registered under the preset's name, else to a {@link HashingEmbeddingEngine} of the preset's
 * dimensions.</p>
 */
public final class EmbeddingEngines {
    private final Map<String, EmbeddingEngine> registered = new ConcurrentHashMap<>();
    private final Map<Integer, EmbeddingEngine> hashing = new ConcurrentHashMap<>();

    public void register(String name, EmbeddingEngine engine) {
        registered.put(Objects.requireNonNull(name, "name must not be null"),
            Objects.requireNonNull(engine, "engine must not be null"));
    }

    /**
     * Engine for an embedding configuration.
     *
     * @param config embedding settings
     * @param chunkingPreset preset named on the chunking config, or null
     * @return engine
     * @throws QuarryException {@code MissingDependency} for an unregistered model,
     *     {@code Validation} for an unknown preset
     */
    public EmbeddingEngine resolve(EmbeddingConfig config, String chunkingPreset) throws QuarryException {
        if (config.getModel() != null) {
            EmbeddingEngine engine = registered.get(config.getModel());
            if (engine == null) {
                throw new QuarryException.MissingDependency(config.getModel(), "Embedding model '"
                    + config.getModel() + "' is not registered. Registered models: " + registered.keySet());
            }
            return engine;
        }
        String presetName = config.getPreset() != null ? config.getPreset()
            : chunkingPreset != null ? chunkingPreset : EmbeddingConfig.DEFAULT_PRESET;
        EmbeddingPreset preset = EmbeddingPresets.get(presetName).orElseThrow(() ->
            new ValidationException("Unknown embedding preset: " + presetName
                + ". Available presets: " + EmbeddingPresets.names()));
        EmbeddingEngine engine = registered.get(preset.name());
        if (engine != null) {
            return engine;
        }
        return hashing.computeIfAbsent(preset.dimensions(), HashingEmbeddingEngine::new);
    }
}
