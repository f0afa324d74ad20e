package dev.quarry.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic feature-hashing encoder. Word unigrams and character trigrams are hashed
 * (FNV-1a) into buckets with a hash-derived sign and log-scaled counts. Equal inputs always yield
 * equal vectors, so results stay cacheable.
 */
public final class HashingEmbeddingEngine implements EmbeddingEngine {
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final int dimensions;

    public HashingEmbeddingEngine(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    float[] embed(String text) {
        float[] counts = new float[dimensions];
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : lower.split("[^\\p{L}\\p{N}]+")) {
            if (!word.isEmpty()) {
                add(counts, "w:" + word);
                String padded = "^" + word + "$";
                for (int i = 0; i + 3 <= padded.length(); i++) {
                    add(counts, "t:" + padded.substring(i, i + 3));
                }
            }
        }
        for (int i = 0; i < counts.length; i++) {
            float value = counts[i];
            counts[i] = (float) (Math.signum(value) * Math.log1p(Math.abs(value)));
        }
        return counts;
    }

    private void add(float[] counts, String feature) {
        long hash = fnv1a(feature);
        int bucket = (int) Long.remainderUnsigned(hash, dimensions);
        counts[bucket] += (hash >>> 63) == 0 ? 1f : -1f;
    }

    static long fnv1a(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
