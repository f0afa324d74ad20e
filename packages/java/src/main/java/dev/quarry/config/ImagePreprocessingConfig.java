package dev.quarry.config;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Image preprocessing configuration for OCR.
 */
public final class ImagePreprocessingConfig {
    private static final List<String> VALID_BINARIZATION = Arrays.asList("none", "otsu", "threshold");

    private final boolean grayscale;
    private final boolean denoise;
    private final boolean contrastEnhance;
    private final String binarizationMethod;
    private final int threshold;
    private final boolean invertColors;

    private ImagePreprocessingConfig(Builder builder) {
        this.grayscale = builder.grayscale;
        this.denoise = builder.denoise;
        this.contrastEnhance = builder.contrastEnhance;
        this.binarizationMethod = builder.binarizationMethod;
        this.threshold = builder.threshold;
        this.invertColors = builder.invertColors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isGrayscale() {
        return grayscale;
    }

    public boolean isDenoise() {
        return denoise;
    }

    public boolean isContrastEnhance() {
        return contrastEnhance;
    }

    /**
     * Binarization: {@code none}, {@code otsu} or {@code threshold}.
     *
     * @return method name
     */
    public String getBinarizationMethod() {
        return binarizationMethod;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isInvertColors() {
        return invertColors;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("grayscale", grayscale);
        map.put("denoise", denoise);
        map.put("contrast_enhance", contrastEnhance);
        map.put("binarization_method", binarizationMethod);
        map.put("threshold", threshold);
        map.put("invert_colors", invertColors);
        return map;
    }

    static ImagePreprocessingConfig fromMap(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        Builder builder = builder();
        if (map.containsKey("grayscale")) {
            builder.grayscale(ConfigValues.asBoolean(map.get("grayscale"), true));
        }
        if (map.containsKey("denoise")) {
            builder.denoise(ConfigValues.asBoolean(map.get("denoise"), false));
        }
        if (map.containsKey("contrast_enhance")) {
            builder.contrastEnhance(ConfigValues.asBoolean(map.get("contrast_enhance"), true));
        }
        String method = ConfigValues.asString(map.get("binarization_method"));
        if (method != null) {
            builder.binarizationMethod(method);
        }
        Integer thresholdValue = ConfigValues.asInteger(map.get("threshold"));
        if (thresholdValue != null) {
            builder.threshold(thresholdValue);
        }
        if (map.containsKey("invert_colors")) {
            builder.invertColors(ConfigValues.asBoolean(map.get("invert_colors"), false));
        }
        return builder.build();
    }

    public static final class Builder {
        private boolean grayscale = true;
        private boolean denoise = false;
        private boolean contrastEnhance = true;
        private String binarizationMethod = "otsu";
        private int threshold = 128;
        private boolean invertColors = false;

        private Builder() { }

        public Builder grayscale(boolean grayscale) {
            this.grayscale = grayscale;
            return this;
        }

        public Builder denoise(boolean denoise) {
            this.denoise = denoise;
            return this;
        }

        public Builder contrastEnhance(boolean contrastEnhance) {
            this.contrastEnhance = contrastEnhance;
            return this;
        }

        public Builder binarizationMethod(String binarizationMethod) {
            String normalized = binarizationMethod == null ? "" : binarizationMethod.trim().toLowerCase(Locale.ROOT);
            if (!VALID_BINARIZATION.contains(normalized)) {
                throw new IllegalArgumentException(
                    "binarization_method must be one of: " + String.join(", ", VALID_BINARIZATION));
            }
            this.binarizationMethod = normalized;
            return this;
        }

        public Builder threshold(int threshold) {
            if (threshold < 0 || threshold > 255) {
                throw new IllegalArgumentException("threshold must be within [0, 255]");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder invertColors(boolean invertColors) {
            this.invertColors = invertColors;
            return this;
        }

        public ImagePreprocessingConfig build() {
            return new ImagePreprocessingConfig(this);
        }
    }
}
