package dev.quarry.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.quarry.QuarryException;
import dev.quarry.ValidationException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Main extraction configuration.
 *
 * <p>Every sub-configuration is optional. An absent sub-configuration means "use that stage's
 * default behavior"; only {@code enabled} flags switch a stage off.</p>
 *
 * <pre>{@code
 * ExtractionConfig config = ExtractionConfig.builder()
 *     .ocr(OcrConfig.builder().backend("tesseract").language("deu").build())
 *     .chunking(ChunkingConfig.builder().maxChars(800).boundary("sentences").build())
 *     .build();
 * }</pre>
 */
public final class ExtractionConfig {
  static final ObjectMapper CONFIG_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  static final TypeReference<Map<String, Object>> CONFIG_MAP_TYPE = new TypeReference<>() { };

  private final boolean useCache;
  private final boolean enableQualityProcessing;
  private final boolean forceOcr;
  private final OutputFormat outputFormat;
  private final OcrConfig ocr;
  private final ChunkingConfig chunking;
  private final LanguageDetectionConfig languageDetection;
  private final PdfConfig pdfOptions;
  private final ImageExtractionConfig imageExtraction;
  private final ImagePreprocessingConfig imagePreprocessing;
  private final PostProcessorConfig postprocessor;
  private final TokenReductionConfig tokenReduction;
  private final KeywordConfig keywords;
  private final PageConfig pages;
  private final Integer maxConcurrentExtractions;
  private final Set<String> explicitKeys;

  private ExtractionConfig(Builder builder) {
    this.useCache = builder.useCache;
    this.enableQualityProcessing = builder.enableQualityProcessing;
    this.forceOcr = builder.forceOcr;
    this.outputFormat = builder.outputFormat;
    this.ocr = builder.ocr;
    this.chunking = builder.chunking;
    this.languageDetection = builder.languageDetection;
    this.pdfOptions = builder.pdfOptions;
    this.imageExtraction = builder.imageExtraction;
    this.imagePreprocessing = builder.imagePreprocessing;
    this.postprocessor = builder.postprocessor;
    this.tokenReduction = builder.tokenReduction;
    this.keywords = builder.keywords;
    this.pages = builder.pages;
    this.maxConcurrentExtractions = builder.maxConcurrentExtractions;
    this.explicitKeys = Collections.unmodifiableSet(new LinkedHashSet<>(builder.explicitKeys));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Configuration with every stage at its default.
   *
   * @return default configuration
   */
  public static ExtractionConfig defaults() {
    return builder().build();
  }

  public boolean isUseCache() {
    return useCache;
  }

  public boolean isEnableQualityProcessing() {
    return enableQualityProcessing;
  }

  public boolean isForceOcr() {
    return forceOcr;
  }

  public OutputFormat getOutputFormat() {
    return outputFormat;
  }

  public OcrConfig getOcr() {
    return ocr;
  }

  /**
   * OCR settings, falling back to the defaults when none were configured.
   *
   * @return effective OCR configuration
   */
  public OcrConfig getEffectiveOcr() {
    return ocr != null ? ocr : OcrConfig.defaults();
  }

  public ChunkingConfig getChunking() {
    return chunking;
  }

  public LanguageDetectionConfig getLanguageDetection() {
    return languageDetection;
  }

  public PdfConfig getPdfOptions() {
    return pdfOptions;
  }

  public ImageExtractionConfig getImageExtraction() {
    return imageExtraction;
  }

  public ImagePreprocessingConfig getImagePreprocessing() {
    return imagePreprocessing;
  }

  public PostProcessorConfig getPostprocessor() {
    return postprocessor;
  }

  /**
   * Post-processor toggles, falling back to "everything enabled".
   *
   * @return effective post-processor configuration
   */
  public PostProcessorConfig getEffectivePostprocessor() {
    return postprocessor != null ? postprocessor : PostProcessorConfig.builder().build();
  }

  public TokenReductionConfig getTokenReduction() {
    return tokenReduction;
  }

  public KeywordConfig getKeywords() {
    return keywords;
  }

  public PageConfig getPages() {
    return pages;
  }

  public Integer getMaxConcurrentExtractions() {
    return maxConcurrentExtractions;
  }

  /**
   * Whether images should be collected, from either {@code images} or {@code pdf_options}.
   *
   * @return true when image extraction was requested
   */
  public boolean wantsImages() {
    return (imageExtraction != null && imageExtraction.isExtractImages())
        || (pdfOptions != null && pdfOptions.isExtractImages());
  }

  /**
   * Parse configuration from JSON.
   *
   * <p>Keys may be camelCase or snake_case at any depth. Unknown keys are ignored.</p>
   *
   * @param json serialized configuration
   * @return parsed configuration
   * @throws ValidationException if the JSON is malformed or holds invalid values
   */
  public static ExtractionConfig fromJson(String json) throws ValidationException {
    if (json == null || json.isBlank()) {
      throw new ValidationException("Configuration JSON must not be empty");
    }
    Map<String, Object> raw;
    try {
      raw = CONFIG_MAPPER.readValue(json, CONFIG_MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Failed to parse extraction config: " + e.getOriginalMessage(), e);
    }
    return fromMap(raw);
  }

  /**
   * Build a configuration from an already parsed tree.
   *
   * @param raw configuration map (camelCase or snake_case keys)
   * @return parsed configuration
   * @throws ValidationException if a value is invalid
   */
  public static ExtractionConfig fromMap(Map<String, Object> raw) throws ValidationException {
    try {
      Builder builder = builder();
      applyTopLevelOverrides(builder, ConfigValues.normalizeKeys(raw));
      return builder.build();
    } catch (IllegalArgumentException | ClassCastException e) {
      throw new ValidationException("Invalid extraction config: " + e.getMessage(), e);
    }
  }

  /**
   * Load configuration from a file (TOML, YAML, or JSON).
   *
   * @param path path to the configuration file
   * @return parsed configuration
   * @throws QuarryException if the file cannot be read or is malformed
   */
  public static ExtractionConfig fromFile(Path path) throws QuarryException {
    return ConfigLoader.load(path);
  }

  public static ExtractionConfig fromFile(String path) throws QuarryException {
    return fromFile(Path.of(path));
  }

  /**
   * Discover configuration from current or parent directories.
   *
   * <p>Searches for quarry.toml, quarry.yaml, quarry.yml or quarry.json in the working
   * directory and each parent.</p>
   *
   * @return discovered configuration, or null if not found
   * @throws QuarryException if a discovered file is malformed
   */
  public static ExtractionConfig discover() throws QuarryException {
    return ConfigLoader.discover(Path.of("").toAbsolutePath()).orElse(null);
  }

  /**
   * Serialize configuration to JSON with sorted keys.
   *
   * <p>The output is canonical: equal configurations produce identical text.</p>
   *
   * @return JSON representation of this configuration
   * @throws QuarryException if serialization fails
   */
  public String toJson() throws QuarryException {
    try {
      return CONFIG_MAPPER.writeValueAsString(toMap());
    } catch (JsonProcessingException e) {
      throw new QuarryException("Failed to serialize config to JSON", e);
    }
  }

  /**
   * Get a specific field from the configuration.
   *
   * Supports dot notation for nested fields (e.g., "ocr.backend").
   *
   * @param fieldName the field name or path (e.g., "use_cache", "ocr.backend")
   * @return the field value as a JSON string, or empty if not found
   * @throws QuarryException if serialization fails
   */
  public Optional<String> getField(String fieldName) throws QuarryException {
    if (fieldName == null || fieldName.isEmpty()) {
      throw new IllegalArgumentException("fieldName cannot be null or empty");
    }
    JsonNode node = CONFIG_MAPPER.valueToTree(toMap());
    for (String segment : fieldName.split("\\.")) {
      node = node.get(ConfigValues.toSnakeCase(segment));
      if (node == null || node.isNull()) {
        return Optional.empty();
      }
    }
    try {
      return Optional.of(CONFIG_MAPPER.writeValueAsString(node));
    } catch (JsonProcessingException e) {
      throw new QuarryException("Failed to retrieve field: " + fieldName, e);
    }
  }

  /**
   * Merge another configuration into this one.
   *
   * Creates a new config where keys set on {@code other} override this config's keys,
   * recursively. For a configuration built in code, every builder call counts as set.
   *
   * @param other the configuration to merge in
   * @return a new merged ExtractionConfig
   * @throws ValidationException if the merged values are inconsistent
   */
  public ExtractionConfig merge(ExtractionConfig other) throws ValidationException {
    if (other == null) {
      throw new IllegalArgumentException("other config cannot be null");
    }
    Map<String, Object> merged = toMap();
    Map<String, Object> overrides = other.toMap();
    for (String key : other.explicitKeys) {
      if (overrides.containsKey(key)) {
        merged.put(key, deepMerge(merged.get(key), overrides.get(key)));
      }
    }
    ExtractionConfig result = fromMap(merged);
    Set<String> keys = new LinkedHashSet<>(explicitKeys);
    keys.addAll(other.explicitKeys);
    return result.withExplicitKeys(keys);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("use_cache", useCache);
    map.put("enable_quality_processing", enableQualityProcessing);
    map.put("force_ocr", forceOcr);
    map.put("output_format", outputFormat.wireName());
    if (ocr != null) {
      map.put("ocr", ocr.toMap());
    }
    if (chunking != null) {
      map.put("chunking", chunking.toMap());
    }
    if (languageDetection != null) {
      map.put("language_detection", languageDetection.toMap());
    }
    if (pdfOptions != null) {
      map.put("pdf_options", pdfOptions.toMap());
    }
    if (imageExtraction != null) {
      map.put("images", imageExtraction.toMap());
    }
    if (imagePreprocessing != null) {
      map.put("image_preprocessing", imagePreprocessing.toMap());
    }
    if (postprocessor != null) {
      map.put("postprocessor", postprocessor.toMap());
    }
    if (tokenReduction != null) {
      map.put("token_reduction", tokenReduction.toMap());
    }
    if (keywords != null) {
      map.put("keywords", keywords.toMap());
    }
    if (pages != null) {
      map.put("pages", pages.toMap());
    }
    if (maxConcurrentExtractions != null) {
      map.put("max_concurrent_extractions", maxConcurrentExtractions);
    }
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExtractionConfig)) {
      return false;
    }
    return toMap().equals(((ExtractionConfig) o).toMap());
  }

  @Override
  public int hashCode() {
    return toMap().hashCode();
  }

  @Override
  public String toString() {
    return "ExtractionConfig" + toMap();
  }

  private ExtractionConfig withExplicitKeys(Set<String> keys) {
    Builder copy = toBuilder();
    copy.explicitKeys.clear();
    copy.explicitKeys.addAll(keys);
    return copy.build();
  }

  /**
   * A builder pre-filled with this configuration.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.useCache = useCache;
    builder.enableQualityProcessing = enableQualityProcessing;
    builder.forceOcr = forceOcr;
    builder.outputFormat = outputFormat;
    builder.ocr = ocr;
    builder.chunking = chunking;
    builder.languageDetection = languageDetection;
    builder.pdfOptions = pdfOptions;
    builder.imageExtraction = imageExtraction;
    builder.imagePreprocessing = imagePreprocessing;
    builder.postprocessor = postprocessor;
    builder.tokenReduction = tokenReduction;
    builder.keywords = keywords;
    builder.pages = pages;
    builder.maxConcurrentExtractions = maxConcurrentExtractions;
    builder.explicitKeys.addAll(explicitKeys);
    return builder;
  }

  @SuppressWarnings("unchecked")
  private static Object deepMerge(Object base, Object override) {
    if (base instanceof Map && override instanceof Map) {
      Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) base);
      for (Map.Entry<String, Object> entry : ((Map<String, Object>) override).entrySet()) {
        merged.put(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue()));
      }
      return merged;
    }
    return override;
  }

  private static void applyTopLevelOverrides(Builder builder, Map<String, Object> raw) {
    if (raw.containsKey("use_cache")) {
      builder.useCache(ConfigValues.asBoolean(raw.get("use_cache"), builder.useCache));
    }
    if (raw.containsKey("enable_quality_processing")) {
      builder.enableQualityProcessing(
          ConfigValues.asBoolean(raw.get("enable_quality_processing"), builder.enableQualityProcessing));
    }
    if (raw.containsKey("force_ocr")) {
      builder.forceOcr(ConfigValues.asBoolean(raw.get("force_ocr"), builder.forceOcr));
    }
    String format = ConfigValues.asString(raw.get("output_format"));
    if (format != null) {
      builder.outputFormat(OutputFormat.fromWireName(format));
    }
    Map<String, Object> ocrMap = ConfigValues.asMap(raw.get("ocr"));
    if (ocrMap != null) {
      builder.ocr(OcrConfig.fromMap(ocrMap));
    }
    Map<String, Object> chunkingMap = ConfigValues.asMap(raw.get("chunking"));
    if (chunkingMap != null) {
      builder.chunking(ChunkingConfig.fromMap(chunkingMap));
    }
    Map<String, Object> languageMap = ConfigValues.asMap(raw.get("language_detection"));
    if (languageMap != null) {
      builder.languageDetection(LanguageDetectionConfig.fromMap(languageMap));
    }
    Map<String, Object> pdfMap = ConfigValues.asMap(
        raw.containsKey("pdf_options") ? raw.get("pdf_options") : raw.get("pdf"));
    if (pdfMap != null) {
      builder.pdfOptions(PdfConfig.fromMap(pdfMap));
    }
    Map<String, Object> imageMap = ConfigValues.asMap(
        raw.containsKey("images") ? raw.get("images") : raw.get("image_extraction"));
    if (imageMap != null) {
      builder.imageExtraction(ImageExtractionConfig.fromMap(imageMap));
    }
    Map<String, Object> imagePreMap = ConfigValues.asMap(raw.get("image_preprocessing"));
    if (imagePreMap != null) {
      builder.imagePreprocessing(ImagePreprocessingConfig.fromMap(imagePreMap));
    }
    Map<String, Object> postprocessorMap = ConfigValues.asMap(raw.get("postprocessor"));
    if (postprocessorMap != null) {
      builder.postprocessor(PostProcessorConfig.fromMap(postprocessorMap));
    }
    Map<String, Object> tokenReductionMap = ConfigValues.asMap(raw.get("token_reduction"));
    if (tokenReductionMap != null) {
      builder.tokenReduction(TokenReductionConfig.fromMap(tokenReductionMap));
    }
    Map<String, Object> keywordMap = ConfigValues.asMap(raw.get("keywords"));
    if (keywordMap != null) {
      builder.keywords(KeywordConfig.fromMap(keywordMap));
    }
    Map<String, Object> pageMap = ConfigValues.asMap(raw.get("pages"));
    if (pageMap != null) {
      builder.pages(PageConfig.fromMap(pageMap));
    }
    if (raw.get("max_concurrent_extractions") != null) {
      builder.maxConcurrentExtractions(ConfigValues.asInteger(raw.get("max_concurrent_extractions")));
    }
  }

  public static final class Builder {
    private boolean useCache = true;
    private boolean enableQualityProcessing = true;
    private boolean forceOcr = false;
    private OutputFormat outputFormat = OutputFormat.PLAIN;
    private OcrConfig ocr;
    private ChunkingConfig chunking;
    private LanguageDetectionConfig languageDetection;
    private PdfConfig pdfOptions;
    private ImageExtractionConfig imageExtraction;
    private ImagePreprocessingConfig imagePreprocessing;
    private PostProcessorConfig postprocessor;
    private TokenReductionConfig tokenReduction;
    private KeywordConfig keywords;
    private PageConfig pages;
    private Integer maxConcurrentExtractions;
    private final Set<String> explicitKeys = new LinkedHashSet<>();

    private Builder() {
    }

    public Builder useCache(boolean useCache) {
      this.useCache = useCache;
      explicitKeys.add("use_cache");
      return this;
    }

    public Builder enableQualityProcessing(boolean enableQualityProcessing) {
      this.enableQualityProcessing = enableQualityProcessing;
      explicitKeys.add("enable_quality_processing");
      return this;
    }

    public Builder forceOcr(boolean forceOcr) {
      this.forceOcr = forceOcr;
      explicitKeys.add("force_ocr");
      return this;
    }

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = outputFormat != null ? outputFormat : OutputFormat.PLAIN;
      explicitKeys.add("output_format");
      return this;
    }

    public Builder ocr(OcrConfig ocr) {
      this.ocr = ocr;
      explicitKeys.add("ocr");
      return this;
    }

    public Builder chunking(ChunkingConfig chunking) {
      this.chunking = chunking;
      explicitKeys.add("chunking");
      return this;
    }

    public Builder languageDetection(LanguageDetectionConfig languageDetection) {
      this.languageDetection = languageDetection;
      explicitKeys.add("language_detection");
      return this;
    }

    public Builder pdfOptions(PdfConfig pdfOptions) {
      this.pdfOptions = pdfOptions;
      explicitKeys.add("pdf_options");
      return this;
    }

    public Builder imageExtraction(ImageExtractionConfig imageExtraction) {
      this.imageExtraction = imageExtraction;
      explicitKeys.add("images");
      return this;
    }

    public Builder imagePreprocessing(ImagePreprocessingConfig imagePreprocessing) {
      this.imagePreprocessing = imagePreprocessing;
      explicitKeys.add("image_preprocessing");
      return this;
    }

    public Builder postprocessor(PostProcessorConfig postprocessor) {
      this.postprocessor = postprocessor;
      explicitKeys.add("postprocessor");
      return this;
    }

    public Builder tokenReduction(TokenReductionConfig tokenReduction) {
      this.tokenReduction = tokenReduction;
      explicitKeys.add("token_reduction");
      return this;
    }

    public Builder keywords(KeywordConfig keywords) {
      this.keywords = keywords;
      explicitKeys.add("keywords");
      return this;
    }

    public Builder pages(PageConfig pages) {
      this.pages = pages;
      explicitKeys.add("pages");
      return this;
    }

    public Builder maxConcurrentExtractions(Integer maxConcurrentExtractions) {
      if (maxConcurrentExtractions != null && maxConcurrentExtractions < 1) {
        throw new IllegalArgumentException("max_concurrent_extractions must be positive");
      }
      this.maxConcurrentExtractions = maxConcurrentExtractions;
      explicitKeys.add("max_concurrent_extractions");
      return this;
    }

    public ExtractionConfig build() {
      return new ExtractionConfig(this);
    }
  }
}
