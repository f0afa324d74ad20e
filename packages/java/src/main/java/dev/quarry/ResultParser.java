package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;
import java.util.Map;

final class ResultParser {
    static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() { };

    private ResultParser() {
    }

    static ExtractionResult fromJson(String json) throws QuarryException {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Result JSON cannot be null or empty");
        }
        try {
            WireExtractionResult wire = MAPPER.readValue(json, WireExtractionResult.class);
            return ExtractionResult.builder(wire.mimeType != null ? wire.mimeType : "")
                .content(wire.content)
                .metadata(wire.metadata)
                .tables(wire.tables)
                .chunks(wire.chunks)
                .images(wire.images)
                .pages(wire.pages)
                .detectedLanguages(wire.detectedLanguages)
                .keywords(wire.keywords)
                .qualityScore(wire.qualityScore)
                .processingWarnings(wire.processingWarnings)
                .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new QuarryException.Parsing("Failed to parse result JSON: " + getOriginalMessage(e), e);
        }
    }

    static String toJson(ExtractionResult result) throws QuarryException {
        WireExtractionResult wire = new WireExtractionResult(
            result.getContent(),
            result.getMimeType(),
            result.getMetadata(),
            result.getTables(),
            result.getChunks(),
            result.getImages(),
            result.getPages(),
            result.getDetectedLanguages(),
            result.getKeywords(),
            result.getQualityScore().orElse(null),
            result.getProcessingWarnings()
        );
        try {
            return MAPPER.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new QuarryException("Failed to serialize extraction result", e);
        }
    }

    static String writeErrorDetails(ErrorDetails details) {
        try {
            return MAPPER.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ErrorDetails is always serializable", e);
        }
    }

    static ErrorDetails readErrorDetails(String json) throws QuarryException {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Error details JSON cannot be null or empty");
        }
        try {
            return MAPPER.readValue(json, ErrorDetails.class);
        } catch (JsonProcessingException e) {
            throw new QuarryException.Parsing("Failed to parse error details JSON", e);
        }
    }

    static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, OBJECT_MAP);
    }

    private static String getOriginalMessage(Exception e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private static final class WireExtractionResult {
        @JsonProperty("content")
        private final String content;
        @JsonProperty("mime_type")
        private final String mimeType;
        @JsonProperty("metadata")
        private final Metadata metadata;
        @JsonProperty("tables")
        private final List<Table> tables;
        @JsonProperty("chunks")
        private final List<Chunk> chunks;
        @JsonProperty("images")
        private final List<ExtractedImage> images;
        @JsonProperty("pages")
        private final List<PageContent> pages;
        @JsonProperty("detected_languages")
        private final List<String> detectedLanguages;
        @JsonProperty("keywords")
        private final List<ExtractedKeyword> keywords;
        @JsonProperty("quality_score")
        private final Double qualityScore;
        @JsonProperty("processing_warnings")
        private final List<ProcessingWarning> processingWarnings;

        @JsonCreator
        WireExtractionResult(
            @JsonProperty("content") String content,
            @JsonProperty("mime_type") String mimeType,
            @JsonProperty("metadata") Metadata metadata,
            @JsonProperty("tables") List<Table> tables,
            @JsonProperty("chunks") List<Chunk> chunks,
            @JsonProperty("images") List<ExtractedImage> images,
            @JsonProperty("pages") List<PageContent> pages,
            @JsonProperty("detected_languages") List<String> detectedLanguages,
            @JsonProperty("keywords") List<ExtractedKeyword> keywords,
            @JsonProperty("quality_score") Double qualityScore,
            @JsonProperty("processing_warnings") List<ProcessingWarning> processingWarnings
        ) {
            this.content = content;
            this.mimeType = mimeType;
            this.metadata = metadata;
            this.tables = tables;
            this.chunks = chunks;
            this.images = images;
            this.pages = pages;
            this.detectedLanguages = detectedLanguages;
            this.keywords = keywords;
            this.qualityScore = qualityScore;
            this.processingWarnings = processingWarnings;
        }
    }
}
