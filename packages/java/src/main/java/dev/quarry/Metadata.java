package dev.quarry;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Document metadata.
 *
 * <p>A fixed set of common fields plus an open {@link #getAdditional() additional} map for
 * format-specific and plugin-injected values. Additional entries serialize flat beside the common
 * fields and survive a JSON round-trip unchanged.</p>
 *
 * <p>Instances are immutable; {@code with*} methods return modified copies.</p>
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Metadata {
    private static final Metadata EMPTY = builder().build();

    @JsonProperty("title")
    private final String title;
    @JsonProperty("subject")
    private final String subject;
    @JsonProperty("authors")
    private final List<String> authors;
    @JsonProperty("keywords")
    private final List<String> keywords;
    @JsonProperty("language")
    private final String language;
    @JsonProperty("created_at")
    private final String createdAt;
    @JsonProperty("modified_at")
    private final String modifiedAt;
    @JsonProperty("created_by")
    private final String createdBy;
    @JsonProperty("modified_by")
    private final String modifiedBy;
    @JsonProperty("page_count")
    private final Integer pageCount;
    private final Map<String, Object> additional;

    @JsonCreator
    Metadata(
        @JsonProperty("title") String title,
        @JsonProperty("subject") String subject,
        @JsonProperty("authors") List<String> authors,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("language") String language,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("modified_at") String modifiedAt,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("modified_by") String modifiedBy,
        @JsonProperty("page_count") Integer pageCount
    ) {
        this.title = title;
        this.subject = subject;
        this.authors = authors != null ? Collections.unmodifiableList(new ArrayList<>(authors)) : null;
        this.keywords = keywords != null ? Collections.unmodifiableList(new ArrayList<>(keywords)) : null;
        this.language = language;
        this.createdAt = createdAt;
        this.modifiedAt = modifiedAt;
        this.createdBy = createdBy;
        this.modifiedBy = modifiedBy;
        this.pageCount = pageCount;
        this.additional = new LinkedHashMap<>();
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.title = title;
        builder.subject = subject;
        builder.authors = authors;
        builder.keywords = keywords;
        builder.language = language;
        builder.createdAt = createdAt;
        builder.modifiedAt = modifiedAt;
        builder.createdBy = createdBy;
        builder.modifiedBy = modifiedBy;
        builder.pageCount = pageCount;
        builder.additional.putAll(additional);
        return builder;
    }

    @JsonAnySetter
    private void putAdditional(String name, Object value) {
        additional.put(name, value);
    }

    @JsonAnyGetter
    private Map<String, Object> additionalForJson() {
        return additional;
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<String> getSubject() {
        return Optional.ofNullable(subject);
    }

    public List<String> getAuthors() {
        return authors != null ? authors : List.of();
    }

    public List<String> getKeywords() {
        return keywords != null ? keywords : List.of();
    }

    public Optional<String> getLanguage() {
        return Optional.ofNullable(language);
    }

    public Optional<String> getCreatedAt() {
        return Optional.ofNullable(createdAt);
    }

    public Optional<String> getModifiedAt() {
        return Optional.ofNullable(modifiedAt);
    }

    public Optional<String> getCreatedBy() {
        return Optional.ofNullable(createdBy);
    }

    public Optional<String> getModifiedBy() {
        return Optional.ofNullable(modifiedBy);
    }

    public Optional<Integer> getPageCount() {
        return Optional.ofNullable(pageCount);
    }

    /**
     * Format-specific and plugin-supplied fields.
     *
     * @return unmodifiable view of the additional fields
     */
    public Map<String, Object> getAdditional() {
        return Collections.unmodifiableMap(additional);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(additional.get(key));
    }

    public Metadata withLanguage(String newLanguage) {
        return toBuilder().language(newLanguage).build();
    }

    public Metadata withAdditional(String key, Object value) {
        return toBuilder().additional(key, value).build();
    }

    public Metadata withoutAdditional(String key) {
        Builder builder = toBuilder();
        builder.additional.remove(key);
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Metadata)) {
            return false;
        }
        Metadata other = (Metadata) o;
        return Objects.equals(title, other.title)
            && Objects.equals(subject, other.subject)
            && Objects.equals(authors, other.authors)
            && Objects.equals(keywords, other.keywords)
            && Objects.equals(language, other.language)
            && Objects.equals(createdAt, other.createdAt)
            && Objects.equals(modifiedAt, other.modifiedAt)
            && Objects.equals(createdBy, other.createdBy)
            && Objects.equals(modifiedBy, other.modifiedBy)
            && Objects.equals(pageCount, other.pageCount)
            && additional.equals(other.additional);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, subject, authors, keywords, language, createdAt, modifiedAt,
            createdBy, modifiedBy, pageCount, additional);
    }

    @Override
    public String toString() {
        return "Metadata{"
            + "title=" + title
            + ", language=" + language
            + ", pageCount=" + pageCount
            + ", additional=" + additional.keySet()
            + '}';
    }

    public static final class Builder {
        private String title;
        private String subject;
        private List<String> authors;
        private List<String> keywords;
        private String language;
        private String createdAt;
        private String modifiedAt;
        private String createdBy;
        private String modifiedBy;
        private Integer pageCount;
        private final Map<String, Object> additional = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = blankToNull(title);
            return this;
        }

        public Builder subject(String subject) {
            this.subject = blankToNull(subject);
            return this;
        }

        public Builder authors(List<String> authors) {
            this.authors = authors == null || authors.isEmpty() ? null : authors;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords == null || keywords.isEmpty() ? null : keywords;
            return this;
        }

        public Builder language(String language) {
            this.language = blankToNull(language);
            return this;
        }

        public Builder createdAt(String createdAt) {
            this.createdAt = blankToNull(createdAt);
            return this;
        }

        public Builder modifiedAt(String modifiedAt) {
            this.modifiedAt = blankToNull(modifiedAt);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = blankToNull(createdBy);
            return this;
        }

        public Builder modifiedBy(String modifiedBy) {
            this.modifiedBy = blankToNull(modifiedBy);
            return this;
        }

        public Builder pageCount(Integer pageCount) {
            this.pageCount = pageCount;
            return this;
        }

        public Builder additional(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (value == null) {
                additional.remove(key);
            } else {
                additional.put(key, value);
            }
            return this;
        }

        public Builder additional(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::additional);
            }
            return this;
        }

        public Metadata build() {
            Metadata metadata = new Metadata(title, subject, authors, keywords, language, createdAt,
                modifiedAt, createdBy, modifiedBy, pageCount);
            metadata.additional.putAll(additional);
            return metadata;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}
