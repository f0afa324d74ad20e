package dev.quarry.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options read by the PDF extractor: passwords for encrypted files, image collection and
 * whether the document-information dictionary is copied into {@code Metadata}.
 */
public final class PdfConfig {
  private final boolean extractImages;
  private final List<String> passwords;
  private final boolean extractMetadata;

  private PdfConfig(Builder builder) {
    this.extractImages = builder.extractImages;
    this.passwords = List.copyOf(builder.passwords);
    this.extractMetadata = builder.extractMetadata;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isExtractImages() {
    return extractImages;
  }

  /**
   * Configured passwords, in the order they were given.
   *
   * @return passwords, never null
   */
  public List<String> getPasswords() {
    return passwords;
  }

  /**
   * Passwords to try when opening a document: the empty owner password first, then the configured
   * ones without duplicates.
   */
  public static List<String> candidatePasswords(PdfConfig config) {
    Set<String> candidates = new LinkedHashSet<>();
    candidates.add("");
    if (config != null) {
      candidates.addAll(config.passwords);
    }
    return new ArrayList<>(candidates);
  }

  public boolean isExtractMetadata() {
    return extractMetadata;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("extract_images", extractImages);
    if (!passwords.isEmpty()) {
      map.put("passwords", passwords);
    }
    map.put("extract_metadata", extractMetadata);
    return map;
  }

  static PdfConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    if (map.containsKey("extract_images")) {
      builder.extractImages(ConfigValues.asBoolean(map.get("extract_images"), false));
    }
    Object passwordValue = map.containsKey("passwords") ? map.get("passwords") : map.get("password");
    if (passwordValue instanceof String) {
      builder.password((String) passwordValue);
    } else {
      List<String> passwordValues = ConfigValues.asStringList(passwordValue);
      if (passwordValues != null) {
        builder.passwords(passwordValues);
      }
    }
    if (map.containsKey("extract_metadata")) {
      builder.extractMetadata(ConfigValues.asBoolean(map.get("extract_metadata"), true));
    }
    return builder.build();
  }

  public static final class Builder {
    private boolean extractImages;
    private final List<String> passwords = new ArrayList<>();
    private boolean extractMetadata = true;

    private Builder() {
    }

    public Builder extractImages(boolean extractImages) {
      this.extractImages = extractImages;
      return this;
    }

    /** Replaces the password list. */
    public Builder passwords(List<String> passwords) {
      this.passwords.clear();
      if (passwords != null) {
        passwords.forEach(this::password);
      }
      return this;
    }

    public Builder password(String password) {
      if (password == null) {
        throw new IllegalArgumentException("pdf_options.passwords must not contain null");
      }
      this.passwords.add(password);
      return this;
    }

    public Builder extractMetadata(boolean extractMetadata) {
      this.extractMetadata = extractMetadata;
      return this;
    }

    public PdfConfig build() {
      return new PdfConfig(this);
    }
  }
}
