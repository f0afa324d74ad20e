package dev.quarry.config;

import java.util.Locale;

/**
 * Representation of {@code ExtractionResult.content}.
 */
public enum OutputFormat {
  PLAIN("plain"),
  MARKDOWN("markdown"),
  HTML("html"),
  STRUCTURED("structured");

  private final String wireName;

  OutputFormat(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Parses a wire name; {@code text} is accepted as an alias of {@code plain}.
   *
   * @param value wire name, case-insensitive
   * @return the format
   * @throws IllegalArgumentException if the name is unknown
   */
  public static OutputFormat fromWireName(String value) {
    if (value == null) {
      return PLAIN;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("text".equals(normalized)) {
      return PLAIN;
    }
    for (OutputFormat format : values()) {
      if (format.wireName.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("output_format must be one of: plain, markdown, html, structured");
  }
}
