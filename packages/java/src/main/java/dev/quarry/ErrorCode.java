package dev.quarry;

import java.util.Locale;

/**
 * Stable error taxonomy shared by every call boundary.
 *
 * <p>Numeric codes never change once published; callers can branch on them
 * without matching message text.</p>
 *
 * @since 1.0.0
 */
public enum ErrorCode {
    VALIDATION(0, "Invalid input, configuration, or rejected result"),
    PARSING(1, "Document could not be parsed"),
    OCR(2, "Optical character recognition failed"),
    MISSING_DEPENDENCY(3, "A required backend or library is not available"),
    IO(4, "File system or stream failure"),
    PLUGIN(5, "A registered plugin failed"),
    UNSUPPORTED_FORMAT(6, "Format or MIME type is not supported"),
    INTERNAL(7, "Unexpected internal fault"),
    CACHE(8, "Cache read or write failure"),
    IMAGE_PROCESSING(9, "Image decoding or preprocessing failure");

    private final int code;
    private final String description;

    ErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    /**
     * Wire name, e.g. {@code missing_dependency}.
     *
     * @return lower snake case name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the ErrorCode for the given numeric code.
     *
     * @param code the numeric error code
     * @return the matching code, or {@link #INTERNAL} if the code is unknown
     */
    public static ErrorCode fromCode(int code) {
        for (ErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return INTERNAL;
    }

    /**
     * Looks up a code by its wire name or enum name.
     *
     * @param name wire name such as {@code "ocr"}
     * @return the matching code, or {@link #INTERNAL}
     */
    public static ErrorCode fromName(String name) {
        if (name == null) {
            return INTERNAL;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ErrorCode value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        return INTERNAL;
    }
}
