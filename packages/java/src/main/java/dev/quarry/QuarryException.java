package dev.quarry;

/**
 * Base exception for all Quarry failures.
 *
 * <p>Every instance carries an {@link ErrorCode}. The nested subclasses name the
 * taxonomy kinds so callers can catch precisely:</p>
 *
 * <pre>{@code
 * try {
 *     Quarry.extractFile("scan.png", config);
 * } catch (QuarryException.MissingDependency e) {
 *     System.err.println("install " + e.getDependency());
 * } catch (QuarryException e) {
 *     System.err.println(e.getErrorCode() + ": " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class QuarryException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private transient ErrorDetails details;

    public QuarryException(String message) {
        this(ErrorCode.INTERNAL, message, null);
    }

    public QuarryException(String message, Throwable cause) {
        this(ErrorCode.INTERNAL, message, cause);
    }

    protected QuarryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Structured details for this failure.
     *
     * <p>Exceptions raised by the fault guard carry the captured fault context; others
     * are described from their type and message.</p>
     *
     * @return error details, never null
     */
    public ErrorDetails toErrorDetails() {
        if (details != null) {
            return details;
        }
        return describe().build();
    }

    QuarryException withDetails(ErrorDetails captured) {
        this.details = captured;
        return this;
    }

    /**
     * Builder pre-filled with this exception's kind and message.
     *
     * @return details builder subclasses may extend
     */
    protected ErrorDetails.Builder describe() {
        return ErrorDetails.builder(errorCode).message(getMessage());
    }

    /**
     * Creates the typed exception for a taxonomy kind.
     *
     * @param code taxonomy kind
     * @param message failure message
     * @param cause underlying cause, may be null
     * @return typed exception
     */
    public static QuarryException of(ErrorCode code, String message, Throwable cause) {
        switch (code) {
            case VALIDATION:
                return new ValidationException(message, cause);
            case PARSING:
                return new Parsing(message, cause);
            case OCR:
                return new Ocr(message, cause);
            case MISSING_DEPENDENCY:
                return new MissingDependency(null, message, cause);
            case IO:
                return new Io(message, cause);
            case PLUGIN:
                return new Plugin(null, message, cause);
            case UNSUPPORTED_FORMAT:
                return new UnsupportedFormat(message, cause);
            case CACHE:
                return new Cache(message, cause);
            case IMAGE_PROCESSING:
                return new ImageProcessing(message, cause);
            default:
                return new QuarryException(ErrorCode.INTERNAL, message, cause);
        }
    }

    /**
     * Recreates the typed exception described by {@code details}.
     *
     * @param details captured error details
     * @return typed exception carrying the same details
     */
    public static QuarryException fromDetails(ErrorDetails details) {
        QuarryException rebuilt;
        switch (details.getKind()) {
            case PLUGIN:
                rebuilt = new Plugin(details.getPluginName(), details.getMessage());
                break;
            case MISSING_DEPENDENCY:
                rebuilt = new MissingDependency(details.getDependency(), details.getMessage());
                break;
            default:
                rebuilt = of(details.getKind(), details.getMessage(), null);
                break;
        }
        return rebuilt.withDetails(details);
    }

    /** Document could not be parsed. */
    public static class Parsing extends QuarryException {
        private static final long serialVersionUID = 1L;

        public Parsing(String message) {
            this(message, null);
        }

        public Parsing(String message, Throwable cause) {
            super(ErrorCode.PARSING, message, cause);
        }
    }

    /** OCR failed. */
    public static class Ocr extends QuarryException {
        private static final long serialVersionUID = 1L;

        public Ocr(String message) {
            this(message, null);
        }

        public Ocr(String message, Throwable cause) {
            super(ErrorCode.OCR, message, cause);
        }
    }

    /** Cache read or write failed. */
    public static class Cache extends QuarryException {
        private static final long serialVersionUID = 1L;

        public Cache(String message) {
            this(message, null);
        }

        public Cache(String message, Throwable cause) {
            super(ErrorCode.CACHE, message, cause);
        }
    }

    /** Image decoding or preprocessing failed. */
    public static class ImageProcessing extends QuarryException {
        private static final long serialVersionUID = 1L;

        public ImageProcessing(String message) {
            this(message, null);
        }

        public ImageProcessing(String message, Throwable cause) {
            super(ErrorCode.IMAGE_PROCESSING, message, cause);
        }
    }

    /** File system or stream failure. */
    public static class Io extends QuarryException {
        private static final long serialVersionUID = 1L;

        public Io(String message) {
            this(message, null);
        }

        public Io(String message, Throwable cause) {
            super(ErrorCode.IO, message, cause);
        }
    }

    /** No extractor exists for the detected or declared format. */
    public static class UnsupportedFormat extends QuarryException {
        private static final long serialVersionUID = 1L;

        public UnsupportedFormat(String message) {
            this(message, null);
        }

        public UnsupportedFormat(String message, Throwable cause) {
            super(ErrorCode.UNSUPPORTED_FORMAT, message, cause);
        }
    }

    /**
     * A registered plugin failed or was misused.
     */
    public static class Plugin extends QuarryException {
        private static final long serialVersionUID = 1L;

        private final String pluginName;

        public Plugin(String pluginName, String message) {
            this(pluginName, message, null);
        }

        public Plugin(String pluginName, String message, Throwable cause) {
            super(ErrorCode.PLUGIN, message, cause);
            this.pluginName = pluginName;
        }

        public String getPluginName() {
            return pluginName;
        }

        @Override
        protected ErrorDetails.Builder describe() {
            return super.describe().pluginName(pluginName);
        }
    }

    /**
     * A required backend or library is not available.
     */
    public static class MissingDependency extends QuarryException {
        private static final long serialVersionUID = 1L;

        private final String dependency;

        public MissingDependency(String dependency, String message) {
            this(dependency, message, null);
        }

        public MissingDependency(String dependency, String message, Throwable cause) {
            super(ErrorCode.MISSING_DEPENDENCY, message, cause);
            this.dependency = dependency;
        }

        public String getDependency() {
            return dependency;
        }

        @Override
        protected ErrorDetails.Builder describe() {
            return super.describe().dependency(dependency);
        }
    }
}
