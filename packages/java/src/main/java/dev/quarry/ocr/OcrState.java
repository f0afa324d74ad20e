package dev.quarry.ocr;

import dev.quarry.OcrResult;
import dev.quarry.QuarryException;
import java.util.Objects;

/**
 * States of OCR for one page: {@code NotNeeded}, or {@code Required} followed by
 * {@code Running} and then {@code Succeeded} or {@code Failed}.
 */
public abstract class OcrState {
    private OcrState() {
    }

    public abstract String name();

    public boolean isRequired() {
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    public static NotNeeded notNeeded() {
        return NotNeeded.INSTANCE;
    }

    public static Required required(OcrReason reason) {
        return new Required(reason);
    }

    public static Running running() {
        return Running.INSTANCE;
    }

    public static Succeeded succeeded(OcrResult result) {
        return new Succeeded(result);
    }

    public static Failed failed(QuarryException error) {
        return new Failed(error);
    }

    public static final class NotNeeded extends OcrState {
        private static final NotNeeded INSTANCE = new NotNeeded();

        @Override
        public String name() {
            return "NotNeeded";
        }
    }

    public static final class Required extends OcrState {
        private final OcrReason reason;

        private Required(OcrReason reason) {
            this.reason = Objects.requireNonNull(reason, "reason must not be null");
        }

        public OcrReason reason() {
            return reason;
        }

        @Override
        public boolean isRequired() {
            return true;
        }

        @Override
        public String name() {
            return "Required";
        }

        @Override
        public String toString() {
            return "Required(" + reason + ")";
        }
    }

    public static final class Running extends OcrState {
        private static final Running INSTANCE = new Running();

        @Override
        public String name() {
            return "Running";
        }
    }

    public static final class Succeeded extends OcrState {
        private final OcrResult result;

        private Succeeded(OcrResult result) {
            this.result = Objects.requireNonNull(result, "result must not be null");
        }

        public OcrResult result() {
            return result;
        }

        @Override
        public String name() {
            return "Succeeded";
        }
    }

    public static final class Failed extends OcrState {
        private final QuarryException error;

        private Failed(QuarryException error) {
            this.error = Objects.requireNonNull(error, "error must not be null");
        }

        public QuarryException error() {
            return error;
        }

        @Override
        public String name() {
            return "Failed";
        }

        @Override
        public String toString() {
            return "Failed(" + error.getErrorCode().wireName() + ": " + error.getMessage() + ")";
        }
    }
}
