package dev.quarry.pipeline;

import dev.quarry.ExtractionResult;

/**
 * Heuristic quality score in [0, 1].
 *
 * <p>Weights: length saturation 0.2, printable-character ratio 0.4, structural density 0.2,
 * absence of OCR garbage 0.2. A result whose OCR degraded is halved.</p>
 */
public final class QualityScorer {
    static final double LENGTH_WEIGHT = 0.2;
    static final double PRINTABLE_WEIGHT = 0.4;
    static final double STRUCTURE_WEIGHT = 0.2;
    static final double GARBAGE_WEIGHT = 0.2;
    static final double DEGRADED_FACTOR = 0.5;

    private static final int GARBAGE_RUN = 4;

    public double score(ExtractionResult result) {
        double score = score(result.getContent());
        if (Boolean.TRUE.equals(result.getMetadata().getAdditional().get("ocr_degraded"))) {
            score *= DEGRADED_FACTOR;
        }
        return clamp(score);
    }

    public double score(String content) {
        if (content == null || content.isBlank()) {
            return 0.0;
        }
        double total = LENGTH_WEIGHT * lengthSaturation(content)
            + PRINTABLE_WEIGHT * printableRatio(content)
            + STRUCTURE_WEIGHT * structuralDensity(content)
            + GARBAGE_WEIGHT * (1.0 - garbageRatio(content));
        return clamp(total);
    }

    static double lengthSaturation(String content) {
        return 1.0 - Math.exp(-content.strip().length() / 500.0);
    }

    static double printableRatio(String content) {
        int printable = 0;
        int total = 0;
        for (int i = 0; i < content.length(); ) {
            int cp = content.codePointAt(i);
            i += Character.charCount(cp);
            total++;
            if (Character.isWhitespace(cp) || Character.isLetterOrDigit(cp) || isPunctuation(cp)) {
                printable++;
            }
        }
        return total == 0 ? 0.0 : (double) printable / total;
    }

    /** Headings plus paragraphs per 1,000 characters, saturating at 2. */
    static double structuralDensity(String content) {
        int units = 0;
        boolean inParagraph = false;
        for (String line : content.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                inParagraph = false;
                continue;
            }
            if (isHeading(trimmed)) {
                units++;
                inParagraph = false;
            } else if (!inParagraph) {
                units++;
                inParagraph = true;
            }
        }
        double perThousand = units * 1000.0 / Math.max(content.length(), 1);
        return Math.min(1.0, perThousand / 2.0);
    }

    /** Share of characters that sit in runs of symbols typical of misrecognized text. */
    static double garbageRatio(String content) {
        int garbage = 0;
        int run = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c) && c != '.' && c != '-'
                && c != '=' && c != '*' && c != '#' && c != '_') {
                run++;
            } else {
                if (run >= GARBAGE_RUN) {
                    garbage += run;
                }
                run = 0;
            }
            if (c == '\uFFFD') {
                garbage++;
            }
        }
        if (run >= GARBAGE_RUN) {
            garbage += run;
        }
        return Math.min(1.0, garbage * 10.0 / content.length());
    }

    private static boolean isHeading(String line) {
        if (line.startsWith("#")) {
            return true;
        }
        if (line.length() > 60 || line.length() < 3) {
            return false;
        }
        boolean hasLetter = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            hasLetter |= Character.isLetter(c);
        }
        return hasLetter;
    }

    private static boolean isPunctuation(int cp) {
        switch (Character.getType(cp)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
                return true;
            default:
                return false;
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
