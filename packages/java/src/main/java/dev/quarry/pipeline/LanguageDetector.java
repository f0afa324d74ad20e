package dev.quarry.pipeline;

import java.lang.Character.UnicodeScript;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects the language of a text as ISO 639-1 codes.
 *
 * <p>Texts dominated by a non-Latin script are decided by the script alone. Latin and Cyrillic
 * texts are scored against per-language stop words and characteristic trigrams; scores are
 * squared and normalized into confidences.</p>
 */
public final class LanguageDetector {
    private static final int SAMPLE_CHARS = 20_000;
    private static final int MIN_SEGMENT_CHARS = 40;

    private static final Map<String, Set<String>> TRIGRAMS = new LinkedHashMap<>();
    private static final Map<UnicodeScript, String> SCRIPTS = new EnumMap<>(UnicodeScript.class);

    static {
        TRIGRAMS.put("en", Set.of(" th", "the", "he ", "and", "nd ", " an", "ing", "ng ", "ion", " of",
            "of ", " to", "to ", "ed ", " in", "is ", "at ", "tio", "ent", "er "));
        TRIGRAMS.put("de", Set.of("en ", "er ", "ch ", "der", "ie ", "ein", " de", "sch", "ich", "nde",
            "die", " di", "che", "gen", "und", " un", "cht", "ine", "ung", " ei"));
        TRIGRAMS.put("fr", Set.of("es ", " de", "de ", "ent", "le ", " le", "ion", "nt ", "les", " la",
            "la ", "re ", "que", "ue ", " qu", "tio", "e d", " et", "et ", "des"));
        TRIGRAMS.put("es", Set.of("de ", " de", "os ", "la ", " la", "el ", "es ", " el", "que", "ue ",
            " qu", "i\u00f3n", "ent", "as ", "nte", "ado", "ien", " en", "en ", "ad "));
        TRIGRAMS.put("it", Set.of(" di", "di ", "la ", " la", "che", "to ", "re ", "one", " ch", "ell",
            "lla", "del", " de", "ion", "ato", "no ", "zio", "ent", "ere", "le "));
        TRIGRAMS.put("pt", Set.of("de ", " de", "os ", "\u00e3o ", "\u00e7\u00e3o", "es ", " qu", "que", "ue ", "do ",
            "da ", " da", " co", "ent", "nte", "as ", " do", "com", "men", "ar "));
        TRIGRAMS.put("nl", Set.of("en ", "de ", " de", "an ", "et ", "van", " va", "het", " he", "een",
            " ee", "er ", "ing", "ijk", "aar", "oor", "den", " ge", "ver", "nd "));
        TRIGRAMS.put("sv", Set.of("en ", "er ", " oc", "och", "ch ", "an ", "f\u00f6r", " f\u00f6", "ar ", "et ",
            "de ", "att", " at", "ing", "ter", "ill", "den", "av ", " av", "som"));
        TRIGRAMS.put("pl", Set.of("ie ", "nie", " ni", " pr", "ch ", "ego", "ej ", "prz", "rze", "wie",
            " po", "ani", "ia ", "go ", "\u00f3w ", "ych", "iej", "a\u0107 ", "\u015bci", "owa"));
        TRIGRAMS.put("ru", Set.of(
            " \u043d\u0430", "\u043e\u0433\u043e", "\u0435\u043d\u0438", " \u043f\u043e", "\u043e\u0441\u0442",
            " \u043f\u0440", "\u0430\u0442\u044c", "\u043d\u0438\u044f", "\u0441\u0442\u0430", " \u043d\u0435",
            "\u0442\u043e ", "\u043e\u0432 ", "\u0435\u0442 ", "\u043d\u044b\u0445", " \u043a\u043e",
            "\u043e\u0435 ", "\u0438\u0439 ", "\u0432\u0430 ", " \u0438 ", "\u043f\u0440\u043e"));

        SCRIPTS.put(UnicodeScript.HAN, "zh");
        SCRIPTS.put(UnicodeScript.HIRAGANA, "ja");
        SCRIPTS.put(UnicodeScript.KATAKANA, "ja");
        SCRIPTS.put(UnicodeScript.HANGUL, "ko");
        SCRIPTS.put(UnicodeScript.ARABIC, "ar");
        SCRIPTS.put(UnicodeScript.HEBREW, "he");
        SCRIPTS.put(UnicodeScript.GREEK, "el");
        SCRIPTS.put(UnicodeScript.DEVANAGARI, "hi");
        SCRIPTS.put(UnicodeScript.THAI, "th");
    }

    /** A language with its confidence in [0, 1]. */
    public record Detection(String language, double confidence) {
    }

    /**
     * Detect the language of a text.
     *
     * <p>With {@code multiple}, paragraphs are detected separately and every language that wins a
     * paragraph above the gate is returned, the one covering the most text first.</p>
     *
     * @param text text to inspect
     * @param minConfidence confidence gate
     * @param multiple whether to look for more than one language
     * @return detections above the gate, possibly empty
     */
    public List<Detection> detect(String text, double minConfidence, boolean multiple) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String sample = text.length() > SAMPLE_CHARS ? text.substring(0, SAMPLE_CHARS) : text;
        if (!multiple) {
            List<Detection> ranked = rank(sample);
            if (ranked.isEmpty() || ranked.get(0).confidence() < minConfidence) {
                return List.of();
            }
            return List.of(ranked.get(0));
        }
        Map<String, Double> best = new HashMap<>();
        Map<String, Integer> weight = new HashMap<>();
        for (String segment : segments(sample)) {
            List<Detection> ranked = rank(segment);
            if (ranked.isEmpty() || ranked.get(0).confidence() < minConfidence) {
                continue;
            }
            Detection top = ranked.get(0);
            best.merge(top.language(), top.confidence(), Math::max);
            weight.merge(top.language(), segment.length(), Integer::sum);
        }
        List<Detection> out = new ArrayList<>();
        for (Map.Entry<String, Double> entry : best.entrySet()) {
            out.add(new Detection(entry.getKey(), entry.getValue()));
        }
        out.sort(Comparator.comparingInt((Detection d) -> weight.get(d.language())).reversed()
            .thenComparing(Comparator.comparingDouble(Detection::confidence).reversed())
            .thenComparing(Detection::language));
        return out;
    }

    /**
     * All candidate languages for a text, best first.
     *
     * @param text sample text
     * @return ranked detections, empty when the text has no letters
     */
    List<Detection> rank(String text) {
        Map<String, Integer> scriptCounts = new HashMap<>();
        int letters = 0;
        boolean kana = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) {
                continue;
            }
            letters++;
            UnicodeScript script = UnicodeScript.of(cp);
            kana |= script == UnicodeScript.HIRAGANA || script == UnicodeScript.KATAKANA;
            String language = SCRIPTS.get(script);
            if (language != null) {
                scriptCounts.merge(language, 1, Integer::sum);
            }
        }
        if (letters == 0) {
            return List.of();
        }
        if (kana && scriptCounts.containsKey("zh")) {
            scriptCounts.merge("ja", scriptCounts.remove("zh"), Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : scriptCounts.entrySet()) {
            if (entry.getValue() * 2 >= letters) {
                return List.of(new Detection(entry.getKey(), (double) entry.getValue() / letters));
            }
        }
        return rankByProfile(text.toLowerCase(Locale.ROOT));
    }

    private static List<Detection> rankByProfile(String text) {
        String[] words = text.split("[^\\p{L}]+");
        int wordCount = 0;
        for (String word : words) {
            if (!word.isEmpty()) {
                wordCount++;
            }
        }
        String normalized = " " + text.replaceAll("[^\\p{L}]+", " ").trim() + " ";
        int trigramCount = Math.max(1, normalized.length() - 2);
        Map<String, Double> scores = new LinkedHashMap<>();
        double sumSquares = 0.0;
        for (Map.Entry<String, Set<String>> profile : TRIGRAMS.entrySet()) {
            String language = profile.getKey();
            Set<String> stopWords = StopWords.forLanguage(language);
            int stopHits = 0;
            for (String word : words) {
                if (!word.isEmpty() && stopWords.contains(word)) {
                    stopHits++;
                }
            }
            int trigramHits = 0;
            for (int i = 0; i + 3 <= normalized.length(); i++) {
                if (profile.getValue().contains(normalized.substring(i, i + 3))) {
                    trigramHits++;
                }
            }
            double score = (wordCount == 0 ? 0.0 : (double) stopHits / wordCount)
                + (double) trigramHits / trigramCount;
            scores.put(language, score);
            sumSquares += score * score;
        }
        List<Detection> ranked = new ArrayList<>();
        if (sumSquares == 0.0) {
            return ranked;
        }
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            ranked.add(new Detection(entry.getKey(), entry.getValue() * entry.getValue() / sumSquares));
        }
        ranked.sort(Comparator.comparingDouble(Detection::confidence).reversed());
        return ranked;
    }

    private static List<String> segments(String text) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String block : text.split("\\n\\s*\\n")) {
            if (current.length() > 0) {
                current.append("\n\n");
            }
            current.append(block.strip());
            if (current.length() >= MIN_SEGMENT_CHARS) {
                segments.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }
        return segments;
    }
}
