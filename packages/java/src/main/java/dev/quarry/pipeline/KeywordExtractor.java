package dev.quarry.pipeline;

import dev.quarry.ExtractedKeyword;
import dev.quarry.config.KeywordConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword extraction with YAKE or RAKE.
 *
 * <p>YAKE scores single terms from casing, position, frequency, relatedness and spread, then
 * combines them into n-gram scores where lower is better; the final score is inverted into
 * (0, 1]. RAKE splits sentences at stop words and scores each candidate phrase by the sum of its
 * words' degree/frequency ratios, normalized by the best phrase.</p>
 */
public final class KeywordExtractor {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'_-]*|[.!?;:,()\\[\\]\"]");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");

    /**
     * Extract keywords.
     *
     * @param content text to analyze
     * @param config keyword settings
     * @param detectedLanguage language found by detection, used when the config names none
     * @return keywords, best first, at most {@code max_keywords}
     */
    public List<ExtractedKeyword> extract(String content, KeywordConfig config, String detectedLanguage) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String language = config.getLanguage() != null ? config.getLanguage() : detectedLanguage;
        Set<String> stopWords = StopWords.forLanguage(language);
        List<Token> tokens = tokenize(content);
        List<ExtractedKeyword> keywords = KeywordConfig.RAKE.equals(config.getAlgorithm())
            ? rake(tokens, stopWords, config)
            : yake(tokens, stopWords, config);
        List<ExtractedKeyword> filtered = new ArrayList<>();
        for (ExtractedKeyword keyword : keywords) {
            if (keyword.score() >= config.getMinScore()) {
                filtered.add(keyword);
            }
            if (filtered.size() == config.getMaxKeywords()) {
                break;
            }
        }
        return filtered;
    }

    List<ExtractedKeyword> rake(List<Token> tokens, Set<String> stopWords, KeywordConfig config) {
        int minWordLength = config.getRakeParams() != null ? config.getRakeParams().getMinWordLength() : 1;
        int maxWords = Math.min(config.getMaxNgram(),
            config.getRakeParams() != null ? config.getRakeParams().getMaxWordsPerPhrase() : 3);

        List<List<Token>> phrases = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            boolean breaks = token.punctuation || stopWords.contains(token.lower)
                || token.text.length() < minWordLength || isNumber(token.text);
            if (breaks) {
                flush(current, phrases);
            } else {
                current.add(token);
            }
        }
        flush(current, phrases);

        Map<String, Integer> frequency = new HashMap<>();
        Map<String, Integer> degree = new HashMap<>();
        for (List<Token> phrase : phrases) {
            for (Token token : phrase) {
                frequency.merge(token.lower, 1, Integer::sum);
                degree.merge(token.lower, phrase.size(), Integer::sum);
            }
        }
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (List<Token> phrase : phrases) {
            if (phrase.size() < config.getMinNgram() || phrase.size() > maxWords) {
                continue;
            }
            String key = key(phrase);
            Candidate candidate = candidates.computeIfAbsent(key, k -> new Candidate(surface(phrase)));
            candidate.positions.add(phrase.get(0).start);
            if (candidate.score == 0.0) {
                double score = 0.0;
                for (Token token : phrase) {
                    score += (double) degree.get(token.lower) / frequency.get(token.lower);
                }
                candidate.score = score;
            }
        }
        double best = 0.0;
        for (Candidate candidate : candidates.values()) {
            best = Math.max(best, candidate.score);
        }
        List<ExtractedKeyword> out = new ArrayList<>();
        for (Candidate candidate : candidates.values()) {
            out.add(new ExtractedKeyword(candidate.text, best == 0.0 ? 0.0 : candidate.score / best,
                KeywordConfig.RAKE, candidate.positions));
        }
        out.sort(Comparator.comparingDouble(ExtractedKeyword::score).reversed()
            .thenComparing(ExtractedKeyword::text));
        return out;
    }

    List<ExtractedKeyword> yake(List<Token> tokens, Set<String> stopWords, KeywordConfig config) {
        int window = config.getYakeParams() != null ? config.getYakeParams().getWindowSize() : 2;

        List<List<Token>> sentences = new ArrayList<>();
        List<Token> sentence = new ArrayList<>();
        for (Token token : tokens) {
            sentence.add(token);
            if (token.punctuation && SENTENCE_END.matcher(token.text).matches()) {
                sentences.add(sentence);
                sentence = new ArrayList<>();
            }
        }
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }

        Map<String, TermStats> terms = new HashMap<>();
        for (int s = 0; s < sentences.size(); s++) {
            List<Token> words = sentences.get(s);
            for (int i = 0; i < words.size(); i++) {
                Token token = words.get(i);
                if (token.punctuation) {
                    continue;
                }
                TermStats stats = terms.computeIfAbsent(token.lower, k -> new TermStats());
                stats.frequency++;
                if (isAcronym(token.text)) {
                    stats.acronym++;
                } else if (i > 0 && Character.isUpperCase(token.text.charAt(0))) {
                    stats.upper++;
                }
                stats.sentences.add(s);
                stats.sentenceIndices.add(s);
                for (int j = Math.max(0, i - window); j < i; j++) {
                    Token left = words.get(j);
                    if (!left.punctuation) {
                        stats.left.add(left.lower);
                        stats.leftCount++;
                        TermStats leftStats = terms.computeIfAbsent(left.lower, k -> new TermStats());
                        leftStats.right.add(token.lower);
                        leftStats.rightCount++;
                    }
                }
            }
        }
        if (terms.isEmpty()) {
            return List.of();
        }

        List<Integer> nonStopFrequencies = new ArrayList<>();
        int maxFrequency = 0;
        for (Map.Entry<String, TermStats> entry : terms.entrySet()) {
            maxFrequency = Math.max(maxFrequency, entry.getValue().frequency);
            if (!stopWords.contains(entry.getKey())) {
                nonStopFrequencies.add(entry.getValue().frequency);
            }
        }
        double mean = 0.0;
        for (int f : nonStopFrequencies) {
            mean += f;
        }
        mean = nonStopFrequencies.isEmpty() ? 0.0 : mean / nonStopFrequencies.size();
        double variance = 0.0;
        for (int f : nonStopFrequencies) {
            variance += (f - mean) * (f - mean);
        }
        double std = nonStopFrequencies.isEmpty() ? 0.0 : Math.sqrt(variance / nonStopFrequencies.size());

        for (TermStats stats : terms.values()) {
            double tf = stats.frequency;
            double casing = Math.max(stats.upper, stats.acronym) / (1.0 + Math.log(tf));
            Collections.sort(stats.sentenceIndices);
            double median = stats.sentenceIndices.get(stats.sentenceIndices.size() / 2);
            double position = Math.log(Math.log(3.0 + median));
            double frequency = tf / (mean + std + 1e-9);
            double wl = stats.leftCount == 0 ? 0.0 : (double) stats.left.size() / stats.leftCount;
            double wr = stats.rightCount == 0 ? 0.0 : (double) stats.right.size() / stats.rightCount;
            double relatedness = 1.0 + (wl + wr) * (tf / maxFrequency);
            double spread = (double) stats.sentences.size() / sentences.size();
            stats.weight = (relatedness * position) / (casing + frequency / relatedness + spread / relatedness);
        }

        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (List<Token> words : sentences) {
            for (int i = 0; i < words.size(); i++) {
                for (int n = config.getMinNgram(); n <= config.getMaxNgram() && i + n <= words.size(); n++) {
                    List<Token> gram = words.subList(i, i + n);
                    if (!validGram(gram, stopWords)) {
                        continue;
                    }
                    Candidate candidate = candidates.computeIfAbsent(key(gram), k -> new Candidate(surface(gram)));
                    candidate.positions.add(gram.get(0).start);
                    candidate.tokens = gram;
                }
            }
        }
        List<ExtractedKeyword> out = new ArrayList<>();
        for (Candidate candidate : candidates.values()) {
            double product = 1.0;
            double sum = 0.0;
            for (Token token : candidate.tokens) {
                if (stopWords.contains(token.lower)) {
                    continue;
                }
                double weight = terms.get(token.lower).weight;
                product *= weight;
                sum += weight;
            }
            double score = product / (candidate.positions.size() * (1.0 + sum));
            out.add(new ExtractedKeyword(candidate.text, 1.0 / (1.0 + score), KeywordConfig.YAKE,
                candidate.positions));
        }
        out.sort(Comparator.comparingDouble(ExtractedKeyword::score).reversed()
            .thenComparing(ExtractedKeyword::text));
        return out;
    }

    static List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(content);
        while (matcher.find()) {
            String text = matcher.group();
            boolean punctuation = !Character.isLetterOrDigit(text.charAt(0));
            tokens.add(new Token(text, matcher.start(), punctuation));
        }
        return tokens;
    }

    private static boolean validGram(List<Token> gram, Set<String> stopWords) {
        for (Token token : gram) {
            if (token.punctuation || isNumber(token.text) || token.text.length() < 2) {
                return false;
            }
        }
        return !stopWords.contains(gram.get(0).lower) && !stopWords.contains(gram.get(gram.size() - 1).lower);
    }

    private static void flush(List<Token> current, List<List<Token>> phrases) {
        if (!current.isEmpty()) {
            phrases.add(new ArrayList<>(current));
            current.clear();
        }
    }

    private static String key(List<Token> tokens) {
        StringBuilder key = new StringBuilder();
        for (Token token : tokens) {
            if (key.length() > 0) {
                key.append(' ');
            }
            key.append(token.lower);
        }
        return key.toString();
    }

    private static String surface(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(isAcronym(token.text) ? token.text : token.lower);
        }
        return text.toString();
    }

    private static boolean isAcronym(String text) {
        if (text.length() < 2) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLowerCase(text.charAt(i))) {
                return false;
            }
        }
        return Character.isLetter(text.charAt(0));
    }

    private static boolean isNumber(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isDigit(c) && c != '.' && c != ',' && c != '-') {
                return false;
            }
        }
        return true;
    }

    static final class Token {
        final String text;
        final String lower;
        final int start;
        final boolean punctuation;

        Token(String text, int start, boolean punctuation) {
            this.text = text;
            this.lower = text.toLowerCase(Locale.ROOT);
            this.start = start;
            this.punctuation = punctuation;
        }
    }

    private static final class TermStats {
        private int frequency;
        private int upper;
        private int acronym;
        private final Set<Integer> sentences = new HashSet<>();
        private final List<Integer> sentenceIndices = new ArrayList<>();
        private final Set<String> left = new HashSet<>();
        private final Set<String> right = new HashSet<>();
        private int leftCount;
        private int rightCount;
        private double weight;
    }

    private static final class Candidate {
        private final String text;
        private final List<Integer> positions = new ArrayList<>();
        private List<Token> tokens = List.of();
        private double score;

        Candidate(String text) {
            this.text = text;
        }
    }
}
