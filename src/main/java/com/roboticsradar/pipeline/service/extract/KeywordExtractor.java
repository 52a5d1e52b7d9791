package com.roboticsradar.pipeline.service.extract;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.util.TermPatterns;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Statistical keyword ranking plus vocabulary-based topic tagging.
 *
 * <p>Tokens are lower-cased, lightly lemmatized and stopword-filtered. Each occurrence
 * counts with a position weight that falls linearly from 2.0 at the first token to 1.0 at
 * the last, so terms from the headline outrank the same terms deep in the body. Adjacent
 * token pairs that occur at least twice compete as bigrams.
 */
@Service
public class KeywordExtractor {
    private static final Pattern URLS = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern MENTIONS = Pattern.compile("(?<![\\p{L}\\p{N}])@[\\w.]+");
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "her", "was", "one",
            "our", "out", "has", "have", "had", "him", "his", "how", "its", "may", "new", "now", "old",
            "see", "two", "way", "who", "did", "get", "got", "let", "say", "she", "too", "use", "used",
            "this", "that", "with", "from", "they", "them", "then", "than", "there", "their", "these",
            "those", "what", "when", "where", "which", "while", "will", "would", "could", "should",
            "about", "after", "again", "also", "been", "being", "before", "between", "both", "each",
            "into", "just", "like", "more", "most", "much", "must", "only", "other", "over", "same",
            "some", "such", "very", "were", "here", "your", "yours", "ours", "because", "does", "doing",
            "during", "through", "under", "until", "upon", "within", "without", "why", "via", "per",
            "amp", "http", "https", "www", "com", "html", "read", "says", "said", "make", "made");

    private final int topK;
    private final Map<String, List<String>> topicTerms = new LinkedHashMap<>();
    private final Map<String, List<Pattern>> topicPatterns = new LinkedHashMap<>();

    public KeywordExtractor(RadarProperties properties) {
        this.topK = properties.getExtraction().getTopK();
        for (Map.Entry<String, List<String>> topic : properties.getDomain().getTopics().entrySet()) {
            List<String> terms = topic.getValue() == null ? List.of() : topic.getValue().stream()
                    .filter(t -> t != null && !t.isBlank())
                    .collect(Collectors.toList());
            topicTerms.put(topic.getKey(), terms.stream().map(t -> lemmatize(t.trim().toLowerCase(Locale.ROOT))).collect(Collectors.toList()));
            topicPatterns.put(topic.getKey(), terms.stream().map(TermPatterns::wholeWord).collect(Collectors.toList()));
        }
    }

    public Extraction extract(String text) {
        List<String> keywords = keywords(text);
        return new Extraction(keywords, topics(text, keywords));
    }

    /** Top-K keywords; ties keep the order of first appearance. */
    public List<String> keywords(String text) {
        List<String> tokens = tokens(text);
        if (tokens.isEmpty()) return List.of();
        int n = tokens.size();

        Map<String, Candidate> candidates = new HashMap<>();
        for (int i = 0; i < n; i++) {
            double w = positionWeight(i, n);
            int pos = i;
            candidates.computeIfAbsent(tokens.get(i), k -> new Candidate(k, pos)).add(w);
        }

        Map<String, Candidate> bigrams = new HashMap<>();
        for (int i = 0; i + 1 < n; i++) {
            String pair = tokens.get(i) + " " + tokens.get(i + 1);
            double w = (positionWeight(i, n) + positionWeight(i + 1, n)) / 2.0;
            int pos = i;
            bigrams.computeIfAbsent(pair, k -> new Candidate(k, pos)).add(w);
        }
        for (Candidate b : bigrams.values()) {
            if (b.count >= 2) candidates.put(b.term, b);
        }

        return candidates.values().stream()
                .sorted((a, b) -> {
                    int c = Double.compare(b.score, a.score);
                    return c != 0 ? c : Integer.compare(a.firstIndex, b.firstIndex);
                })
                .limit(topK)
                .map(c -> c.term)
                .collect(Collectors.toList());
    }

    /** Configured topics whose trigger terms occur in the raw text or among the keywords, in configuration order. */
    public Set<String> topics(String text, List<String> keywords) {
        Set<String> found = new LinkedHashSet<>();
        String haystack = text == null ? "" : text;
        Set<String> keywordSet = new LinkedHashSet<>(keywords);
        for (Map.Entry<String, List<Pattern>> topic : topicPatterns.entrySet()) {
            boolean hit = topic.getValue().stream().anyMatch(p -> p.matcher(haystack).find())
                    || topicTerms.get(topic.getKey()).stream().anyMatch(keywordSet::contains);
            if (hit) found.add(topic.getKey());
        }
        return found;
    }

    /** Lower-cased, lemmatized, stopword-free tokens in text order, with URLs and mentions removed. */
    List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        String cleaned = URLS.matcher(text).replaceAll(" ");
        cleaned = MENTIONS.matcher(cleaned).replaceAll(" ");
        List<String> out = new ArrayList<>();
        for (String raw : SPLIT.split(cleaned.toLowerCase(Locale.ROOT))) {
            if (raw.length() < MIN_TOKEN_LENGTH || isNumber(raw) || STOPWORDS.contains(raw)) continue;
            String lemma = lemmatize(raw);
            if (lemma.length() < MIN_TOKEN_LENGTH || STOPWORDS.contains(lemma)) continue;
            out.add(lemma);
        }
        return out;
    }

    /** Plural folding only: ies to y, sses to ss, and a trailing s unless the word ends in ss, us or is. */
    static String lemmatize(String word) {
        if (word.length() > 4 && word.endsWith("ies")) return word.substring(0, word.length() - 3) + "y";
        if (word.endsWith("sses")) return word.substring(0, word.length() - 2);
        if (word.length() > 3 && word.endsWith("s")
                && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    static double positionWeight(int index, int count) {
        if (count <= 1) return 2.0;
        return 2.0 - (double) index / (count - 1);
    }

    private static boolean isNumber(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    private static final class Candidate {
        final String term;
        final int firstIndex;
        double score;
        int count;

        Candidate(String term, int firstIndex) {
            this.term = term;
            this.firstIndex = firstIndex;
        }

        void add(double weight) {
            score += weight;
            count++;
        }
    }
}
