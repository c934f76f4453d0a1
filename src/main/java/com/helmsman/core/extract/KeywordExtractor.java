package com.helmsman.core.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks salient terms from document text: short multi-word phrases made of
 * content words, followed by the most frequent longer words.
 * <p>
 * Results are lower-cased, deduplicated and capped at {@link #MAX_KEYWORDS}.
 */
@Component
public class KeywordExtractor {

    public static final int MAX_KEYWORDS = 15;

    static final int MAX_PHRASES = 5;
    static final int MAX_FREQUENT_WORDS = 10;
    private static final int MAX_PHRASE_WORDS = 3;
    private static final int FALLBACK_MIN_LENGTH = 5;

    static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "with", "was", "were", "been", "has", "have", "had",
            "this", "that", "these", "those", "from", "into", "onto", "over", "under", "upon",
            "will", "would", "should", "could", "shall", "must", "may", "might", "can",
            "not", "but", "all", "any", "its", "our", "their", "there", "then", "than",
            "which", "while", "when", "where", "what", "who", "also", "some", "such",
            "very", "each", "about", "after", "before", "during", "next", "per", "via",
            "they", "them", "his", "her", "you", "your");

    private static final Pattern CLAUSE_BREAK = Pattern.compile("[.,;:!?()]+");
    private static final Pattern TOKEN_BREAK = Pattern.compile("[^\\p{L}\\p{N}-]+");

    /**
     * Extracts keywords from cleaned text.
     *
     * @return at most {@link #MAX_KEYWORDS} distinct keywords, phrases first
     */
    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);

        var keywords = new LinkedHashSet<String>();
        keywords.addAll(phrases(lowerText));
        keywords.addAll(frequentWords(lowerText));
        return keywords.stream().limit(MAX_KEYWORDS).toList();
    }

    /**
     * Plain fallback used when {@link #extract} cannot complete: the distinct
     * words longer than four characters, in order of appearance.
     */
    public List<String> fallback(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(w -> w.length() >= FALLBACK_MIN_LENGTH)
                .distinct()
                .limit(MAX_KEYWORDS)
                .toList();
    }

    List<String> phrases(String lowerText) {
        var found = new LinkedHashSet<String>();
        for (String clause : CLAUSE_BREAK.split(lowerText)) {
            var run = new ArrayList<String>();
            for (String token : tokens(clause)) {
                if (isContentWord(token)) {
                    run.add(token);
                } else {
                    addChunks(run, found);
                    run.clear();
                }
            }
            addChunks(run, found);
            if (found.size() >= MAX_PHRASES) {
                break;
            }
        }
        return found.stream().limit(MAX_PHRASES).toList();
    }

    List<String> frequentWords(String lowerText) {
        var counts = new LinkedHashMap<String, Integer>();
        for (String token : tokens(lowerText)) {
            if (token.length() > 3 && !STOPWORDS.contains(token) && hasLetter(token)) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        // stable sort keeps first-seen order among equal counts
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(MAX_FREQUENT_WORDS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static void addChunks(List<String> run, Set<String> target) {
        for (int start = 0; start < run.size(); start += MAX_PHRASE_WORDS) {
            int end = Math.min(start + MAX_PHRASE_WORDS, run.size());
            if (end - start >= 2) {
                target.add(String.join(" ", run.subList(start, end)));
            }
        }
    }

    private static List<String> tokens(String text) {
        return Arrays.stream(TOKEN_BREAK.split(text))
                .map(t -> t.replaceAll("^-+|-+$", ""))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private static boolean isContentWord(String token) {
        return token.length() > 2 && !STOPWORDS.contains(token) && Character.isLetter(token.charAt(0));
    }

    private static boolean hasLetter(String token) {
        return token.chars().anyMatch(Character::isLetter);
    }
}
