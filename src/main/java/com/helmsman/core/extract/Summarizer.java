package com.helmsman.core.extract;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extractive summary: the first sentence, extended with following sentences
 * while the result still fits the length budget.
 */
@Component
public class Summarizer {

    public static final int DEFAULT_MAX_LENGTH = 150;

    private static final String ELLIPSIS = "...";
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    public String summarize(String text) {
        return summarize(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * @param text      cleaned document text, null is treated as empty
     * @param maxLength upper bound on the summary length, ellipsis included
     * @return a summary no longer than {@code maxLength}, never null
     */
    public String summarize(String text, int maxLength) {
        if (text == null || text.isBlank()) {
            return "";
        }
        List<String> sentences = sentences(text);
        if (sentences.isEmpty()) {
            return truncate(text, maxLength);
        }

        var summary = new StringBuilder(sentences.get(0));
        for (String sentence : sentences.subList(1, sentences.size())) {
            if (summary.length() + 1 + sentence.length() > maxLength) {
                break;
            }
            summary.append(' ').append(sentence);
        }
        return truncate(summary.toString(), maxLength);
    }

    /**
     * Cuts {@code text} to {@code maxLength} characters, marking the cut with an ellipsis.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, cutPoint(text, Math.max(0, maxLength)));
        }
        return text.substring(0, cutPoint(text, maxLength - ELLIPSIS.length())) + ELLIPSIS;
    }

    // never split a surrogate pair
    private static int cutPoint(String text, int cut) {
        return cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1)) ? cut - 1 : cut;
    }

    static List<String> sentences(String text) {
        return Arrays.stream(SENTENCE_BOUNDARY.split(text.trim()))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
