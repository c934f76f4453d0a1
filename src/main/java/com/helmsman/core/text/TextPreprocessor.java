package com.helmsman.core.text;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalizes raw document text before analysis.
 * <p>
 * Whitespace runs become single spaces, characters outside word characters,
 * whitespace and {@code . , ; : ! ? - ( )} become spaces, and runs of
 * {@code .} or {@code !} collapse to one. The operation is idempotent.
 */
@Component
public class TextPreprocessor {

    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("(?U)[^\\w\\s.,;:!?\\-()]");
    private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{2,}");
    private static final Pattern REPEATED_BANGS = Pattern.compile("!{2,}");

    /**
     * @param text raw input, must not be null
     * @return normalized text, empty if nothing meaningful remains
     */
    public String normalize(String text) {
        Objects.requireNonNull(text, "text");
        String result = collapseWhitespace(text);
        result = DISALLOWED.matcher(result).replaceAll(" ");
        result = REPEATED_DOTS.matcher(result).replaceAll(".");
        result = REPEATED_BANGS.matcher(result).replaceAll("!");
        return collapseWhitespace(result);
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
